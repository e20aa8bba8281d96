package crewdesk.workflow.notify;

import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.ReminderType;

import java.time.LocalDate;

/**
 * Produces the text of every outbound message. The workflow only decides
 * who gets a message and when; wording is delegated here.
 */
public interface MessageComposer {

    /** First touch with a new lead */
    String leadGreeting(String name);

    /** Later text stages of the lead sequence */
    String leadFollowUp(String name, int stage);

    String dayBeforeReminder(String name, LocalDate appointmentDate);

    /** Crew chat: a job is offered to you */
    String cleanerOffer(Job job);

    /** Crew chat: the offer is still open and getting urgent */
    String urgentOfferNudge(Job job);

    /** Customer SMS once a crew member accepted */
    String cleanerAssigned(Job job, Cleaner cleaner);

    /** Crew chat after accepting */
    String assignmentConfirmed(Job job);

    /** Crew chat after declining */
    String declineAcknowledged(Job job);

    /** Customer SMS when nobody accepted */
    String assignmentDelayed(Job job);

    /** Owner SMS when the cascade ran out of candidates */
    String ownerEscalation(Job job, int cleanersContacted);

    /** Owner SMS when the broadcast escalation phase fires */
    String broadcastEscalation(Job job);

    String rescheduleCustomer(Job job, LocalDate originalDate, LocalDate newDate);

    String rescheduleCleaner(Job job, LocalDate originalDate, LocalDate newDate);

    String rainDaySummary(String weatherInfo, LocalDate date, int jobsAffected, int jobsRescheduled,
            int jobsFailed, int notificationsSent);

    String jobReminder(ReminderType type, Job job);

    String postServiceFollowUp(String name);
}
