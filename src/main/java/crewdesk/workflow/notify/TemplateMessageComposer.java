package crewdesk.workflow.notify;

import crewdesk.workflow.model.Cleaner;
import crewdesk.workflow.model.Job;
import crewdesk.workflow.model.ReminderType;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Fixed-template message texts.
 */
public class TemplateMessageComposer implements MessageComposer {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("EEEE, MMMM d", Locale.US);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("h:mm a", Locale.US);
    private static final String DEFAULT_TIME = "9:00 AM";

    private final String businessName;

    public TemplateMessageComposer(String businessName) {
        this.businessName = businessName;
    }

    public static String formatDate(LocalDate date) {
        return date.format(DATE_FORMAT);
    }

    public static String formatTime(LocalTime time) {
        return time != null ? time.format(TIME_FORMAT) : DEFAULT_TIME;
    }

    @Override
    public String leadGreeting(String name) {
        return "Hi " + nameOr(name, "there") + "! Thanks for reaching out to " + businessName
                + ". We'd love to help with your cleaning needs. When works best for a quick call?";
    }

    @Override
    public String leadFollowUp(String name, int stage) {
        return "Hey " + nameOr(name, "there") + ", just checking in! Still interested in getting a cleaning quote? "
                + "Reply YES and we'll get you scheduled right away.";
    }

    @Override
    public String dayBeforeReminder(String name, LocalDate appointmentDate) {
        return "Hi " + nameOr(name, "there") + "! Just a reminder that your " + businessName
                + " cleaning is tomorrow, " + formatDate(appointmentDate)
                + ". Reply if you need to make any changes.";
    }

    @Override
    public String cleanerOffer(Job job) {
        return "New job available!\n"
                + formatDate(job.serviceDate()) + " at " + formatTime(job.scheduledTime()) + "\n"
                + nameOr(job.address(), "Address on file") + "\n"
                + "Reply ACCEPT or DECLINE.";
    }

    @Override
    public String urgentOfferNudge(Job job) {
        return "Still available? The job on " + formatDate(job.serviceDate()) + " at "
                + formatTime(job.scheduledTime()) + " needs an answer soon. Reply ACCEPT or DECLINE.";
    }

    @Override
    public String cleanerAssigned(Job job, Cleaner cleaner) {
        return "Hi " + nameOr(job.customerName(), "there") + "! " + cleaner.name() + " will be your cleaner on "
                + formatDate(job.serviceDate()) + " at " + formatTime(job.scheduledTime())
                + ". Contact them at " + nameOr(cleaner.phone(), "our office") + " if needed. See you soon!";
    }

    @Override
    public String assignmentConfirmed(Job job) {
        return "Confirmed! You're booked for " + formatDate(job.serviceDate()) + " at "
                + formatTime(job.scheduledTime()) + ", " + nameOr(job.address(), "address on file") + ".";
    }

    @Override
    public String declineAcknowledged(Job job) {
        return "No problem, we'll offer the " + formatDate(job.serviceDate()) + " job to someone else.";
    }

    @Override
    public String assignmentDelayed(Job job) {
        return "Hi " + nameOr(job.customerName(), "there") + ", we're sorry for the delay confirming your cleaner for "
                + formatDate(job.serviceDate()) + ". Our team is on it and will follow up shortly.";
    }

    @Override
    public String ownerEscalation(Job job, int cleanersContacted) {
        return "URGENT: Job " + job.id() + " needs manual assignment. " + cleanersContacted
                + " cleaner(s) contacted, none accepted. " + nameOr(job.customerName(), "Customer") + " on "
                + formatDate(job.serviceDate()) + ".";
    }

    @Override
    public String broadcastEscalation(Job job) {
        return "URGENT: Job " + job.id() + " needs manual assignment. No cleaner confirmed for "
                + formatDate(job.serviceDate()) + ".";
    }

    @Override
    public String rescheduleCustomer(Job job, LocalDate originalDate, LocalDate newDate) {
        return "Hi " + nameOr(job.customerName(), "there") + "! Due to weather conditions, your " + businessName
                + " cleaning originally scheduled for " + formatDate(originalDate) + " has been rescheduled to "
                + formatDate(newDate) + ". Same time: " + formatTime(job.scheduledTime())
                + ". Reply with any questions!";
    }

    @Override
    public String rescheduleCleaner(Job job, LocalDate originalDate, LocalDate newDate) {
        return "Schedule change: the job at " + nameOr(job.address(), "address on file") + " moved from "
                + formatDate(originalDate) + " to " + formatDate(newDate) + " at "
                + formatTime(job.scheduledTime()) + ".";
    }

    @Override
    public String rainDaySummary(String weatherInfo, LocalDate date, int jobsAffected, int jobsRescheduled,
            int jobsFailed, int notificationsSent) {
        StringBuilder sb = new StringBuilder("RAIN DAY AUTO-RESCHEDULE\n\n")
                .append(weatherInfo).append("\n\n")
                .append(jobsAffected).append(" jobs on ").append(formatDate(date)).append(" have been rescheduled.\n")
                .append(jobsRescheduled).append(" successfully moved.\n");
        if (jobsFailed > 0) {
            sb.append(jobsFailed).append(" failed - check dashboard.\n");
        }
        sb.append(notificationsSent).append(" notifications sent.");
        return sb.toString();
    }

    @Override
    public String jobReminder(ReminderType type, Job job) {
        return switch (type) {
            case ONE_HOUR -> "Reminder: you have a job in 1 hour at " + nameOr(job.address(), "address on file")
                    + " (" + formatTime(job.scheduledTime()) + ").";
            case JOB_START -> "Your job at " + nameOr(job.address(), "address on file")
                    + " starts now. Have a great clean!";
        };
    }

    @Override
    public String postServiceFollowUp(String name) {
        return "Hi " + nameOr(name, "there") + "! Thanks for choosing " + businessName
                + ". We hope you loved your clean! Reply anytime to book your next visit.";
    }

    private static String nameOr(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
