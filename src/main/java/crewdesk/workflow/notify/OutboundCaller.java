package crewdesk.workflow.notify;

/**
 * Places an automated outbound call to a lead.
 */
public interface OutboundCaller {

    SendResult call(String phone, String name, long leadId);
}
