package crewdesk.workflow.notify;

/**
 * Outcome of a send or call. {@code error} is set only on failure.
 */
public record SendResult(boolean success, String error) {

    public static SendResult ok() {
        return new SendResult(true, null);
    }

    public static SendResult failed(String error) {
        return new SendResult(false, error);
    }
}
