package crewdesk.workflow.model;

/**
 * Outcome of scheduling a task. {@code created} is false when a live task with
 * the same dedup key already existed and its id is returned instead.
 */
public record ScheduleResult(String taskId, boolean created) {

    public static ScheduleResult created(String taskId) {
        return new ScheduleResult(taskId, true);
    }

    public static ScheduleResult existing(String taskId) {
        return new ScheduleResult(taskId, false);
    }
}
