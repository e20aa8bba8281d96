package crewdesk.workflow.scheduler;

import crewdesk.workflow.model.ScheduledTask;
import crewdesk.workflow.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes a claimed task to the handler for its type.
 * Construction fails unless every {@link TaskType} has exactly one handler.
 */
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);

    public TaskDispatcher(List<TaskHandler> handlers) {
        for (TaskHandler handler : handlers) {
            TaskHandler previous = this.handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate handler for " + handler.type() + ": "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }

        Set<TaskType> missing = EnumSet.allOf(TaskType.class);
        missing.removeAll(this.handlers.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("No handler registered for task types " + missing);
        }

        log.debug("Dispatcher ready with {} handlers", this.handlers.size());
    }

    public void dispatch(ScheduledTask task) {
        handlers.get(task.type()).handle(task);
    }
}
