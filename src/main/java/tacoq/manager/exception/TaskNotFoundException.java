package tacoq.manager.exception;

import java.util.UUID;

public class TaskNotFoundException extends ManagerException {

    public TaskNotFoundException(UUID taskId) {
        super("task not found: " + taskId);
    }
}
