package tacoq.manager.exception;

import java.util.UUID;

public class WorkerNotFoundException extends ManagerException {

    public WorkerNotFoundException(UUID workerId) {
        super("worker not registered: " + workerId);
    }
}
