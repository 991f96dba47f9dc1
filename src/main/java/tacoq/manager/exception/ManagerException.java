package tacoq.manager.exception;

/**
 * Base class for errors raised by the task coordination engine.
 */
public class ManagerException extends RuntimeException {

    public ManagerException(String message) {
        super(message);
    }

    public ManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
