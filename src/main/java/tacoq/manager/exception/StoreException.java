package tacoq.manager.exception;

/**
 * The task store failed to execute a statement.
 */
public class StoreException extends ManagerException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
