package tacoq.manager.exception;

/**
 * The queue transport did not accept a message.
 */
public class PublishFailureException extends ManagerException {

    public PublishFailureException(String message) {
        super(message);
    }

    public PublishFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
