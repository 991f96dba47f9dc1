package tacoq.manager.exception;

public class UnknownTaskTypeException extends ManagerException {

    public UnknownTaskTypeException(String typeName) {
        super("unknown task type: " + typeName);
    }
}
