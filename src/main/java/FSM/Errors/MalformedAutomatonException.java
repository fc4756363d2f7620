package FSM.Errors;

public class MalformedAutomatonException extends AutomatonException {
    public MalformedAutomatonException(String message) {
        super(message);
    }

    public MalformedAutomatonException(String message, Throwable cause) {
        super(message, cause);
    }
}
