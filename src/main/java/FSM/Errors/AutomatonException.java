package FSM.Errors;

/**
 * Base class of every failure raised while building, reading or transforming an automaton.
 * These are deterministic, input-derived failures: the operation in progress is aborted and
 * no partial automaton is returned.
 */
public class AutomatonException extends RuntimeException {
    public AutomatonException(String message) {
        super(message);
    }

    public AutomatonException(String message, Throwable cause) {
        super(message, cause);
    }
}
