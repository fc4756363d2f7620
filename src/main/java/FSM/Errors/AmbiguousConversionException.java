package FSM.Errors;

/**
 * A Mealy state needed to build the Moore machine cannot be resolved to an output.
 */
public class AmbiguousConversionException extends AutomatonException {
    private final String state;

    public AmbiguousConversionException(String state, String message) {
        super("State " + state + ": " + message);
        this.state = state;
    }

    public String getState() {
        return state;
    }
}
