package FSM.Errors;

/**
 * Malformed regular expression: unbalanced parentheses, dangling operator or unsupported character.
 */
public class RegexSyntaxException extends AutomatonException {
    private final int position;

    public RegexSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /**
     * @return zero-based character offset in the expression where the problem was detected
     */
    public int getPosition() {
        return position;
    }
}
