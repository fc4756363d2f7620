package FSM.Regex;

/**
 * One lexical unit of a regular expression.
 *
 * @param type     kind of token
 * @param symbol   the literal symbol, only set for {@link Type#LITERAL}
 * @param position offset of the token in the expression text
 */
public record RegexToken(Type type, String symbol, int position) {

    public enum Type {
        LITERAL,
        EPSILON,
        UNION,
        CONCAT,
        STAR,
        PLUS,
        LEFT_PAREN,
        RIGHT_PAREN;

        /**
         * Binding strength of the binary and repetition operators; 0 for everything else.
         */
        int precedence() {
            switch (this) {
                case UNION:
                    return 1;
                case CONCAT:
                    return 2;
                case STAR:
                case PLUS:
                    return 3;
                default:
                    return 0;
            }
        }

        boolean endsOperand() {
            return this == LITERAL || this == EPSILON || this == RIGHT_PAREN || this == STAR || this == PLUS;
        }

        boolean startsOperand() {
            return this == LITERAL || this == EPSILON || this == LEFT_PAREN;
        }
    }

    static RegexToken of(Type type, int position) {
        return new RegexToken(type, null, position);
    }

    static RegexToken literal(String symbol, int position) {
        return new RegexToken(Type.LITERAL, symbol, position);
    }

    @Override
    public String toString() {
        switch (type) {
            case LITERAL:
                return symbol;
            case EPSILON:
                return "()";
            case UNION:
                return "|";
            case CONCAT:
                return ".";
            case STAR:
                return "*";
            case PLUS:
                return "+";
            case LEFT_PAREN:
                return "(";
            default:
                return ")";
        }
    }
}
