package FSM.Regex;

import java.util.ArrayList;
import java.util.List;

import FSM.Errors.RegexSyntaxException;
import FSM.Model.Nfa;

/**
 * Splits a regular expression into tokens and makes concatenation explicit.
 */
public class RegexTokenizer {
    private RegexTokenizer() {}

    /**
     * Supported literals are letters, digits and '_'. Whitespace is ignored and "()" is the empty-string literal.
     */
    public static List<RegexToken> tokenize(String regex) {
        final List<RegexToken> tokens = new ArrayList<>();
        for (int i = 0; i < regex.length(); i++) {
            final char c = regex.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            switch (c) {
                case '|':
                    tokens.add(RegexToken.of(RegexToken.Type.UNION, i));
                    break;
                case '*':
                    tokens.add(RegexToken.of(RegexToken.Type.STAR, i));
                    break;
                case '+':
                    tokens.add(RegexToken.of(RegexToken.Type.PLUS, i));
                    break;
                case ')':
                    tokens.add(RegexToken.of(RegexToken.Type.RIGHT_PAREN, i));
                    break;
                case '(':
                    final int close = skipWhitespace(regex, i + 1);
                    if (close < regex.length() && regex.charAt(close) == ')') {
                        tokens.add(RegexToken.of(RegexToken.Type.EPSILON, i));
                        i = close;
                    } else {
                        tokens.add(RegexToken.of(RegexToken.Type.LEFT_PAREN, i));
                    }
                    break;
                default:
                    if (!isLiteral(c)) {
                        throw new RegexSyntaxException("Unsupported character '" + c + "'", i);
                    }
                    tokens.add(RegexToken.literal(String.valueOf(c), i));
            }
        }
        return tokens;
    }

    /**
     * Inserts a {@link RegexToken.Type#CONCAT} token between every operand end and the operand start that follows it.
     */
    public static List<RegexToken> insertConcatenation(List<RegexToken> tokens) {
        final List<RegexToken> result = new ArrayList<>(tokens.size() * 2);
        RegexToken prev = null;
        for (RegexToken token : tokens) {
            if (prev != null && prev.type().endsOperand() && token.type().startsOperand()) {
                result.add(RegexToken.of(RegexToken.Type.CONCAT, token.position()));
            }
            result.add(token);
            prev = token;
        }
        return result;
    }

    static boolean isLiteral(char c) {
        return (Character.isLetterOrDigit(c) || c == '_') && !Nfa.EPSILON.equals(String.valueOf(c));
    }

    private static int skipWhitespace(String regex, int from) {
        int i = from;
        while (i < regex.length() && Character.isWhitespace(regex.charAt(i))) {
            i++;
        }
        return i;
    }
}
