package FSM.Regex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import FSM.Errors.RegexSyntaxException;

/**
 * Shunting-yard conversion of an explicit-concatenation token sequence to postfix order.
 * Precedence: union &lt; concatenation &lt; star/plus; binary operators are left-associative.
 */
public class PostfixConverter {
    private PostfixConverter() {}

    public static List<RegexToken> toPostfix(List<RegexToken> infix) {
        final List<RegexToken> output = new ArrayList<>(infix.size());
        final Deque<RegexToken> operators = new ArrayDeque<>();

        for (RegexToken token : infix) {
            switch (token.type()) {
                case LITERAL:
                case EPSILON:
                case STAR:
                case PLUS:
                    // repetition binds tighter than anything on the stack and applies to the operand just emitted
                    output.add(token);
                    break;
                case LEFT_PAREN:
                    operators.push(token);
                    break;
                case RIGHT_PAREN:
                    while (!operators.isEmpty() && operators.peek().type() != RegexToken.Type.LEFT_PAREN) {
                        output.add(operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw new RegexSyntaxException("Unmatched ')'", token.position());
                    }
                    operators.pop();
                    break;
                default:
                    while (!operators.isEmpty()
                            && operators.peek().type().precedence() >= token.type().precedence()) {
                        output.add(operators.pop());
                    }
                    operators.push(token);
            }
        }

        while (!operators.isEmpty()) {
            final RegexToken op = operators.pop();
            if (op.type() == RegexToken.Type.LEFT_PAREN) {
                throw new RegexSyntaxException("Unmatched '('", op.position());
            }
            output.add(op);
        }
        return output;
    }
}
