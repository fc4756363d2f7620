package FSM.Regex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import FSM.Errors.RegexSyntaxException;
import FSM.Model.Nfa;
import FSM.Model.StateIdAllocator;

/**
 * Evaluates a postfix token sequence on a stack of NFA fragments.
 * Every fragment has exactly one start and one accept state; the accept state has no outgoing edge
 * until an enclosing operator connects it.
 */
public class ThompsonConstruction {
    private final Nfa.Builder builder = Nfa.builder();
    private final StateIdAllocator ids;

    private ThompsonConstruction(StateIdAllocator ids) {
        this.ids = ids;
    }

    /**
     * @param postfix tokens in postfix order, without parentheses
     * @param ids     allocator owned by the current compilation
     * @return NFA whose initial state is the start of the outermost fragment and whose only accepting
     * state is its accept state
     */
    public static Nfa evaluate(List<RegexToken> postfix, StateIdAllocator ids) {
        final ThompsonConstruction tc = new ThompsonConstruction(ids);
        final Deque<Fragment> stack = new ArrayDeque<>();

        for (RegexToken token : postfix) {
            switch (token.type()) {
                case LITERAL:
                    tc.builder.addSymbol(token.symbol());
                    stack.push(tc.edge(token.symbol()));
                    break;
                case EPSILON:
                    stack.push(tc.edge(Nfa.EPSILON));
                    break;
                case CONCAT: {
                    final Fragment right = pop(stack, token);
                    final Fragment left = pop(stack, token);
                    stack.push(tc.concat(left, right));
                    break;
                }
                case UNION: {
                    final Fragment right = pop(stack, token);
                    final Fragment left = pop(stack, token);
                    stack.push(tc.union(left, right));
                    break;
                }
                case STAR:
                    stack.push(tc.repeat(pop(stack, token), true));
                    break;
                case PLUS:
                    stack.push(tc.repeat(pop(stack, token), false));
                    break;
                default:
                    throw new RegexSyntaxException("Unexpected '" + token + "' in postfix form", token.position());
            }
        }

        if (stack.isEmpty()) {
            throw new RegexSyntaxException("Empty expression", 0);
        }
        if (stack.size() > 1) {
            throw new RegexSyntaxException(stack.size() + " operands are not joined by an operator",
                    postfix.get(postfix.size() - 1).position());
        }

        final Fragment result = stack.pop();
        return tc.builder.setInitial(result.start())
                .setAccepting(result.accept(), true)
                .build();
    }

    private static Fragment pop(Deque<Fragment> stack, RegexToken operator) {
        if (stack.isEmpty()) {
            throw new RegexSyntaxException("Operator '" + operator + "' is missing an operand", operator.position());
        }
        return stack.pop();
    }

    private String newState() {
        final String state = ids.next();
        builder.addState(state);
        return state;
    }

    private Fragment edge(String symbol) {
        final String start = newState();
        final String accept = newState();
        builder.addTransition(start, symbol, accept);
        return new Fragment(start, accept);
    }

    private Fragment concat(Fragment left, Fragment right) {
        builder.addEpsilonTransition(left.accept(), right.start());
        return new Fragment(left.start(), right.accept());
    }

    private Fragment union(Fragment left, Fragment right) {
        final String start = newState();
        final String accept = newState();
        builder.addEpsilonTransition(start, left.start());
        builder.addEpsilonTransition(start, right.start());
        builder.addEpsilonTransition(left.accept(), accept);
        builder.addEpsilonTransition(right.accept(), accept);
        return new Fragment(start, accept);
    }

    /**
     * Star when {@code allowZero} is set, plus otherwise: plus lacks the start-to-accept skip edge.
     */
    private Fragment repeat(Fragment inner, boolean allowZero) {
        final String start = newState();
        final String accept = newState();
        builder.addEpsilonTransition(start, inner.start());
        if (allowZero) {
            builder.addEpsilonTransition(start, accept);
        }
        builder.addEpsilonTransition(inner.accept(), inner.start());
        builder.addEpsilonTransition(inner.accept(), accept);
        return new Fragment(start, accept);
    }

    record Fragment(String start, String accept) { }
}
