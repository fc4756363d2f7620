package FSM.Regex;

import java.util.List;

import FSM.Model.Nfa;
import FSM.Model.StateIdAllocator;

/**
 * Compiles a regular expression to an NFA with silent transitions.
 * <p>
 * Supported syntax: literals (letters, digits, '_'), '|' union, implicit concatenation, '*' and '+'
 * repetition, parentheses for grouping and "()" for the empty string.
 */
public class RegexCompiler {
    public static final String STATE_PREFIX = "q";

    private RegexCompiler() {}

    /**
     * @throws FSM.Errors.RegexSyntaxException if the expression is malformed
     */
    public static Nfa compile(String regex) {
        return compile(regex, new StateIdAllocator(STATE_PREFIX));
    }

    public static Nfa compile(String regex, StateIdAllocator ids) {
        return ThompsonConstruction.evaluate(toPostfix(regex), ids);
    }

    /**
     * Exposed separately so the grammar can be checked without building automata.
     */
    public static List<RegexToken> toPostfix(String regex) {
        final List<RegexToken> tokens = RegexTokenizer.insertConcatenation(RegexTokenizer.tokenize(regex));
        return PostfixConverter.toPostfix(tokens);
    }
}
