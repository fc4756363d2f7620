package FSM;

import FSM.Model.Nfa;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.common.util.random.RandomUtil;

import java.util.List;
import java.util.Random;

public class TabakovVardiRandomNFA {
    public static final List<String> SYMBOLS = List.of("a", "b");

    /**
     * Generate random NFA using Tabakov and Vardi's approach, described in the paper
     * <a href="https://doi.org/10.1007/11591191_28">Experimental Evaluation of Classical Automata Constructions</a>
     * by Deian Tabakov and Moshe Y. Vardi.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states
     * @param td
     *      transition density, in [0,size]
     * @param ad
     *      acceptance density, in (0,1]. 0.5 is the usual value
     * @param alphabet
     *      alphabet
     * @return
     *      a random NFA, not necessarily connected
     */
    public static CompactNFA<String> generateNFA(Random r, int size, float td, float ad, Alphabet<String> alphabet) {
        return generateNFA(r, size, Math.round(td * size), Math.max(1, Math.round(ad * size)), alphabet);
    }

    /**
     * Generate random NFA, with fixed number of accept states and edges (per letter).
     */
    public static CompactNFA<String> generateNFA(Random r, int size, int edgeNum, int acceptNum, Alphabet<String> alphabet) {
        assert acceptNum > 0 && acceptNum <= size;
        assert edgeNum >= 0 && edgeNum <= size*size;

        CompactNFA<String> result = new CompactNFA<>(alphabet, size);
        for (int i = 0; i < size; i++) {
            result.addState(false);
        }
        // per the paper, the first state is always initial and accepting
        result.setInitial(0, true);
        result.setAccepting(0, true);

        // We want exactly acceptNum-1 further final states, from the elements [1,size).
        int[] finalStates = RandomUtil.distinctIntegers(r, acceptNum - 1, 1, size);
        for (int f : finalStates) {
            result.setAccepting(f, true);
        }

        // For each letter, add edgeNum transitions.
        for (String a : alphabet) {
            for (int edgeIndex : RandomUtil.distinctIntegers(r, edgeNum, size*size)) {
                result.addTransition(edgeIndex / size, a, edgeIndex % size);
            }
        }
        return result;
    }

    public static CompactNFA<String> getRandomAutomaton(int randomSeed, int size) {
        final float td = 1.25f;
        final float ad = 0.5f;
        final Random random = new Random(randomSeed);
        return generateNFA(random, size, td, ad, Alphabets.fromList(SYMBOLS));
    }

    /**
     * Same automaton as {@link #getRandomAutomaton(int, int)}, plus {@code epsilonNum} random silent edges.
     */
    public static Nfa getRandomEpsilonNfa(int randomSeed, int size, int epsilonNum) {
        final Nfa plain = BAFormat.fromCompactNFA(getRandomAutomaton(randomSeed, size));
        final Nfa.Builder builder = Nfa.builder().setInitial(plain.getInitialState());
        for (String a : plain.getInputAlphabet()) {
            builder.addSymbol(a);
        }
        for (String s : plain.getStates()) {
            builder.addState(s, plain.isAccepting(s));
        }
        for (String s : plain.getStates()) {
            for (String a : plain.getInputAlphabet()) {
                for (String t : plain.getTransitions(s, a)) {
                    builder.addTransition(s, a, t);
                }
            }
        }
        final Random random = new Random(-randomSeed - 1);
        for (int edgeIndex : RandomUtil.distinctIntegers(random, Math.min(epsilonNum, size*size), size*size)) {
            builder.addEpsilonTransition(plain.getStates().get(edgeIndex / size), plain.getStates().get(edgeIndex % size));
        }
        return builder.build();
    }
}
