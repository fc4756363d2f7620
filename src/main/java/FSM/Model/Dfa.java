package FSM.Model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import FSM.Errors.MalformedAutomatonException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Immutable deterministic finite acceptor with a partial transition function.
 * A missing transition means there is no move; there is no implicit reject state.
 */
public final class Dfa extends AbstractAutomaton {
    private final Map<String, Map<String, String>> transitions;
    private final Set<String> acceptingStates;

    private Dfa(Builder builder) {
        super(builder.states, builder.alphabet, builder.initialState);
        this.transitions = freeze(builder.transitions);
        this.acceptingStates = Collections.unmodifiableSet(new LinkedHashSet<>(builder.accepting));
    }

    public Set<String> getAcceptingStates() {
        return acceptingStates;
    }

    public boolean isAccepting(String state) {
        return acceptingStates.contains(state);
    }

    /**
     * @return the destination, or {@code null} if the state has no move on the symbol
     */
    public String getSuccessor(String state, String symbol) {
        final Map<String, String> row = transitions.get(state);
        return row == null ? null : row.get(symbol);
    }

    /**
     * Runs the word from the initial state. A missing transition rejects the word.
     *
     * @throws FSM.Errors.UnsupportedSymbolException if the word contains a symbol outside the alphabet
     */
    public boolean accepts(Iterable<String> word) {
        String current = getInitialState();
        for (String symbol : word) {
            requireSymbol(symbol);
            if (current != null) {
                current = getSuccessor(current, symbol);
            }
        }
        return current != null && isAccepting(current);
    }

    /**
     * Exports this automaton to an AutomataLib {@link CompactDFA}; the initial state gets id 0 and the
     * remaining states follow in declaration order.
     */
    public CompactDFA<String> toCompactDFA() {
        final Alphabet<String> alphabet = Alphabets.fromCollection(getInputAlphabet());
        final CompactDFA<String> out = new CompactDFA<>(alphabet, size());
        final Map<String, Integer> ids = new HashMap<>();
        ids.put(getInitialState(), out.addInitialState(isAccepting(getInitialState())));
        for (String state : getStates()) {
            if (!ids.containsKey(state)) {
                ids.put(state, out.addState(isAccepting(state)));
            }
        }
        for (String state : getStates()) {
            for (String symbol : getInputAlphabet()) {
                final String succ = getSuccessor(state, symbol);
                if (succ != null) {
                    out.setTransition(ids.get(state), symbol, ids.get(succ));
                }
            }
        }
        return out;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "DFA[" + size() + " states, initial " + getInitialState() + ", accepting " + acceptingStates + "]";
    }

    public static final class Builder {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Set<String> accepting = new LinkedHashSet<>();
        private final Map<String, Map<String, String>> transitions = new LinkedHashMap<>();
        private String initialState;

        private Builder() {}

        public Builder addSymbol(String symbol) {
            alphabet.add(symbol);
            return this;
        }

        public Builder addSymbols(Iterable<String> symbols) {
            for (String symbol : symbols) {
                addSymbol(symbol);
            }
            return this;
        }

        public Builder addState(String state, boolean accepting) {
            declare(states, state);
            if (accepting) {
                this.accepting.add(state);
            }
            return this;
        }

        public Builder setInitial(String state) {
            this.initialState = state;
            return this;
        }

        /**
         * @throws MalformedAutomatonException if a different destination was already set for the pair
         */
        public Builder setTransition(String from, String symbol, String to) {
            final String previous = transitions.computeIfAbsent(from, k -> new LinkedHashMap<>()).putIfAbsent(symbol, to);
            if (previous != null && !previous.equals(to)) {
                throw new MalformedAutomatonException("State " + from + " has two destinations on " + symbol
                        + ": " + previous + " and " + to);
            }
            return this;
        }

        public Dfa build() {
            validate(states, alphabet, initialState);
            transitions.forEach((from, row) -> {
                requireDeclared(states, from, "Transition source");
                row.forEach((symbol, to) -> {
                    if (!alphabet.contains(symbol)) {
                        throw new MalformedAutomatonException(
                                "Transition " + from + " -" + symbol + "-> uses a symbol outside the alphabet " + alphabet);
                    }
                    requireDeclared(states, to, "Transition " + from + " -" + symbol + "->");
                });
            });
            return new Dfa(this);
        }
    }
}
