package FSM.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import FSM.Errors.MalformedAutomatonException;

/**
 * Immutable nondeterministic finite acceptor with a single initial state and silent transitions.
 * Silent transitions are stored under {@link #EPSILON}, which is never part of the input alphabet.
 */
public final class Nfa extends AbstractAutomaton {
    public static final String EPSILON = "ε";

    private final Map<String, Map<String, Set<String>>> transitions;
    private final Set<String> acceptingStates;

    private Nfa(Builder builder) {
        super(builder.states, builder.alphabet, builder.initialState);
        final Map<String, Map<String, Set<String>>> copy = new LinkedHashMap<>();
        builder.transitions.forEach((state, row) -> {
            final Map<String, Set<String>> rowCopy = new LinkedHashMap<>();
            row.forEach((symbol, targets) -> rowCopy.put(symbol, Collections.unmodifiableSet(new LinkedHashSet<>(targets))));
            copy.put(state, rowCopy);
        });
        this.transitions = freeze(copy);
        this.acceptingStates = Collections.unmodifiableSet(new LinkedHashSet<>(builder.accepting));
    }

    public Set<String> getAcceptingStates() {
        return acceptingStates;
    }

    public boolean isAccepting(String state) {
        return acceptingStates.contains(state);
    }

    /**
     * @param symbol an input symbol or {@link #EPSILON}
     * @return destinations of the state on the symbol, empty if there is none
     */
    public Set<String> getTransitions(String state, String symbol) {
        final Map<String, Set<String>> row = transitions.get(state);
        if (row == null) {
            return Collections.emptySet();
        }
        return row.getOrDefault(symbol, Collections.emptySet());
    }

    public Set<String> getEpsilonTransitions(String state) {
        return getTransitions(state, EPSILON);
    }

    public boolean hasEpsilonTransitions() {
        for (Map<String, Set<String>> row : transitions.values()) {
            if (row.containsKey(EPSILON)) {
                return true;
            }
        }
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "NFA[" + size() + " states, initial " + getInitialState() + ", accepting " + acceptingStates + "]";
    }

    public static final class Builder {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Set<String> accepting = new LinkedHashSet<>();
        private final Map<String, Map<String, Set<String>>> transitions = new LinkedHashMap<>();
        private String initialState;

        private Builder() {}

        /**
         * Declares an input symbol; declaring the same symbol again has no effect.
         */
        public Builder addSymbol(String symbol) {
            if (EPSILON.equals(symbol)) {
                throw new MalformedAutomatonException("The reserved symbol " + EPSILON + " cannot be declared as input");
            }
            alphabet.add(symbol);
            return this;
        }

        public Builder addState(String state) {
            return addState(state, false);
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

        public Builder setAccepting(String state, boolean accepting) {
            if (accepting) {
                this.accepting.add(state);
            } else {
                this.accepting.remove(state);
            }
            return this;
        }

        public Builder addTransition(String from, String symbol, String to) {
            transitions.computeIfAbsent(from, k -> new LinkedHashMap<>())
                    .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
                    .add(to);
            return this;
        }

        public Builder addEpsilonTransition(String from, String to) {
            return addTransition(from, EPSILON, to);
        }

        public Nfa build() {
            validate(states, alphabet, initialState);
            for (String state : accepting) {
                requireDeclared(states, state, "Accepting set");
            }
            transitions.forEach((from, row) -> {
                requireDeclared(states, from, "Transition source");
                row.forEach((symbol, targets) -> {
                    if (!EPSILON.equals(symbol) && !alphabet.contains(symbol)) {
                        throw new MalformedAutomatonException(
                                "Transition " + from + " -" + symbol + "-> uses a symbol outside the alphabet " + alphabet);
                    }
                    for (String to : targets) {
                        requireDeclared(states, to, "Transition " + from + " -" + symbol + "->");
                    }
                });
            });
            return new Nfa(this);
        }
    }
}
