package FSM.Model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import FSM.Errors.MalformedAutomatonException;

/**
 * Immutable deterministic Mealy machine: every transition carries the output it emits.
 */
public final class MealyMachine extends AbstractAutomaton {
    private final Map<String, Map<String, MealyTransition>> transitions;

    private MealyMachine(Builder builder) {
        super(builder.states, builder.alphabet, builder.initialState);
        this.transitions = freeze(builder.transitions);
    }

    /**
     * @return the transition, or {@code null} if the state has no move on the symbol
     */
    public MealyTransition getTransition(String state, String symbol) {
        final Map<String, MealyTransition> row = transitions.get(state);
        return row == null ? null : row.get(symbol);
    }

    public String getSuccessor(String state, String symbol) {
        final MealyTransition t = getTransition(state, symbol);
        return t == null ? null : t.target();
    }

    /**
     * Feeds the word to the machine and collects the emitted outputs.
     *
     * @return the outputs, or empty if some transition along the word is missing
     * @throws FSM.Errors.UnsupportedSymbolException if the word contains a symbol outside the alphabet
     */
    public Optional<List<String>> run(Iterable<String> word) {
        final List<String> outputs = new ArrayList<>();
        String current = getInitialState();
        for (String symbol : word) {
            requireSymbol(symbol);
            if (current == null) {
                continue;
            }
            final MealyTransition t = getTransition(current, symbol);
            if (t == null) {
                current = null;
            } else {
                outputs.add(t.output());
                current = t.target();
            }
        }
        return current == null ? Optional.empty() : Optional.of(outputs);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Mealy[" + size() + " states, initial " + getInitialState() + "]";
    }

    public static final class Builder {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Map<String, Map<String, MealyTransition>> transitions = new LinkedHashMap<>();
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

        public Builder addState(String state) {
            declare(states, state);
            return this;
        }

        public Builder setInitial(String state) {
            this.initialState = state;
            return this;
        }

        public Builder setTransition(String from, String symbol, String to, String output) {
            if (output == null) {
                throw new MalformedAutomatonException("Transition " + from + " -" + symbol + "-> has no output");
            }
            final MealyTransition t = new MealyTransition(to, output);
            final MealyTransition previous = transitions.computeIfAbsent(from, k -> new LinkedHashMap<>()).putIfAbsent(symbol, t);
            if (previous != null && !previous.equals(t)) {
                throw new MalformedAutomatonException("State " + from + " has two transitions on " + symbol
                        + ": " + previous + " and " + t);
            }
            return this;
        }

        public MealyMachine build() {
            validate(states, alphabet, initialState);
            transitions.forEach((from, row) -> {
                requireDeclared(states, from, "Transition source");
                row.forEach((symbol, t) -> {
                    if (!alphabet.contains(symbol)) {
                        throw new MalformedAutomatonException(
                                "Transition " + from + " -" + symbol + "-> uses a symbol outside the alphabet " + alphabet);
                    }
                    requireDeclared(states, t.target(), "Transition " + from + " -" + symbol + "->");
                });
            });
            return new MealyMachine(this);
        }
    }
}
