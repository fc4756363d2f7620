package FSM.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import FSM.Errors.MalformedAutomatonException;

/**
 * Immutable Moore machine: every state carries an output label.
 * Tables may list several destinations for one (state, symbol) pair, so the transition relation is kept
 * set-valued; {@link #getSuccessor(String, String)} is the deterministic view used by the algorithms.
 */
public final class MooreMachine extends AbstractAutomaton {
    private final Map<String, String> outputs;
    private final Map<String, Map<String, Set<String>>> transitions;

    private MooreMachine(Builder builder) {
        super(builder.states, builder.alphabet, builder.initialState);
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
        final Map<String, Map<String, Set<String>>> copy = new LinkedHashMap<>();
        builder.transitions.forEach((state, row) -> {
            final Map<String, Set<String>> rowCopy = new LinkedHashMap<>();
            row.forEach((symbol, targets) -> rowCopy.put(symbol, Collections.unmodifiableSet(new LinkedHashSet<>(targets))));
            copy.put(state, rowCopy);
        });
        this.transitions = freeze(copy);
    }

    public String getOutput(String state) {
        return outputs.get(state);
    }

    public Set<String> getSuccessors(String state, String symbol) {
        final Map<String, Set<String>> row = transitions.get(state);
        if (row == null) {
            return Collections.emptySet();
        }
        return row.getOrDefault(symbol, Collections.emptySet());
    }

    /**
     * @return the single destination, or {@code null} if there is none
     * @throws MalformedAutomatonException if the pair has several destinations
     */
    public String getSuccessor(String state, String symbol) {
        final Set<String> succs = getSuccessors(state, symbol);
        if (succs.isEmpty()) {
            return null;
        }
        if (succs.size() > 1) {
            throw new MalformedAutomatonException("State " + state + " has " + succs.size()
                    + " destinations on " + symbol + "; a deterministic Moore machine is required");
        }
        return succs.iterator().next();
    }

    public boolean isDeterministic() {
        for (Map<String, Set<String>> row : transitions.values()) {
            for (Set<String> targets : row.values()) {
                if (targets.size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Feeds the word to the machine and collects the output of every visited state, initial state included.
     *
     * @return the outputs, or empty if some transition along the word is missing
     */
    public Optional<List<String>> run(Iterable<String> word) {
        final List<String> result = new ArrayList<>();
        String current = getInitialState();
        result.add(getOutput(current));
        for (String symbol : word) {
            requireSymbol(symbol);
            if (current == null) {
                continue;
            }
            current = getSuccessor(current, symbol);
            if (current != null) {
                result.add(getOutput(current));
            }
        }
        return current == null ? Optional.empty() : Optional.of(result);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Moore[" + size() + " states, initial " + getInitialState() + "]";
    }

    public static final class Builder {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Map<String, String> outputs = new LinkedHashMap<>();
        private final Map<String, Map<String, Set<String>>> transitions = new LinkedHashMap<>();
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

        public Builder addState(String state, String output) {
            if (output == null) {
                throw new MalformedAutomatonException("State " + state + " has no output");
            }
            declare(states, state);
            outputs.put(state, output);
            return this;
        }

        public Builder setInitial(String state) {
            this.initialState = state;
            return this;
        }

        public Builder addTransition(String from, String symbol, String to) {
            transitions.computeIfAbsent(from, k -> new LinkedHashMap<>())
                    .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
                    .add(to);
            return this;
        }

        public MooreMachine build() {
            validate(states, alphabet, initialState);
            transitions.forEach((from, row) -> {
                requireDeclared(states, from, "Transition source");
                row.forEach((symbol, targets) -> {
                    if (!alphabet.contains(symbol)) {
                        throw new MalformedAutomatonException(
                                "Transition " + from + " -" + symbol + "-> uses a symbol outside the alphabet " + alphabet);
                    }
                    for (String to : targets) {
                        requireDeclared(states, to, "Transition " + from + " -" + symbol + "->");
                    }
                });
            });
            return new MooreMachine(this);
        }
    }
}
