package FSM.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSM.Errors.MalformedAutomatonException;
import FSM.Errors.UnsupportedSymbolException;

/**
 * Shared part of every immutable automaton: ordered states, ordered input alphabet and the initial state.
 */
public abstract class AbstractAutomaton {
    private final List<String> states;
    private final List<String> alphabet;
    private final Set<String> stateSet;
    private final Set<String> alphabetSet;
    private final String initialState;

    protected AbstractAutomaton(Set<String> states, Set<String> alphabet, String initialState) {
        this.states = List.copyOf(states);
        this.alphabet = List.copyOf(alphabet);
        this.stateSet = Collections.unmodifiableSet(new LinkedHashSet<>(states));
        this.alphabetSet = Collections.unmodifiableSet(new LinkedHashSet<>(alphabet));
        this.initialState = initialState;
    }

    /**
     * @return states in declaration order
     */
    public List<String> getStates() {
        return states;
    }

    /**
     * @return input symbols in declaration order; never contains {@link Nfa#EPSILON}
     */
    public List<String> getInputAlphabet() {
        return alphabet;
    }

    public String getInitialState() {
        return initialState;
    }

    public boolean containsState(String state) {
        return stateSet.contains(state);
    }

    public boolean containsSymbol(String symbol) {
        return alphabetSet.contains(symbol);
    }

    public int size() {
        return states.size();
    }

    protected void requireSymbol(String symbol) {
        if (!alphabetSet.contains(symbol)) {
            throw new UnsupportedSymbolException(symbol);
        }
    }

    /**
     * Checks the parts every builder has in common before an automaton is frozen.
     */
    static void validate(Set<String> states, Set<String> alphabet, String initialState) {
        if (initialState == null) {
            throw new MalformedAutomatonException("Missing initial state");
        }
        if (!states.contains(initialState)) {
            throw new MalformedAutomatonException("Initial state " + initialState + " is not declared");
        }
        if (alphabet.contains(Nfa.EPSILON)) {
            throw new MalformedAutomatonException("The reserved symbol " + Nfa.EPSILON + " cannot be part of the alphabet");
        }
    }

    static void requireDeclared(Set<String> states, String state, String role) {
        if (!states.contains(state)) {
            throw new MalformedAutomatonException(role + " references undeclared state " + state);
        }
    }

    static void declare(Set<String> states, String state) {
        if (state == null || state.isEmpty()) {
            throw new MalformedAutomatonException("State identifiers must be non-empty");
        }
        if (!states.add(state)) {
            throw new MalformedAutomatonException("State " + state + " is declared twice");
        }
    }

    static <V> Map<String, Map<String, V>> freeze(Map<String, Map<String, V>> table) {
        final Map<String, Map<String, V>> copy = new LinkedHashMap<>();
        table.forEach((state, row) -> copy.put(state, Collections.unmodifiableMap(new LinkedHashMap<>(row))));
        return Collections.unmodifiableMap(copy);
    }
}
