package FSM;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSM.Errors.AmbiguousConversionException;
import FSM.Model.MealyMachine;
import FSM.Model.MealyTransition;
import FSM.Model.MooreMachine;
import FSM.Model.StateIdAllocator;

/**
 * Conversions between Mealy machines (outputs on transitions) and Moore machines (outputs on states).
 */
public class MealyMooreConverter {
    public static final String MOORE_STATE_PREFIX = "R";

    private MealyMooreConverter() {}

    public static MooreMachine toMoore(MealyMachine mealy) {
        return toMoore(mealy, new StateIdAllocator(MOORE_STATE_PREFIX));
    }

    /**
     * Splits every Mealy state into one Moore state per output it is entered with.
     * <p>
     * Incoming outputs are collected in first-discovery order, scanning states in declaration order and
     * symbols in alphabet order. An initial state that is never entered borrows the output of its first
     * outgoing transition. Moore states are named by {@code ids} in (state order, discovery order); the
     * initial Moore state is the copy of the Mealy initial state with its first incoming output.
     * States not reachable from it are dropped.
     *
     * @throws AmbiguousConversionException if the initial state has neither incoming nor outgoing transitions
     */
    public static MooreMachine toMoore(MealyMachine mealy, StateIdAllocator ids) {
        final List<String> alphabet = mealy.getInputAlphabet();
        final Map<String, Set<String>> incoming = incomingOutputs(mealy);

        final String start = mealy.getInitialState();
        final Set<String> startOutputs = incoming.get(start);
        if (startOutputs.isEmpty()) {
            startOutputs.add(firstOutgoingOutput(mealy, start));
        }

        final Map<Copy, String> copies = new HashMap<>();
        final List<Copy> order = new ArrayList<>();
        for (String q : mealy.getStates()) {
            for (String o : incoming.get(q)) {
                register(new Copy(q, o), copies, order, ids);
            }
        }
        final Copy startCopy = new Copy(start, startOutputs.iterator().next());

        // order may grow while iterating: copies met only as targets are registered on demand
        final Map<String, Map<String, String>> transitions = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            final Copy copy = order.get(i);
            final Map<String, String> row = new LinkedHashMap<>();
            for (String a : alphabet) {
                final MealyTransition t = mealy.getTransition(copy.state(), a);
                if (t != null) {
                    row.put(a, register(new Copy(t.target(), t.output()), copies, order, ids));
                }
            }
            transitions.put(copies.get(copy), row);
        }

        final MooreMachine.Builder out = MooreMachine.builder()
                .addSymbols(alphabet)
                .setInitial(copies.get(startCopy));
        for (Copy copy : order) {
            out.addState(copies.get(copy), copy.output());
        }
        transitions.forEach((from, row) -> row.forEach((a, to) -> out.addTransition(from, a, to)));
        return AutomatonTrim.trim(out.build());
    }

    /**
     * Moves the output of every destination state onto the transitions leading to it.
     * State names and the initial state are kept; unreachable states are dropped.
     *
     * @throws FSM.Errors.MalformedAutomatonException if the Moore machine is nondeterministic
     */
    public static MealyMachine toMealy(MooreMachine moore) {
        final MealyMachine.Builder out = MealyMachine.builder()
                .addSymbols(moore.getInputAlphabet())
                .setInitial(moore.getInitialState());
        for (String s : moore.getStates()) {
            out.addState(s);
        }
        for (String s : moore.getStates()) {
            for (String a : moore.getInputAlphabet()) {
                final String t = moore.getSuccessor(s, a);
                if (t != null) {
                    out.setTransition(s, a, t, moore.getOutput(t));
                }
            }
        }
        return AutomatonTrim.trim(out.build());
    }

    /**
     * @return for every state, the outputs of the transitions entering it, in first-discovery order
     */
    static Map<String, Set<String>> incomingOutputs(MealyMachine mealy) {
        final Map<String, Set<String>> incoming = new LinkedHashMap<>();
        for (String q : mealy.getStates()) {
            incoming.put(q, new LinkedHashSet<>());
        }
        for (String q : mealy.getStates()) {
            for (String a : mealy.getInputAlphabet()) {
                final MealyTransition t = mealy.getTransition(q, a);
                if (t != null) {
                    incoming.get(t.target()).add(t.output());
                }
            }
        }
        return incoming;
    }

    private static String firstOutgoingOutput(MealyMachine mealy, String state) {
        for (String a : mealy.getInputAlphabet()) {
            final MealyTransition t = mealy.getTransition(state, a);
            if (t != null) {
                return t.output();
            }
        }
        throw new AmbiguousConversionException(state,
                "initial state has no incoming and no outgoing transition, its Moore output is undefined");
    }

    private static String register(Copy copy, Map<Copy, String> copies, List<Copy> order, StateIdAllocator ids) {
        String name = copies.get(copy);
        if (name == null) {
            name = ids.next();
            copies.put(copy, name);
            order.add(copy);
        }
        return name;
    }

    /**
     * A Mealy state together with the output it was entered with.
     */
    private record Copy(String state, String output) { }
}
