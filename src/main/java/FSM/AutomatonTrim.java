package FSM;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

import FSM.Model.Dfa;
import FSM.Model.MealyMachine;
import FSM.Model.MealyTransition;
import FSM.Model.MooreMachine;

/**
 * Removal of states that cannot be reached from the initial state.
 * Kept states keep their names and their relative order.
 */
public class AutomatonTrim {
    private AutomatonTrim() {}

    /**
     * Deterministic breadth-first search, successors visited in alphabet order.
     *
     * @return reachable states in discovery order
     */
    public static Set<String> reachableStates(String initial,
                                              List<String> alphabet,
                                              BiFunction<String, String, Collection<String>> successors) {
        final Set<String> reachable = new LinkedHashSet<>();
        final Deque<String> queue = new ArrayDeque<>();
        reachable.add(initial);
        queue.add(initial);
        while (!queue.isEmpty()) {
            final String s = queue.poll();
            for (String a : alphabet) {
                for (String t : successors.apply(s, a)) {
                    if (reachable.add(t)) {
                        queue.add(t);
                    }
                }
            }
        }
        return reachable;
    }

    public static Dfa trim(Dfa dfa) {
        final Set<String> reachable = reachableStates(dfa.getInitialState(), dfa.getInputAlphabet(),
                (s, a) -> singletonOrEmpty(dfa.getSuccessor(s, a)));
        if (reachable.size() == dfa.size()) {
            return dfa;
        }
        final Dfa.Builder out = Dfa.builder().addSymbols(dfa.getInputAlphabet()).setInitial(dfa.getInitialState());
        for (String s : dfa.getStates()) {
            if (reachable.contains(s)) {
                out.addState(s, dfa.isAccepting(s));
            }
        }
        for (String s : dfa.getStates()) {
            if (!reachable.contains(s)) {
                continue;
            }
            for (String a : dfa.getInputAlphabet()) {
                final String t = dfa.getSuccessor(s, a);
                if (t != null) {
                    out.setTransition(s, a, t);
                }
            }
        }
        return out.build();
    }

    public static MealyMachine trim(MealyMachine mealy) {
        final Set<String> reachable = reachableStates(mealy.getInitialState(), mealy.getInputAlphabet(),
                (s, a) -> singletonOrEmpty(mealy.getSuccessor(s, a)));
        if (reachable.size() == mealy.size()) {
            return mealy;
        }
        final MealyMachine.Builder out = MealyMachine.builder()
                .addSymbols(mealy.getInputAlphabet())
                .setInitial(mealy.getInitialState());
        for (String s : mealy.getStates()) {
            if (reachable.contains(s)) {
                out.addState(s);
            }
        }
        for (String s : mealy.getStates()) {
            if (!reachable.contains(s)) {
                continue;
            }
            for (String a : mealy.getInputAlphabet()) {
                final MealyTransition t = mealy.getTransition(s, a);
                if (t != null) {
                    out.setTransition(s, a, t.target(), t.output());
                }
            }
        }
        return out.build();
    }

    public static MooreMachine trim(MooreMachine moore) {
        final Set<String> reachable = reachableStates(moore.getInitialState(), moore.getInputAlphabet(),
                moore::getSuccessors);
        if (reachable.size() == moore.size()) {
            return moore;
        }
        final MooreMachine.Builder out = MooreMachine.builder()
                .addSymbols(moore.getInputAlphabet())
                .setInitial(moore.getInitialState());
        for (String s : moore.getStates()) {
            if (reachable.contains(s)) {
                out.addState(s, moore.getOutput(s));
            }
        }
        for (String s : moore.getStates()) {
            if (!reachable.contains(s)) {
                continue;
            }
            for (String a : moore.getInputAlphabet()) {
                for (String t : moore.getSuccessors(s, a)) {
                    out.addTransition(s, a, t);
                }
            }
        }
        return out.build();
    }

    private static Collection<String> singletonOrEmpty(String state) {
        return state == null ? Collections.emptySet() : Collections.singleton(state);
    }
}
