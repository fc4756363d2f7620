package FSM;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import FSM.Model.MooreMachine;

/**
 * Decides whether two Moore machines are the same machine up to renaming of states.
 * <p>
 * Both machines are traversed breadth-first in lockstep from their initial states while a partial
 * injective mapping from the first machine's states to the second's is extended. Destination sets are
 * paired after sorting them lexicographically, so the check is exact for deterministic machines and only
 * a heuristic where a state has several destinations for one symbol.
 */
public class EquivalenceChecker {
    private EquivalenceChecker() {}

    public static boolean areEquivalent(MooreMachine first, MooreMachine second) {
        return findDifference(first, second).isEmpty();
    }

    /**
     * @return a description of the first mismatch met by the traversal, or empty if the machines correspond
     */
    public static Optional<String> findDifference(MooreMachine first, MooreMachine second) {
        final Map<String, String> forward = new HashMap<>();
        final Map<String, String> backward = new HashMap<>();
        final Deque<String[]> queue = new ArrayDeque<>();

        final Set<String> symbols = new TreeSet<>(first.getInputAlphabet());
        symbols.addAll(second.getInputAlphabet());

        forward.put(first.getInitialState(), second.getInitialState());
        backward.put(second.getInitialState(), first.getInitialState());
        queue.add(new String[] {first.getInitialState(), second.getInitialState()});

        while (!queue.isEmpty()) {
            final String[] pair = queue.poll();
            final String s1 = pair[0];
            final String s2 = pair[1];

            if (!Objects.equals(first.getOutput(s1), second.getOutput(s2))) {
                return Optional.of("States " + s1 + " and " + s2 + " have different outputs: "
                        + first.getOutput(s1) + " vs " + second.getOutput(s2));
            }

            for (String symbol : symbols) {
                final List<String> targets1 = new ArrayList<>(new TreeSet<>(first.getSuccessors(s1, symbol)));
                final List<String> targets2 = new ArrayList<>(new TreeSet<>(second.getSuccessors(s2, symbol)));
                if (targets1.size() != targets2.size()) {
                    return Optional.of("States " + s1 + " and " + s2 + " have " + targets1.size() + " vs "
                            + targets2.size() + " destinations on " + symbol);
                }
                for (int i = 0; i < targets1.size(); i++) {
                    final String t1 = targets1.get(i);
                    final String t2 = targets2.get(i);
                    final String mapped = forward.get(t1);
                    if (mapped != null) {
                        if (!mapped.equals(t2)) {
                            return Optional.of("State " + t1 + " corresponds to " + mapped + " but is reached with "
                                    + t2 + " on " + symbol + " from " + s1 + "/" + s2);
                        }
                        continue;
                    }
                    final String preimage = backward.get(t2);
                    if (preimage != null) {
                        return Optional.of("State " + t2 + " already corresponds to " + preimage + ", not to " + t1);
                    }
                    forward.put(t1, t2);
                    backward.put(t2, t1);
                    queue.add(new String[] {t1, t2});
                }
            }
        }
        return Optional.empty();
    }
}
