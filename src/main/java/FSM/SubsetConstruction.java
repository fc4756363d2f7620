package FSM;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSM.Model.DeterminizeRecord;
import FSM.Model.Dfa;
import FSM.Model.Nfa;
import FSM.Model.StateIdAllocator;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Subset construction with epsilon-closure.
 * NFA state sets are kept as {@link BitSet}s over the NFA's state indices; every distinct non-empty set
 * reached from the closure of the initial state becomes one DFA state.
 */
public class SubsetConstruction {
    public static boolean DEBUG = false;
    public static final String STATE_PREFIX = "S";
    private static final long STATES_EXPLORED_PERIOD = 10000L;

    private final Nfa nfa;
    private final List<String> states;
    private final Object2IntMap<String> stateIndex;
    private final BitSet accepting;

    public SubsetConstruction(Nfa nfa) {
        this.nfa = nfa;
        this.states = nfa.getStates();
        this.stateIndex = new Object2IntOpenHashMap<>(states.size());
        this.stateIndex.defaultReturnValue(-1);
        this.accepting = new BitSet(states.size());
        for (int i = 0; i < states.size(); i++) {
            stateIndex.put(states.get(i), i);
            if (nfa.isAccepting(states.get(i))) {
                accepting.set(i);
            }
        }
    }

    public static Dfa determinize(Nfa nfa) {
        return determinize(nfa, new StateIdAllocator(STATE_PREFIX));
    }

    public static Dfa determinize(Nfa nfa, StateIdAllocator ids) {
        return new SubsetConstruction(nfa).determinize(ids);
    }

    /**
     * Breadth-first subset construction. DFA states are named by {@code ids} in discovery order,
     * the closure of the NFA's initial state first. An empty successor set records no transition.
     */
    public Dfa determinize(StateIdAllocator ids) {
        final Dfa.Builder out = Dfa.builder().addSymbols(nfa.getInputAlphabet());
        final Map<BitSet, String> outStateMap = new HashMap<>();
        final Deque<DeterminizeRecord> queue = new ArrayDeque<>();

        final BitSet init = new BitSet(states.size());
        init.set(stateIndex.getInt(nfa.getInitialState()));
        final BitSet initClosure = epsilonClosure(init);
        final String initOut = ids.next();
        out.addState(initOut, initClosure.intersects(accepting)).setInitial(initOut);
        outStateMap.put(initClosure, initOut);
        queue.add(new DeterminizeRecord(initClosure, initOut));

        long statesExplored = 0;
        while (!queue.isEmpty()) {
            final DeterminizeRecord curr = queue.poll();

            for (String symbol : nfa.getInputAlphabet()) {
                final BitSet succ = epsilonClosure(move(curr.inputState(), symbol));
                if (succ.isEmpty()) {
                    continue;
                }
                String outSucc = outStateMap.get(succ);
                if (outSucc == null) {
                    // add new state to DFA and to queue
                    outSucc = ids.next();
                    out.addState(outSucc, succ.intersects(accepting));
                    outStateMap.put(succ, outSucc);
                    queue.add(new DeterminizeRecord(succ, outSucc));
                }
                out.setTransition(curr.outputState(), symbol, outSucc);
            }
            statesExplored++;
            if (DEBUG && statesExplored % STATES_EXPLORED_PERIOD == 0) {
                System.out.println("DEBUG: Explored " + statesExplored + " subsets - "
                        + queue.size() + " left in queue - " + outStateMap.size() + " DFA states");
            }
        }

        if (DEBUG) {
            System.out.println("DEBUG: Subset construction: " + states.size() + " NFA states -> "
                    + outStateMap.size() + " DFA states");
        }
        return out.build();
    }

    /**
     * @return the smallest superset of {@code set} closed under silent transitions; {@code set} is not modified
     */
    public BitSet epsilonClosure(BitSet set) {
        final BitSet closure = (BitSet) set.clone();
        final Deque<Integer> worklist = new ArrayDeque<>();
        for (int i = set.nextSetBit(0); i >= 0; i = set.nextSetBit(i + 1)) {
            worklist.push(i);
        }
        while (!worklist.isEmpty()) {
            final int current = worklist.pop();
            for (String t : nfa.getEpsilonTransitions(states.get(current))) {
                final int ti = stateIndex.getInt(t);
                if (!closure.get(ti)) { // visited guard; silent edges may form cycles
                    closure.set(ti);
                    worklist.push(ti);
                }
            }
        }
        return closure;
    }

    /**
     * Name-based view of {@link #epsilonClosure(BitSet)}, states listed in NFA declaration order.
     */
    public Set<String> epsilonClosure(Collection<String> stateNames) {
        final BitSet set = new BitSet(states.size());
        for (String s : stateNames) {
            final int i = stateIndex.getInt(s);
            if (i < 0) {
                throw new IllegalArgumentException("Unknown NFA state " + s);
            }
            set.set(i);
        }
        return toNames(epsilonClosure(set));
    }

    private BitSet move(BitSet set, String symbol) {
        final BitSet result = new BitSet(states.size());
        for (int i = set.nextSetBit(0); i >= 0; i = set.nextSetBit(i + 1)) {
            for (String t : nfa.getTransitions(states.get(i), symbol)) {
                result.set(stateIndex.getInt(t));
            }
        }
        return result;
    }

    private Set<String> toNames(BitSet set) {
        final List<String> names = new ArrayList<>(set.cardinality());
        for (int i = set.nextSetBit(0); i >= 0; i = set.nextSetBit(i + 1)) {
            names.add(states.get(i));
        }
        return new LinkedHashSet<>(names);
    }
}
