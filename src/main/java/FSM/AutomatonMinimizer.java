package FSM;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSM.Model.Dfa;
import FSM.Model.MealyMachine;
import FSM.Model.MealyTransition;
import FSM.Model.MooreMachine;
import FSM.Model.StateIdAllocator;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Minimization by iterative signature refinement.
 * <p>
 * States start grouped by their observable signature (Moore: state output, Mealy: outputs per symbol,
 * DFA: acceptance). Every pass then splits each block by (observable signature, block indices reached
 * per symbol), until a pass splits nothing. Blocks only ever split, so at most |states| passes are needed.
 * The quotient has one state per block, named in final block order, and keeps only the blocks reachable
 * from the initial block.
 */
public class AutomatonMinimizer {
    public static boolean DEBUG = false;
    public static final String STATE_PREFIX = "s";
    static final int NO_SUCCESSOR = -1;

    private AutomatonMinimizer() {}

    public static MooreMachine minimize(MooreMachine moore) {
        return minimize(moore, new StateIdAllocator(STATE_PREFIX));
    }

    /**
     * @throws FSM.Errors.MalformedAutomatonException if the machine is nondeterministic
     */
    public static MooreMachine minimize(MooreMachine moore, StateIdAllocator ids) {
        final List<String> states = moore.getStates();
        final List<String> alphabet = moore.getInputAlphabet();
        final Object2IntMap<String> index = indexOf(states);
        final int[] successors = successorsOf(moore, index);
        final Partition partition = refine(states.size(), alphabet.size(), successors, outputsOf(moore));
        final String[] names = partition.names(ids);

        final MooreMachine.Builder out = MooreMachine.builder()
                .addSymbols(alphabet)
                .setInitial(names[partition.blockOf[index.getInt(moore.getInitialState())]]);
        for (int b = 0; b < partition.size(); b++) {
            out.addState(names[b], moore.getOutput(states.get(partition.representative(b))));
        }
        for (int b = 0; b < partition.size(); b++) {
            final int rep = partition.representative(b);
            for (int a = 0; a < alphabet.size(); a++) {
                final int succ = successors[rep * alphabet.size() + a];
                if (succ != NO_SUCCESSOR) {
                    out.addTransition(names[b], alphabet.get(a), names[partition.blockOf[succ]]);
                }
            }
        }
        return AutomatonTrim.trim(out.build());
    }

    public static MealyMachine minimize(MealyMachine mealy) {
        return minimize(mealy, new StateIdAllocator(STATE_PREFIX));
    }

    public static MealyMachine minimize(MealyMachine mealy, StateIdAllocator ids) {
        final List<String> states = mealy.getStates();
        final List<String> alphabet = mealy.getInputAlphabet();
        final Object2IntMap<String> index = indexOf(states);
        final int[] successors = new int[states.size() * alphabet.size()];
        final List<Object> observable = new ArrayList<>(states.size());
        for (int s = 0; s < states.size(); s++) {
            // ArrayList tolerates the null marker of a missing transition
            final List<String> outputs = new ArrayList<>(alphabet.size());
            for (int a = 0; a < alphabet.size(); a++) {
                final MealyTransition t = mealy.getTransition(states.get(s), alphabet.get(a));
                successors[s * alphabet.size() + a] = t == null ? NO_SUCCESSOR : index.getInt(t.target());
                outputs.add(t == null ? null : t.output());
            }
            observable.add(outputs);
        }

        final Partition partition = refine(states.size(), alphabet.size(), successors, observable);
        final String[] names = partition.names(ids);

        final MealyMachine.Builder out = MealyMachine.builder()
                .addSymbols(alphabet)
                .setInitial(names[partition.blockOf[index.getInt(mealy.getInitialState())]]);
        for (int b = 0; b < partition.size(); b++) {
            out.addState(names[b]);
        }
        for (int b = 0; b < partition.size(); b++) {
            final String rep = states.get(partition.representative(b));
            for (String a : alphabet) {
                final MealyTransition t = mealy.getTransition(rep, a);
                if (t != null) {
                    out.setTransition(names[b], a, names[partition.blockOf[index.getInt(t.target())]], t.output());
                }
            }
        }
        return AutomatonTrim.trim(out.build());
    }

    public static Dfa minimize(Dfa dfa) {
        return minimize(dfa, new StateIdAllocator(STATE_PREFIX));
    }

    /**
     * The transition function stays partial: a missing transition is part of a state's signature,
     * no sink state is introduced.
     */
    public static Dfa minimize(Dfa dfa, StateIdAllocator ids) {
        final List<String> states = dfa.getStates();
        final List<String> alphabet = dfa.getInputAlphabet();
        final Object2IntMap<String> index = indexOf(states);
        final int[] successors = new int[states.size() * alphabet.size()];
        final List<Object> observable = new ArrayList<>(states.size());
        for (int s = 0; s < states.size(); s++) {
            for (int a = 0; a < alphabet.size(); a++) {
                successors[s * alphabet.size() + a] = indexOrNone(index, dfa.getSuccessor(states.get(s), alphabet.get(a)));
            }
            observable.add(dfa.isAccepting(states.get(s)));
        }

        final Partition partition = refine(states.size(), alphabet.size(), successors, observable);
        final String[] names = partition.names(ids);

        final Dfa.Builder out = Dfa.builder()
                .addSymbols(alphabet)
                .setInitial(names[partition.blockOf[index.getInt(dfa.getInitialState())]]);
        for (int b = 0; b < partition.size(); b++) {
            out.addState(names[b], dfa.isAccepting(states.get(partition.representative(b))));
        }
        for (int b = 0; b < partition.size(); b++) {
            final int rep = partition.representative(b);
            for (int a = 0; a < alphabet.size(); a++) {
                final int succ = successors[rep * alphabet.size() + a];
                if (succ != NO_SUCCESSOR) {
                    out.setTransition(names[b], alphabet.get(a), names[partition.blockOf[succ]]);
                }
            }
        }
        return AutomatonTrim.trim(out.build());
    }

    /**
     * Computes the coarsest stable partition.
     *
     * @param numStates  number of states, identified by 0..numStates-1
     * @param numInputs  number of input symbols, identified by 0..numInputs-1
     * @param successors {@code successors[s * numInputs + a]} is the successor of s on a, or {@link #NO_SUCCESSOR}
     * @param observable observable signature of each state; compared with {@code equals}
     */
    static Partition refine(int numStates, int numInputs, int[] successors, List<?> observable) {
        final Map<Object, IntList> initial = new LinkedHashMap<>();
        for (int s = 0; s < numStates; s++) {
            initial.computeIfAbsent(observable.get(s), k -> new IntArrayList()).add(s);
        }
        Partition partition = new Partition(new ArrayList<>(initial.values()), numStates);

        int passes = 0;
        boolean split = true;
        while (split) {
            split = false;
            final List<IntList> next = new ArrayList<>(partition.size());
            for (IntList block : partition.blocks) {
                final Map<Signature, IntList> buckets = new LinkedHashMap<>();
                for (int s : block) {
                    final IntList targets = new IntArrayList(numInputs);
                    for (int a = 0; a < numInputs; a++) {
                        final int succ = successors[s * numInputs + a];
                        targets.add(succ == NO_SUCCESSOR ? NO_SUCCESSOR : partition.blockOf[succ]);
                    }
                    buckets.computeIfAbsent(new Signature(observable.get(s), targets), k -> new IntArrayList()).add(s);
                }
                if (buckets.size() > 1) {
                    split = true;
                }
                next.addAll(buckets.values());
            }
            partition = new Partition(next, numStates);
            passes++;
        }

        if (DEBUG) {
            System.out.println("DEBUG: Refinement stable after " + passes + " passes: "
                    + numStates + " states -> " + partition.size() + " blocks");
        }
        return partition;
    }

    /**
     * Name-based view of the stable partition of a Moore machine, blocks in final order.
     */
    public static List<Set<String>> stablePartition(MooreMachine moore) {
        final List<String> states = moore.getStates();
        final List<String> alphabet = moore.getInputAlphabet();
        final Object2IntMap<String> index = indexOf(states);
        final int[] successors = successorsOf(moore, index);
        final Partition partition = refine(states.size(), alphabet.size(), successors, outputsOf(moore));
        final List<Set<String>> result = new ArrayList<>(partition.size());
        for (IntList block : partition.blocks) {
            final Set<String> members = new LinkedHashSet<>();
            for (int s : block) {
                members.add(states.get(s));
            }
            result.add(members);
        }
        return result;
    }

    private static int[] successorsOf(MooreMachine moore, Object2IntMap<String> index) {
        final List<String> states = moore.getStates();
        final List<String> alphabet = moore.getInputAlphabet();
        final int[] successors = new int[states.size() * alphabet.size()];
        for (int s = 0; s < states.size(); s++) {
            for (int a = 0; a < alphabet.size(); a++) {
                successors[s * alphabet.size() + a] = indexOrNone(index, moore.getSuccessor(states.get(s), alphabet.get(a)));
            }
        }
        return successors;
    }

    private static List<String> outputsOf(MooreMachine moore) {
        final List<String> outputs = new ArrayList<>(moore.size());
        for (String s : moore.getStates()) {
            outputs.add(moore.getOutput(s));
        }
        return outputs;
    }

    private static Object2IntMap<String> indexOf(List<String> states) {
        final Object2IntMap<String> index = new Object2IntOpenHashMap<>(states.size());
        index.defaultReturnValue(NO_SUCCESSOR);
        for (int i = 0; i < states.size(); i++) {
            index.put(states.get(i), i);
        }
        return index;
    }

    private static int indexOrNone(Object2IntMap<String> index, String state) {
        return state == null ? NO_SUCCESSOR : index.getInt(state);
    }

    private record Signature(Object observable, IntList targets) { }

    /**
     * Disjoint blocks covering 0..numStates-1; members of a block are in increasing order.
     */
    static final class Partition {
        final List<IntList> blocks;
        final int[] blockOf;

        Partition(List<IntList> blocks, int numStates) {
            this.blocks = blocks;
            this.blockOf = new int[numStates];
            Arrays.fill(blockOf, -1);
            for (int b = 0; b < blocks.size(); b++) {
                for (int s : blocks.get(b)) {
                    blockOf[s] = b;
                }
            }
        }

        int size() {
            return blocks.size();
        }

        int representative(int block) {
            return blocks.get(block).getInt(0);
        }

        String[] names(StateIdAllocator ids) {
            final String[] names = new String[blocks.size()];
            for (int b = 0; b < names.length; b++) {
                names[b] = ids.next();
            }
            return names;
        }
    }
}
