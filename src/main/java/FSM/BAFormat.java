package FSM;

import FSM.Errors.MalformedAutomatonException;
import FSM.Model.Dfa;
import FSM.Model.Nfa;
import FSM.Model.StateIdAllocator;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

import java.io.*;
import java.util.*;

/**
 * BA (Büchi automaton) files, read as finite acceptors: https://languageinclusion.org/doku.php?id=tools
 */
public class BAFormat {
    public static final String STATE_PREFIX = "q";

    /*
    We just use code from Automatalib and convert from a CompactNFA<String>
     */
    public static Nfa readNfa(InputStream is) throws IOException {
        final CompactNFA<String> automaton;
        try {
            automaton = BAParsers.nfa().readModel(is).model;
        } catch (FormatException e) {
            throw new MalformedAutomatonException("Invalid BA input: " + e.getMessage(), e);
        }
        return fromCompactNFA(automaton);
    }

    public static Nfa readNfa(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return readNfa(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + filePath, e);
        }
    }

    /**
     * States are renamed q0, q1, ... by AutomataLib id. Several initial states are joined under a fresh
     * initial state with silent transitions to each of them.
     */
    static Nfa fromCompactNFA(CompactNFA<String> automaton) {
        final int states = automaton.size();
        final Set<Integer> initialStates = automaton.getInitialStates();
        if (initialStates.isEmpty()) {
            throw new MalformedAutomatonException("BA automaton has no initial state");
        }

        final StateIdAllocator ids = new StateIdAllocator(STATE_PREFIX);
        final String[] names = new String[states];
        final Nfa.Builder builder = Nfa.builder();
        for (String a : automaton.getInputAlphabet()) {
            builder.addSymbol(a);
        }
        for (int i = 0; i < states; i++) {
            names[i] = ids.next();
            builder.addState(names[i], automaton.isAccepting(i));
        }
        for (int i = 0; i < states; i++) {
            for (String a : automaton.getInputAlphabet()) {
                for (Integer t : automaton.getTransitions(i, a)) {
                    builder.addTransition(names[i], a, names[t]);
                }
            }
        }

        if (initialStates.size() == 1) {
            builder.setInitial(names[initialStates.iterator().next()]);
        } else {
            final String start = ids.next();
            builder.addState(start).setInitial(start);
            for (Integer i : new TreeSet<>(initialStates)) {
                builder.addEpsilonTransition(start, names[i]);
            }
        }
        return builder.build();
    }

    public static void writeDfa(OutputStream os, Dfa dfa) throws IOException {
        final CompactDFA<String> compact = dfa.toCompactDFA();
        BAWriter<String> baWriter = new BAWriter<>();
        baWriter.writeModel(os, compact, compact.getInputAlphabet());
    }

    public static void writeDfa(String filename, Dfa dfa) {
        try (OutputStream os = new FileOutputStream(filename)) {
            writeDfa(os, dfa);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + filename, e);
        }
    }
}
