package FSM.Table;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import FSM.Errors.MalformedAutomatonException;
import FSM.Model.AbstractAutomaton;
import FSM.Model.Dfa;
import FSM.Model.MealyMachine;
import FSM.Model.MealyTransition;
import FSM.Model.MooreMachine;
import FSM.Model.Nfa;

/**
 * Semicolon-delimited transition tables. Columns are states, rows are input symbols; the first state
 * column is the initial state.
 * <pre>
 * acceptor:  ;;F        Moore:  ;y1;y2      Mealy:  ;s0;s1
 *            ;q0;q1             ;s0;s1              a;s1/y1;s0/y2
 *            a;q0,q1;-          a;s1;s0
 *            ε;q1;
 * </pre>
 * Empty lines are ignored, cells are trimmed, an empty cell or "-" means no transition.
 */
public class TableFormat {
    public static final String DELIMITER = ";";
    public static final String ACCEPTING_FLAG = "F";
    public static final String NO_TRANSITION = "-";
    private static final String TARGET_SEPARATOR = ",";
    private static final String OUTPUT_SEPARATOR = "/";

    private TableFormat() {}

    public static Nfa readNfa(Path path) {
        return readNfa(readLines(path));
    }

    public static Nfa readNfa(List<String> lines) {
        final List<Row> rows = rows(lines, 2, "acceptor");
        final Row flags = rows.get(0);
        final Row header = rows.get(1);
        final List<String> states = declaredStates(header);
        if (flags.width() > states.size()) {
            throw malformed(flags, "has " + flags.width() + " flags for " + states.size() + " states");
        }

        final Nfa.Builder builder = Nfa.builder();
        for (int i = 0; i < states.size(); i++) {
            builder.addState(states.get(i), ACCEPTING_FLAG.equalsIgnoreCase(flags.cell(i)));
        }
        builder.setInitial(states.get(0));

        final Set<String> symbols = new HashSet<>();
        for (Row row : rows.subList(2, rows.size())) {
            final String symbol = symbolOf(row, states.size(), symbols);
            if (!Nfa.EPSILON.equals(symbol)) {
                builder.addSymbol(symbol);
            }
            for (int i = 0; i < states.size(); i++) {
                for (String target : targets(row, i, states)) {
                    builder.addTransition(states.get(i), symbol, target);
                }
            }
        }
        return builder.build();
    }

    public static Dfa readDfa(Path path) {
        return readDfa(readLines(path));
    }

    /**
     * Reads an acceptor table that must not contain silent or multi-target transitions.
     */
    public static Dfa readDfa(List<String> lines) {
        final Nfa nfa = readNfa(lines);
        final Dfa.Builder builder = Dfa.builder().addSymbols(nfa.getInputAlphabet()).setInitial(nfa.getInitialState());
        for (String s : nfa.getStates()) {
            builder.addState(s, nfa.isAccepting(s));
            if (!nfa.getEpsilonTransitions(s).isEmpty()) {
                throw new MalformedAutomatonException("State " + s + " has silent transitions; a DFA table is required");
            }
        }
        for (String s : nfa.getStates()) {
            for (String a : nfa.getInputAlphabet()) {
                final Set<String> targets = nfa.getTransitions(s, a);
                if (targets.size() > 1) {
                    throw new MalformedAutomatonException("State " + s + " has " + targets.size()
                            + " destinations on " + a + "; a DFA table is required");
                }
                for (String t : targets) {
                    builder.setTransition(s, a, t);
                }
            }
        }
        return builder.build();
    }

    public static MooreMachine readMoore(Path path) {
        return readMoore(readLines(path));
    }

    public static MooreMachine readMoore(List<String> lines) {
        final List<Row> rows = rows(lines, 2, "Moore");
        final Row outputs = rows.get(0);
        final Row header = rows.get(1);
        final List<String> states = declaredStates(header);
        if (outputs.width() != states.size()) {
            throw malformed(outputs, "has " + outputs.width() + " outputs for " + states.size() + " states");
        }

        final MooreMachine.Builder builder = MooreMachine.builder();
        for (int i = 0; i < states.size(); i++) {
            builder.addState(states.get(i), outputs.cell(i));
        }
        builder.setInitial(states.get(0));

        final Set<String> symbols = new HashSet<>();
        for (Row row : rows.subList(2, rows.size())) {
            final String symbol = symbolOf(row, states.size(), symbols);
            builder.addSymbol(symbol);
            for (int i = 0; i < states.size(); i++) {
                for (String target : targets(row, i, states)) {
                    builder.addTransition(states.get(i), symbol, target);
                }
            }
        }
        return builder.build();
    }

    public static MealyMachine readMealy(Path path) {
        return readMealy(readLines(path));
    }

    public static MealyMachine readMealy(List<String> lines) {
        final List<Row> rows = rows(lines, 1, "Mealy");
        final List<String> states = declaredStates(rows.get(0));

        final MealyMachine.Builder builder = MealyMachine.builder();
        for (String s : states) {
            builder.addState(s);
        }
        builder.setInitial(states.get(0));

        final Set<String> symbols = new HashSet<>();
        for (Row row : rows.subList(1, rows.size())) {
            final String symbol = symbolOf(row, states.size(), symbols);
            builder.addSymbol(symbol);
            for (int i = 0; i < states.size(); i++) {
                final String cell = row.cell(i);
                if (cell.isEmpty() || NO_TRANSITION.equals(cell)) {
                    continue;
                }
                final int sep = cell.indexOf(OUTPUT_SEPARATOR);
                if (sep < 0) {
                    throw malformed(row, "cell '" + cell + "' is not of the form target/output");
                }
                final String target = cell.substring(0, sep).trim();
                requireState(row, target, states);
                builder.setTransition(states.get(i), symbol, target, cell.substring(sep + 1).trim());
            }
        }
        return builder.build();
    }

    public static List<String> write(Nfa nfa) {
        final List<String> columns = columns(nfa);
        final List<String> lines = new ArrayList<>();
        final List<String> flags = new ArrayList<>();
        for (String s : columns) {
            flags.add(nfa.isAccepting(s) ? ACCEPTING_FLAG : "");
        }
        lines.add(line("", flags));
        lines.add(line("", columns));

        final List<String> symbols = new ArrayList<>(nfa.getInputAlphabet());
        if (nfa.hasEpsilonTransitions()) {
            symbols.add(Nfa.EPSILON);
        }
        for (String a : symbols) {
            final List<String> cells = new ArrayList<>();
            for (String s : columns) {
                cells.add(String.join(TARGET_SEPARATOR, nfa.getTransitions(s, a)));
            }
            lines.add(line(a, cells));
        }
        return lines;
    }

    public static List<String> write(Dfa dfa) {
        final List<String> columns = columns(dfa);
        final List<String> lines = new ArrayList<>();
        final List<String> flags = new ArrayList<>();
        for (String s : columns) {
            flags.add(dfa.isAccepting(s) ? ACCEPTING_FLAG : "");
        }
        lines.add(line("", flags));
        lines.add(line("", columns));
        for (String a : dfa.getInputAlphabet()) {
            final List<String> cells = new ArrayList<>();
            for (String s : columns) {
                final String t = dfa.getSuccessor(s, a);
                cells.add(t == null ? "" : t);
            }
            lines.add(line(a, cells));
        }
        return lines;
    }

    public static List<String> write(MooreMachine moore) {
        final List<String> columns = columns(moore);
        final List<String> lines = new ArrayList<>();
        final List<String> outputs = new ArrayList<>();
        for (String s : columns) {
            outputs.add(moore.getOutput(s));
        }
        lines.add(line("", outputs));
        lines.add(line("", columns));
        for (String a : moore.getInputAlphabet()) {
            final List<String> cells = new ArrayList<>();
            for (String s : columns) {
                cells.add(String.join(TARGET_SEPARATOR, moore.getSuccessors(s, a)));
            }
            lines.add(line(a, cells));
        }
        return lines;
    }

    public static List<String> write(MealyMachine mealy) {
        final List<String> columns = columns(mealy);
        final List<String> lines = new ArrayList<>();
        lines.add(line("", columns));
        for (String a : mealy.getInputAlphabet()) {
            final List<String> cells = new ArrayList<>();
            for (String s : columns) {
                final MealyTransition t = mealy.getTransition(s, a);
                cells.add(t == null ? "" : t.toString());
            }
            lines.add(line(a, cells));
        }
        return lines;
    }

    public static List<String> readLines(Path path) {
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    public static void writeLines(Path path, List<String> lines) {
        try {
            Files.write(path, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + path, e);
        }
    }

    private static List<Row> rows(List<String> lines, int headerRows, String kind) {
        final List<Row> rows = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            // a flag row without any accepting state is only delimiters, so only truly empty lines are skipped
            if (lines.get(i).isBlank()) {
                continue;
            }
            final String[] cells = lines.get(i).split(DELIMITER, -1);
            for (int c = 0; c < cells.length; c++) {
                cells[c] = cells[c].trim();
            }
            rows.add(new Row(i + 1, cells));
        }
        if (rows.size() < headerRows) {
            throw new MalformedAutomatonException("A " + kind + " table needs " + headerRows
                    + " header rows, found " + rows.size());
        }
        return rows;
    }

    private static List<String> declaredStates(Row header) {
        final List<String> states = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (int i = 0; i < header.width(); i++) {
            final String s = header.cell(i);
            if (s.isEmpty()) {
                throw malformed(header, "has an empty state name in column " + (i + 2));
            }
            if (!seen.add(s)) {
                throw malformed(header, "declares state " + s + " twice");
            }
            states.add(s);
        }
        if (states.isEmpty()) {
            throw malformed(header, "declares no states");
        }
        return states;
    }

    private static String symbolOf(Row row, int numStates, Set<String> seen) {
        final String symbol = row.label();
        if (symbol.isEmpty()) {
            throw malformed(row, "has no input symbol");
        }
        if (!seen.add(symbol)) {
            throw malformed(row, "repeats input symbol " + symbol);
        }
        if (row.width() != numStates) {
            throw malformed(row, "has " + row.width() + " cells for " + numStates + " states");
        }
        return symbol;
    }

    private static List<String> targets(Row row, int column, List<String> states) {
        final String cell = row.cell(column);
        final List<String> result = new ArrayList<>();
        if (cell.isEmpty() || NO_TRANSITION.equals(cell)) {
            return result;
        }
        for (String t : cell.split(TARGET_SEPARATOR)) {
            final String target = t.trim();
            if (!target.isEmpty()) {
                requireState(row, target, states);
                result.add(target);
            }
        }
        return result;
    }

    private static void requireState(Row row, String state, List<String> states) {
        if (!states.contains(state)) {
            throw malformed(row, "references undeclared state " + state);
        }
    }

    private static MalformedAutomatonException malformed(Row row, String problem) {
        return new MalformedAutomatonException("Line " + row.lineNumber() + " " + problem);
    }

    /**
     * @return the state columns of a written table: the initial state first, then the others in declaration order
     */
    private static List<String> columns(AbstractAutomaton automaton) {
        final List<String> columns = new ArrayList<>();
        columns.add(automaton.getInitialState());
        for (String s : automaton.getStates()) {
            if (!s.equals(automaton.getInitialState())) {
                columns.add(s);
            }
        }
        return columns;
    }

    private static String line(String label, List<String> cells) {
        return label + DELIMITER + String.join(DELIMITER, cells);
    }

    /**
     * One non-blank table line: the label in the first cell, then one cell per state column.
     */
    private record Row(int lineNumber, String[] cells) {
        String label() {
            return cells[0];
        }

        int width() {
            return cells.length - 1;
        }

        String cell(int column) {
            return column + 1 < cells.length ? cells[column + 1] : "";
        }

        @Override
        public String toString() {
            return lineNumber + ": " + Arrays.toString(cells);
        }
    }
}
