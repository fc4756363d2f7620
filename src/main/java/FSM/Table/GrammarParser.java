package FSM.Table;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import FSM.Errors.MalformedAutomatonException;
import FSM.Model.Nfa;
import FSM.Model.StateIdAllocator;

/**
 * Regular (left- or right-linear) grammars to acceptors.
 * <pre>
 * &lt;S&gt; -&gt; a&lt;A&gt; | b
 * &lt;A&gt; -&gt; a&lt;A&gt;
 *      | b
 * </pre>
 * A line that starts with whitespace continues the rule above it. Only the first character of a
 * terminal part is read.
 */
public class GrammarParser {
    public static final String FINAL_NONTERMINAL = "H";
    public static final String STATE_PREFIX = "q";
    private static final String ARROW = "->";
    private static final Pattern NONTERMINAL = Pattern.compile("<([^>]+)>");
    private static final Comparator<String> DIGITS_FIRST =
            Comparator.comparing((String t) -> !Character.isDigit(t.charAt(0))).thenComparing(Comparator.naturalOrder());

    private final List<String> rules;
    private final boolean leftLinear;
    private final List<String> nonterminals = new ArrayList<>();
    private final Map<String, Map<String, Set<String>>> transitions = new LinkedHashMap<>();
    private final Set<String> terminals = new TreeSet<>(DIGITS_FIRST);

    private GrammarParser(List<String> rules) {
        this.rules = rules;
        this.leftLinear = isLeftLinear(rules);
    }

    public static Nfa parse(Path path) {
        return parse(TableFormat.readLines(path));
    }

    /**
     * @throws MalformedAutomatonException if the lines contain no rule
     */
    public static Nfa parse(List<String> lines) {
        final List<String> rules = combine(lines);
        if (rules.isEmpty()) {
            throw new MalformedAutomatonException("Grammar has no rule of the form <N> " + ARROW + " ...");
        }
        return new GrammarParser(rules).toNfa();
    }

    /**
     * Joins continuation lines onto the rule they belong to and drops everything that is not a rule.
     */
    static List<String> combine(List<String> lines) {
        final List<String> combined = new ArrayList<>();
        StringBuilder buffer = null;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            if (Character.isWhitespace(line.charAt(0)) && buffer != null) {
                buffer.append(' ').append(line.strip());
            } else {
                if (buffer != null) {
                    combined.add(buffer.toString());
                }
                buffer = new StringBuilder(line.strip());
            }
        }
        if (buffer != null) {
            combined.add(buffer.toString());
        }
        combined.removeIf(rule -> !rule.contains(ARROW));
        return combined;
    }

    static boolean isLeftLinear(List<String> rules) {
        for (String rule : rules) {
            final List<String> alts = alternatives(rule);
            if (!alts.isEmpty()) {
                return alts.get(0).startsWith("<");
            }
        }
        return false;
    }

    private Nfa toNfa() {
        for (String rule : rules) {
            final int arrow = rule.indexOf(ARROW);
            final String head = rule.substring(0, arrow).replaceAll("[<>]", "").strip();
            if (!nonterminals.contains(head)) {
                nonterminals.add(head);
            }
            for (String alt : alternatives(rule)) {
                if (leftLinear) {
                    leftLinearProduction(head, alt);
                } else {
                    rightLinearProduction(head, alt);
                }
            }
        }

        final List<String> order = stateOrder();
        final StateIdAllocator ids = new StateIdAllocator(STATE_PREFIX);
        final Map<String, String> names = new LinkedHashMap<>();
        for (String n : order) {
            names.put(n, ids.next());
        }

        final String start = leftLinear ? FINAL_NONTERMINAL : nonterminals.get(0);
        final String accepting = leftLinear ? nonterminals.get(0) : FINAL_NONTERMINAL;

        final Nfa.Builder builder = Nfa.builder().setInitial(names.get(start));
        for (String t : terminals) {
            if (!Nfa.EPSILON.equals(t)) {
                builder.addSymbol(t);
            }
        }
        for (String n : order) {
            builder.addState(names.get(n), n.equals(accepting));
        }
        for (String from : order) {
            final Map<String, Set<String>> row = transitions.getOrDefault(from, Collections.emptyMap());
            for (String t : terminals) {
                for (String to : order) {
                    if (row.getOrDefault(t, Collections.emptySet()).contains(to)) {
                        builder.addTransition(names.get(from), t, names.get(to));
                    }
                }
            }
        }
        return builder.build();
    }

    // <N> -> a<M> or <N> -> a
    private void rightLinearProduction(String head, String alt) {
        if (alt.startsWith("<")) {
            final Matcher m = NONTERMINAL.matcher(alt);
            if (!m.lookingAt()) {
                return;
            }
            final String rest = alt.substring(m.end()).strip();
            if (!rest.isEmpty()) {
                add(head, rest.substring(0, 1), m.group(1));
            }
            return;
        }
        final Matcher m = NONTERMINAL.matcher(alt);
        add(head, alt.substring(0, 1), m.find() ? m.group(1) : FINAL_NONTERMINAL);
    }

    // <N> -> <M>a or <N> -> a
    private void leftLinearProduction(String head, String alt) {
        if (alt.startsWith("<")) {
            final Matcher m = NONTERMINAL.matcher(alt);
            if (!m.lookingAt()) {
                return;
            }
            final String rest = alt.substring(m.end()).strip();
            if (!rest.isEmpty()) {
                add(m.group(1), rest.substring(0, 1), head);
            }
            return;
        }
        add(FINAL_NONTERMINAL, alt.substring(0, 1), head);
    }

    private void add(String from, String terminal, String to) {
        transitions.computeIfAbsent(from, k -> new LinkedHashMap<>())
                .computeIfAbsent(terminal, k -> new LinkedHashSet<>())
                .add(to);
        terminals.add(terminal);
    }

    private List<String> stateOrder() {
        // nonterminals used only on right-hand sides become states without rules
        final Set<String> all = new LinkedHashSet<>(nonterminals);
        transitions.forEach((from, row) -> {
            all.add(from);
            row.values().forEach(all::addAll);
        });
        final List<String> order = new ArrayList<>(all);
        if (leftLinear) {
            order.remove(FINAL_NONTERMINAL);
            Collections.reverse(order);
            order.add(0, FINAL_NONTERMINAL);
        } else if (order.remove(FINAL_NONTERMINAL)) {
            order.add(FINAL_NONTERMINAL);
        }
        return order;
    }

    private static List<String> alternatives(String rule) {
        final String body = rule.substring(rule.indexOf(ARROW) + ARROW.length());
        final List<String> result = new ArrayList<>();
        for (String alt : body.split("\\|")) {
            final String trimmed = alt.strip();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }
}
