package FSM.Table;

import FSM.Errors.MalformedAutomatonException;
import FSM.Model.Dfa;
import FSM.Model.MealyMachine;
import FSM.Model.MealyTransition;
import FSM.Model.MooreMachine;
import FSM.Model.Nfa;
import FSM.Regex.RegexCompiler;
import FSM.SubsetConstruction;
import FSM.Words;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

class TableFormatTest {
  @Test
  void testReadNfa() {
    Nfa nfa = TableFormat.readNfa(List.of(
        ";;F",
        ";q0;q1",
        "a;q0,q1;-",
        "",
        "b; ;q1",
        "ε;q1;"));
    Assertions.assertEquals(List.of("q0", "q1"), nfa.getStates());
    Assertions.assertEquals(List.of("a", "b"), nfa.getInputAlphabet());
    Assertions.assertEquals("q0", nfa.getInitialState());
    Assertions.assertEquals(Set.of("q1"), nfa.getAcceptingStates());
    Assertions.assertEquals(Set.of("q0", "q1"), nfa.getTransitions("q0", "a"));
    Assertions.assertTrue(nfa.getTransitions("q1", "a").isEmpty());
    Assertions.assertTrue(nfa.getTransitions("q0", "b").isEmpty());
    Assertions.assertEquals(Set.of("q1"), nfa.getEpsilonTransitions("q0"));
  }

  @Test
  void testShortFlagRow() {
    // trailing flags may be left out
    Nfa nfa = TableFormat.readNfa(List.of("F", ";p;q", "a;q;p"));
    Assertions.assertTrue(nfa.getAcceptingStates().isEmpty());

    // no accepting state at all: the flag row is only delimiters
    nfa = TableFormat.readNfa(List.of(";;", ";p;q", "a;q;p"));
    Assertions.assertEquals(List.of("p", "q"), nfa.getStates());
    Assertions.assertTrue(nfa.getAcceptingStates().isEmpty());
  }

  @Test
  void testNfaWriteRead() {
    Nfa nfa = RegexCompiler.compile("(a|b)*c");
    List<String> lines = TableFormat.write(nfa);
    Assertions.assertEquals("ε", lines.get(lines.size() - 1).split(";")[0]);
    Nfa back = TableFormat.readNfa(lines);
    Assertions.assertEquals(nfa.getInitialState(), back.getInitialState());
    Assertions.assertEquals(Set.copyOf(nfa.getStates()), Set.copyOf(back.getStates()));
    Assertions.assertEquals(nfa.getAcceptingStates(), back.getAcceptingStates());
    for (String s : nfa.getStates()) {
      Assertions.assertEquals(nfa.getEpsilonTransitions(s), back.getEpsilonTransitions(s));
      for (String a : nfa.getInputAlphabet()) {
        Assertions.assertEquals(nfa.getTransitions(s, a), back.getTransitions(s, a));
      }
    }
  }

  @Test
  void testInitialStateWrittenFirst() {
    // Thompson construction creates the start of a starred fragment after its body
    Nfa nfa = RegexCompiler.compile("a*b");
    Assertions.assertNotEquals(nfa.getStates().get(0), nfa.getInitialState());

    List<String> lines = TableFormat.write(nfa);
    Assertions.assertEquals(nfa.getInitialState(), lines.get(1).split(";")[1]);
    Nfa back = TableFormat.readNfa(lines);
    Assertions.assertEquals(nfa.getInitialState(), back.getInitialState());

    Dfa dfa = SubsetConstruction.determinize(back);
    for (String w : List.of("b", "ab", "aab")) {
      Assertions.assertTrue(dfa.accepts(Words.of(w)), w);
    }
    Assertions.assertFalse(dfa.accepts(Words.of("a")));
  }

  @Test
  void testInitialStateWrittenFirstForMachines() {
    Dfa dfa = Dfa.builder()
        .addSymbol("a")
        .addState("p", true).addState("q", false)
        .setInitial("q")
        .setTransition("q", "a", "p")
        .build();
    Dfa dfaBack = TableFormat.readDfa(TableFormat.write(dfa));
    Assertions.assertEquals("q", dfaBack.getInitialState());
    Assertions.assertEquals(List.of("q", "p"), dfaBack.getStates());
    Assertions.assertFalse(dfaBack.accepts(List.of()));
    Assertions.assertTrue(dfaBack.accepts(List.of("a")));

    MooreMachine moore = MooreMachine.builder()
        .addSymbol("x")
        .addState("a0", "y1").addState("a1", "y2")
        .setInitial("a1")
        .addTransition("a1", "x", "a0")
        .build();
    List<String> mooreLines = TableFormat.write(moore);
    Assertions.assertEquals(List.of(";y2;y1", ";a1;a0", "x;a0;"), mooreLines);
    Assertions.assertEquals("a1", TableFormat.readMoore(mooreLines).getInitialState());

    MealyMachine mealy = MealyMachine.builder()
        .addSymbol("x")
        .addState("s0").addState("s1")
        .setInitial("s1")
        .setTransition("s1", "x", "s0", "o")
        .build();
    MealyMachine mealyBack = TableFormat.readMealy(TableFormat.write(mealy));
    Assertions.assertEquals("s1", mealyBack.getInitialState());
    Assertions.assertEquals(mealy.run(List.of("x")), mealyBack.run(List.of("x")));
  }

  @Test
  void testDfaTables() {
    Dfa dfa = SubsetConstruction.determinize(RegexCompiler.compile("a*b"));
    Dfa back = TableFormat.readDfa(TableFormat.write(dfa));
    Assertions.assertEquals(dfa.getStates(), back.getStates());
    Assertions.assertEquals(dfa.getAcceptingStates(), back.getAcceptingStates());
    Assertions.assertTrue(back.accepts(List.of("a", "b")));

    Assertions.assertThrows(MalformedAutomatonException.class,
        () -> TableFormat.readDfa(List.of(";;F", ";p;q", "a;p,q;q")));
    Assertions.assertThrows(MalformedAutomatonException.class,
        () -> TableFormat.readDfa(List.of(";;F", ";p;q", "a;q;q", "ε;q;")));
  }

  @Test
  void testMoore() {
    MooreMachine moore = TableFormat.readMoore(List.of(
        ";y1;y2;y1",
        ";a0;a1;a2",
        "x;a1;a2;a0",
        "z;-;a0;a1,a2"));
    Assertions.assertEquals("y2", moore.getOutput("a1"));
    Assertions.assertEquals("a1", moore.getSuccessor("a0", "x"));
    Assertions.assertNull(moore.getSuccessor("a0", "z"));
    Assertions.assertFalse(moore.isDeterministic());

    List<String> lines = TableFormat.write(moore);
    Assertions.assertEquals(";y1;y2;y1", lines.get(0));
    Assertions.assertEquals("z;;a0;a1,a2", lines.get(3));

    Assertions.assertThrows(MalformedAutomatonException.class,
        () -> TableFormat.readMoore(List.of(";y1", ";a0;a1", "x;a1;a0")));
  }

  @Test
  void testMealy() {
    MealyMachine mealy = TableFormat.readMealy(List.of(
        ";s0;s1",
        "a;s1/y1;s0/y2",
        "b;s0/y1;"));
    Assertions.assertEquals(new MealyTransition("s0", "y2"), mealy.getTransition("s1", "a"));
    Assertions.assertNull(mealy.getTransition("s1", "b"));
    Assertions.assertEquals(List.of(";s0;s1", "a;s1/y1;s0/y2", "b;s0/y1;"), TableFormat.write(mealy));

    MalformedAutomatonException e = Assertions.assertThrows(MalformedAutomatonException.class,
        () -> TableFormat.readMealy(List.of(";s0;s1", "a;s1;s0/y2")));
    Assertions.assertTrue(e.getMessage().startsWith("Line 2"), e.getMessage());
  }

  @Test
  void testMalformedTables() {
    assertMalformedAt(3, List.of(";;F", ";p;q", "a;p"));
    assertMalformedAt(3, List.of(";;F", ";p;q", "a;p;r"));
    assertMalformedAt(4, List.of(";;F", ";p;q", "a;p;q", "a;q;p"));
    assertMalformedAt(3, List.of(";;F", ";p;q", ";p;q"));
    assertMalformedAt(2, List.of(";;F", ";p;p"));
    assertMalformedAt(2, List.of(";;F", ";p;"));
    Assertions.assertThrows(MalformedAutomatonException.class, () -> TableFormat.readNfa(List.of(";;F")));
  }

  @Test
  void testFiles(@TempDir Path dir) {
    Path file = dir.resolve("dfa.csv");
    Dfa dfa = SubsetConstruction.determinize(RegexCompiler.compile("ab*"));
    TableFormat.writeLines(file, TableFormat.write(dfa));
    Assertions.assertEquals(dfa.getStates(), TableFormat.readDfa(file).getStates());

    Assertions.assertThrows(UncheckedIOException.class, () -> TableFormat.readNfa(dir.resolve("missing.csv")));
  }

  private static void assertMalformedAt(int line, List<String> lines) {
    MalformedAutomatonException e = Assertions.assertThrows(MalformedAutomatonException.class,
        () -> TableFormat.readNfa(lines));
    Assertions.assertTrue(e.getMessage().startsWith("Line " + line + " "), e.getMessage());
  }
}
