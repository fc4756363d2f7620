package FSM.Regex;

import FSM.Errors.RegexSyntaxException;
import FSM.Model.Nfa;
import FSM.Model.StateIdAllocator;
import FSM.Words;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

class RegexCompilerTest {
  @Test
  void testStarThenLiteral() {
    Nfa nfa = RegexCompiler.compile("a*b");
    Assertions.assertEquals(List.of("a", "b"), nfa.getInputAlphabet());
    for (String w : List.of("b", "ab", "aab", "aaaab")) {
      Assertions.assertTrue(Words.nfaAccepts(nfa, Words.of(w)), w);
    }
    for (String w : List.of("", "a", "ba", "abb")) {
      Assertions.assertFalse(Words.nfaAccepts(nfa, Words.of(w)), w);
    }
  }

  @Test
  void testPlusOfUnion() {
    Nfa nfa = RegexCompiler.compile("(a|b)+");
    for (String w : List.of("a", "ab", "bba", "babab")) {
      Assertions.assertTrue(Words.nfaAccepts(nfa, Words.of(w)), w);
    }
    Assertions.assertFalse(Words.nfaAccepts(nfa, Words.of("")));

    Nfa star = RegexCompiler.compile("(a|b)*");
    Assertions.assertTrue(Words.nfaAccepts(star, Words.of("")));
  }

  @Test
  void testThompsonShape() {
    Nfa nfa = RegexCompiler.compile("a");
    Assertions.assertEquals(List.of("q0", "q1"), nfa.getStates());
    Assertions.assertEquals("q0", nfa.getInitialState());
    Assertions.assertEquals(1, nfa.getAcceptingStates().size());
    Assertions.assertTrue(nfa.isAccepting("q1"));

    // every operator adds exactly two states, concatenation adds none
    Assertions.assertEquals(4, RegexCompiler.compile("ab").size());
    Assertions.assertEquals(6, RegexCompiler.compile("a|b").size());
    Assertions.assertEquals(4, RegexCompiler.compile("a*").size());
    Assertions.assertEquals(4, RegexCompiler.compile("a+").size());

    // the accepting state has no outgoing edge
    Nfa union = RegexCompiler.compile("(ab|c)*d");
    String accept = union.getAcceptingStates().iterator().next();
    Assertions.assertTrue(union.getEpsilonTransitions(accept).isEmpty());
    for (String a : union.getInputAlphabet()) {
      Assertions.assertTrue(union.getTransitions(accept, a).isEmpty());
    }
  }

  @Test
  void testStateNamesPerCompilation() {
    // independent compilations do not share a counter
    Assertions.assertEquals(RegexCompiler.compile("ab").getStates(), RegexCompiler.compile("ab").getStates());

    StateIdAllocator ids = new StateIdAllocator("x", 10);
    Nfa nfa = RegexCompiler.compile("a", ids);
    Assertions.assertEquals(List.of("x10", "x11"), nfa.getStates());
    Assertions.assertEquals(12, ids.allocated());
  }

  @Test
  void testPostfixOrder() {
    Assertions.assertEquals("ab.c|", postfix("ab|c"));
    Assertions.assertEquals("abc|.", postfix("a(b|c)"));
    Assertions.assertEquals("a*b.", postfix("a*b"));
    Assertions.assertEquals("ab|+", postfix("(a|b)+"));
    Assertions.assertEquals("ab.c.", postfix("a b c"));
  }

  @Test
  void testEmptyStringLiteral() {
    Nfa nfa = RegexCompiler.compile("a(b|())");
    Assertions.assertTrue(Words.nfaAccepts(nfa, Words.of("a")));
    Assertions.assertTrue(Words.nfaAccepts(nfa, Words.of("ab")));
    Assertions.assertFalse(Words.nfaAccepts(nfa, Words.of("")));

    Nfa only = RegexCompiler.compile("( )");
    Assertions.assertTrue(only.getInputAlphabet().isEmpty());
    Assertions.assertTrue(Words.nfaAccepts(only, List.of()));
  }

  @Test
  void testSyntaxErrors() {
    assertSyntaxError("(a", 0);
    assertSyntaxError("a)", 1);
    assertSyntaxError("a|", 1);
    assertSyntaxError("*a", 0);
    assertSyntaxError("a$b", 1);
    assertSyntaxError("", 0);
    assertSyntaxError("   ", 0);

    RegexSyntaxException e = Assertions.assertThrows(RegexSyntaxException.class, () -> RegexCompiler.compile("ab)"));
    Assertions.assertTrue(e.getMessage().contains("Unmatched ')'"), e.getMessage());
  }

  private static void assertSyntaxError(String regex, int position) {
    RegexSyntaxException e = Assertions.assertThrows(RegexSyntaxException.class, () -> RegexCompiler.compile(regex));
    Assertions.assertEquals(position, e.getPosition(), regex);
  }

  private static String postfix(String regex) {
    return RegexCompiler.toPostfix(regex).stream().map(RegexToken::toString).collect(Collectors.joining());
  }
}
