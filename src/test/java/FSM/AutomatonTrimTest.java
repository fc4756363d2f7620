package FSM;

import FSM.Model.Dfa;
import FSM.Model.MealyMachine;
import FSM.Model.MooreMachine;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class AutomatonTrimTest {
  @Test
  void testSmallTrim() {
    Dfa dfa = Dfa.builder()
        .addSymbols(List.of("a", "b"))
        .addState("p", false).addState("q", true).addState("r", true)
        .setInitial("p")
        .setTransition("p", "a", "q")
        .setTransition("r", "a", "p")
        .build();
    Dfa trimmed = AutomatonTrim.trim(dfa);
    Assertions.assertEquals(List.of("p", "q"), trimmed.getStates()); // r isn't reachable
    Assertions.assertEquals(Set.of("q"), trimmed.getAcceptingStates());
    Assertions.assertEquals("q", trimmed.getSuccessor("p", "a"));

    // nothing to remove: same instance
    Assertions.assertSame(trimmed, AutomatonTrim.trim(trimmed));
  }

  @Test
  void testTrimKeepsDeclarationOrder() {
    MooreMachine moore = MooreMachine.builder()
        .addSymbol("a")
        .addState("p", "0").addState("x", "1").addState("q", "1").addState("r", "0")
        .setInitial("p")
        .addTransition("p", "a", "r")
        .addTransition("r", "a", "q")
        .build();
    Assertions.assertEquals(List.of("p", "q", "r"), AutomatonTrim.trim(moore).getStates());
    Assertions.assertEquals(List.of("p", "r", "q"),
        List.copyOf(AutomatonTrim.reachableStates("p", moore.getInputAlphabet(), moore::getSuccessors)));

    MealyMachine mealy = MealyMachine.builder()
        .addSymbol("a")
        .addState("p").addState("x")
        .setInitial("p")
        .setTransition("x", "a", "p", "o")
        .build();
    MealyMachine trimmed = AutomatonTrim.trim(mealy);
    Assertions.assertEquals(List.of("p"), trimmed.getStates());
    Assertions.assertNull(trimmed.getTransition("p", "a"));
  }
}
