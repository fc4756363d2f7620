package FSM.Model;

import java.util.BitSet;

/**
 * Pending subset-construction work item: a set of NFA state indices and the DFA state it became.
 */
public record DeterminizeRecord(BitSet inputState, String outputState) {

  @Override
  public String toString() {
    return outputState + ": " + inputState;
  }
}
