package FSM.Model;

import java.util.Objects;

/**
 * Destination and emitted output of one Mealy transition.
 */
public record MealyTransition(String target, String output) {
    public MealyTransition {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(output, "output");
    }

    @Override
    public String toString() {
        return target + "/" + output;
    }
}
