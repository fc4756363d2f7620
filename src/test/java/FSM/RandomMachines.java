package FSM;

import FSM.Model.MealyMachine;
import FSM.Model.MooreMachine;

import java.util.List;
import java.util.Random;

/**
 * Seeded random complete Mealy and Moore machines over {@link #SYMBOLS}, with outputs drawn from {@link #OUTPUTS}.
 */
public class RandomMachines {
    public static final List<String> SYMBOLS = List.of("x", "y");
    public static final List<String> OUTPUTS = List.of("0", "1");

    public static MealyMachine randomMealy(int randomSeed, int size) {
        final Random random = new Random(randomSeed);
        final MealyMachine.Builder builder = MealyMachine.builder().addSymbols(SYMBOLS);
        for (int i = 0; i < size; i++) {
            builder.addState("m" + i);
        }
        builder.setInitial("m0");
        for (int i = 0; i < size; i++) {
            for (String a : SYMBOLS) {
                builder.setTransition("m" + i, a, "m" + random.nextInt(size), OUTPUTS.get(random.nextInt(OUTPUTS.size())));
            }
        }
        return builder.build();
    }

    public static MooreMachine randomMoore(int randomSeed, int size) {
        final Random random = new Random(randomSeed);
        final MooreMachine.Builder builder = MooreMachine.builder().addSymbols(SYMBOLS);
        for (int i = 0; i < size; i++) {
            builder.addState("m" + i, OUTPUTS.get(random.nextInt(OUTPUTS.size())));
        }
        builder.setInitial("m0");
        for (int i = 0; i < size; i++) {
            for (String a : SYMBOLS) {
                builder.addTransition("m" + i, a, "m" + random.nextInt(size));
            }
        }
        return builder.build();
    }
}
