package io.surfworks.vectorforge.cli;

import io.surfworks.vectorforge.sample.Constraint;
import io.surfworks.vectorforge.sample.Evaluation;
import io.surfworks.vectorforge.sample.SymbolicProgram;
import io.surfworks.vectorforge.value.ConcreteValue;

import java.util.Random;

/**
 * Built-in programs for trying the generator without writing an evaluator.
 */
final class ExamplePrograms {

    private ExamplePrograms() {}

    /**
     * Two random {@code Word8} inputs {@code x < y}; outputs {@code x + y}
     * (wrapping) and whether the sum overflowed. Evenness of {@code x} is
     * recorded as a soft constraint.
     */
    static SymbolicProgram orderedSum(long seed) {
        Random random = new Random(seed);
        return () -> {
            int x = random.nextInt(256);
            int y = random.nextInt(256);
            int sum = x + y;
            return Evaluation.builder()
                    .input("x", ConcreteValue.word(8, x))
                    .input("y", ConcreteValue.word(8, y))
                    .node("x_lt_y", ConcreteValue.bool(x < y))
                    .node("x_even", ConcreteValue.bool(x % 2 == 0))
                    .node("sum", ConcreteValue.word(8, sum & 0xFF))
                    .node("carry", ConcreteValue.bool(sum > 0xFF))
                    .constrain(Constraint.hard("x_lt_y").withLabel("x < y"))
                    .constrain(Constraint.soft("x_even").withLabel("even x"))
                    .output("sum")
                    .output("carry")
                    .build();
        };
    }
}
