package io.surfworks.vectorforge.render;

import java.util.List;

/**
 * Bit widths used to regroup the blasted input and output bit strings of each
 * vector into tokens.
 *
 * @param inputSplits  widths for the input side, consumed left to right
 * @param outputSplits widths for the output side, consumed left to right
 */
public record SplitSpec(List<Integer> inputSplits, List<Integer> outputSplits) {

    public SplitSpec {
        inputSplits = List.copyOf(inputSplits);
        outputSplits = List.copyOf(outputSplits);
        requirePositive(inputSplits, "input");
        requirePositive(outputSplits, "output");
    }

    public static SplitSpec of(List<Integer> inputSplits, List<Integer> outputSplits) {
        return new SplitSpec(inputSplits, outputSplits);
    }

    public int inputBits() {
        return sum(inputSplits);
    }

    public int outputBits() {
        return sum(outputSplits);
    }

    private static void requirePositive(List<Integer> splits, String side) {
        for (int width : splits) {
            if (width <= 0) {
                throw new IllegalArgumentException("Split widths must be positive, " + side + " has " + width);
            }
        }
    }

    private static int sum(List<Integer> splits) {
        int total = 0;
        for (int width : splits) {
            total += width;
        }
        return total;
    }
}
