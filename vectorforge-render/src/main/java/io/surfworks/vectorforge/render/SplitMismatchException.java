package io.surfworks.vectorforge.render;

/**
 * Thrown when bit-vector split widths do not exactly use up a blasted bit string.
 */
public class SplitMismatchException extends RenderException {

    private final int expectedBits;
    private final int remainingBits;

    private SplitMismatchException(String message, int expectedBits, int remainingBits) {
        super(message);
        this.expectedBits = expectedBits;
        this.remainingBits = remainingBits;
    }

    /**
     * A split point asked for more bits than were left.
     */
    static SplitMismatchException shortStream(String side, int splitIndex, int expectedBits, int remainingBits) {
        return new SplitMismatchException(String.format(
                "Mismatched %s split %d: looking for %d bit(s), but only %d remain",
                side, splitIndex, expectedBits, remainingBits), expectedBits, remainingBits);
    }

    /**
     * Bits were left over after the last split point.
     */
    static SplitMismatchException extraBits(String side, int remainingBits) {
        return new SplitMismatchException(String.format(
                "Mismatched %s splits: expected 0 bit(s) left after the last split point, but %d remain",
                side, remainingBits), 0, remainingBits);
    }

    public int getExpectedBits() {
        return expectedBits;
    }

    public int getRemainingBits() {
        return remainingBits;
    }
}
