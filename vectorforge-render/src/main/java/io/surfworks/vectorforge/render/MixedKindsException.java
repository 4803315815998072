package io.surfworks.vectorforge.render;

import io.surfworks.vectorforge.value.Dialect;

/**
 * Thrown when a dialect that lays out types from the first vector is given a
 * set whose vectors do not all share that vector's kind sequence.
 */
public class MixedKindsException extends RenderException {

    private final int vectorIndex;

    public MixedKindsException(Dialect dialect, int vectorIndex, String expected, String actual) {
        super(String.format("%s output needs every vector to match the first vector's kinds; "
                + "vector %d has %s, expected %s", dialect.cliName(), vectorIndex, actual, expected));
        this.vectorIndex = vectorIndex;
    }

    public int getVectorIndex() {
        return vectorIndex;
    }
}
