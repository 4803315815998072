package io.surfworks.vectorforge.sample;

/**
 * Thrown when one sample could not be accepted within the configured number of draws.
 */
public class SamplingExhaustedException extends SamplingException {

    private final int sampleIndex;
    private final long attempts;

    public SamplingExhaustedException(int sampleIndex, long attempts) {
        super(String.format("Sample %d: no draw satisfied the hard constraints after %d attempts",
                sampleIndex, attempts));
        this.sampleIndex = sampleIndex;
        this.attempts = attempts;
    }

    public int getSampleIndex() {
        return sampleIndex;
    }

    public long getAttempts() {
        return attempts;
    }
}
