package io.surfworks.vectorforge.sample;

/**
 * Settings for {@link RejectionSampler}.
 *
 * @param maxAttemptsPerSample draws allowed for one accepted sample, or
 *                             {@link #UNBOUNDED} to retry forever
 */
public record SamplerConfig(long maxAttemptsPerSample) {

    /** Retry until a draw is accepted, however long it takes. */
    public static final long UNBOUNDED = 0;

    public SamplerConfig {
        if (maxAttemptsPerSample < 0) {
            throw new IllegalArgumentException("maxAttemptsPerSample cannot be negative: " + maxAttemptsPerSample);
        }
    }

    public static SamplerConfig defaults() {
        return new SamplerConfig(UNBOUNDED);
    }

    public SamplerConfig withMaxAttempts(long maxAttempts) {
        return new SamplerConfig(maxAttempts);
    }

    public boolean isBounded() {
        return maxAttemptsPerSample != UNBOUNDED;
    }
}
