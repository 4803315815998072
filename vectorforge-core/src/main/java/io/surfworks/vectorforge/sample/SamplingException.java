package io.surfworks.vectorforge.sample;

/**
 * Base class for failures raised while generating test vectors.
 */
public class SamplingException extends RuntimeException {

    public SamplingException(String message) {
        super(message);
    }

    public SamplingException(String message, Throwable cause) {
        super(message, cause);
    }
}
