package io.surfworks.vectorforge.sample;

/**
 * A symbolic computation that can be run once under a fresh concrete valuation.
 *
 * <p>Each call to {@link #evaluateOnce()} must draw new values for the free
 * variables; the sampler relies on successive draws being independent.
 */
@FunctionalInterface
public interface SymbolicProgram {

    Evaluation evaluateOnce();
}
