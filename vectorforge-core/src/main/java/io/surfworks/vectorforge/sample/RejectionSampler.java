package io.surfworks.vectorforge.sample;

import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.value.ValueKind;
import io.surfworks.vectorforge.vector.TestVector;
import io.surfworks.vectorforge.vector.TestVectorSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Draws concrete test vectors from a symbolic program by rejection sampling.
 *
 * <p>Each draw runs the program once. A draw is kept only if every hard
 * constraint evaluated to {@code true}; otherwise the program is run again from
 * scratch. No attempt is made to repair a rejected draw, so a program whose hard
 * constraints are rarely satisfied will take many draws, and one whose
 * constraints cannot be satisfied never finishes unless
 * {@link SamplerConfig#maxAttemptsPerSample()} is set.
 */
public final class RejectionSampler {

    private static final Logger LOG = Logger.getLogger(RejectionSampler.class.getName());

    private final SamplerConfig config;

    public RejectionSampler() {
        this(SamplerConfig.defaults());
    }

    public RejectionSampler(SamplerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public SamplerConfig config() {
        return config;
    }

    /**
     * Generates {@code count} accepted test vectors, in draw order.
     *
     * @param count   number of vectors to produce; zero performs no draws
     * @param program the program to sample
     * @return the accepted vectors
     * @throws UnsupportedProgramException if a draw declares external function definitions
     * @throws MissingBindingException     if an output or constraint has no concrete value
     * @throws SamplingExhaustedException  if the attempt limit is reached for one sample
     */
    public TestVectorSet generate(int count, SymbolicProgram program) {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative: " + count);
        }
        Objects.requireNonNull(program, "program");

        List<TestVector> accepted = new ArrayList<>();
        long totalDraws = 0;
        for (int i = 0; i < count; i++) {
            long attempts = 0;
            TestVector vector = null;
            while (vector == null) {
                if (config.isBounded() && attempts >= config.maxAttemptsPerSample()) {
                    throw new SamplingExhaustedException(i, attempts);
                }
                attempts++;
                vector = draw(program.evaluateOnce());
            }
            totalDraws += attempts;
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Accepted sample " + i + " after " + attempts + " draw(s)");
            }
            accepted.add(vector);
        }

        if (count > 0) {
            LOG.fine("Generated " + count + " test vectors in " + totalDraws + " draws");
        }
        return TestVectorSet.of(accepted);
    }

    /**
     * Checks one evaluation and turns it into a vector, or returns null if a hard
     * constraint failed.
     */
    private TestVector draw(Evaluation evaluation) {
        if (!evaluation.definitions().isEmpty()) {
            throw new UnsupportedProgramException(evaluation.definitions());
        }

        boolean satisfied = true;
        for (Constraint constraint : evaluation.constraints()) {
            boolean holds = truthOf(constraint, evaluation);
            if (!constraint.isHard()) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Soft constraint " + constraint.displayName() + " = " + holds);
                }
                continue;
            }
            if (!holds) {
                satisfied = false;
            }
        }
        if (!satisfied) {
            return null;
        }

        List<ConcreteValue> inputs = new ArrayList<>(evaluation.bindings().size());
        for (Evaluation.Binding binding : evaluation.bindings()) {
            inputs.add(binding.value());
        }
        List<ConcreteValue> outputs = new ArrayList<>(evaluation.outputs().size());
        for (String node : evaluation.outputs()) {
            outputs.add(evaluation.lookup(node)
                    .orElseThrow(() -> new MissingBindingException(node, "output")));
        }
        return new TestVector(inputs, outputs);
    }

    private static boolean truthOf(Constraint constraint, Evaluation evaluation) {
        ConcreteValue value = evaluation.lookup(constraint.node())
                .orElseThrow(() -> new MissingBindingException(constraint.node(), "constraint"));
        if (!(value.kind() instanceof ValueKind.BoolKind)) {
            throw new IllegalStateException("Constraint " + constraint.displayName()
                    + " evaluated to a non-boolean value: " + value);
        }
        return value.asBoolean();
    }
}
