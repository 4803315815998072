package io.surfworks.vectorforge.sample;

import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.vector.TestVector;
import io.surfworks.vectorforge.vector.TestVectorSet;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RejectionSamplerTest {

    /** x : Word8 free, constraint x < 10, output x + 1. */
    private static SymbolicProgram smallIncrement(Random random, AtomicInteger draws) {
        return () -> {
            draws.incrementAndGet();
            int x = random.nextInt(256);
            return Evaluation.builder()
                    .input("x", ConcreteValue.word(8, x))
                    .node("x_lt_10", ConcreteValue.bool(x < 10))
                    .node("x_plus_1", ConcreteValue.word(8, (x + 1) & 0xFF))
                    .constrain("x_lt_10")
                    .output("x_plus_1")
                    .build();
        };
    }

    /** Replays a fixed sequence of x values through the small increment program. */
    private static SymbolicProgram scripted(AtomicInteger draws, int... xs) {
        return () -> {
            int x = xs[draws.getAndIncrement()];
            return Evaluation.builder()
                    .input("x", ConcreteValue.word(8, x))
                    .node("x_lt_10", ConcreteValue.bool(x < 10))
                    .node("x_plus_1", ConcreteValue.word(8, (x + 1) & 0xFF))
                    .constrain("x_lt_10")
                    .output("x_plus_1")
                    .build();
        };
    }

    @Nested
    class Acceptance {

        @Test
        void everyVectorSatisfiesItsHardConstraint() {
            AtomicInteger draws = new AtomicInteger();
            TestVectorSet set = new RejectionSampler().generate(3, smallIncrement(new Random(42), draws));

            assertEquals(3, set.size());
            for (TestVector vector : set) {
                long x = vector.inputs().get(0).asBigInteger().longValueExact();
                long y = vector.outputs().get(0).asBigInteger().longValueExact();
                assertTrue(x < 10, "accepted x = " + x);
                assertEquals(x + 1, y);
            }
            assertTrue(draws.get() >= 3);
        }

        @Test
        void vectorsFollowDrawOrderAndSkipRejections() {
            AtomicInteger draws = new AtomicInteger();
            TestVectorSet set = new RejectionSampler().generate(2, scripted(draws, 200, 3, 50, 99, 7));

            assertEquals(5, draws.get());
            assertEquals(ConcreteValue.word(8, 3), set.get(0).inputs().get(0));
            assertEquals(ConcreteValue.word(8, 7), set.get(1).inputs().get(0));
            assertEquals(ConcreteValue.word(8, 8), set.get(1).outputs().get(0));
        }

        @Test
        void zeroCountPerformsNoDraws() {
            AtomicInteger draws = new AtomicInteger();
            TestVectorSet set = new RejectionSampler().generate(0, smallIncrement(new Random(1), draws));

            assertTrue(set.isEmpty());
            assertEquals(0, draws.get());
        }

        @Test
        void negativeCountIsRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> new RejectionSampler().generate(-1, smallIncrement(new Random(1), new AtomicInteger())));
        }

        @Test
        void unconstrainedProgramAcceptsEveryDraw() {
            AtomicInteger draws = new AtomicInteger();
            SymbolicProgram program = () -> {
                int n = draws.incrementAndGet();
                return Evaluation.builder()
                        .input("b", ConcreteValue.bool(n % 2 == 0))
                        .output("b")
                        .build();
            };

            TestVectorSet set = new RejectionSampler().generate(4, program);

            assertEquals(4, draws.get());
            assertEquals(ConcreteValue.bool(false), set.get(0).outputs().get(0));
            assertEquals(ConcreteValue.bool(true), set.get(3).outputs().get(0));
        }

        @Test
        void softConstraintsDoNotGateAcceptance() {
            AtomicInteger draws = new AtomicInteger();
            SymbolicProgram program = () -> {
                draws.incrementAndGet();
                return Evaluation.builder()
                        .input("x", ConcreteValue.word(8, 1))
                        .node("never", ConcreteValue.bool(false))
                        .constrain(Constraint.soft("never").withLabel("x is large"))
                        .output("x")
                        .build();
            };

            TestVectorSet set = new RejectionSampler().generate(2, program);

            assertEquals(2, set.size());
            assertEquals(2, draws.get());
        }
    }

    @Nested
    class Failures {

        @Test
        void externalDefinitionOnFirstDraw() {
            SymbolicProgram program = () -> Evaluation.builder()
                    .input("x", ConcreteValue.word(8, 1))
                    .define("f")
                    .output("x")
                    .build();

            UnsupportedProgramException e = assertThrows(UnsupportedProgramException.class,
                    () -> new RejectionSampler().generate(1, program));
            assertEquals(List.of("f"), e.getDefinitions());
        }

        @Test
        void externalDefinitionOnALaterDraw() {
            AtomicInteger draws = new AtomicInteger();
            SymbolicProgram program = () -> {
                Evaluation.Builder builder = Evaluation.builder()
                        .input("x", ConcreteValue.word(8, 1))
                        .output("x");
                if (draws.incrementAndGet() == 3) {
                    builder.define("g").define("h");
                }
                return builder.build();
            };

            UnsupportedProgramException e = assertThrows(UnsupportedProgramException.class,
                    () -> new RejectionSampler().generate(5, program));
            assertEquals(List.of("g", "h"), e.getDefinitions());
            assertEquals(3, draws.get());
        }

        @Test
        void definitionIsReportedEvenWhenConstraintsFail() {
            SymbolicProgram program = () -> Evaluation.builder()
                    .input("x", ConcreteValue.word(8, 1))
                    .node("no", ConcreteValue.bool(false))
                    .constrain("no")
                    .define("f")
                    .build();

            assertThrows(UnsupportedProgramException.class, () -> new RejectionSampler().generate(1, program));
        }

        @Test
        void missingOutputBinding() {
            SymbolicProgram program = () -> Evaluation.builder()
                    .input("x", ConcreteValue.word(8, 1))
                    .output("y")
                    .build();

            MissingBindingException e = assertThrows(MissingBindingException.class,
                    () -> new RejectionSampler().generate(1, program));
            assertEquals("y", e.getNode());
            assertTrue(e.getMessage().contains("output"), e.getMessage());
        }

        @Test
        void missingConstraintBinding() {
            SymbolicProgram program = () -> Evaluation.builder()
                    .input("x", ConcreteValue.word(8, 1))
                    .constrain("c")
                    .output("x")
                    .build();

            MissingBindingException e = assertThrows(MissingBindingException.class,
                    () -> new RejectionSampler().generate(1, program));
            assertEquals("c", e.getNode());
        }

        @Test
        void missingSoftConstraintBindingIsStillAnError() {
            SymbolicProgram program = () -> Evaluation.builder()
                    .input("x", ConcreteValue.word(8, 1))
                    .constrain(Constraint.soft("s"))
                    .output("x")
                    .build();

            assertThrows(MissingBindingException.class, () -> new RejectionSampler().generate(1, program));
        }

        @Test
        void nonBooleanConstraint() {
            SymbolicProgram program = () -> Evaluation.builder()
                    .input("x", ConcreteValue.word(8, 1))
                    .constrain("x")
                    .output("x")
                    .build();

            assertThrows(IllegalStateException.class, () -> new RejectionSampler().generate(1, program));
        }

        @Test
        void unsatisfiableProgramStopsAtTheAttemptLimit() {
            AtomicInteger draws = new AtomicInteger();
            SymbolicProgram program = () -> {
                draws.incrementAndGet();
                return Evaluation.builder()
                        .input("x", ConcreteValue.word(8, 1))
                        .node("false", ConcreteValue.bool(false))
                        .constrain("false")
                        .output("x")
                        .build();
            };

            SamplingExhaustedException e = assertThrows(SamplingExhaustedException.class,
                    () -> new RejectionSampler(new SamplerConfig(25)).generate(3, program));
            assertEquals(0, e.getSampleIndex());
            assertEquals(25, e.getAttempts());
            assertEquals(25, draws.get());
        }

        @Test
        void hugeCountStillStopsAtTheFirstExhaustedSample() {
            AtomicInteger draws = new AtomicInteger();
            SymbolicProgram program = () -> {
                draws.incrementAndGet();
                return Evaluation.builder()
                        .input("x", ConcreteValue.word(8, 1))
                        .node("false", ConcreteValue.bool(false))
                        .constrain("false")
                        .output("x")
                        .build();
            };

            SamplingExhaustedException e = assertThrows(SamplingExhaustedException.class,
                    () -> new RejectionSampler(new SamplerConfig(1)).generate(Integer.MAX_VALUE, program));
            assertEquals(0, e.getSampleIndex());
            assertEquals(1, e.getAttempts());
            assertEquals(1, draws.get());
        }

        @Test
        void attemptLimitIsCountedPerSample() {
            AtomicInteger draws = new AtomicInteger();
            // each sample needs exactly two draws: one rejected, one accepted
            TestVectorSet set = new RejectionSampler(new SamplerConfig(2))
                    .generate(3, scripted(draws, 100, 1, 100, 2, 100, 3));

            assertEquals(3, set.size());
            assertEquals(6, draws.get());
        }

        @Test
        void exhaustionReportsTheFailingSample() {
            AtomicInteger draws = new AtomicInteger();
            SamplingExhaustedException e = assertThrows(SamplingExhaustedException.class,
                    () -> new RejectionSampler(new SamplerConfig(2))
                            .generate(2, scripted(draws, 1, 100, 100)));
            assertEquals(1, e.getSampleIndex());
            assertEquals(2, e.getAttempts());
        }
    }

    @Test
    void samplerConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SamplerConfig(-1));
        assertTrue(SamplerConfig.defaults().withMaxAttempts(10).isBounded());
        assertEquals(SamplerConfig.UNBOUNDED, SamplerConfig.defaults().maxAttemptsPerSample());
    }
}
