package io.surfworks.vectorforge.render;

import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.value.Dialect;
import io.surfworks.vectorforge.vector.TestVector;
import io.surfworks.vectorforge.vector.TestVectorSet;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BitVectorRendererTest {

    private static final String HELPER =
            "   let c s = val [_, r] = str_split s \"'\" in map (\\s. s == \"1\") (explode (string_tl r))";

    private static TestVectorSet boolAndNibble() {
        return TestVectorSet.of(new TestVector(
                List.of(ConcreteValue.bool(true), ConcreteValue.word(4, 0b1010)),
                List.of(ConcreteValue.bool(false))));
    }

    @Test
    void rendersBitLiteralTuples() throws RenderException {
        String expected = String.join("\n",
                "// Automatically generated by VectorForge. Do not edit!",
                "let tv =",
                HELPER,
                "   in [ ((T, c \"4'b1010\"), F)",
                "      ];");

        String out = BitVectorRenderer.render("tv", Endianness.BIG_ENDIAN,
                SplitSpec.of(List.of(1, 4), List.of(1)), boolAndNibble());

        assertEquals(expected, out);
    }

    @Test
    void littleEndianReversesEachSideBeforeSplitting() throws RenderException {
        String out = BitVectorRenderer.render("tv", Endianness.LITTLE_ENDIAN,
                SplitSpec.of(List.of(1, 4), List.of(1)), boolAndNibble());

        assertTrue(out.contains("   in [ ((F, c \"4'b1011\"), F)"), out);
    }

    @Test
    void splitsNeedNotFollowValueBoundaries() throws RenderException {
        TestVectorSet set = TestVectorSet.of(new TestVector(
                List.of(ConcreteValue.word(8, 0xA5), ConcreteValue.signed(8, -1)),
                List.of(ConcreteValue.word(16, 0x00FF))));

        String out = BitVectorRenderer.render("x", Endianness.BIG_ENDIAN,
                SplitSpec.of(List.of(4, 8, 4), List.of(16)), set);

        assertTrue(out.contains("((c \"4'b1010\", c \"8'b01011111\", c \"4'b1111\"), c \"16'b0000000011111111\")"),
                out);
    }

    @Test
    void multipleVectorsAreCommaLed() throws RenderException {
        TestVectorSet set = TestVectorSet.of(
                new TestVector(List.of(ConcreteValue.bool(true)), List.of(ConcreteValue.bool(false))),
                new TestVector(List.of(ConcreteValue.bool(false)), List.of(ConcreteValue.bool(true))));

        String out = BitVectorRenderer.render("", Endianness.BIG_ENDIAN, SplitSpec.of(List.of(1), List.of(1)), set);

        assertTrue(out.contains("let testVectors =\n"), out);
        assertTrue(out.endsWith("   in [ (T, F)\n      , (F, T)\n      ];"), out);
    }

    @Test
    void emptySidesRenderAsUnit() throws RenderException {
        TestVectorSet set = TestVectorSet.of(new TestVector(List.of(ConcreteValue.bool(true)), List.of()));

        String out = BitVectorRenderer.render("u", Endianness.BIG_ENDIAN, SplitSpec.of(List.of(1), List.of()), set);

        assertTrue(out.contains("[ (T, ())"), out);
    }

    @Test
    void emptySetRendersAnEmptyList() throws RenderException {
        String out = BitVectorRenderer.render("e", Endianness.BIG_ENDIAN,
                SplitSpec.of(List.of(8), List.of(8)), TestVectorSet.empty());

        assertTrue(out.endsWith("   in [ \n      ];"), out);
    }

    @Nested
    class Mismatches {

        @Test
        void oneBitTooFew() {
            SplitMismatchException e = assertThrows(SplitMismatchException.class,
                    () -> BitVectorRenderer.render("tv", Endianness.BIG_ENDIAN,
                            SplitSpec.of(List.of(1, 3), List.of(1)), boolAndNibble()));
            assertEquals(0, e.getExpectedBits());
            assertEquals(1, e.getRemainingBits());
            assertTrue(e.getMessage().contains("input"), e.getMessage());
        }

        @Test
        void oneBitTooMany() {
            SplitMismatchException e = assertThrows(SplitMismatchException.class,
                    () -> BitVectorRenderer.render("tv", Endianness.BIG_ENDIAN,
                            SplitSpec.of(List.of(1, 5), List.of(1)), boolAndNibble()));
            assertEquals(5, e.getExpectedBits());
            assertEquals(4, e.getRemainingBits());
        }

        @Test
        void outputSideIsCheckedToo() {
            SplitMismatchException e = assertThrows(SplitMismatchException.class,
                    () -> BitVectorRenderer.render("tv", Endianness.BIG_ENDIAN,
                            SplitSpec.of(List.of(1, 4), List.of(2)), boolAndNibble()));
            assertTrue(e.getMessage().contains("output"), e.getMessage());
        }

        @Test
        void partitionReportsTheFailingSplit() {
            SplitMismatchException e = assertThrows(SplitMismatchException.class,
                    () -> BitVectorRenderer.partition("input", List.of(2, 2, 2), "11110"));
            assertEquals(2, e.getExpectedBits());
            assertEquals(1, e.getRemainingBits());
            assertTrue(e.getMessage().contains("split 2"), e.getMessage());
        }
    }

    @Test
    void floatsAndUnboundedIntegersAreRejected() {
        UnsupportedKindException e = assertThrows(UnsupportedKindException.class,
                () -> BitVectorRenderer.render("f", Endianness.BIG_ENDIAN, SplitSpec.of(List.of(32), List.of()),
                        TestVectorSet.of(new TestVector(List.of(ConcreteValue.ofFloat(1.0f)), List.of()))));
        assertEquals(Dialect.BIT_VECTOR, e.getDialect());

        assertThrows(UnsupportedKindException.class,
                () -> BitVectorRenderer.render("i", Endianness.BIG_ENDIAN, SplitSpec.of(List.of(), List.of(8)),
                        TestVectorSet.of(new TestVector(List.of(),
                                List.of(ConcreteValue.integer(BigInteger.ONE))))));
    }

    @Test
    void splitWidthsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> SplitSpec.of(List.of(1, 0), List.of()));
        assertEquals(5, SplitSpec.of(List.of(1, 4), List.of()).inputBits());
    }
}
