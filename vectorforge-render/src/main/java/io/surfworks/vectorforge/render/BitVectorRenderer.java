package io.surfworks.vectorforge.render;

import io.surfworks.vectorforge.value.Dialect;
import io.surfworks.vectorforge.vector.TestVector;
import io.surfworks.vectorforge.vector.TestVectorSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a test vector set as a Forte binding of bit-literal tuples.
 *
 * <p>Each side of a vector is blasted into one bit string, reversed for
 * little-endian output, then cut into tokens by the split widths: a width of
 * one becomes {@code T} or {@code F}, a wider split becomes
 * {@code c "<width>'b<bits>"}, where {@code c} is the helper defined in the
 * emitted header that turns the literal into a bit list.
 */
public final class BitVectorRenderer {

    static final String HEADER = "// Automatically generated by VectorForge. Do not edit!";

    private static final String BIT_HELPER =
            "   let c s = val [_, r] = str_split s \"'\" in map (\\s. s == \"1\") (explode (string_tl r))";

    private BitVectorRenderer() {}

    /**
     * Renders {@code set} as a Forte {@code let} binding.
     *
     * @param name       binding name; empty selects {@code testVectors}, a leading
     *                   non-letter is prefixed with {@code tv}
     * @param endianness bit order applied to each side before splitting
     * @param splits     token widths for the input and output sides
     * @param set        the vectors to render
     * @return the Forte source
     * @throws UnsupportedKindException if a value is neither boolean nor a bounded integer
     * @throws SplitMismatchException   if the splits do not exactly cover a side's bits
     */
    public static String render(String name, Endianness endianness, SplitSpec splits, TestVectorSet set)
            throws RenderException {
        RenderChecks.requireSupported(set, Dialect.BIT_VECTOR);

        String n = RenderChecks.identifier(name);
        List<String> entries = new ArrayList<>(set.size());
        for (TestVector vector : set) {
            String in = tuple(partition("input", splits.inputSplits(),
                    order(BitBlaster.blast(vector.inputs()), endianness)));
            String out = tuple(partition("output", splits.outputSplits(),
                    order(BitBlaster.blast(vector.outputs()), endianness)));
            entries.add("(" + in + ", " + out + ")");
        }

        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        lines.add("let " + n + " =");
        lines.add(BIT_HELPER);
        lines.add("   in [ " + String.join("\n      , ", entries));
        lines.add("      ];");
        return String.join("\n", lines);
    }

    private static String order(String bits, Endianness endianness) {
        return endianness == Endianness.LITTLE_ENDIAN ? new StringBuilder(bits).reverse().toString() : bits;
    }

    /**
     * Cuts {@code bits} into one token per split width, left to right.
     */
    static List<String> partition(String side, List<Integer> widths, String bits) throws SplitMismatchException {
        List<String> tokens = new ArrayList<>(widths.size());
        int pos = 0;
        for (int i = 0; i < widths.size(); i++) {
            int width = widths.get(i);
            int remaining = bits.length() - pos;
            if (remaining < width) {
                throw SplitMismatchException.shortStream(side, i, width, remaining);
            }
            String chunk = bits.substring(pos, pos + width);
            pos += width;
            if (width == 1) {
                tokens.add(chunk.charAt(0) == '1' ? "T" : "F");
            } else {
                tokens.add("c \"" + width + "'b" + chunk + "\"");
            }
        }
        if (pos != bits.length()) {
            throw SplitMismatchException.extraBits(side, bits.length() - pos);
        }
        return tokens;
    }

    private static String tuple(List<String> elements) {
        if (elements.size() == 1) {
            return elements.get(0);
        }
        return "(" + String.join(", ", elements) + ")";
    }
}
