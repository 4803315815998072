package io.surfworks.vectorforge.render;

import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.value.Dialect;
import io.surfworks.vectorforge.value.ValueKind;

import java.math.BigInteger;
import java.util.List;

/**
 * Converts booleans and bounded integers to explicit bit strings and back.
 *
 * <p>Bits are written as {@code '0'}/{@code '1'} characters, most significant
 * bit first. Signed values use their two's-complement pattern.
 */
public final class BitBlaster {

    private BitBlaster() {}

    /**
     * Bit pattern of a single value.
     *
     * @throws UnsupportedKindException for anything other than a boolean or bounded integer
     */
    public static String blast(ConcreteValue value) throws UnsupportedKindException {
        RenderChecks.requireSupported(value, Dialect.BIT_VECTOR);
        ValueKind kind = value.kind();
        if (kind instanceof ValueKind.BoolKind) {
            return value.asBoolean() ? "1" : "0";
        }
        int width = ((ValueKind.BoundedKind) kind).width();
        BigInteger v = value.asBigInteger();
        StringBuilder sb = new StringBuilder(width);
        for (int i = width - 1; i >= 0; i--) {
            sb.append(v.testBit(i) ? '1' : '0');
        }
        return sb.toString();
    }

    /**
     * Concatenated bit patterns of {@code values}, in order.
     */
    public static String blast(List<ConcreteValue> values) throws UnsupportedKindException {
        StringBuilder sb = new StringBuilder();
        for (ConcreteValue value : values) {
            sb.append(blast(value));
        }
        return sb.toString();
    }

    /**
     * Reads an MSB-first bit string back as a value of {@code kind}.
     *
     * @throws IllegalArgumentException if the bit count differs from the kind's width
     */
    public static ConcreteValue read(String bits, ValueKind.BoundedKind kind) {
        if (bits.length() != kind.width()) {
            throw new IllegalArgumentException(
                    "Expected " + kind.width() + " bits for " + kind.describe() + " but got " + bits.length());
        }
        return ConcreteValue.fromBits(kind, new BigInteger(bits, 2));
    }
}
