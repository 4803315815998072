package io.surfworks.vectorforge.value;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Closed description of every concrete value shape VectorForge can carry.
 *
 * <p>Only booleans, bounded and unbounded integers and IEEE floats are rendered
 * by any dialect; the remaining shapes exist so that an evaluator can hand them
 * back and a renderer can reject them by name.
 */
public sealed interface ValueKind permits
        ValueKind.BoolKind, ValueKind.BoundedKind, ValueKind.UnboundedKind,
        ValueKind.FloatKind, ValueKind.DoubleKind, ValueKind.RealKind,
        ValueKind.CharKind, ValueKind.StringKind, ValueKind.ListKind,
        ValueKind.SetKind, ValueKind.TupleKind, ValueKind.OptionalKind,
        ValueKind.SumKind, ValueKind.UninterpretedKind {

    BoolKind BOOL = new BoolKind();
    UnboundedKind UNBOUNDED = new UnboundedKind();
    FloatKind FLOAT = new FloatKind();
    DoubleKind DOUBLE = new DoubleKind();
    RealKind REAL = new RealKind();
    CharKind CHAR = new CharKind();
    StringKind STRING = new StringKind();

    /**
     * Variant tag. Capability tables switch over this so that adding a kind
     * breaks every table that has not been taught about it.
     */
    enum Tag {
        BOOL, BOUNDED, UNBOUNDED, FLOAT, DOUBLE, REAL,
        CHAR, STRING, LIST, SET, TUPLE, OPTIONAL, SUM, UNINTERPRETED
    }

    Tag tag();

    /**
     * Human readable kind name, e.g. {@code Word8}, {@code [Int16]}, {@code Maybe Bool}.
     */
    String describe();

    static BoundedKind word(int width) {
        return new BoundedKind(false, width);
    }

    static BoundedKind signed(int width) {
        return new BoundedKind(true, width);
    }

    // ==================== Scalars ====================

    record BoolKind() implements ValueKind {
        @Override
        public Tag tag() {
            return Tag.BOOL;
        }

        @Override
        public String describe() {
            return "Bool";
        }
    }

    /**
     * Fixed-width two's-complement (signed) or plain binary (unsigned) integer.
     */
    record BoundedKind(boolean signed, int width) implements ValueKind {

        public BoundedKind {
            if (width <= 0) {
                throw new IllegalArgumentException("Bit width must be positive: " + width);
            }
        }

        public BigInteger minValue() {
            return signed ? BigInteger.ONE.shiftLeft(width - 1).negate() : BigInteger.ZERO;
        }

        public BigInteger maxValue() {
            return signed
                    ? BigInteger.ONE.shiftLeft(width - 1).subtract(BigInteger.ONE)
                    : BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
        }

        public boolean inRange(BigInteger value) {
            return value.compareTo(minValue()) >= 0 && value.compareTo(maxValue()) <= 0;
        }

        /**
         * Reinterprets the low {@code width} bits of {@code bits} as a value of this kind.
         */
        public BigInteger fromBits(BigInteger bits) {
            BigInteger masked = bits.and(BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE));
            if (signed && masked.testBit(width - 1)) {
                return masked.subtract(BigInteger.ONE.shiftLeft(width));
            }
            return masked;
        }

        /**
         * True for the 8/16/32/64 bit widths that have native machine types.
         */
        public boolean isMachineWidth() {
            return width == 8 || width == 16 || width == 32 || width == 64;
        }

        @Override
        public Tag tag() {
            return Tag.BOUNDED;
        }

        @Override
        public String describe() {
            return (signed ? "Int" : "Word") + width;
        }
    }

    record UnboundedKind() implements ValueKind {
        @Override
        public Tag tag() {
            return Tag.UNBOUNDED;
        }

        @Override
        public String describe() {
            return "Integer";
        }
    }

    record FloatKind() implements ValueKind {
        @Override
        public Tag tag() {
            return Tag.FLOAT;
        }

        @Override
        public String describe() {
            return "Float";
        }
    }

    record DoubleKind() implements ValueKind {
        @Override
        public Tag tag() {
            return Tag.DOUBLE;
        }

        @Override
        public String describe() {
            return "Double";
        }
    }

    record RealKind() implements ValueKind {
        @Override
        public Tag tag() {
            return Tag.REAL;
        }

        @Override
        public String describe() {
            return "Real";
        }
    }

    record CharKind() implements ValueKind {
        @Override
        public Tag tag() {
            return Tag.CHAR;
        }

        @Override
        public String describe() {
            return "Char";
        }
    }

    record StringKind() implements ValueKind {
        @Override
        public Tag tag() {
            return Tag.STRING;
        }

        @Override
        public String describe() {
            return "String";
        }
    }

    // ==================== Structured ====================

    record ListKind(ValueKind element) implements ValueKind {
        public ListKind {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public Tag tag() {
            return Tag.LIST;
        }

        @Override
        public String describe() {
            return "[" + element.describe() + "]";
        }
    }

    record SetKind(ValueKind element) implements ValueKind {
        public SetKind {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public Tag tag() {
            return Tag.SET;
        }

        @Override
        public String describe() {
            return "{" + element.describe() + "}";
        }
    }

    record TupleKind(List<ValueKind> components) implements ValueKind {
        public TupleKind {
            components = List.copyOf(components);
        }

        @Override
        public Tag tag() {
            return Tag.TUPLE;
        }

        @Override
        public String describe() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < components.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(components.get(i).describe());
            }
            return sb.append(")").toString();
        }
    }

    record OptionalKind(ValueKind element) implements ValueKind {
        public OptionalKind {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public Tag tag() {
            return Tag.OPTIONAL;
        }

        @Override
        public String describe() {
            return "Maybe " + element.describe();
        }
    }

    record SumKind(ValueKind left, ValueKind right) implements ValueKind {
        public SumKind {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public Tag tag() {
            return Tag.SUM;
        }

        @Override
        public String describe() {
            return "Either " + left.describe() + " " + right.describe();
        }
    }

    /**
     * A user-declared sort with no interpretation, optionally enumerated.
     */
    record UninterpretedKind(String name, List<String> constructors) implements ValueKind {
        public UninterpretedKind {
            Objects.requireNonNull(name, "name");
            constructors = List.copyOf(constructors);
        }

        @Override
        public Tag tag() {
            return Tag.UNINTERPRETED;
        }

        @Override
        public String describe() {
            return name;
        }
    }
}
