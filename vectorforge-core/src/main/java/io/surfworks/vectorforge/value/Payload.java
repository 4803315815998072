package io.surfworks.vectorforge.value;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * The raw data carried by a {@link ConcreteValue}. Which variant is legal is
 * decided by the value's {@link ValueKind}.
 */
public sealed interface Payload permits
        Payload.BoolPayload, Payload.IntegerPayload, Payload.FloatPayload,
        Payload.DoublePayload, Payload.RealPayload, Payload.CharPayload,
        Payload.StringPayload, Payload.ElementsPayload, Payload.SumPayload,
        Payload.UninterpretedPayload {

    String show();

    record BoolPayload(boolean value) implements Payload {
        @Override
        public String show() {
            return value ? "True" : "False";
        }
    }

    /**
     * Integer payload shared by bounded and unbounded kinds.
     */
    record IntegerPayload(BigInteger value) implements Payload {
        public IntegerPayload {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String show() {
            return value.toString();
        }
    }

    record FloatPayload(float value) implements Payload {
        @Override
        public String show() {
            return Float.toString(value);
        }
    }

    record DoublePayload(double value) implements Payload {
        @Override
        public String show() {
            return Double.toString(value);
        }
    }

    /**
     * Exact rational, kept in lowest terms with a positive denominator.
     */
    record RealPayload(BigInteger numerator, BigInteger denominator) implements Payload {
        public RealPayload {
            Objects.requireNonNull(numerator, "numerator");
            Objects.requireNonNull(denominator, "denominator");
            if (denominator.signum() == 0) {
                throw new IllegalArgumentException("Zero denominator");
            }
            if (denominator.signum() < 0) {
                numerator = numerator.negate();
                denominator = denominator.negate();
            }
            BigInteger gcd = numerator.gcd(denominator);
            if (gcd.signum() != 0 && !gcd.equals(BigInteger.ONE)) {
                numerator = numerator.divide(gcd);
                denominator = denominator.divide(gcd);
            }
        }

        @Override
        public String show() {
            return denominator.equals(BigInteger.ONE)
                    ? numerator.toString()
                    : numerator + "/" + denominator;
        }
    }

    record CharPayload(int codePoint) implements Payload {
        public CharPayload {
            if (!Character.isValidCodePoint(codePoint)) {
                throw new IllegalArgumentException("Invalid code point: " + codePoint);
            }
        }

        @Override
        public String show() {
            return "'" + new String(Character.toChars(codePoint)) + "'";
        }
    }

    record StringPayload(String value) implements Payload {
        public StringPayload {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String show() {
            return "\"" + value + "\"";
        }
    }

    /**
     * Components of a list, set, tuple or optional value.
     */
    record ElementsPayload(List<ConcreteValue> elements) implements Payload {
        public ElementsPayload {
            elements = List.copyOf(elements);
        }

        @Override
        public String show() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(elements.get(i).payload().show());
            }
            return sb.append("]").toString();
        }
    }

    record SumPayload(boolean isLeft, ConcreteValue value) implements Payload {
        public SumPayload {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String show() {
            return (isLeft ? "Left " : "Right ") + value.payload().show();
        }
    }

    record UninterpretedPayload(String constant) implements Payload {
        public UninterpretedPayload {
            Objects.requireNonNull(constant, "constant");
        }

        @Override
        public String show() {
            return constant;
        }
    }
}
