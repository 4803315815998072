package io.surfworks.vectorforge.value;

import io.surfworks.vectorforge.value.Payload.BoolPayload;
import io.surfworks.vectorforge.value.Payload.CharPayload;
import io.surfworks.vectorforge.value.Payload.DoublePayload;
import io.surfworks.vectorforge.value.Payload.ElementsPayload;
import io.surfworks.vectorforge.value.Payload.FloatPayload;
import io.surfworks.vectorforge.value.Payload.IntegerPayload;
import io.surfworks.vectorforge.value.Payload.RealPayload;
import io.surfworks.vectorforge.value.Payload.StringPayload;
import io.surfworks.vectorforge.value.Payload.SumPayload;
import io.surfworks.vectorforge.value.Payload.UninterpretedPayload;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A concrete value: a kind plus a payload consistent with that kind.
 *
 * <p>Bounded integers are range checked on construction, so a {@code Word8}
 * never holds 256 and an {@code Int8} never holds 128.
 */
public record ConcreteValue(ValueKind kind, Payload payload) {

    public ConcreteValue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        checkConsistent(kind, payload);
    }

    // ==================== Factories ====================

    public static ConcreteValue bool(boolean value) {
        return new ConcreteValue(ValueKind.BOOL, new BoolPayload(value));
    }

    public static ConcreteValue word(int width, long value) {
        return bounded(ValueKind.word(width), BigInteger.valueOf(value));
    }

    public static ConcreteValue signed(int width, long value) {
        return bounded(ValueKind.signed(width), BigInteger.valueOf(value));
    }

    public static ConcreteValue bounded(ValueKind.BoundedKind kind, BigInteger value) {
        return new ConcreteValue(kind, new IntegerPayload(value));
    }

    /**
     * Builds a bounded value from a raw bit pattern, keeping only the low {@code width} bits.
     */
    public static ConcreteValue fromBits(ValueKind.BoundedKind kind, BigInteger bits) {
        return bounded(kind, kind.fromBits(bits));
    }

    public static ConcreteValue integer(BigInteger value) {
        return new ConcreteValue(ValueKind.UNBOUNDED, new IntegerPayload(value));
    }

    public static ConcreteValue ofFloat(float value) {
        return new ConcreteValue(ValueKind.FLOAT, new FloatPayload(value));
    }

    public static ConcreteValue ofDouble(double value) {
        return new ConcreteValue(ValueKind.DOUBLE, new DoublePayload(value));
    }

    public static ConcreteValue real(BigInteger numerator, BigInteger denominator) {
        return new ConcreteValue(ValueKind.REAL, new RealPayload(numerator, denominator));
    }

    public static ConcreteValue character(int codePoint) {
        return new ConcreteValue(ValueKind.CHAR, new CharPayload(codePoint));
    }

    public static ConcreteValue string(String value) {
        return new ConcreteValue(ValueKind.STRING, new StringPayload(value));
    }

    public static ConcreteValue list(ValueKind element, List<ConcreteValue> elements) {
        return new ConcreteValue(new ValueKind.ListKind(element), new ElementsPayload(elements));
    }

    public static ConcreteValue set(ValueKind element, List<ConcreteValue> elements) {
        return new ConcreteValue(new ValueKind.SetKind(element), new ElementsPayload(elements));
    }

    public static ConcreteValue tuple(List<ConcreteValue> components) {
        List<ValueKind> kinds = new ArrayList<>(components.size());
        for (ConcreteValue component : components) {
            kinds.add(component.kind());
        }
        return new ConcreteValue(new ValueKind.TupleKind(kinds), new ElementsPayload(components));
    }

    public static ConcreteValue none(ValueKind element) {
        return new ConcreteValue(new ValueKind.OptionalKind(element), new ElementsPayload(List.of()));
    }

    public static ConcreteValue some(ConcreteValue value) {
        return new ConcreteValue(new ValueKind.OptionalKind(value.kind()), new ElementsPayload(List.of(value)));
    }

    public static ConcreteValue left(ValueKind.SumKind kind, ConcreteValue value) {
        return new ConcreteValue(kind, new SumPayload(true, value));
    }

    public static ConcreteValue right(ValueKind.SumKind kind, ConcreteValue value) {
        return new ConcreteValue(kind, new SumPayload(false, value));
    }

    public static ConcreteValue uninterpreted(ValueKind.UninterpretedKind kind, String constant) {
        return new ConcreteValue(kind, new UninterpretedPayload(constant));
    }

    // ==================== Accessors ====================

    public boolean asBoolean() {
        if (payload instanceof BoolPayload b) {
            return b.value();
        }
        throw new IllegalStateException("Not a boolean value: " + this);
    }

    public BigInteger asBigInteger() {
        if (payload instanceof IntegerPayload i) {
            return i.value();
        }
        throw new IllegalStateException("Not an integer value: " + this);
    }

    public float asFloat() {
        if (payload instanceof FloatPayload f) {
            return f.value();
        }
        throw new IllegalStateException("Not a float value: " + this);
    }

    public double asDouble() {
        if (payload instanceof DoublePayload d) {
            return d.value();
        }
        throw new IllegalStateException("Not a double value: " + this);
    }

    @Override
    public String toString() {
        return payload.show() + " :: " + kind.describe();
    }

    // ==================== Consistency ====================

    private static void checkConsistent(ValueKind kind, Payload payload) {
        boolean ok = switch (kind.tag()) {
            case BOOL -> payload instanceof BoolPayload;
            case BOUNDED -> payload instanceof IntegerPayload i
                    && ((ValueKind.BoundedKind) kind).inRange(i.value());
            case UNBOUNDED -> payload instanceof IntegerPayload;
            case FLOAT -> payload instanceof FloatPayload;
            case DOUBLE -> payload instanceof DoublePayload;
            case REAL -> payload instanceof RealPayload;
            case CHAR -> payload instanceof CharPayload;
            case STRING -> payload instanceof StringPayload;
            case LIST -> payload instanceof ElementsPayload e
                    && allOfKind(e.elements(), ((ValueKind.ListKind) kind).element());
            case SET -> payload instanceof ElementsPayload e
                    && allOfKind(e.elements(), ((ValueKind.SetKind) kind).element());
            case OPTIONAL -> payload instanceof ElementsPayload e
                    && e.elements().size() <= 1
                    && allOfKind(e.elements(), ((ValueKind.OptionalKind) kind).element());
            case TUPLE -> payload instanceof ElementsPayload e
                    && componentsMatch(e.elements(), ((ValueKind.TupleKind) kind).components());
            case SUM -> payload instanceof SumPayload s
                    && s.value().kind().equals(s.isLeft()
                            ? ((ValueKind.SumKind) kind).left()
                            : ((ValueKind.SumKind) kind).right());
            case UNINTERPRETED -> payload instanceof UninterpretedPayload u
                    && (((ValueKind.UninterpretedKind) kind).constructors().isEmpty()
                            || ((ValueKind.UninterpretedKind) kind).constructors().contains(u.constant()));
        };
        if (!ok) {
            throw new IllegalArgumentException(
                    "Payload " + payload.show() + " is not valid for kind " + kind.describe());
        }
    }

    private static boolean allOfKind(List<ConcreteValue> elements, ValueKind kind) {
        for (ConcreteValue element : elements) {
            if (!element.kind().equals(kind)) {
                return false;
            }
        }
        return true;
    }

    private static boolean componentsMatch(List<ConcreteValue> elements, List<ValueKind> kinds) {
        if (elements.size() != kinds.size()) {
            return false;
        }
        for (int i = 0; i < elements.size(); i++) {
            if (!elements.get(i).kind().equals(kinds.get(i))) {
                return false;
            }
        }
        return true;
    }
}
