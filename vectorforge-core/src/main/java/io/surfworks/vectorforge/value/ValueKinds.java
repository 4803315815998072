package io.surfworks.vectorforge.value;

import java.util.ArrayList;
import java.util.List;

/**
 * Classification helpers over {@link ValueKind}.
 */
public final class ValueKinds {

    private ValueKinds() {}

    public static ValueKind kindOf(ConcreteValue value) {
        return value.kind();
    }

    public static boolean isSupported(ValueKind kind, Dialect dialect) {
        return KindCapabilities.isSupported(kind, dialect);
    }

    /**
     * Kind sequence of a list of values, in order.
     */
    public static List<ValueKind> kindsOf(List<ConcreteValue> values) {
        List<ValueKind> kinds = new ArrayList<>(values.size());
        for (ConcreteValue value : values) {
            kinds.add(value.kind());
        }
        return kinds;
    }

    public static boolean isSignedBounded(ValueKind kind) {
        return kind instanceof ValueKind.BoundedKind b && b.signed();
    }

    public static boolean isUnsignedBounded(ValueKind kind) {
        return kind instanceof ValueKind.BoundedKind b && !b.signed();
    }
}
