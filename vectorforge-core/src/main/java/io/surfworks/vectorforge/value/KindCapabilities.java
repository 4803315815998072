package io.surfworks.vectorforge.value;

/**
 * Which value kinds each dialect can encode.
 *
 * <p>Every table is an exhaustive switch over {@link ValueKind.Tag}, so a new
 * kind does not compile until each dialect has an answer for it.
 */
final class KindCapabilities {

    private KindCapabilities() {}

    static boolean isSupported(ValueKind kind, Dialect dialect) {
        return switch (dialect) {
            case FUNCTIONAL -> functional(kind);
            case STRUCT_ARRAY -> structArray(kind);
            case BIT_VECTOR -> bitVector(kind);
        };
    }

    private static boolean functional(ValueKind kind) {
        return switch (kind.tag()) {
            case BOOL, UNBOUNDED, FLOAT, DOUBLE -> true;
            case BOUNDED -> ((ValueKind.BoundedKind) kind).isMachineWidth();
            case REAL, CHAR, STRING, LIST, SET, TUPLE, OPTIONAL, SUM, UNINTERPRETED -> false;
        };
    }

    private static boolean structArray(ValueKind kind) {
        return switch (kind.tag()) {
            case BOOL, FLOAT, DOUBLE -> true;
            case BOUNDED -> ((ValueKind.BoundedKind) kind).isMachineWidth();
            case UNBOUNDED, REAL, CHAR, STRING, LIST, SET, TUPLE, OPTIONAL, SUM, UNINTERPRETED -> false;
        };
    }

    private static boolean bitVector(ValueKind kind) {
        return switch (kind.tag()) {
            case BOOL, BOUNDED -> true;
            case UNBOUNDED, FLOAT, DOUBLE, REAL, CHAR, STRING, LIST, SET, TUPLE, OPTIONAL, SUM, UNINTERPRETED -> false;
        };
    }
}
