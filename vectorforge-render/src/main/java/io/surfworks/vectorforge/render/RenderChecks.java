package io.surfworks.vectorforge.render;

import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.value.Dialect;
import io.surfworks.vectorforge.value.ValueKind;
import io.surfworks.vectorforge.value.ValueKinds;
import io.surfworks.vectorforge.vector.TestVector;
import io.surfworks.vectorforge.vector.TestVectorSet;

import java.util.List;

/**
 * Validation shared by the renderers. Everything is checked before any text is
 * produced, so a renderer either returns the whole document or throws.
 */
final class RenderChecks {

    private RenderChecks() {}

    static void requireSupported(ConcreteValue value, Dialect dialect) throws UnsupportedKindException {
        if (!ValueKinds.isSupported(value.kind(), dialect)) {
            throw new UnsupportedKindException(value, dialect);
        }
    }

    static void requireSupported(TestVectorSet set, Dialect dialect) throws UnsupportedKindException {
        for (TestVector vector : set) {
            for (ConcreteValue value : vector.inputs()) {
                requireSupported(value, dialect);
            }
            for (ConcreteValue value : vector.outputs()) {
                requireSupported(value, dialect);
            }
        }
    }

    /**
     * Every vector must carry the first vector's kind sequence on both sides.
     */
    static void requireHomogeneous(TestVectorSet set, Dialect dialect) throws MixedKindsException {
        if (set.isEmpty()) {
            return;
        }
        TestVector first = set.get(0);
        for (int i = 1; i < set.size(); i++) {
            TestVector vector = set.get(i);
            if (!vector.sameKindsAs(first)) {
                throw new MixedKindsException(dialect, i, signature(first), signature(vector));
            }
        }
    }

    /**
     * Normalizes a user-supplied name into an identifier: empty becomes
     * {@code testVectors}, a leading non-letter gets a {@code tv} prefix.
     */
    static String identifier(String name) {
        if (name.isEmpty()) {
            return "testVectors";
        }
        if (!Character.isLetter(name.charAt(0))) {
            return "tv" + name;
        }
        return name;
    }

    private static String signature(TestVector vector) {
        return describe(vector.inputKinds()) + " -> " + describe(vector.outputKinds());
    }

    private static String describe(List<ValueKind> kinds) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < kinds.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(kinds.get(i).describe());
        }
        return sb.append(")").toString();
    }
}
