package io.surfworks.vectorforge.render;

import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.value.Dialect;
import io.surfworks.vectorforge.value.ValueKind;
import io.surfworks.vectorforge.value.ValueKinds;
import io.surfworks.vectorforge.vector.TestVector;
import io.surfworks.vectorforge.vector.TestVectorSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders a test vector set as a standalone Haskell module.
 *
 * <p>The module exports one value, a list of {@code (inputs, outputs)} tuples:
 * <pre>
 * tv :: [((Bool, Word8), Word8)]
 * tv = [ ((True , 0x05), 0x0a)
 *      ]
 * </pre>
 *
 * <p>Adjacent values of the same kind are collected into a list, so four
 * {@code Word8} inputs become one {@code [Word8]}. Imports and the element
 * types come from the first vector; later vectors must have the same kinds.
 */
public final class FunctionalModuleRenderer {

    static final String HEADER = "-- Automatically generated by VectorForge. Do not edit!";

    private static final Map<ValueKind, String> TYPE_NAMES = Map.ofEntries(
            Map.entry(ValueKind.BOOL, "Bool"),
            Map.entry(ValueKind.word(8), "Word8"),
            Map.entry(ValueKind.word(16), "Word16"),
            Map.entry(ValueKind.word(32), "Word32"),
            Map.entry(ValueKind.word(64), "Word64"),
            Map.entry(ValueKind.signed(8), "Int8"),
            Map.entry(ValueKind.signed(16), "Int16"),
            Map.entry(ValueKind.signed(32), "Int32"),
            Map.entry(ValueKind.signed(64), "Int64"),
            Map.entry(ValueKind.UNBOUNDED, "Integer"),
            Map.entry(ValueKind.FLOAT, "Float"),
            Map.entry(ValueKind.DOUBLE, "Double")
    );

    private FunctionalModuleRenderer() {}

    /**
     * Renders {@code set} as a module binding it to {@code name}.
     *
     * @param name value name; empty selects {@code testVectors}, a leading
     *             non-letter is prefixed with {@code tv}
     * @param set  the vectors to render
     * @return the module source
     * @throws UnsupportedKindException if any value has no Haskell encoding here
     * @throws MixedKindsException      if the vectors do not share one kind layout
     */
    public static String render(String name, TestVectorSet set) throws RenderException {
        RenderChecks.requireSupported(set, Dialect.FUNCTIONAL);
        RenderChecks.requireHomogeneous(set, Dialect.FUNCTIONAL);

        String n = RenderChecks.identifier(name);
        String moduleName = Character.toUpperCase(n.charAt(0)) + n.substring(1);
        String pad = " ".repeat(n.length() + 3);

        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        lines.add("");
        if (set.first().map(FunctionalModuleRenderer::hasFloating).orElse(false)) {
            lines.add("{-# LANGUAGE HexFloatLiterals #-}");
            lines.add("");
        }
        lines.add("module " + moduleName + "(" + n + ") where");
        lines.add("");
        lines.addAll(imports(set));

        lines.add(n + " :: " + listType(set));

        List<String> entries = new ArrayList<>(set.size());
        for (TestVector vector : set) {
            entries.add("(" + mapGroups(vector.inputs(), FunctionalModuleRenderer::groupValue)
                    + ", " + mapGroups(vector.outputs(), FunctionalModuleRenderer::groupValue) + ")");
        }
        lines.add(n + " = [ " + String.join("\n" + pad + ", ", entries));
        lines.add(pad + "]");

        return String.join("\n", lines);
    }

    /**
     * Import lines chosen from the first vector only.
     */
    private static List<String> imports(TestVectorSet set) {
        if (set.isEmpty()) {
            return List.of();
        }
        TestVector first = set.get(0);
        List<ConcreteValue> params = new ArrayList<>(first.inputs());
        params.addAll(first.outputs());

        boolean needsInt = false;
        boolean needsWord = false;
        for (ConcreteValue value : params) {
            ValueKind kind = value.kind();
            needsInt |= ValueKinds.isSignedBounded(kind);
            needsWord |= ValueKinds.isUnsignedBounded(kind) && ((ValueKind.BoundedKind) kind).width() > 1;
        }

        List<String> imports = new ArrayList<>();
        if (needsInt) imports.add("import Data.Int");
        if (needsWord) imports.add("import Data.Word");
        if (!imports.isEmpty()) {
            imports.add("");
        }
        return imports;
    }

    private static boolean hasFloating(TestVector vector) {
        for (List<ConcreteValue> side : List.of(vector.inputs(), vector.outputs())) {
            for (ConcreteValue value : side) {
                if (value.kind() instanceof ValueKind.FloatKind || value.kind() instanceof ValueKind.DoubleKind) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String listType(TestVectorSet set) {
        if (set.isEmpty()) {
            return "[a]";
        }
        TestVector first = set.get(0);
        return "[(" + mapGroups(first.inputs(), FunctionalModuleRenderer::groupType)
                + ", " + mapGroups(first.outputs(), FunctionalModuleRenderer::groupType) + ")]";
    }

    // ==================== Grouping ====================

    /**
     * Splits {@code values} into runs of equal kind, renders each run and wraps
     * the runs in a tuple when there is more than one.
     */
    private static String mapGroups(List<ConcreteValue> values, Function<List<ConcreteValue>, String> render) {
        List<String> groups = new ArrayList<>();
        int start = 0;
        while (start < values.size()) {
            ValueKind kind = values.get(start).kind();
            int end = start + 1;
            while (end < values.size() && values.get(end).kind().equals(kind)) {
                end++;
            }
            groups.add(render.apply(values.subList(start, end)));
            start = end;
        }
        if (groups.size() == 1) {
            return groups.get(0);
        }
        return "(" + String.join(", ", groups) + ")";
    }

    private static String groupType(List<ConcreteValue> group) {
        String t = typeName(group.get(0));
        return group.size() == 1 ? t : "[" + t + "]";
    }

    private static String groupValue(List<ConcreteValue> group) {
        if (group.size() == 1) {
            return valueText(group.get(0));
        }
        List<String> items = new ArrayList<>(group.size());
        for (ConcreteValue value : group) {
            items.add(valueText(value));
        }
        return "[" + String.join(", ", items) + "]";
    }

    // ==================== Tokens ====================

    private static String typeName(ConcreteValue value) {
        String name = TYPE_NAMES.get(value.kind());
        if (name == null) {
            throw new IllegalStateException("No Haskell type for " + value.kind().describe());
        }
        return name;
    }

    private static String valueText(ConcreteValue value) {
        ValueKind kind = value.kind();
        return switch (kind.tag()) {
            case BOOL -> NumberFormats.padRight(value.asBoolean() ? "True" : "False", 5);
            case BOUNDED -> NumberFormats.signedHex(value.asBigInteger(), ((ValueKind.BoundedKind) kind).width());
            case UNBOUNDED -> NumberFormats.signedHex(value.asBigInteger());
            case FLOAT -> hexFloat(value.asFloat());
            case DOUBLE -> hexDouble(value.asDouble());
            case REAL, CHAR, STRING, LIST, SET, TUPLE, OPTIONAL, SUM, UNINTERPRETED ->
                    throw new IllegalStateException("No Haskell literal for " + kind.describe());
        };
    }

    private static String hexFloat(float f) {
        if (Float.isNaN(f)) return "(0/0)";
        if (Float.isInfinite(f)) return f > 0 ? "(1/0)" : "(-1/0)";
        return Float.toHexString(f);
    }

    private static String hexDouble(double d) {
        if (Double.isNaN(d)) return "(0/0)";
        if (Double.isInfinite(d)) return d > 0 ? "(1/0)" : "(-1/0)";
        return Double.toHexString(d);
    }
}
