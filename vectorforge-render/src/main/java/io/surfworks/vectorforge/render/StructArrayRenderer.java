package io.surfworks.vectorforge.render;

import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.value.Dialect;
import io.surfworks.vectorforge.value.ValueKind;
import io.surfworks.vectorforge.vector.TestVector;
import io.surfworks.vectorforge.vector.TestVectorSet;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a test vector set as a C program: a record type with {@code input}
 * and {@code output} sub-structs, a static array of records, a length constant
 * and a stub {@code main} that prints every record.
 *
 * <p>The record layout comes from the first vector; later vectors must have the
 * same kinds. Unbounded integers and reals have no C counterpart and are rejected.
 */
public final class StructArrayRenderer {

    private static final List<String> PRELUDE = List.of(
            "/* Automatically generated by VectorForge. Do not edit! */",
            "",
            "#include <stdio.h>",
            "#include <inttypes.h>",
            "#include <stdint.h>",
            "#include <stdbool.h>",
            "#include <string.h>",
            "#include <math.h>",
            "",
            "/* The boolean type */",
            "typedef bool SBool;",
            "",
            "/* The float type */",
            "typedef float SFloat;",
            "",
            "/* The double type */",
            "typedef double SDouble;",
            "",
            "/* Unsigned bit-vectors */",
            "typedef uint8_t  SWord8;",
            "typedef uint16_t SWord16;",
            "typedef uint32_t SWord32;",
            "typedef uint64_t SWord64;",
            "",
            "/* Signed bit-vectors */",
            "typedef int8_t  SInt8;",
            "typedef int16_t SInt16;",
            "typedef int32_t SInt32;",
            "typedef int64_t SInt64;",
            ""
    );

    private static final Map<ValueKind, String> FIELD_TYPES = Map.ofEntries(
            Map.entry(ValueKind.BOOL, "SBool"),
            Map.entry(ValueKind.word(8), "SWord8"),
            Map.entry(ValueKind.word(16), "SWord16"),
            Map.entry(ValueKind.word(32), "SWord32"),
            Map.entry(ValueKind.word(64), "SWord64"),
            Map.entry(ValueKind.signed(8), "SInt8"),
            Map.entry(ValueKind.signed(16), "SInt16"),
            Map.entry(ValueKind.signed(32), "SInt32"),
            Map.entry(ValueKind.signed(64), "SInt64"),
            Map.entry(ValueKind.FLOAT, "SFloat"),
            Map.entry(ValueKind.DOUBLE, "SDouble")
    );

    // printf conversions; the trailing U/L suffixes are printed literally
    private static final Map<ValueKind, String> PRINT_FORMATS = Map.ofEntries(
            Map.entry(ValueKind.BOOL, "%s"),
            Map.entry(ValueKind.word(8), "0x%02\"PRIx8\""),
            Map.entry(ValueKind.word(16), "0x%04\"PRIx16\"U"),
            Map.entry(ValueKind.word(32), "0x%08\"PRIx32\"UL"),
            Map.entry(ValueKind.word(64), "0x%016\"PRIx64\"ULL"),
            Map.entry(ValueKind.signed(8), "%\"PRId8\""),
            Map.entry(ValueKind.signed(16), "%\"PRId16\""),
            Map.entry(ValueKind.signed(32), "%\"PRId32\"L"),
            Map.entry(ValueKind.signed(64), "%\"PRId64\"LL"),
            Map.entry(ValueKind.FLOAT, "%f"),
            Map.entry(ValueKind.DOUBLE, "%f")
    );

    private static final Map<ValueKind, String> LITERAL_SUFFIXES = Map.of(
            ValueKind.word(8), "",
            ValueKind.word(16), "U",
            ValueKind.word(32), "UL",
            ValueKind.word(64), "ULL",
            ValueKind.signed(8), "",
            ValueKind.signed(16), "",
            ValueKind.signed(32), "L",
            ValueKind.signed(64), "LL"
    );

    private StructArrayRenderer() {}

    /**
     * Renders {@code set} as a C program.
     *
     * @param name base name for the record type, array and length constant
     * @param set  the vectors to render
     * @return the program source
     * @throws UnsupportedKindException if any value has no C encoding
     * @throws MixedKindsException      if the vectors do not share one kind layout
     */
    public static String render(String name, TestVectorSet set) throws RenderException {
        RenderChecks.requireSupported(set, Dialect.STRUCT_ARRAY);
        RenderChecks.requireHomogeneous(set, Dialect.STRUCT_ARRAY);

        String n = RenderChecks.identifier(name);
        List<ConcreteValue> firstInputs = set.first().map(TestVector::inputs).orElse(List.of());
        List<ConcreteValue> firstOutputs = set.first().map(TestVector::outputs).orElse(List.of());

        List<String> lines = new ArrayList<>(PRELUDE);
        lines.add("typedef struct {");
        lines.add("  struct {");
        for (int i = 0; i < firstInputs.size(); i++) {
            lines.add(field("i", i, firstInputs.get(i)));
        }
        lines.add("  } input;");
        lines.add("  struct {");
        for (int i = 0; i < firstOutputs.size(); i++) {
            lines.add(field("o", i, firstOutputs.get(i)));
        }
        lines.add("  } output;");
        lines.add("} " + n + "TestVector;");
        lines.add("");

        lines.add(n + "TestVector " + n + "[] = {");
        List<String> records = new ArrayList<>(set.size());
        for (TestVector vector : set) {
            records.add("{{" + literals(vector.inputs()) + "}, {" + literals(vector.outputs()) + "}}");
        }
        lines.add("      " + String.join("\n    , ", records));
        lines.add("};");
        lines.add("");
        lines.add("int " + n + "Length = " + set.size() + ";");
        lines.add("");
        lines.add("/* Stub driver showing the test values, replace with code that uses the test vectors. */");
        lines.add("int main(void)");
        lines.add("{");
        lines.add("  int i;");
        lines.add("  for(i = 0; i < " + n + "Length; ++i)");
        lines.add("  {");
        lines.add("    " + printStatement(n, set.size(), firstInputs, firstOutputs));
        lines.add("  }");
        lines.add("");
        lines.add("  return 0;");
        lines.add("}");

        return String.join("\n", lines);
    }

    private static String field(String prefix, int index, ConcreteValue value) {
        return "    " + FIELD_TYPES.get(value.kind()) + " " + prefix + index + ";";
    }

    private static String printStatement(String n, int count,
                                         List<ConcreteValue> inputs, List<ConcreteValue> outputs) {
        if (count == 0) {
            return "printf(\"\");";
        }
        List<String> inFormats = new ArrayList<>();
        List<String> args = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            inFormats.add(PRINT_FORMATS.get(inputs.get(i).kind()));
            args.add(printArgument(inputs.get(i), n + "[i].input.i" + i));
        }
        List<String> outFormats = new ArrayList<>();
        for (int i = 0; i < outputs.size(); i++) {
            outFormats.add(PRINT_FORMATS.get(outputs.get(i).kind()));
            args.add(printArgument(outputs.get(i), n + "[i].output.o" + i));
        }
        String format = String.join(" ", inFormats) + " -> " + String.join(" ", outFormats);
        int indexWidth = String.valueOf(count - 1).length();

        StringBuilder sb = new StringBuilder();
        sb.append("printf(\"%*d. ").append(format).append("\\n\", ").append(indexWidth).append(", i");
        for (String arg : args) {
            sb.append("\n           , ").append(arg);
        }
        return sb.append(");").toString();
    }

    private static String printArgument(ConcreteValue value, String access) {
        if (value.kind() instanceof ValueKind.BoolKind) {
            return "(" + access + " == true) ? \"true \" : \"false\"";
        }
        return access;
    }

    // ==================== Literals ====================

    private static String literals(List<ConcreteValue> values) {
        List<String> out = new ArrayList<>(values.size());
        for (ConcreteValue value : values) {
            out.add(literal(value));
        }
        return String.join(", ", out);
    }

    static String literal(ConcreteValue value) {
        ValueKind kind = value.kind();
        return switch (kind.tag()) {
            case BOOL -> value.asBoolean() ? "true " : "false";
            case BOUNDED -> integerLiteral((ValueKind.BoundedKind) kind, value.asBigInteger());
            case FLOAT -> floatLiteral(value.asFloat());
            case DOUBLE -> doubleLiteral(value.asDouble());
            case UNBOUNDED, REAL, CHAR, STRING, LIST, SET, TUPLE, OPTIONAL, SUM, UNINTERPRETED ->
                    throw new IllegalStateException("No C literal for " + kind.describe());
        };
    }

    /**
     * Unsigned values as zero-padded hex, signed values in decimal, both with
     * the suffix matching the width. The most negative signed value cannot be
     * written directly for 32 and 64 bits, so it becomes {@code (min + 1) - 1}.
     */
    private static String integerLiteral(ValueKind.BoundedKind kind, BigInteger value) {
        String suffix = LITERAL_SUFFIXES.get(kind);
        if (!kind.signed()) {
            return "0x" + NumberFormats.paddedHex(value, NumberFormats.hexDigits(kind.width())) + suffix;
        }
        if (kind.width() >= 32 && value.equals(kind.minValue())) {
            return "(" + value.add(BigInteger.ONE) + suffix + " - 1)";
        }
        return value + suffix;
    }

    private static String floatLiteral(float f) {
        if (Float.isNaN(f)) return "((float) NAN)";
        if (Float.isInfinite(f)) return f > 0 ? "((float) INFINITY)" : "((float) (-INFINITY))";
        return Float.toString(f) + "F";
    }

    private static String doubleLiteral(double d) {
        if (Double.isNaN(d)) return "((double) NAN)";
        if (Double.isInfinite(d)) return d > 0 ? "((double) INFINITY)" : "((double) (-INFINITY))";
        return Double.toString(d);
    }
}
