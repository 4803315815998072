package io.surfworks.vectorforge.vector;

import io.surfworks.vectorforge.value.ConcreteValue;
import io.surfworks.vectorforge.value.Payload;
import io.surfworks.vectorforge.value.ValueKind;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a {@link TestVectorSet}.
 *
 * <pre>
 * {"vectors": [
 *   {"inputs":  [{"kind": "Bool", "value": true}, {"kind": "Word8", "value": "5"}],
 *    "outputs": [{"kind": "Word8", "value": "10"}]}
 * ]}
 * </pre>
 *
 * <p>Numbers travel as strings so that 64-bit and unbounded integers, NaN and
 * infinities survive. Only scalar kinds are supported.
 */
public final class TestVectorJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private TestVectorJson() {}

    public static String toJson(TestVectorSet set) {
        JsonArray vectors = new JsonArray();
        for (TestVector vector : set) {
            JsonObject obj = new JsonObject();
            obj.add("inputs", writeValues(vector.inputs()));
            obj.add("outputs", writeValues(vector.outputs()));
            vectors.add(obj);
        }
        JsonObject root = new JsonObject();
        root.add("vectors", vectors);
        return GSON.toJson(root);
    }

    public static TestVectorSet fromJson(String json) {
        JsonObject root = GSON.fromJson(json, JsonObject.class);
        if (root == null || !root.has("vectors") || !root.get("vectors").isJsonArray()) {
            throw new JsonParseException("Expected an object with a \"vectors\" array");
        }
        List<TestVector> vectors = new ArrayList<>();
        for (JsonElement element : root.getAsJsonArray("vectors")) {
            JsonObject obj = object(element, "vector");
            vectors.add(new TestVector(readValues(obj, "inputs"), readValues(obj, "outputs")));
        }
        return TestVectorSet.of(vectors);
    }

    public static void write(TestVectorSet set, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson(set), StandardCharsets.UTF_8);
    }

    public static TestVectorSet read(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    // ==================== Values ====================

    private static JsonArray writeValues(List<ConcreteValue> values) {
        JsonArray array = new JsonArray();
        for (ConcreteValue value : values) {
            JsonObject obj = new JsonObject();
            obj.addProperty("kind", value.kind().describe());
            Payload payload = value.payload();
            if (payload instanceof Payload.BoolPayload b) {
                obj.addProperty("value", b.value());
            } else if (payload instanceof Payload.IntegerPayload i) {
                obj.addProperty("value", i.value().toString());
            } else if (payload instanceof Payload.FloatPayload f) {
                obj.addProperty("value", Float.toString(f.value()));
            } else if (payload instanceof Payload.DoublePayload d) {
                obj.addProperty("value", Double.toString(d.value()));
            } else if (payload instanceof Payload.RealPayload r) {
                obj.addProperty("value", r.numerator() + "/" + r.denominator());
            } else if (payload instanceof Payload.CharPayload c) {
                obj.addProperty("value", new String(Character.toChars(c.codePoint())));
            } else if (payload instanceof Payload.StringPayload s) {
                obj.addProperty("value", s.value());
            } else {
                throw new IllegalArgumentException("Cannot write " + value.kind().describe() + " values as JSON");
            }
            array.add(obj);
        }
        return array;
    }

    private static List<ConcreteValue> readValues(JsonObject vector, String side) {
        JsonElement element = vector.get(side);
        if (element == null || !element.isJsonArray()) {
            throw new JsonParseException("Vector is missing its \"" + side + "\" array");
        }
        List<ConcreteValue> values = new ArrayList<>();
        for (JsonElement item : element.getAsJsonArray()) {
            JsonObject obj = object(item, side + " value");
            if (!obj.has("kind") || !obj.has("value")) {
                throw new JsonParseException("Value needs both \"kind\" and \"value\": " + obj);
            }
            JsonElement kind = obj.get("kind");
            JsonElement value = obj.get("value");
            if (!kind.isJsonPrimitive() || !kind.getAsJsonPrimitive().isString()) {
                throw new JsonParseException("\"kind\" must be a string: " + obj);
            }
            if (!value.isJsonPrimitive()) {
                throw new JsonParseException("\"value\" must be a string or boolean: " + obj);
            }
            values.add(readValue(kind.getAsString(), value));
        }
        return values;
    }

    private static JsonObject object(JsonElement element, String what) {
        if (!element.isJsonObject()) {
            throw new JsonParseException("Expected a " + what + " object but got " + element);
        }
        return element.getAsJsonObject();
    }

    private static ConcreteValue readValue(String kindName, JsonElement value) {
        ValueKind kind = parseKind(kindName);
        try {
            return switch (kind.tag()) {
                case BOOL -> {
                    if (!value.getAsJsonPrimitive().isBoolean()) {
                        throw new JsonParseException("Bool value must be true or false: " + value);
                    }
                    yield ConcreteValue.bool(value.getAsBoolean());
                }
                case BOUNDED -> ConcreteValue.bounded((ValueKind.BoundedKind) kind, new BigInteger(value.getAsString()));
                case UNBOUNDED -> ConcreteValue.integer(new BigInteger(value.getAsString()));
                case FLOAT -> ConcreteValue.ofFloat(Float.parseFloat(value.getAsString()));
                case DOUBLE -> ConcreteValue.ofDouble(Double.parseDouble(value.getAsString()));
                case REAL -> parseReal(value.getAsString());
                case CHAR -> parseChar(value.getAsString());
                case STRING -> ConcreteValue.string(value.getAsString());
                case LIST, SET, TUPLE, OPTIONAL, SUM, UNINTERPRETED ->
                        throw new JsonParseException("Unsupported kind in JSON: " + kindName);
            };
        } catch (IllegalStateException | IllegalArgumentException | UnsupportedOperationException e) {
            throw new JsonParseException("Bad " + kindName + " value " + value + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses the scalar kind names produced by {@link ValueKind#describe()}.
     */
    static ValueKind parseKind(String name) {
        switch (name) {
            case "Bool":
                return ValueKind.BOOL;
            case "Integer":
                return ValueKind.UNBOUNDED;
            case "Float":
                return ValueKind.FLOAT;
            case "Double":
                return ValueKind.DOUBLE;
            case "Real":
                return ValueKind.REAL;
            case "Char":
                return ValueKind.CHAR;
            case "String":
                return ValueKind.STRING;
            default:
                break;
        }
        if (name.startsWith("Word")) {
            return ValueKind.word(parseWidth(name, name.substring(4)));
        }
        if (name.startsWith("Int")) {
            return ValueKind.signed(parseWidth(name, name.substring(3)));
        }
        throw new JsonParseException("Unsupported kind in JSON: " + name);
    }

    private static int parseWidth(String name, String digits) {
        try {
            int width = Integer.parseInt(digits);
            if (width <= 0) {
                throw new JsonParseException("Bit width must be positive: " + name);
            }
            return width;
        } catch (NumberFormatException e) {
            throw new JsonParseException("Unsupported kind in JSON: " + name, e);
        }
    }

    private static ConcreteValue parseReal(String text) {
        int slash = text.indexOf('/');
        if (slash < 0) {
            return ConcreteValue.real(new BigInteger(text.trim()), BigInteger.ONE);
        }
        return ConcreteValue.real(
                new BigInteger(text.substring(0, slash).trim()),
                new BigInteger(text.substring(slash + 1).trim()));
    }

    private static ConcreteValue parseChar(String text) {
        if (text.codePointCount(0, text.length()) != 1) {
            throw new JsonParseException("Char value must be exactly one character: \"" + text + "\"");
        }
        return ConcreteValue.character(text.codePointAt(0));
    }
}
