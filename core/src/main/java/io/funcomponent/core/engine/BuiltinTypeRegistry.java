package io.funcomponent.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.funcomponent.core.error.ValueSerializationException;
import io.funcomponent.core.spi.TypeRegistry;
import io.funcomponent.core.spi.ValueCodec;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The built-in data types: {@code String}, {@code Integer}, {@code Float}, {@code Boolean},
 * {@code JsonArray} and {@code JsonObject}.
 *
 * <p>Serves both as the {@link TypeRegistry} consulted while generating the container program and
 * as the {@link ValueCodec} used to materialize parameter defaults. Immutable and thread-safe.
 */
public final class BuiltinTypeRegistry implements TypeRegistry, ValueCodec {

    private static final Logger LOG = LoggerFactory.getLogger(BuiltinTypeRegistry.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public static final String STRING = "String";
    public static final String INTEGER = "Integer";
    public static final String FLOAT = "Float";
    public static final String BOOLEAN = "Boolean";
    public static final String JSON_ARRAY = "JsonArray";
    public static final String JSON_OBJECT = "JsonObject";

    private static final String SERIALIZE_STR = """
            def _serialize_str(str_value: str) -> str:
                if not isinstance(str_value, str):
                    raise TypeError('Value "{}" has type "{}" instead of str.'.format(str(str_value), str(type(str_value))))
                return str_value
            """;

    private static final String SERIALIZE_INT = """
            def _serialize_int(int_value: int) -> str:
                if isinstance(int_value, str):
                    return int_value
                if not isinstance(int_value, int):
                    raise TypeError('Value "{}" has type "{}" instead of int.'.format(str(int_value), str(type(int_value))))
                return str(int_value)
            """;

    private static final String SERIALIZE_FLOAT = """
            def _serialize_float(float_value: float) -> str:
                if isinstance(float_value, str):
                    return float_value
                if not isinstance(float_value, (float, int)):
                    raise TypeError('Value "{}" has type "{}" instead of float.'.format(str(float_value), str(type(float_value))))
                return str(float_value)
            """;

    private static final String SERIALIZE_BOOL = """
            def _serialize_bool(bool_value: bool) -> str:
                if isinstance(bool_value, str):
                    return bool_value
                if not isinstance(bool_value, bool):
                    raise TypeError('Value "{}" has type "{}" instead of bool.'.format(str(bool_value), str(type(bool_value))))
                return str(bool_value)
            """;

    private static final String SERIALIZE_JSON = """
            def _serialize_json(obj) -> str:
                if isinstance(obj, str):
                    return obj
                import json
                def default_serializer(obj):
                    if hasattr(obj, 'to_struct'):
                        return obj.to_struct()
                    raise TypeError("Object of type '%s' is not JSON serializable and does not have .to_struct() method." % obj.__class__.__name__)
                return json.dumps(obj, default=default_serializer, sort_keys=True)
            """;

    private static final String DESERIALIZE_BOOL = """
            def _deserialize_bool(s) -> bool:
                normalized = s.strip().lower()
                if normalized in ('y', 'yes', 't', 'true', 'on', '1'):
                    return True
                if normalized in ('n', 'no', 'f', 'false', 'off', '0'):
                    return False
                raise ValueError('Invalid boolean value: %r' % (s,))
            """;

    private static final BuiltinTypeRegistry STANDARD = new BuiltinTypeRegistry();

    private final Map<String, String> typeNames;
    private final Map<String, Serializer> serializers;
    private final Map<String, Deserializer> deserializers;

    private BuiltinTypeRegistry() {
        Map<String, String> names = new LinkedHashMap<>();
        register(names, STRING, "str");
        register(names, INTEGER, "int");
        register(names, FLOAT, "float");
        register(names, BOOLEAN, "bool");
        register(names, JSON_ARRAY, "list", "List");
        register(names, JSON_OBJECT, "dict", "Dict");
        this.typeNames = Map.copyOf(names);

        this.serializers = Map.of(
                STRING, new Serializer("_serialize_str", SERIALIZE_STR),
                INTEGER, new Serializer("_serialize_int", SERIALIZE_INT),
                FLOAT, new Serializer("_serialize_float", SERIALIZE_FLOAT),
                BOOLEAN, new Serializer("_serialize_bool", SERIALIZE_BOOL),
                JSON_ARRAY, new Serializer("_serialize_json", SERIALIZE_JSON),
                JSON_OBJECT, new Serializer("_serialize_json", SERIALIZE_JSON));

        this.deserializers = Map.of(
                STRING, new Deserializer("str", null),
                INTEGER, new Deserializer("int", null),
                FLOAT, new Deserializer("float", null),
                BOOLEAN, new Deserializer("_deserialize_bool", DESERIALIZE_BOOL),
                JSON_ARRAY, new Deserializer("json.loads", "import json"),
                JSON_OBJECT, new Deserializer("json.loads", "import json"));
    }

    /** Returns the shared registry instance. */
    public static BuiltinTypeRegistry standard() {
        return STANDARD;
    }

    private static void register(Map<String, String> names, String typeName, String... aliases) {
        names.put(typeName, typeName);
        for (String alias : aliases) {
            names.put(alias, typeName);
        }
    }

    @Override
    public Optional<String> typeName(String typeKey) {
        return typeKey == null ? Optional.empty() : Optional.ofNullable(typeNames.get(typeKey));
    }

    @Override
    public Optional<Serializer> serializer(String typeName) {
        return typeName == null ? Optional.empty() : Optional.ofNullable(serializers.get(typeName));
    }

    @Override
    public Optional<Deserializer> deserializer(String typeName) {
        return typeName == null ? Optional.empty() : Optional.ofNullable(deserializers.get(typeName));
    }

    // --- ValueCodec ---

    @Override
    public String serialize(Object value, String typeName) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        if (value instanceof String text) {
            // Strings are taken as already serialized
            return text;
        }
        String effectiveType = typeName;
        if (effectiveType == null) {
            effectiveType = inferTypeName(value);
            LOG.warn("Missing type name was inferred as \"{}\" based on the value \"{}\"", effectiveType, value);
        }
        String canonical = typeName(effectiveType).orElse(effectiveType);
        switch (canonical) {
            case INTEGER:
                if (isIntegral(value)) {
                    return value.toString();
                }
                throw mismatch(value, canonical);
            case FLOAT:
                if (value instanceof Number number) {
                    return pythonFloat(number.doubleValue());
                }
                throw mismatch(value, canonical);
            case BOOLEAN:
                if (value instanceof Boolean bool) {
                    return bool ? "True" : "False";
                }
                throw mismatch(value, canonical);
            case JSON_ARRAY:
                if (value instanceof Collection<?> || value.getClass().isArray()) {
                    return toJson(value, canonical);
                }
                throw mismatch(value, canonical);
            case JSON_OBJECT:
                if (value instanceof Map<?, ?>) {
                    return toJson(value, canonical);
                }
                throw mismatch(value, canonical);
            case STRING:
                throw mismatch(value, canonical);
            default:
                String serialized = String.valueOf(value);
                LOG.warn(
                        "There are no registered serializers for type \"{}\", so the value will be serialized as string \"{}\"",
                        canonical,
                        serialized);
                return serialized;
        }
    }

    @Override
    public Object deserialize(String text, String typeName) {
        if (text == null) {
            return null;
        }
        String canonical = typeName == null ? STRING : typeName(typeName).orElse(typeName);
        try {
            switch (canonical) {
                case INTEGER:
                    BigInteger integer = new BigInteger(text.trim());
                    if (integer.bitLength() < Integer.SIZE) {
                        return integer.intValueExact();
                    }
                    if (integer.bitLength() < Long.SIZE) {
                        return integer.longValueExact();
                    }
                    return integer;
                case FLOAT:
                    return parseFloat(text);
                case BOOLEAN:
                    return parseBoolean(text);
                case JSON_ARRAY:
                    return JSON.readValue(text, List.class);
                case JSON_OBJECT:
                    return JSON.readValue(text, Map.class);
                default:
                    return text;
            }
        } catch (JsonProcessingException | NumberFormatException | ArithmeticException e) {
            throw new ValueSerializationException(
                    "Failed to deserialize \"" + text + "\" as type \"" + canonical + "\": " + e.getMessage(),
                    e,
                    canonical);
        }
    }

    private static String inferTypeName(Object value) {
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (isIntegral(value)) {
            return INTEGER;
        }
        if (value instanceof Number) {
            return FLOAT;
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return JSON_ARRAY;
        }
        if (value instanceof Map<?, ?>) {
            return JSON_OBJECT;
        }
        return value.getClass().getSimpleName();
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    /** Formats a double the way Python's {@code repr(float)} does. */
    static String pythonFloat(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        BigDecimal decimal = shortestDecimal(value);
        double magnitude = Math.abs(value);
        if (value == 0 || (magnitude >= 1e-4 && magnitude < 1e16)) {
            String plain = decimal.toPlainString();
            if (value == 0) {
                plain = 1 / value < 0 ? "-0" : "0";
            }
            return plain.indexOf('.') >= 0 ? plain : plain + ".0";
        }
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        String sign = value < 0 ? "-" : "";
        return sign + mantissa + "e" + (exponent < 0 ? "-" : "+") + String.format("%02d", Math.abs(exponent));
    }

    /** Fewest significant digits that read back as the same double, as Python's repr picks them. */
    private static BigDecimal shortestDecimal(double value) {
        BigDecimal exact = new BigDecimal(value);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == value) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    /** Accepts the {@code nan}, {@code inf} and {@code infinity} spellings Python's float() reads. */
    private static double parseFloat(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        boolean negative = normalized.startsWith("-");
        String unsigned = normalized.startsWith("-") || normalized.startsWith("+") ? normalized.substring(1) : normalized;
        switch (unsigned) {
            case "nan":
                return Double.NaN;
            case "inf":
            case "infinity":
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            default:
                return Double.parseDouble(normalized);
        }
    }

    private static boolean parseBoolean(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "y", "yes", "t", "true", "on", "1" -> true;
            case "n", "no", "f", "false", "off", "0" -> false;
            default -> throw new NumberFormatException("Invalid boolean value: '" + text + "'");
        };
    }

    private static String toJson(Object value, String typeName) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValueSerializationException(
                    "Failed to serialize the value \"" + value + "\" to type \"" + typeName + "\": " + e.getMessage(),
                    e,
                    typeName);
        }
    }

    private static ValueSerializationException mismatch(Object value, String typeName) {
        return new ValueSerializationException(
                "Failed to serialize the value \"" + value + "\" of type \"" + value.getClass().getSimpleName()
                        + "\" to type \"" + typeName + "\"",
                typeName);
    }
}
