package com.example.mcpinvoke.binding;

import com.example.mcpinvoke.model.JsonType;
import com.example.mcpinvoke.model.ParameterInfo;
import com.example.mcpinvoke.model.ParameterSlot;
import com.example.mcpinvoke.model.RegisteredTool;
import com.example.mcpinvoke.schema.TypeIntrospector;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ParameterBinder {

    private static final Logger log = LoggerFactory.getLogger(ParameterBinder.class);

    private final ObjectMapper objectMapper;

    public ParameterBinder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public BindingResult bind(RegisteredTool tool, JsonNode arguments) {
        Object[] values = new Object[tool.slots().size()];
        for (ParameterSlot slot : tool.slots()) {
            if (slot.isInfrastructure()) {
                continue;
            }
            ParameterInfo schema = slot.schema();
            JsonNode raw = arguments == null ? null : arguments.get(schema.name());

            if (isAbsent(raw)) {
                if (schema.required()) {
                    return BindingResult.failure(BindingError.missingRequired(schema.name(), schema.type().wireName()));
                }
                if (schema.defaultValue() == null) {
                    values[slot.position()] = naturalZero(slot.javaType());
                    continue;
                }
                raw = objectMapper.valueToTree(schema.defaultValue());
            }

            List<BindingError> errors = new ArrayList<>(1);
            JsonNode normalized = normalize(raw, schema, schema.name(), errors);
            if (!errors.isEmpty()) {
                return BindingResult.failure(errors.get(0));
            }

            JavaType javaType = objectMapper.getTypeFactory().constructType(slot.javaType());
            try {
                values[slot.position()] = objectMapper.convertValue(normalized, javaType);
            } catch (IllegalArgumentException ex) {
                log.debug("Conversion of parameter {} to {} failed: {}", schema.name(), javaType, ex.getMessage());
                return BindingResult.failure(BindingError.typeMismatch(schema.name(), schema.type().wireName(), raw));
            }
        }
        return BindingResult.success(values);
    }

    private JsonNode normalize(JsonNode value, ParameterInfo schema, String path, List<BindingError> errors) {
        if (schema.isEnum()) {
            return normalizeEnum(value, schema, path, errors);
        }
        switch (schema.type()) {
            case STRING:
                if (!value.isTextual()) {
                    errors.add(BindingError.typeMismatch(path, schema.type().wireName(), value));
                    return null;
                }
                return value;
            case INTEGER:
                return normalizeInteger(value, schema, path, errors);
            case NUMBER:
                return normalizeNumber(value, schema, path, errors);
            case BOOLEAN:
                if (value.isBoolean()) {
                    return value;
                }
                if (value.isTextual() && ("true".equalsIgnoreCase(value.asText()) || "false".equalsIgnoreCase(value.asText()))) {
                    return BooleanNode.valueOf(Boolean.parseBoolean(value.asText()));
                }
                errors.add(BindingError.typeMismatch(path, schema.type().wireName(), value));
                return null;
            case OBJECT:
                return normalizeObject(value, schema, path, errors);
            case ARRAY:
                return normalizeArray(value, schema, path, errors);
            default:
                return value;
        }
    }

    private JsonNode normalizeInteger(JsonNode value, ParameterInfo schema, String path, List<BindingError> errors) {
        if (value.isIntegralNumber()) {
            return value;
        }
        if (value.isNumber() && value.canConvertToExactIntegral()) {
            return integralNode(value.decimalValue().toBigIntegerExact());
        }
        if (value.isTextual()) {
            try {
                return integralNode(new BigInteger(value.asText().trim()));
            } catch (NumberFormatException ex) {
                log.trace("'{}' is not an integer", value.asText());
            }
        }
        errors.add(BindingError.typeMismatch(path, schema.type().wireName(), value));
        return null;
    }

    private JsonNode normalizeNumber(JsonNode value, ParameterInfo schema, String path, List<BindingError> errors) {
        if (value.isNumber()) {
            return value;
        }
        if (value.isTextual()) {
            try {
                return DecimalNode.valueOf(new BigDecimal(value.asText().trim()));
            } catch (NumberFormatException ex) {
                log.trace("'{}' is not a number", value.asText());
            }
        }
        errors.add(BindingError.typeMismatch(path, schema.type().wireName(), value));
        return null;
    }

    private JsonNode normalizeObject(JsonNode value, ParameterInfo schema, String path, List<BindingError> errors) {
        if (!value.isObject()) {
            errors.add(BindingError.typeMismatch(path, schema.type().wireName(), value));
            return null;
        }
        ObjectNode copy = ((ObjectNode) value).deepCopy();
        if (schema.properties() == null || schema.properties().isEmpty()) {
            return copy;
        }
        for (String requiredProperty : schema.requiredProperties()) {
            if (isAbsent(copy.get(requiredProperty))) {
                ParameterInfo property = schema.properties().get(requiredProperty);
                String expected = property == null ? JsonType.OBJECT.wireName() : property.type().wireName();
                errors.add(BindingError.missingRequired(path + "." + requiredProperty, expected));
                return null;
            }
        }
        for (Map.Entry<String, ParameterInfo> property : schema.properties().entrySet()) {
            JsonNode child = copy.get(property.getKey());
            if (isAbsent(child)) {
                continue;
            }
            JsonNode normalized = normalize(child, property.getValue(), path + "." + property.getKey(), errors);
            if (!errors.isEmpty()) {
                return null;
            }
            copy.set(property.getKey(), normalized);
        }
        return copy;
    }

    private JsonNode normalizeArray(JsonNode value, ParameterInfo schema, String path, List<BindingError> errors) {
        if (!value.isArray()) {
            errors.add(BindingError.typeMismatch(path, schema.type().wireName(), value));
            return null;
        }
        ArrayNode result = objectMapper.createArrayNode();
        for (int i = 0; i < value.size(); i++) {
            JsonNode element = value.get(i);
            if (element.isNull()) {
                result.add(element);
                continue;
            }
            JsonNode normalized = normalize(element, schema.items(), path + "[" + i + "]", errors);
            if (!errors.isEmpty()) {
                return null;
            }
            result.add(normalized);
        }
        return result;
    }

    private JsonNode normalizeEnum(JsonNode value, ParameterInfo schema, String path, List<BindingError> errors) {
        List<Object> literals = schema.enumValues();
        List<String> names = schema.enumNames() == null ? List.of() : schema.enumNames();
        boolean numericLiterals = schema.type() == JsonType.INTEGER || schema.type() == JsonType.NUMBER;

        if (value.isTextual()) {
            String text = value.asText().trim();
            for (int i = 0; i < literals.size(); i++) {
                boolean nameMatch = i < names.size() && names.get(i).equalsIgnoreCase(text);
                if (nameMatch || String.valueOf(literals.get(i)).equalsIgnoreCase(text)) {
                    return objectMapper.valueToTree(literals.get(i));
                }
            }
        }

        Optional<BigInteger> number = integralValue(value);
        if (number.isPresent()) {
            BigInteger n = number.get();
            if (numericLiterals) {
                for (Object literal : literals) {
                    if (literal instanceof Number code && new BigDecimal(code.toString()).compareTo(new BigDecimal(n)) == 0) {
                        return objectMapper.valueToTree(literal);
                    }
                }
            } else if (n.signum() >= 0 && n.compareTo(BigInteger.valueOf(literals.size())) < 0) {
                return objectMapper.valueToTree(literals.get(n.intValue()));
            }
        }

        errors.add(BindingError.enumViolation(path, schema.type().wireName(), value, literals));
        return null;
    }

    private static Optional<BigInteger> integralValue(JsonNode value) {
        if (value.isNumber() && value.canConvertToExactIntegral()) {
            return Optional.of(value.decimalValue().toBigIntegerExact());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(new BigInteger(value.asText().trim()));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static JsonNode integralNode(BigInteger value) {
        return value.bitLength() < 64 ? LongNode.valueOf(value.longValue()) : BigIntegerNode.valueOf(value);
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    static Object naturalZero(Type type) {
        Class<?> raw = TypeIntrospector.rawClass(type);
        if (raw == Optional.class) {
            return Optional.empty();
        }
        if (!raw.isPrimitive()) {
            return null;
        }
        if (raw == boolean.class) {
            return false;
        }
        if (raw == char.class) {
            return '\0';
        }
        if (raw == byte.class) {
            return (byte) 0;
        }
        if (raw == short.class) {
            return (short) 0;
        }
        if (raw == int.class) {
            return 0;
        }
        if (raw == long.class) {
            return 0L;
        }
        if (raw == float.class) {
            return 0f;
        }
        return 0d;
    }
}
