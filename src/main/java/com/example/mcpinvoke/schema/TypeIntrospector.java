package com.example.mcpinvoke.schema;

import com.example.mcpinvoke.annotation.ToolDescription;
import com.example.mcpinvoke.model.JsonType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedField;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.AnnotatedMethod;
import com.fasterxml.jackson.databind.introspect.AnnotatedParameter;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.core.ResolvableType;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public final class TypeIntrospector {

    private static final Set<Class<?>> INTEGRAL_TYPES = Set.of(
            byte.class, short.class, int.class, long.class,
            Byte.class, Short.class, Integer.class, Long.class,
            BigInteger.class, AtomicInteger.class, AtomicLong.class
    );

    private static final Set<Class<?>> SIMPLE_TYPES = Set.of(
            String.class, Character.class, Boolean.class, UUID.class, URI.class, URL.class,
            Date.class, Duration.class, Class.class
    );

    private TypeIntrospector() {
    }

    public static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> clazz) {
            return clazz;
        }
        if (type instanceof ParameterizedType parameterized) {
            return rawClass(parameterized.getRawType());
        }
        if (type instanceof GenericArrayType arrayType) {
            return Array.newInstance(rawClass(arrayType.getGenericComponentType()), 0).getClass();
        }
        if (type instanceof WildcardType wildcard) {
            return rawClass(wildcard.getUpperBounds()[0]);
        }
        if (type instanceof TypeVariable<?> variable) {
            Type[] bounds = variable.getBounds();
            return bounds.length == 0 ? Object.class : rawClass(bounds[0]);
        }
        return Object.class;
    }

    public static boolean isOptional(Type type) {
        return rawClass(type) == Optional.class;
    }

    public static Type unwrapOptional(Type type) {
        if (!isOptional(type)) {
            return type;
        }
        ResolvableType generic = ResolvableType.forType(type).getGeneric(0);
        return generic == ResolvableType.NONE ? Object.class : generic.getType();
    }

    public static boolean isSimple(Class<?> type) {
        return type.isPrimitive()
                || type.isEnum()
                || SIMPLE_TYPES.contains(type)
                || CharSequence.class.isAssignableFrom(type)
                || Number.class.isAssignableFrom(type)
                || Temporal.class.isAssignableFrom(type);
    }

    public static boolean isArrayLike(Type type) {
        Class<?> raw = rawClass(type);
        if (raw == byte[].class) {
            return false;
        }
        return raw.isArray() || (Iterable.class.isAssignableFrom(raw) && !JsonNode.class.isAssignableFrom(raw));
    }

    public static boolean isFreeFormObject(Class<?> type) {
        return type == Object.class || Map.class.isAssignableFrom(type) || JsonNode.class.isAssignableFrom(type);
    }

    public static Type elementType(Type type) {
        if (type instanceof GenericArrayType arrayType) {
            return arrayType.getGenericComponentType();
        }
        Class<?> raw = rawClass(type);
        if (raw.isArray()) {
            return raw.getComponentType();
        }
        ResolvableType element = ResolvableType.forType(type).as(Iterable.class).getGeneric(0);
        if (element == ResolvableType.NONE || element.resolve() == null) {
            return Object.class;
        }
        return element.getType() instanceof TypeVariable<?> ? element.resolve() : element.getType();
    }

    public static JsonType scalarType(Class<?> type) {
        if (type == boolean.class || type == Boolean.class) {
            return JsonType.BOOLEAN;
        }
        if (INTEGRAL_TYPES.contains(type)) {
            return JsonType.INTEGER;
        }
        if (type == float.class || type == double.class || Number.class.isAssignableFrom(type)) {
            return JsonType.NUMBER;
        }
        return JsonType.STRING;
    }

    public static String format(Class<?> type) {
        if (type == LocalDateTime.class || type == OffsetDateTime.class || type == ZonedDateTime.class
                || type == Instant.class || type == Date.class) {
            return "date-time";
        }
        if (type == LocalDate.class) {
            return "date";
        }
        if (type == LocalTime.class) {
            return "time";
        }
        if (type == UUID.class) {
            return "uuid";
        }
        if (type == URI.class || type == URL.class) {
            return "uri";
        }
        if (type == Duration.class) {
            return "duration";
        }
        return null;
    }

    /**
     * Properties a complex type accepts when deserialized by {@code mapper}, in Jackson's order
     * (base class members first). Names follow the mapper's naming strategy and
     * {@code @JsonProperty}; accessors that cannot be written to are left out.
     */
    public static List<PropertyDescriptor> properties(ObjectMapper mapper, Class<?> type) {
        JavaType javaType = mapper.getTypeFactory().constructType(type);
        BeanDescription bean = mapper.getDeserializationConfig().introspect(javaType);
        List<PropertyDescriptor> properties = new ArrayList<>();
        for (BeanPropertyDefinition property : bean.findProperties()) {
            if (!property.couldDeserialize()) {
                continue;
            }
            List<AnnotatedMember> members = accessors(property);
            properties.add(new PropertyDescriptor(
                    property.getName(),
                    memberType(property.getMutator(), type),
                    property.isRequired() || members.stream().anyMatch(TypeIntrospector::isRequired),
                    members.stream()
                            .map(member -> member.getAnnotation(ToolDescription.class))
                            .filter(description -> description != null && !description.value().isBlank())
                            .map(ToolDescription::value)
                            .findFirst()
                            .orElse(null)
            ));
        }
        return properties;
    }

    public static EnumLiterals enumLiterals(Class<?> enumType) {
        Object[] constants = enumType.getEnumConstants();
        Method jsonValue = findJsonValueMethod(enumType);
        List<Object> values = new ArrayList<>(constants.length);
        List<String> names = new ArrayList<>(constants.length);
        for (Object constant : constants) {
            String name = ((Enum<?>) constant).name();
            names.add(name);
            if (jsonValue != null) {
                values.add(ReflectionUtils.invokeMethod(jsonValue, constant));
            } else {
                values.add(constantLiteral(enumType, name));
            }
        }
        JsonType type = JsonType.STRING;
        if (jsonValue != null) {
            JsonType valueType = scalarType(jsonValue.getReturnType());
            if (valueType == JsonType.INTEGER || valueType == JsonType.NUMBER) {
                type = valueType;
            }
        }
        return new EnumLiterals(type, values, names);
    }

    public static String simpleName(Type type) {
        Class<?> raw = rawClass(type);
        if (type instanceof ParameterizedType || type instanceof GenericArrayType) {
            return type.getTypeName().replaceAll("[\\w$]+\\.", "");
        }
        return raw.getSimpleName();
    }

    private static List<AnnotatedMember> accessors(BeanPropertyDefinition property) {
        List<AnnotatedMember> members = new ArrayList<>(4);
        for (AnnotatedMember member : new AnnotatedMember[]{
                property.getField(), property.getGetter(), property.getSetter(), property.getConstructorParameter()}) {
            if (member != null) {
                members.add(member);
            }
        }
        return members;
    }

    private static Type memberType(AnnotatedMember member, Class<?> owner) {
        ResolvableType resolved;
        if (member instanceof AnnotatedField field) {
            resolved = ResolvableType.forField(field.getAnnotated(), owner);
        } else if (member instanceof AnnotatedMethod method) {
            Method accessor = method.getAnnotated();
            resolved = accessor.getParameterCount() == 0
                    ? ResolvableType.forMethodReturnType(accessor, owner)
                    : ResolvableType.forMethodParameter(accessor, 0, owner);
        } else if (member instanceof AnnotatedParameter parameter) {
            AnnotatedElement declaring = parameter.getOwner().getAnnotated();
            if (declaring instanceof Constructor<?> constructor) {
                resolved = ResolvableType.forConstructorParameter(constructor, parameter.getIndex(), owner);
            } else if (declaring instanceof Method factory) {
                resolved = ResolvableType.forMethodParameter(factory, parameter.getIndex(), owner);
            } else {
                return parameter.getRawType();
            }
        } else {
            return member == null ? Object.class : member.getRawType();
        }
        if (resolved.getType() instanceof TypeVariable<?>) {
            Class<?> clazz = resolved.resolve();
            return clazz == null ? Object.class : clazz;
        }
        return resolved.getType();
    }

    private static boolean isRequired(AnnotatedMember member) {
        return member.hasAnnotation(NotNull.class)
                || member.hasAnnotation(NotBlank.class)
                || member.hasAnnotation(NotEmpty.class);
    }

    private static Method findJsonValueMethod(Class<?> enumType) {
        for (Method method : enumType.getDeclaredMethods()) {
            JsonValue jsonValue = method.getAnnotation(JsonValue.class);
            if (jsonValue != null && jsonValue.value() && method.getParameterCount() == 0) {
                ReflectionUtils.makeAccessible(method);
                return method;
            }
        }
        return null;
    }

    private static Object constantLiteral(Class<?> enumType, String constantName) {
        try {
            JsonProperty property = enumType.getField(constantName).getAnnotation(JsonProperty.class);
            if (property != null && !property.value().isEmpty()) {
                return property.value();
            }
        } catch (NoSuchFieldException ex) {
            throw new IllegalStateException("Enum constant " + constantName + " not found on " + enumType.getName(), ex);
        }
        return constantName;
    }

    public record PropertyDescriptor(String name, Type type, boolean required, String description) {
    }

    public record EnumLiterals(JsonType type, List<Object> values, List<String> names) {
    }
}
