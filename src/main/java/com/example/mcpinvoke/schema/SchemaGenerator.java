package com.example.mcpinvoke.schema;

import com.example.mcpinvoke.model.DiscoveredOperation;
import com.example.mcpinvoke.model.JsonType;
import com.example.mcpinvoke.model.ParameterInfo;
import com.example.mcpinvoke.model.ParameterSlot;
import com.example.mcpinvoke.model.ParameterSource;
import com.example.mcpinvoke.model.RegisteredTool;
import com.example.mcpinvoke.model.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a discovered operation into a registered tool: one schema node per exposed parameter
 * plus the positional slot layout the binder fills in.
 *
 * <p>Complex types are expanded recursively into their properties. A type that is already being
 * expanded higher up the path is emitted as a leaf object without properties, so self-referencing
 * and mutually-referencing types terminate. Expansions that did not hit such a leaf are cached per
 * type.
 */
public class SchemaGenerator {

    private static final Logger log = LoggerFactory.getLogger(SchemaGenerator.class);

    private final BindingSourceInspector inspector;
    private final ObjectMapper objectMapper;
    private final SourceInferencePolicy sourcePolicy;
    private final boolean exposeComplexTypeProperties;
    private final Map<Class<?>, ParameterInfo> expansionCache = new ConcurrentHashMap<>();

    public SchemaGenerator(BindingSourceInspector inspector, ObjectMapper objectMapper) {
        this(inspector, objectMapper, SourceInferencePolicy.DEFAULT, true);
    }

    public SchemaGenerator(BindingSourceInspector inspector, ObjectMapper objectMapper,
                           SourceInferencePolicy sourcePolicy, boolean exposeComplexTypeProperties) {
        this.inspector = inspector;
        this.objectMapper = objectMapper;
        this.sourcePolicy = sourcePolicy;
        this.exposeComplexTypeProperties = exposeComplexTypeProperties;
    }

    public RegisteredTool generate(DiscoveredOperation operation) {
        Method method = operation.method();
        Set<String> routeVariables = SourceInferencePolicy.routeVariables(operation.routeTemplates());
        Parameter[] parameters = method.getParameters();
        Type[] genericTypes = method.getGenericParameterTypes();

        List<ParameterSlot> slots = new ArrayList<>(parameters.length);
        List<ParameterInfo> inputSchema = new ArrayList<>();
        for (int i = 0; i < parameters.length; i++) {
            Type type = genericTypes.length == parameters.length ? genericTypes[i] : parameters[i].getParameterizedType();
            if (inspector.isInfrastructure(parameters[i])) {
                slots.add(new ParameterSlot(i, type, null));
                continue;
            }
            ParameterInfo info = describeParameter(parameters[i], type, routeVariables);
            slots.add(new ParameterSlot(i, type, info));
            inputSchema.add(info);
        }

        log.debug("Generated schema for tool {} with {} parameter(s)", operation.toolName(), inputSchema.size());
        return new RegisteredTool(
                new ToolDefinition(operation.toolName(), operation.description(), inputSchema),
                operation.handlerType(),
                method,
                slots
        );
    }

    ParameterInfo describeParameter(Parameter parameter, Type type, Set<String> routeVariables) {
        String name = inspector.parameterName(parameter);
        ParameterSource source = sourcePolicy.infer(new SourceInferencePolicy.Candidate(
                name, type, inspector.explicitSource(parameter), routeVariables));

        boolean required;
        if (source == ParameterSource.ROUTE) {
            required = true;
        } else {
            boolean optionalByType = TypeIntrospector.isOptional(type) || parameter.isAnnotationPresent(Nullable.class);
            required = inspector.explicitRequired(parameter).orElse(!optionalByType);
        }

        String description = inspector.description(parameter)
                .orElse("Parameter " + name + " of type " + TypeIntrospector.simpleName(type));

        ParameterInfo described = describeType(name, type, description, new HashSet<>());
        ParameterInfo.Builder builder = described.toBuilder()
                .required(required)
                .source(source);
        inspector.defaultValue(parameter).ifPresent(literal -> {
            builder.required(false);
            // an empty default converts to null for anything but plain strings
            boolean text = described.type() == JsonType.STRING && !described.isEnum();
            if (text || !literal.isBlank()) {
                builder.defaultValue(typedDefault(literal, described.type()));
            }
        });
        return builder.build();
    }

    private ParameterInfo describeType(String name, Type type, String description, Set<Class<?>> expanding) {
        Type effective = TypeIntrospector.unwrapOptional(type);
        Class<?> raw = TypeIntrospector.rawClass(effective);

        if (raw == byte[].class) {
            return ParameterInfo.builder(name, JsonType.STRING).description(description).format("byte").build();
        }
        if (raw.isEnum()) {
            TypeIntrospector.EnumLiterals literals = TypeIntrospector.enumLiterals(raw);
            return ParameterInfo.builder(name, literals.type())
                    .description(description)
                    .enumeration(literals.values(), literals.names())
                    .build();
        }
        if (TypeIntrospector.isSimple(raw)) {
            return ParameterInfo.builder(name, TypeIntrospector.scalarType(raw))
                    .description(description)
                    .format(TypeIntrospector.format(raw))
                    .build();
        }
        if (TypeIntrospector.isArrayLike(effective)) {
            Type elementType = TypeIntrospector.elementType(effective);
            ParameterInfo items = describeType("items", elementType,
                    "Array item of type " + TypeIntrospector.simpleName(elementType), expanding);
            return ParameterInfo.builder(name, JsonType.ARRAY).description(description).items(items).build();
        }
        if (TypeIntrospector.isFreeFormObject(raw) || !exposeComplexTypeProperties) {
            return ParameterInfo.builder(name, JsonType.OBJECT)
                    .description(description)
                    .properties(Map.of())
                    .build();
        }
        return describeObject(name, raw, description, expanding);
    }

    private ParameterInfo describeObject(String name, Class<?> type, String description, Set<Class<?>> expanding) {
        if (expanding.contains(type)) {
            return ParameterInfo.builder(name, JsonType.OBJECT)
                    .description(description + " (circular reference to " + type.getSimpleName() + ")")
                    .build();
        }
        ParameterInfo cached = expansionCache.get(type);
        if (cached != null) {
            return cached.toBuilder().name(name).description(description).build();
        }

        expanding.add(type);
        try {
            Map<String, ParameterInfo> properties = new LinkedHashMap<>();
            List<String> requiredProperties = new ArrayList<>();
            boolean truncated = false;
            for (TypeIntrospector.PropertyDescriptor property : TypeIntrospector.properties(objectMapper, type)) {
                String propertyDescription = property.description() != null
                        ? property.description()
                        : "Property " + property.name() + " of type " + TypeIntrospector.simpleName(property.type());
                ParameterInfo node = describeType(property.name(), property.type(), propertyDescription, expanding);
                truncated |= containsTruncation(node);
                properties.put(property.name(), node);
                if (property.required()) {
                    requiredProperties.add(property.name());
                }
            }
            ParameterInfo info = ParameterInfo.builder(name, JsonType.OBJECT)
                    .description(description)
                    .properties(properties)
                    .requiredProperties(requiredProperties)
                    .build();
            if (!truncated) {
                expansionCache.put(type, info);
            }
            return info;
        } finally {
            expanding.remove(type);
        }
    }

    private static boolean containsTruncation(ParameterInfo node) {
        if (node.type() == JsonType.OBJECT && node.properties() == null) {
            return true;
        }
        if (node.items() != null && containsTruncation(node.items())) {
            return true;
        }
        if (node.properties() != null) {
            for (ParameterInfo child : node.properties().values()) {
                if (containsTruncation(child)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Object typedDefault(String literal, JsonType type) {
        try {
            switch (type) {
                case INTEGER:
                    return Long.parseLong(literal.trim());
                case NUMBER:
                    return Double.parseDouble(literal.trim());
                case BOOLEAN:
                    return Boolean.parseBoolean(literal.trim());
                default:
                    return literal;
            }
        } catch (NumberFormatException ex) {
            return literal;
        }
    }
}
