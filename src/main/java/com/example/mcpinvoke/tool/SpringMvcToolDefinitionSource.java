package com.example.mcpinvoke.tool;

import com.example.mcpinvoke.annotation.McpExclude;
import com.example.mcpinvoke.annotation.ToolDescription;
import com.example.mcpinvoke.model.DiscoveredOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ClassUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class SpringMvcToolDefinitionSource implements ToolDefinitionSource {

    private static final Logger log = LoggerFactory.getLogger(SpringMvcToolDefinitionSource.class);
    private static final String CONTROLLER_SUFFIX = "Controller";

    private final RequestMappingHandlerMapping handlerMapping;
    private final boolean includeControllerName;
    private final Set<String> excludedControllers;

    public SpringMvcToolDefinitionSource(RequestMappingHandlerMapping handlerMapping,
                                         boolean includeControllerName,
                                         Collection<String> excludedControllers) {
        this.handlerMapping = handlerMapping;
        this.includeControllerName = includeControllerName;
        this.excludedControllers = excludedControllers.stream()
                .map(SpringMvcToolDefinitionSource::normalizeControllerName)
                .collect(Collectors.toSet());
    }

    @Override
    public List<DiscoveredOperation> discover() {
        Map<Method, List<String>> routesByMethod = new LinkedHashMap<>();
        Map<Method, Class<?>> typesByMethod = new LinkedHashMap<>();

        for (Map.Entry<RequestMappingInfo, HandlerMethod> entry : handlerMapping.getHandlerMethods().entrySet()) {
            HandlerMethod handlerMethod = entry.getValue();
            Class<?> handlerType = ClassUtils.getUserClass(handlerMethod.getBeanType());
            Method method = handlerMethod.getMethod();
            if (isExcluded(handlerType, method)) {
                continue;
            }
            typesByMethod.putIfAbsent(method, handlerType);
            routesByMethod.computeIfAbsent(method, key -> new ArrayList<>())
                    .addAll(entry.getKey().getPatternValues());
        }

        List<DiscoveredOperation> operations = new ArrayList<>(routesByMethod.size());
        routesByMethod.forEach((method, routes) -> {
            Class<?> handlerType = typesByMethod.get(method);
            String controllerName = controllerName(handlerType);
            operations.add(new DiscoveredOperation(
                    toolName(controllerName, method),
                    description(controllerName, method),
                    handlerType,
                    method,
                    routes.stream().sorted().toList()
            ));
        });

        operations.sort(Comparator
                .comparing((DiscoveredOperation operation) -> operation.handlerType().getName())
                .thenComparing(operation -> operation.method().getName())
                .thenComparing(operation -> operation.method().toGenericString()));
        log.debug("Discovered {} controller action(s)", operations.size());
        return operations;
    }

    private boolean isExcluded(Class<?> handlerType, Method method) {
        if (handlerType.getName().startsWith("org.springframework.")) {
            return true;
        }
        if (AnnotatedElementUtils.hasAnnotation(handlerType, McpExclude.class)
                || AnnotatedElementUtils.hasAnnotation(method, McpExclude.class)) {
            return true;
        }
        return excludedControllers.contains(normalizeControllerName(handlerType.getSimpleName()));
    }

    private String toolName(String controllerName, Method method) {
        return includeControllerName ? controllerName + "_" + method.getName() : method.getName();
    }

    private static String description(String controllerName, Method method) {
        ToolDescription description = AnnotatedElementUtils.findMergedAnnotation(method, ToolDescription.class);
        if (description != null && !description.value().isBlank()) {
            return description.value();
        }
        return "Action method " + method.getName() + " from controller " + controllerName;
    }

    static String controllerName(Class<?> handlerType) {
        String simpleName = handlerType.getSimpleName();
        if (simpleName.endsWith(CONTROLLER_SUFFIX) && simpleName.length() > CONTROLLER_SUFFIX.length()) {
            return simpleName.substring(0, simpleName.length() - CONTROLLER_SUFFIX.length());
        }
        return simpleName;
    }

    private static String normalizeControllerName(String name) {
        String trimmed = name.trim();
        if (trimmed.endsWith(CONTROLLER_SUFFIX) && trimmed.length() > CONTROLLER_SUFFIX.length()) {
            trimmed = trimmed.substring(0, trimmed.length() - CONTROLLER_SUFFIX.length());
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
