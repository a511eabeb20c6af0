package com.example.mcpinvoke.schema;

import com.example.mcpinvoke.model.ParameterSource;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Parameter;
import java.util.Optional;

/**
 * Reads the host framework's binding metadata for a handler method parameter.
 *
 * <p>The schema generator never looks at framework annotations itself; everything it needs to know
 * about where a value is bound from comes through this interface.
 */
public interface BindingSourceInspector {

    /**
     * Source declared explicitly on the parameter, if any.
     */
    Optional<ParameterSource> explicitSource(Parameter parameter);

    /**
     * Name the parameter is exposed under. Falls back to the compiled parameter name.
     */
    String parameterName(Parameter parameter);

    /**
     * Whether the parameter is supplied by the framework (request, session, locale, ...) and must
     * never appear in a tool schema.
     */
    boolean isInfrastructure(Parameter parameter);

    /**
     * Required-ness stated by the binding metadata, if it states one.
     */
    Optional<Boolean> explicitRequired(Parameter parameter);

    /**
     * Declared default literal, if any.
     */
    Optional<String> defaultValue(Parameter parameter);

    Optional<String> description(AnnotatedElement element);
}
