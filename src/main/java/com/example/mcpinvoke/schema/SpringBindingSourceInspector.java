package com.example.mcpinvoke.schema;

import com.example.mcpinvoke.annotation.ToolDescription;
import com.example.mcpinvoke.model.ParameterSource;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpSession;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.ui.Model;
import org.springframework.validation.Errors;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ValueConstants;
import org.springframework.web.bind.support.SessionStatus;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Parameter;
import java.security.Principal;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TimeZone;

public class SpringBindingSourceInspector implements BindingSourceInspector {

    private static final List<Class<?>> INFRASTRUCTURE_TYPES = List.of(
            ServletRequest.class,
            ServletResponse.class,
            HttpSession.class,
            WebRequest.class,
            Principal.class,
            Locale.class,
            TimeZone.class,
            ZoneId.class,
            Errors.class,
            Model.class,
            SessionStatus.class,
            UriComponentsBuilder.class,
            InputStream.class,
            OutputStream.class,
            Reader.class,
            Writer.class
    );

    @Override
    public Optional<ParameterSource> explicitSource(Parameter parameter) {
        if (has(parameter, PathVariable.class)) {
            return Optional.of(ParameterSource.ROUTE);
        }
        if (has(parameter, RequestBody.class)) {
            return Optional.of(ParameterSource.BODY);
        }
        if (has(parameter, RequestParam.class)) {
            return Optional.of(ParameterSource.QUERY);
        }
        if (has(parameter, RequestHeader.class) || has(parameter, CookieValue.class)) {
            return Optional.of(ParameterSource.HEADER);
        }
        if (has(parameter, RequestPart.class) || has(parameter, ModelAttribute.class)) {
            return Optional.of(ParameterSource.FORM);
        }
        return Optional.empty();
    }

    @Override
    public String parameterName(Parameter parameter) {
        String declared = null;
        PathVariable pathVariable = find(parameter, PathVariable.class);
        RequestParam requestParam = find(parameter, RequestParam.class);
        RequestHeader requestHeader = find(parameter, RequestHeader.class);
        RequestPart requestPart = find(parameter, RequestPart.class);
        if (pathVariable != null) {
            declared = pathVariable.name();
        } else if (requestParam != null) {
            declared = requestParam.name();
        } else if (requestHeader != null) {
            declared = requestHeader.name();
        } else if (requestPart != null) {
            declared = requestPart.name();
        }
        return declared == null || declared.isEmpty() ? parameter.getName() : declared;
    }

    @Override
    public boolean isInfrastructure(Parameter parameter) {
        Class<?> type = parameter.getType();
        return INFRASTRUCTURE_TYPES.stream().anyMatch(infrastructure -> infrastructure.isAssignableFrom(type));
    }

    @Override
    public Optional<Boolean> explicitRequired(Parameter parameter) {
        PathVariable pathVariable = find(parameter, PathVariable.class);
        if (pathVariable != null) {
            return Optional.of(pathVariable.required());
        }
        RequestParam requestParam = find(parameter, RequestParam.class);
        if (requestParam != null) {
            return Optional.of(requestParam.required() && ValueConstants.DEFAULT_NONE.equals(requestParam.defaultValue()));
        }
        RequestHeader requestHeader = find(parameter, RequestHeader.class);
        if (requestHeader != null) {
            return Optional.of(requestHeader.required() && ValueConstants.DEFAULT_NONE.equals(requestHeader.defaultValue()));
        }
        RequestBody requestBody = find(parameter, RequestBody.class);
        if (requestBody != null) {
            return Optional.of(requestBody.required());
        }
        RequestPart requestPart = find(parameter, RequestPart.class);
        if (requestPart != null) {
            return Optional.of(requestPart.required());
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> defaultValue(Parameter parameter) {
        RequestParam requestParam = find(parameter, RequestParam.class);
        if (requestParam != null && !ValueConstants.DEFAULT_NONE.equals(requestParam.defaultValue())) {
            return Optional.of(requestParam.defaultValue());
        }
        RequestHeader requestHeader = find(parameter, RequestHeader.class);
        if (requestHeader != null && !ValueConstants.DEFAULT_NONE.equals(requestHeader.defaultValue())) {
            return Optional.of(requestHeader.defaultValue());
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> description(AnnotatedElement element) {
        ToolDescription description = element.getAnnotation(ToolDescription.class);
        if (description == null || description.value().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(description.value());
    }

    private static boolean has(Parameter parameter, Class<? extends Annotation> annotationType) {
        return AnnotatedElementUtils.hasAnnotation(parameter, annotationType);
    }

    private static <A extends Annotation> A find(Parameter parameter, Class<A> annotationType) {
        return AnnotatedElementUtils.findMergedAnnotation(parameter, annotationType);
    }
}
