package com.example.mcpinvoke.schema;

import com.example.mcpinvoke.model.ParameterSource;

import java.lang.reflect.Type;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SourceInferencePolicy {

    private static final Pattern ROUTE_VARIABLE = Pattern.compile("\\{\\*?([\\w.-]+)(?::[^}]*)?}");

    public static final SourceInferencePolicy DEFAULT = new SourceInferencePolicy(List.of(
            candidate -> candidate.explicitSource(),
            candidate -> candidate.routeVariables().contains(candidate.name())
                    ? Optional.of(ParameterSource.ROUTE) : Optional.empty(),
            candidate -> isSimpleOrSimpleCollection(candidate.type())
                    ? Optional.of(ParameterSource.QUERY) : Optional.empty(),
            candidate -> Optional.of(ParameterSource.BODY)
    ));

    private final List<Function<Candidate, Optional<ParameterSource>>> rules;

    public SourceInferencePolicy(List<Function<Candidate, Optional<ParameterSource>>> rules) {
        this.rules = List.copyOf(rules);
    }

    public ParameterSource infer(Candidate candidate) {
        for (Function<Candidate, Optional<ParameterSource>> rule : rules) {
            Optional<ParameterSource> source = rule.apply(candidate);
            if (source.isPresent()) {
                return source.get();
            }
        }
        return ParameterSource.BODY;
    }

    public static Set<String> routeVariables(List<String> routeTemplates) {
        LinkedHashSet<String> variables = new LinkedHashSet<>();
        for (String template : routeTemplates) {
            Matcher matcher = ROUTE_VARIABLE.matcher(template);
            while (matcher.find()) {
                variables.add(matcher.group(1));
            }
        }
        return variables;
    }

    private static boolean isSimpleOrSimpleCollection(Type type) {
        Type effective = TypeIntrospector.unwrapOptional(type);
        if (TypeIntrospector.isArrayLike(effective)) {
            return TypeIntrospector.isSimple(TypeIntrospector.rawClass(TypeIntrospector.elementType(effective)));
        }
        Class<?> raw = TypeIntrospector.rawClass(effective);
        return raw == byte[].class || TypeIntrospector.isSimple(raw);
    }

    public record Candidate(String name, Type type, Optional<ParameterSource> explicitSource, Set<String> routeVariables) {
    }
}
