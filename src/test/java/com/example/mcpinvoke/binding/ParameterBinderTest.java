package com.example.mcpinvoke.binding;

import com.example.mcpinvoke.model.RegisteredTool;
import com.example.mcpinvoke.support.ToolFixtures;
import com.example.mcpinvoke.support.ToolFixtures.Account;
import com.example.mcpinvoke.support.ToolFixtures.Code;
import com.example.mcpinvoke.support.ToolFixtures.Derived;
import com.example.mcpinvoke.support.ToolFixtures.Labeled;
import com.example.mcpinvoke.support.ToolFixtures.Status;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;

import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

import static com.example.mcpinvoke.support.ToolFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;

class ParameterBinderTest {

    private final ParameterBinder binder = new ParameterBinder(ToolFixtures.OBJECT_MAPPER);

    @Test
    void bindsArgumentsInMethodOrderAndCoercesIntegralStrings() {
        BindingResult result = binder.bind(ToolFixtures.tool("add"), json("{\"b\": 5, \"a\": \"10\"}"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.arguments()).containsExactly(10, 5);
    }

    @Test
    void missingRequiredArgumentIsReported() {
        BindingResult result = binder.bind(ToolFixtures.tool("add"), json("{\"a\": 1}"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error().reason()).isEqualTo(BindingError.Reason.MISSING_REQUIRED);
        assertThat(result.error().path()).isEqualTo("b");
        assertThat(result.error().message()).contains("'b'");
    }

    @Test
    void explicitNullIsTreatedAsAbsent() {
        BindingResult result = binder.bind(ToolFixtures.tool("add"), json("{\"a\": 1, \"b\": null}"));

        assertThat(result.error().reason()).isEqualTo(BindingError.Reason.MISSING_REQUIRED);
    }

    @Test
    void nonNumericValueIsATypeMismatch() {
        BindingResult result = binder.bind(ToolFixtures.tool("add"), json("{\"a\": \"ten\", \"b\": 1}"));

        assertThat(result.error().reason()).isEqualTo(BindingError.Reason.TYPE_MISMATCH);
        assertThat(result.error().path()).isEqualTo("a");
        assertThat(result.error().expectedType()).isEqualTo("integer");
    }

    @Test
    void infrastructureSlotsAndOptionalParametersAreLeftEmpty() {
        RegisteredTool tool = ToolFixtures.tool("lookup", "/items/{id}");

        BindingResult result = binder.bind(tool, json("{\"id\": \"i-1\"}"));

        assertThat(result.arguments()).containsExactly("i-1", null, null, null);
    }

    @Test
    void declaredDefaultsAreAppliedWhenAbsent() {
        BindingResult result = binder.bind(ToolFixtures.tool("defaults"), json("{}"));

        assertThat(result.arguments()).containsExactly(25, RoundingMode.HALF_UP);
    }

    @Test
    void blankDefaultBindsNaturalZeroForNonStringParameters() {
        BindingResult result = binder.bind(ToolFixtures.tool("blankDefaults"), json("{}"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.arguments()).containsExactly(null, "");
    }

    @Test
    void booleanIsAccessorBindsUnderItsJacksonName() {
        BindingResult result = binder.bind(ToolFixtures.tool("account"),
                json("{\"account\": {\"fullName\": \"Ada\", \"active\": true}}"));

        assertThat(result.isSuccess()).isTrue();
        Account account = (Account) result.arguments()[0];
        assertThat(account.getFullName()).isEqualTo("Ada");
        assertThat(account.isActive()).isTrue();
    }

    @Test
    void requiredPropertiesAreCheckedUnderTheMapperNamingStrategy() {
        ObjectMapper snakeCase = JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .build();
        ParameterBinder snakeCaseBinder = new ParameterBinder(snakeCase);
        RegisteredTool tool = ToolFixtures.tool(snakeCase, "account");

        BindingResult missing = snakeCaseBinder.bind(tool, json("{\"account\": {\"fullName\": \"Ada\"}}"));
        assertThat(missing.isSuccess()).isFalse();
        assertThat(missing.error().reason()).isEqualTo(BindingError.Reason.MISSING_REQUIRED);
        assertThat(missing.error().path()).isEqualTo("account.full_name");

        BindingResult bound = snakeCaseBinder.bind(tool, json("{\"account\": {\"full_name\": \"Ada\", \"active\": true}}"));
        Account account = (Account) bound.arguments()[0];
        assertThat(account.getFullName()).isEqualTo("Ada");
        assertThat(account.isActive()).isTrue();
    }

    @Test
    void enumsAcceptNamesLiteralsOrdinalsAndCodes() {
        RegisteredTool tool = ToolFixtures.tool("enums");

        BindingResult byName = binder.bind(tool, json("{\"status\": \"inactive\", \"code\": \"B\", \"labeled\": \"FIRST\"}"));
        assertThat(byName.arguments()).containsExactly(Status.INACTIVE, Code.B, Labeled.FIRST);

        BindingResult byValue = binder.bind(tool, json("{\"status\": 0, \"code\": 10, \"labeled\": \"first\"}"));
        assertThat(byValue.arguments()).containsExactly(Status.ACTIVE, Code.A, Labeled.FIRST);
    }

    @Test
    void unknownEnumValueIsAViolation() {
        BindingResult result = binder.bind(ToolFixtures.tool("enums"),
                json("{\"status\": \"ARCHIVED\", \"code\": 10, \"labeled\": \"first\"}"));

        assertThat(result.error().reason()).isEqualTo(BindingError.Reason.ENUM_VIOLATION);
        assertThat(result.error().path()).isEqualTo("status");
    }

    @Test
    void nestedObjectsAndArraysAreBoundToDeclaredTypes() {
        BindingResult result = binder.bind(ToolFixtures.tool("inferred", "/things/{id}"), json("""
                {"id": "t-1", "limit": 3, "payload": {"id": "p-1", "display_name": "Payload", "unknown": true},
                 "tags": ["a", "b"]}
                """));

        assertThat(result.isSuccess()).isTrue();
        Object[] arguments = result.arguments();
        assertThat(arguments[1]).isEqualTo(3);
        assertThat(arguments[2]).isInstanceOf(Derived.class);
        assertThat(((Derived) arguments[2]).getDisplayName()).isEqualTo("Payload");
        assertThat(arguments[3]).isEqualTo(Optional.empty());
        assertThat(arguments[4]).isEqualTo(List.of("a", "b"));
    }

    @Test
    void missingNestedPropertyIsReportedWithDottedPath() {
        BindingResult result = binder.bind(ToolFixtures.tool("inferred", "/things/{id}"),
                json("{\"id\": \"t-1\", \"limit\": 3, \"payload\": {\"display_name\": \"x\"}, \"tags\": []}"));

        assertThat(result.error().reason()).isEqualTo(BindingError.Reason.MISSING_REQUIRED);
        assertThat(result.error().path()).isEqualTo("payload.id");
    }

    @Test
    void arrayElementsAreValidatedWithIndexedPath() {
        BindingResult result = binder.bind(ToolFixtures.tool("inferred", "/things/{id}"),
                json("{\"id\": \"t-1\", \"limit\": 3, \"payload\": {\"id\": \"p\"}, \"tags\": [\"a\", 5]}"));

        assertThat(result.error().reason()).isEqualTo(BindingError.Reason.TYPE_MISMATCH);
        assertThat(result.error().path()).isEqualTo("tags[1]");
    }

    @Test
    void booleanAndNumberStringsAreCoerced() {
        BindingResult result = binder.bind(ToolFixtures.tool("freeForm"), json("""
                {"extra": {"k": 1}, "raw": {"any": [1, 2]}, "blob": "AQI=", "day": "2026-02-11",
                 "ref": "3f1c1a62-64f5-4f4e-9a51-7d2b0f3e8c11", "flag": "true", "ratio": "0.5"}
                """));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.arguments()[5]).isEqualTo(true);
        assertThat(result.arguments()[6]).isEqualTo(0.5d);
        assertThat((byte[]) result.arguments()[2]).containsExactly(1, 2);
    }
}
