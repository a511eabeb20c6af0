package com.example.mcpinvoke.schema;

import com.example.mcpinvoke.model.JsonType;
import com.example.mcpinvoke.model.ParameterInfo;
import com.example.mcpinvoke.model.ParameterSource;
import com.example.mcpinvoke.model.RegisteredTool;
import com.example.mcpinvoke.support.ToolFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaGeneratorTest {

    @Test
    void infrastructureParametersAreSlottedButNotExposed() {
        RegisteredTool tool = ToolFixtures.tool("lookup", "/items/{id}");

        assertThat(tool.definition().inputSchema()).extracting(ParameterInfo::name).containsExactly("id", "filter");
        assertThat(tool.slots()).hasSize(4);
        assertThat(tool.slots().get(2).isInfrastructure()).isTrue();
        assertThat(tool.slots().get(3).isInfrastructure()).isTrue();

        ParameterInfo id = parameter(tool, "id");
        assertThat(id.source()).isEqualTo(ParameterSource.ROUTE);
        assertThat(id.required()).isTrue();
        ParameterInfo filter = parameter(tool, "filter");
        assertThat(filter.source()).isEqualTo(ParameterSource.QUERY);
        assertThat(filter.required()).isFalse();
    }

    @Test
    void sourcesAreInferredForUnannotatedParameters() {
        RegisteredTool tool = ToolFixtures.tool("inferred", "/things/{id}");

        assertThat(parameter(tool, "id").source()).isEqualTo(ParameterSource.ROUTE);
        assertThat(parameter(tool, "limit").source()).isEqualTo(ParameterSource.QUERY);
        assertThat(parameter(tool, "limit").type()).isEqualTo(JsonType.INTEGER);
        assertThat(parameter(tool, "limit").required()).isTrue();
        assertThat(parameter(tool, "payload").source()).isEqualTo(ParameterSource.BODY);
        assertThat(parameter(tool, "note").required()).isFalse();
        assertThat(parameter(tool, "note").type()).isEqualTo(JsonType.STRING);

        ParameterInfo tags = parameter(tool, "tags");
        assertThat(tags.source()).isEqualTo(ParameterSource.QUERY);
        assertThat(tags.type()).isEqualTo(JsonType.ARRAY);
        assertThat(tags.items().type()).isEqualTo(JsonType.STRING);
    }

    @Test
    void complexTypesExposeInheritedPropertiesBaseFirst() {
        ParameterInfo payload = parameter(ToolFixtures.tool("inferred", "/things/{id}"), "payload");

        assertThat(payload.type()).isEqualTo(JsonType.OBJECT);
        assertThat(payload.properties()).containsOnlyKeys("id", "display_name");
        assertThat(payload.properties().keySet()).containsExactly("id", "display_name");
        assertThat(payload.requiredProperties()).containsExactly("id");
        assertThat(payload.properties().get("display_name").description())
                .isEqualTo("Property display_name of type String");
    }

    @Test
    void selfReferencingTypeTerminatesWithLeafObject() {
        ParameterInfo node = parameter(ToolFixtures.tool("recursive"), "node");

        assertThat(node.properties()).containsOnlyKeys("label", "next", "children");
        ParameterInfo next = node.properties().get("next");
        assertThat(next.type()).isEqualTo(JsonType.OBJECT);
        assertThat(next.properties()).isNull();
        ParameterInfo children = node.properties().get("children");
        assertThat(children.type()).isEqualTo(JsonType.ARRAY);
        assertThat(children.items().type()).isEqualTo(JsonType.OBJECT);
        assertThat(children.items().properties()).isNull();
    }

    @Test
    void mutuallyReferencingTypesTerminateAndShareCachedExpansions() {
        RegisteredTool tool = ToolFixtures.tool("mutual");

        ParameterInfo team = parameter(tool, "team");
        assertThat(team.properties()).containsOnlyKeys("lead", "address");
        ParameterInfo lead = team.properties().get("lead");
        assertThat(lead.properties()).containsOnlyKeys("team", "address");
        ParameterInfo backReference = lead.properties().get("team");
        assertThat(backReference.type()).isEqualTo(JsonType.OBJECT);
        assertThat(backReference.properties()).isNull();
        assertThat(backReference.description()).contains("circular reference to Team");

        ParameterInfo person = parameter(tool, "person");
        ParameterInfo personTeam = person.properties().get("team");
        assertThat(personTeam.properties()).containsOnlyKeys("lead", "address");
        assertThat(personTeam.properties().get("lead").properties()).isNull();

        ParameterInfo teamAddress = team.properties().get("address");
        ParameterInfo personAddress = person.properties().get("address");
        assertThat(teamAddress.name()).isEqualTo("address");
        assertThat(teamAddress.description()).isEqualTo("Property address of type Address");
        assertThat(teamAddress.properties()).containsOnlyKeys("city");
        assertThat(personAddress).isEqualTo(teamAddress);
        assertThat(personTeam.properties().get("address")).isEqualTo(teamAddress);
    }

    @Test
    void propertyNamesFollowJacksonAccessors() {
        ParameterInfo account = parameter(ToolFixtures.tool("account"), "account");

        assertThat(account.properties().keySet()).containsExactly("fullName", "active");
        assertThat(account.properties().get("active").type()).isEqualTo(JsonType.BOOLEAN);
        assertThat(account.requiredProperties()).containsExactly("fullName");
    }

    @Test
    void propertyNamesFollowTheMapperNamingStrategy() {
        ObjectMapper snakeCase = JsonMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .build();

        ParameterInfo account = parameter(ToolFixtures.tool(snakeCase, "account"), "account");

        assertThat(account.properties().keySet()).containsExactly("full_name", "active");
        assertThat(account.requiredProperties()).containsExactly("full_name");
    }

    @Test
    void enumsListTheirWireLiterals() {
        RegisteredTool tool = ToolFixtures.tool("enums");

        ParameterInfo status = parameter(tool, "status");
        assertThat(status.type()).isEqualTo(JsonType.STRING);
        assertThat(status.enumValues()).containsExactly("ACTIVE", "INACTIVE");
        assertThat(status.enumNames()).containsExactly("ACTIVE", "INACTIVE");

        ParameterInfo code = parameter(tool, "code");
        assertThat(code.type()).isEqualTo(JsonType.INTEGER);
        assertThat(code.enumValues()).containsExactly(10, 20);
        assertThat(code.enumNames()).containsExactly("A", "B");

        assertThat(parameter(tool, "labeled").enumValues()).containsExactly("first", "SECOND");
    }

    @Test
    void declaredDefaultsMakeParametersOptional() {
        RegisteredTool tool = ToolFixtures.tool("defaults");

        ParameterInfo size = parameter(tool, "size");
        assertThat(size.required()).isFalse();
        assertThat(size.defaultValue()).isEqualTo(25L);
        ParameterInfo mode = parameter(tool, "mode");
        assertThat(mode.required()).isFalse();
        assertThat(mode.defaultValue()).isEqualTo("HALF_UP");
        assertThat(mode.enumValues()).contains("HALF_UP", "HALF_EVEN");
    }

    @Test
    void blankDefaultIsDroppedForNonStringParameters() {
        RegisteredTool tool = ToolFixtures.tool("blankDefaults");

        ParameterInfo page = parameter(tool, "page");
        assertThat(page.required()).isFalse();
        assertThat(page.defaultValue()).isNull();
        ParameterInfo prefix = parameter(tool, "prefix");
        assertThat(prefix.required()).isFalse();
        assertThat(prefix.defaultValue()).isEqualTo("");
    }

    @Test
    void scalarFormatsAndFreeFormObjects() {
        RegisteredTool tool = ToolFixtures.tool("freeForm");

        assertThat(parameter(tool, "extra").type()).isEqualTo(JsonType.OBJECT);
        assertThat(parameter(tool, "extra").properties()).isEmpty();
        assertThat(parameter(tool, "raw").type()).isEqualTo(JsonType.OBJECT);
        assertThat(parameter(tool, "blob").format()).isEqualTo("byte");
        assertThat(parameter(tool, "day").format()).isEqualTo("date");
        assertThat(parameter(tool, "ref").format()).isEqualTo("uuid");
        assertThat(parameter(tool, "flag").type()).isEqualTo(JsonType.BOOLEAN);
        assertThat(parameter(tool, "ratio").type()).isEqualTo(JsonType.NUMBER);
    }

    @Test
    void complexTypesCanBeLeftUnexpanded() {
        SchemaGenerator generator = new SchemaGenerator(new SpringBindingSourceInspector(),
                ToolFixtures.OBJECT_MAPPER, SourceInferencePolicy.DEFAULT, false);

        RegisteredTool tool = generator.generate(ToolFixtures.operation("inferred", "/things/{id}"));

        assertThat(parameter(tool, "payload").type()).isEqualTo(JsonType.OBJECT);
        assertThat(parameter(tool, "payload").properties()).isEmpty();
    }

    @Test
    void writerRendersJsonSchema() {
        Map<String, Object> descriptor = JsonSchemaWriter.toolDescriptor(
                ToolFixtures.tool("inferred", "/things/{id}").definition());

        assertThat(descriptor).containsEntry("name", "Fixture_inferred");
        Map<String, Object> inputSchema = (Map<String, Object>) descriptor.get("inputSchema");
        assertThat(inputSchema).containsEntry("type", "object");
        assertThat(inputSchema).containsEntry("required", List.of("id", "limit", "payload", "tags"));
        Map<String, Object> properties = (Map<String, Object>) inputSchema.get("properties");
        Map<String, Object> payload = (Map<String, Object>) properties.get("payload");
        assertThat(payload).containsEntry("source", "body").containsEntry("required", List.of("id"));
        assertThat(payload).doesNotContainKey("enum");
        Map<String, Object> tags = (Map<String, Object>) properties.get("tags");
        assertThat((Map<String, Object>) tags.get("items")).containsEntry("type", "string");
    }

    private static ParameterInfo parameter(RegisteredTool tool, String name) {
        return tool.definition().inputSchema().stream()
                .filter(parameter -> parameter.name().equals(name))
                .findFirst()
                .orElseThrow();
    }
}
