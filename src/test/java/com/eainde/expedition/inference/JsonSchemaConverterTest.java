package com.eainde.expedition.inference;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaConverterTest {

    @Test
    void toLangChainSchema_shouldParseObjectWithPrimitives() {
        // Arrange
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "hypothesis": { "type": "string", "description": "Most likely cause" },
                    "confidence": { "type": "number" },
                    "rank": { "type": "integer" }
                  },
                  "required": ["hypothesis", "confidence"]
                }""";

        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("finding", json);

        // Assert
        assertThat(result.name()).isEqualTo("finding");
        assertThat(result.rootElement()).isInstanceOf(JsonObjectSchema.class);
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();

        assertThat(root.properties()).containsOnlyKeys("hypothesis", "confidence", "rank");
        JsonSchemaElement hypothesis = root.properties().get("hypothesis");
        assertThat(hypothesis).isInstanceOf(JsonStringSchema.class);
        assertThat(hypothesis.description()).isEqualTo("Most likely cause");
        assertThat(root.properties().get("confidence")).isInstanceOf(JsonNumberSchema.class);
        assertThat(root.required()).containsExactly("hypothesis", "confidence");
    }

    @Test
    void toLangChainSchema_shouldParseArraysOfObjects() {
        // Arrange
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "factors": {
                      "type": "array",
                      "items": {
                        "type": "object",
                        "properties": { "name": { "type": "string" } }
                      }
                    }
                  }
                }""";

        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("factors", json);

        // Assert
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();
        assertThat(root.properties().get("factors")).isInstanceOf(JsonArraySchema.class);
        JsonArraySchema factors = (JsonArraySchema) root.properties().get("factors");
        assertThat(factors.items()).isInstanceOf(JsonObjectSchema.class);
        assertThat(((JsonObjectSchema) factors.items()).properties()).containsKey("name");
    }

    @Test
    void toLangChainSchema_shouldParseEnums() {
        // Arrange
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "family": { "type": "string", "enum": ["PAID_MEDIA", "INFLUENCER", "OFFLINE"] }
                  }
                }""";

        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("route", json);

        // Assert
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();
        JsonEnumSchema family = (JsonEnumSchema) root.properties().get("family");
        assertThat(family.enumValues()).containsExactly("PAID_MEDIA", "INFLUENCER", "OFFLINE");
    }

    @Test
    void toLangChainSchema_shouldThrowException_whenJsonIsInvalid() {
        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("broken", "{ \"type\": \"object\", ... }"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to parse JSON Schema string");
    }

    @Test
    void toLangChainSchema_shouldThrowException_whenRootIsNotAnObject() {
        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("list", "[1, 2]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("root must be an object");
    }

    @Test
    void toLangChainSchema_shouldThrowException_whenTypeIsUnsupported() {
        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("nulls",
                "{\"type\": \"object\", \"properties\": {\"gone\": {\"type\": \"null\"}}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported JSON Schema type: null");
    }
}
