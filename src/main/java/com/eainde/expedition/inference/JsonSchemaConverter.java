package com.eainde.expedition.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts plain JSON-Schema documents into langchain4j {@link JsonSchema} objects for structured responses.
 */
public final class JsonSchemaConverter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonSchemaConverter() {
    }

    public static JsonSchema toLangChainSchema(String name, String jsonSchemaString) {
        try {
            return toLangChainSchema(name, objectMapper.readTree(jsonSchemaString));
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse JSON Schema string", e);
        }
    }

    public static JsonSchema toLangChainSchema(String name, JsonNode rootNode) {
        if (rootNode == null || !rootNode.isObject()) {
            throw new IllegalArgumentException("JSON Schema root must be an object");
        }
        return JsonSchema.builder()
                .name(name != null ? name : "Schema")
                .rootElement(parseElement(rootNode))
                .build();
    }

    private static JsonSchemaElement parseElement(JsonNode node) {
        if (!node.has("type")) {
            if (node.has("properties")) return parseObject(node);
            if (node.has("enum")) return parseString(node);
            return JsonStringSchema.builder().build();
        }

        String type = node.get("type").asText();

        return switch (type) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "string" -> parseString(node);
            case "integer" -> parseInteger(node);
            case "number" -> parseNumber(node);
            case "boolean" -> parseBoolean(node);
            default -> throw new IllegalArgumentException("Unsupported JSON Schema type: " + type);
        };
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();

        if (node.has("description")) {
            builder.description(node.get("description").asText());
        }

        if (node.has("properties")) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.get("properties").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.addProperty(field.getKey(), parseElement(field.getValue()));
            }
        }

        if (node.has("required") && node.get("required").isArray()) {
            List<String> requiredFields = new ArrayList<>();
            node.get("required").forEach(n -> requiredFields.add(n.asText()));
            builder.required(requiredFields);
        }

        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder();
        if (node.has("description")) builder.description(node.get("description").asText());
        if (node.has("items")) {
            builder.items(parseElement(node.get("items")));
        }
        return builder.build();
    }

    private static JsonSchemaElement parseString(JsonNode node) {
        if (node.has("enum")) {
            List<String> enumValues = new ArrayList<>();
            node.get("enum").forEach(n -> enumValues.add(n.asText()));
            return JsonEnumSchema.builder()
                    .description(descriptionOf(node))
                    .enumValues(enumValues)
                    .build();
        }

        return JsonStringSchema.builder()
                .description(descriptionOf(node))
                .build();
    }

    private static JsonIntegerSchema parseInteger(JsonNode node) {
        return JsonIntegerSchema.builder()
                .description(descriptionOf(node))
                .build();
    }

    private static JsonNumberSchema parseNumber(JsonNode node) {
        return JsonNumberSchema.builder()
                .description(descriptionOf(node))
                .build();
    }

    private static JsonBooleanSchema parseBoolean(JsonNode node) {
        return JsonBooleanSchema.builder()
                .description(descriptionOf(node))
                .build();
    }

    private static String descriptionOf(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }
}
