package com.eainde.expedition.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Response schemas loaded from {@code schemas/<name>.json}. Static schemas are converted once; the synthesis
 * schema is specialised per run with the permitted action types and the evidence ids of that run.
 */
@Component
public class ResponseSchemas {

    public static final String ROUTE = "route";
    public static final String FINDING = "finding";
    public static final String SYNTHESIS = "synthesis";
    public static final String CRITIQUE = "critique";

    private final ObjectMapper objectMapper;
    private final Map<String, JsonNode> documents = new ConcurrentHashMap<>();
    private final Map<String, JsonSchema> converted = new ConcurrentHashMap<>();

    public ResponseSchemas(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonSchema schema(String name) {
        return converted.computeIfAbsent(name, n -> JsonSchemaConverter.toLangChainSchema(n, document(n)));
    }

    /**
     * The synthesis schema with {@code actionType} restricted to {@code actionTypes} and every citation list
     * restricted to {@code evidenceIds}.
     */
    public JsonSchema synthesis(Collection<String> actionTypes, Collection<String> evidenceIds) {
        ObjectNode root = document(SYNTHESIS).deepCopy();
        ObjectNode claimProps = (ObjectNode) root.at("/properties/claims/items/properties");
        ObjectNode actionProps = (ObjectNode) root.at("/properties/actions/items/properties");
        restrict((ObjectNode) actionProps.get("actionType"), actionTypes);
        restrict((ObjectNode) claimProps.at("/citations/items"), evidenceIds);
        restrict((ObjectNode) actionProps.at("/citations/items"), evidenceIds);
        return JsonSchemaConverter.toLangChainSchema(SYNTHESIS, root);
    }

    private void restrict(ObjectNode stringSchema, Collection<String> values) {
        if (values.isEmpty()) {
            return;
        }
        ArrayNode allowed = stringSchema.putArray("enum");
        values.forEach(allowed::add);
    }

    private JsonNode document(String name) {
        return documents.computeIfAbsent(name, n -> {
            ClassPathResource resource = new ClassPathResource("schemas/" + n + ".json");
            try (InputStream in = resource.getInputStream()) {
                return objectMapper.readTree(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Schema resource not found: " + resource.getPath(), e);
            }
        });
    }
}
