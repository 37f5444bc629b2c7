package com.eainde.expedition.inference;

import com.eainde.expedition.error.ErrorCode;
import dev.langchain4j.model.chat.request.json.JsonSchema;

import java.util.Objects;

/**
 * One structured inference call.
 *
 * @param promptName    prompt resource the text came from, used for logging
 * @param schema        response schema the model must follow
 * @param malformedCode error code raised when the response does not fit the schema
 */
public record InferenceRequest(
        InferenceTier tier,
        String promptName,
        String systemPrompt,
        String userPrompt,
        JsonSchema schema,
        ErrorCode malformedCode
) {

    public InferenceRequest {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(userPrompt, "userPrompt");
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(malformedCode, "malformedCode");
    }

    public static InferenceRequest of(InferenceTier tier, RenderedPrompt prompt, JsonSchema schema, ErrorCode malformedCode) {
        return new InferenceRequest(tier, prompt.name(), prompt.system(), prompt.user(), schema, malformedCode);
    }
}
