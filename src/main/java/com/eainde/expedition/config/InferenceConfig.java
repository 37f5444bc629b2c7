package com.eainde.expedition.config;

import com.eainde.expedition.inference.ChatModelInferenceClient;
import com.eainde.expedition.inference.InferenceClient;
import com.eainde.expedition.inference.InferenceLoggingListener;
import com.eainde.expedition.inference.InferenceTier;
import com.eainde.expedition.memory.EmbeddingStoreIncidentMemory;
import com.eainde.expedition.memory.IncidentMemory;
import com.eainde.expedition.model.HistoricalIncident;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Gemini-backed inference and embeddings. Only active when an API key is configured; otherwise the host
 * supplies its own {@link InferenceClient} and {@link IncidentMemory}.
 */
@Log4j2
@Configuration
@ConditionalOnProperty(prefix = "expedition.inference", name = "api-key")
public class InferenceConfig {

    @Bean
    public ChatModelListener inferenceLoggingListener() {
        return new InferenceLoggingListener();
    }

    @Bean("tier1ChatModel")
    public ChatModel tier1ChatModel(ExpeditionProperties properties, ChatModelListener listener) {
        ExpeditionProperties.Inference inference = properties.getInference();
        return GoogleAiGeminiChatModel.builder()
                .apiKey(inference.getApiKey())
                .modelName(inference.getTier1Model())
                .temperature(inference.getTier1Temperature())
                .maxOutputTokens(inference.getTier1MaxOutputTokens())
                .timeout(inference.getTimeout())
                .listeners(List.of(listener))
                .build();
    }

    @Bean("tier2ChatModel")
    public ChatModel tier2ChatModel(ExpeditionProperties properties, ChatModelListener listener) {
        ExpeditionProperties.Inference inference = properties.getInference();
        return GoogleAiGeminiChatModel.builder()
                .apiKey(inference.getApiKey())
                .modelName(inference.getTier2Model())
                .temperature(inference.getTier2Temperature())
                .maxOutputTokens(inference.getTier2MaxOutputTokens())
                .timeout(inference.getTimeout())
                .listeners(List.of(listener))
                .build();
    }

    @Bean
    public InferenceClient inferenceClient(@Qualifier("tier1ChatModel") ChatModel tier1,
                                           @Qualifier("tier2ChatModel") ChatModel tier2,
                                           ObjectMapper objectMapper,
                                           ExpeditionProperties properties) {
        return new ChatModelInferenceClient(
                Map.of(InferenceTier.TIER_1, tier1, InferenceTier.TIER_2, tier2),
                objectMapper,
                properties.getInference().getTimeout());
    }

    @Bean
    public EmbeddingModel embeddingModel(ExpeditionProperties properties) {
        return GoogleAiEmbeddingModel.builder()
                .apiKey(properties.getInference().getApiKey())
                .modelName(properties.getEmbedding().getModelName())
                .timeout(properties.getInference().getTimeout())
                .build();
    }

    @Bean
    public IncidentMemory incidentMemory(EmbeddingModel embeddingModel, ExpeditionProperties properties,
                                         ObjectMapper objectMapper) throws IOException {
        IncidentMemory memory = new EmbeddingStoreIncidentMemory(embeddingModel, new InMemoryEmbeddingStore<>());
        String seed = properties.getEmbedding().getSeedResource();
        if (seed != null && !seed.isBlank()) {
            try (InputStream in = new ClassPathResource(seed).getInputStream()) {
                List<HistoricalIncident> incidents = objectMapper.readValue(in, new TypeReference<>() {
                });
                memory.ingest(incidents);
            }
        } else {
            log.info("No incident seed configured, memory starts empty");
        }
        return memory;
    }
}
