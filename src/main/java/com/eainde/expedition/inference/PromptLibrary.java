package com.eainde.expedition.inference;

import dev.langchain4j.model.input.PromptTemplate;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classpath prompt templates. A prompt {@code name} is a pair of resources,
 * {@code prompts/<name>.system.txt} and {@code prompts/<name>.user.txt}, using {@code {{variable}}} placeholders.
 */
@Component
public class PromptLibrary {

    private static final String ROOT = "prompts/";

    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    public RenderedPrompt render(String name, Map<String, Object> variables) {
        String system = template(name + ".system.txt").apply(variables).text();
        String user = template(name + ".user.txt").apply(variables).text();
        return new RenderedPrompt(name, system, user);
    }

    private PromptTemplate template(String resource) {
        return templates.computeIfAbsent(resource, r -> PromptTemplate.from(read(ROOT + r)));
    }

    private static String read(String path) {
        ClassPathResource resource = new ClassPathResource(path);
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Prompt resource not found: " + path, e);
        }
    }
}
