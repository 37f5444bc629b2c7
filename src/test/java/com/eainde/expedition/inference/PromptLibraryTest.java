package com.eainde.expedition.inference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptLibraryTest {

    private final PromptLibrary prompts = new PromptLibrary();

    @Test
    @DisplayName("should render both halves of a prompt with its variables")
    void render() {
        RenderedPrompt prompt = prompts.render("router", Map.of(
                "channel", "snapchat_ads",
                "metric", "cpa",
                "anomaly", "cpa SPIKE z=4.1",
                "families", "PAID_MEDIA, INFLUENCER, OFFLINE"));

        assertThat(prompt.name()).isEqualTo("router");
        assertThat(prompt.system()).isNotBlank();
        assertThat(prompt.user()).contains("snapchat_ads").contains("cpa SPIKE z=4.1");
    }

    @Test
    @DisplayName("should fail for a missing prompt resource")
    void missingPrompt() {
        assertThatThrownBy(() -> prompts.render("nonexistent", Map.of()))
                .hasMessageContaining("prompts/nonexistent");
    }
}
