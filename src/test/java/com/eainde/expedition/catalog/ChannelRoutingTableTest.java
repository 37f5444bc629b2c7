package com.eainde.expedition.catalog;

import com.eainde.expedition.DiagnosisFixtures;
import com.eainde.expedition.model.ChannelFamily;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelRoutingTableTest {

    private final ChannelRoutingTable table = DiagnosisFixtures.routingTable();

    @Test
    @DisplayName("should map known channels to their family ignoring case and whitespace")
    void familyOf() {
        assertThat(table.familyOf("google_search")).contains(ChannelFamily.PAID_MEDIA);
        assertThat(table.familyOf(" Influencer_Campaigns ")).contains(ChannelFamily.INFLUENCER);
        assertThat(table.familyOf("tv")).contains(ChannelFamily.OFFLINE);
    }

    @Test
    @DisplayName("should return empty for unmapped channels")
    void unmapped() {
        assertThat(table.familyOf("snapchat_ads")).isEmpty();
        assertThat(table.familyOf(null)).isEmpty();
    }

    @Test
    @DisplayName("should resolve the platform by longest prefix and fall back to the channel")
    void platformOf() {
        ChannelRoutingTable custom = new ChannelRoutingTable(Map.of(),
                Map.of("google", "google_ads", "google_youtube", "youtube_studio"));

        assertThat(custom.platformOf("google_search")).isEqualTo("google_ads");
        assertThat(custom.platformOf("google_youtube")).isEqualTo("youtube_studio");
        assertThat(custom.platformOf("Radio")).isEqualTo("radio");
    }

    @Test
    @DisplayName("should load platforms from the bundled table")
    void bundledPlatforms() {
        assertThat(table.platformOf("meta_ads")).isEqualTo("meta_ads");
        assertThat(table.platformOf("influencer_campaigns")).isEqualTo("creatoriq");
        assertThat(table.size()).isEqualTo(17);
    }
}
