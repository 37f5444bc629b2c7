package com.eainde.expedition.config;

import com.eainde.expedition.model.ChannelFamily;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the diagnosis pipeline, bound from the {@code expedition.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "expedition")
public class ExpeditionProperties {

    private Detector detector = new Detector();
    private Router router = new Router();
    private Retrieval retrieval = new Retrieval();
    private Critic critic = new Critic();
    private Stage stage = new Stage();
    private Batch batch = new Batch();
    private Preflight preflight = new Preflight();
    private Inference inference = new Inference();
    private Embedding embedding = new Embedding();
    private Catalog catalog = new Catalog();

    @Data
    public static class Detector {
        private int windowLength = 28;
        private int minSamples = 5;
        private double warningZ = 2.0;
        private double criticalZ = 3.0;
    }

    @Data
    public static class Router {
        private ChannelFamily fallbackFamily = ChannelFamily.PAID_MEDIA;
    }

    @Data
    public static class Retrieval {
        private int topK = 3;
        private double minSimilarity = 0.5;

        public int effectiveTopK() {
            return Math.max(1, Math.min(10, topK));
        }
    }

    @Data
    public static class Critic {
        private double maxHallucinationRisk = 0.50;
    }

    /** Per-call policy applied to every external call a stage makes. */
    @Data
    public static class Stage {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class Batch {
        private int workerLimit = 4;
    }

    @Data
    public static class Preflight {
        private boolean enabled = true;
        private Duration maxDataLatency = Duration.ofHours(1);
    }

    @Data
    public static class Inference {
        private String apiKey;
        private String tier1Model = "gemini-2.0-flash-lite";
        private String tier2Model = "gemini-2.5-pro";
        private double tier1Temperature = 0.1;
        private double tier2Temperature = 0.3;
        private int tier1MaxOutputTokens = 1024;
        private int tier2MaxOutputTokens = 4096;
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Embedding {
        private String modelName = "text-embedding-004";
        private String seedResource;
    }

    @Data
    public static class Catalog {
        private String actionCatalogResource = "catalog/action-catalog.json";
        private String channelRoutingResource = "catalog/channel-routing.json";
    }
}
