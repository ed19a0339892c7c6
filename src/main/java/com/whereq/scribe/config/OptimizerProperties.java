package com.whereq.scribe.config;

import com.whereq.scribe.model.PreservationFlags;
import com.whereq.scribe.model.SiteCredentials;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for WhereQ Scribe.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "optimizer")
@Data
public class OptimizerProperties {

    /**
     * Recorded in the improvement history of every optimized page.
     */
    private String version = "1.0.0";

    private AiConfig ai = new AiConfig();

    private WordPressConfig wordpress = new WordPressConfig();

    private SearchConfig search = new SearchConfig();

    private NeuronConfig neuron = new NeuronConfig();

    private SynthesisConfig synthesis = new SynthesisConfig();

    private GenerationConfig generation = new GenerationConfig();

    private PreservationConfig preservation = new PreservationConfig();

    private GeoConfig geo = new GeoConfig();

    private BulkConfig bulk = new BulkConfig();

    private LogConfig log = new LogConfig();

    @Data
    public static class AiConfig {
        /**
         * Content generation provider: gemini, openrouter, openai, anthropic or groq.
         */
        private String provider = "gemini";

        /**
         * Model for providers without a fixed model.
         */
        private String model = "gemini-2.5-flash";

        /**
         * API keys by provider name.
         */
        private Map<String, String> keys = new HashMap<>();

        public boolean hasAnyKey() {
            return keys.values().stream().anyMatch(k -> k != null && !k.isBlank());
        }

        /**
         * Key of the selected provider, falling back to any configured key.
         */
        public String activeKey() {
            String key = keys.get(provider);
            if (key != null && !key.isBlank()) {
                return key;
            }
            return keys.values().stream()
                .filter(k -> k != null && !k.isBlank())
                .findFirst()
                .orElse(null);
        }

        /**
         * Model actually sent to the provider.
         */
        public String actualModel() {
            return switch (provider) {
                case "openrouter" -> model != null && !model.isBlank() ? model : "google/gemini-2.5-flash-preview";
                case "groq" -> model != null && !model.isBlank() ? model : "llama-3.3-70b-versatile";
                case "openai" -> "gpt-4o";
                case "anthropic" -> "claude-sonnet-4";
                default -> model;
            };
        }
    }

    @Data
    public static class WordPressConfig {
        private String url;

        private String username;

        /**
         * Application password.
         */
        private String password;

        private String orgName = "Expert Website";

        private String authorName = "Editorial Team";

        private PublishMode publishMode = PublishMode.DRAFT;

        public SiteCredentials credentials() {
            return SiteCredentials.builder()
                .url(url)
                .username(username)
                .password(password)
                .build();
        }
    }

    @Data
    public static class SearchConfig {
        /**
         * Serper.dev API key. Entity gap analysis is skipped without it.
         */
        private String serperApiKey;

        private String endpoint = "https://google.serper.dev/search";

        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class NeuronConfig {
        private boolean enabled = false;

        private String apiKey;

        private String projectId;

        private String endpoint = "https://app.neuronwriter.com/neuron-api/0.5/writer";

        private String engine = "google.com";

        /**
         * Delay between get-query polls while the analysis is prepared.
         */
        private Duration pollInterval = Duration.ofSeconds(10);

        private int maxPolls = 12;

        public boolean isConfigured() {
            return enabled && apiKey != null && !apiKey.isBlank() && projectId != null && !projectId.isBlank();
        }
    }

    @Data
    public static class SynthesisConfig {
        /**
         * Synthesis engine endpoint streaming stage events and the final article.
         */
        private String endpoint = "http://localhost:8090/api/v1/synthesize";

        private Duration timeout = Duration.ofMinutes(8);
    }

    @Data
    public static class GenerationConfig {
        private OptimizationMode mode = OptimizationMode.SURGICAL;

        private int targetWords = 4000;

        /**
         * Generated HTML shorter than this many characters fails the job.
         */
        private int minContentLength = 2000;

        /**
         * Pages scoring at least this much count as improved.
         */
        private int improvedThreshold = 70;

        /**
         * Maximum internal link candidates handed to synthesis.
         */
        private int maxInternalLinks = 50;
    }

    @Data
    public static class PreservationConfig {
        private boolean featuredImage = true;

        private boolean categories = true;

        private boolean tags = true;

        public PreservationFlags toFlags() {
            return PreservationFlags.builder()
                .preserveFeaturedImage(featuredImage)
                .preserveSlug(true)
                .preserveCategories(categories)
                .preserveTags(tags)
                .build();
        }
    }

    @Data
    public static class GeoConfig {
        private boolean enabled = false;

        private String country = "US";

        private String language = "en";
    }

    @Data
    public static class BulkConfig {
        private int defaultConcurrency = 3;

        /**
         * Wall-clock budget of a single bulk job.
         */
        private Duration jobTimeout = Duration.ofMinutes(10);

        /**
         * Pause between waves to stay under upstream rate limits.
         */
        private Duration waveCooldown = Duration.ofSeconds(2);

        /**
         * Minimum score for a bulk job to count as completed.
         */
        private int qualityThreshold = 50;
    }

    @Data
    public static class LogConfig {
        private int jobLogCapacity = 200;

        private int activityLogCapacity = 500;
    }

    public enum PublishMode {
        /**
         * Save as draft for review.
         */
        DRAFT,

        /**
         * Publish immediately.
         */
        PUBLISH
    }

    public enum OptimizationMode {
        /**
         * Keep the existing structure and improve it.
         */
        SURGICAL,

        /**
         * Write the article from scratch.
         */
        WRITER
    }
}
