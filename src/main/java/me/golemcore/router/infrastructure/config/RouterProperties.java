package me.golemcore.router.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the router, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code router.*} prefix:
 * <ul>
 * <li>{@link OptimizationProperties} - global optimization switch</li>
 * <li>{@link AnalysisProperties} - query analysis cache</li>
 * <li>{@link PromptProperties} - template selection and prompt tuning</li>
 * <li>{@link PreferenceProperties} - model weight learning</li>
 * <li>{@link FeedbackProperties} - feedback collection</li>
 * <li>{@link DiscussionProperties} - group discussion</li>
 * <li>{@link StorageProperties} - feedback database location</li>
 * <li>{@link ExportProperties} - RLHF export</li>
 * <li>{@link InferenceProperties} - model inference provider</li>
 * <li>{@link CatalogProperties} - model and template catalogs</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "router")
@Data
public class RouterProperties {

    private OptimizationProperties optimization = new OptimizationProperties();
    private AnalysisProperties analysis = new AnalysisProperties();
    private PromptProperties prompt = new PromptProperties();
    private PreferenceProperties preference = new PreferenceProperties();
    private FeedbackProperties feedback = new FeedbackProperties();
    private DiscussionProperties discussion = new DiscussionProperties();
    private StorageProperties storage = new StorageProperties();
    private ExportProperties export = new ExportProperties();
    private InferenceProperties inference = new InferenceProperties();
    private CatalogProperties catalog = new CatalogProperties();

    private static final String USER_HOME_PLACEHOLDER = "${user.home}";

    /**
     * Resolves a configured path, expanding a literal {@code ${user.home}} left
     * in field defaults and a leading {@code ~}.
     */
    public static Path resolvePath(String configured) {
        String home = System.getProperty("user.home");
        String value = configured == null ? "" : configured.trim();
        value = value.replace(USER_HOME_PLACEHOLDER, home);
        if (value.startsWith("~")) {
            value = home + value.substring(1);
        }
        return Paths.get(value).toAbsolutePath().normalize();
    }

    @Data
    public static class OptimizationProperties {
        private boolean enabled = true;

        /** Max remembered query to template associations. */
        private int templateMemorySize = 1000;
    }

    @Data
    public static class AnalysisProperties {
        private int cacheSize = 1000;
    }

    @Data
    public static class PromptProperties {
        /** {@code best_match} or {@code performance_based}. */
        private String templateSelectionStrategy = "best_match";
        private boolean dynamicInstructionTuning = true;
        private int maxPromptChars = 8000;
    }

    @Data
    public static class PreferenceProperties {
        private double weightUpdateFactor = 0.1;
        private double winRateWeight = 0.7;
        private double scoreWeight = 0.3;
        private double defaultWeight = 1.0;
        private double minWeight = 0.5;
        private double maxWeight = 2.0;
        private int performanceCacheSize = 5000;
    }

    @Data
    public static class FeedbackProperties {
        private boolean enabled = true;
        private double collectionProbability = 0.3;
        private boolean collectComparisons = true;
        private int feedbackCacheSize = 1000;
        private int cacheEvictionBatch = 100;
        private int askedConversationCapacity = 10000;
    }

    // ==================== GROUP DISCUSSION ====================

    @Data
    public static class DiscussionProperties {
        private String name = "group_discussion";
        private String systemPrompt = "This is the result of a group discussion between different AI experts. "
                + "Each expert has contributed from their specialized field, and the results have been "
                + "synthesized into a comprehensive answer.";
        private int defaultRounds = 2;

        /** Upper bound on requested rounds. */
        private int maxRounds = 10;
        private double temperature = 0.7;
        private int maxTokens = 1024;
        private double synthesisTemperature = 0.5;
        private int synthesisMaxTokens = 1536;
        private String synthesisRole = "deep_thinking";
        private int historySize = 100;

        /** Strength overrides for the group discussion pseudo-model. */
        private Map<String, Double> strengths = new HashMap<>();
    }

    @Data
    public static class StorageProperties {
        private String dbPath = "${user.home}/.golemcore/router/feedback";
        private String backupDir = "backups";
    }

    @Data
    public static class ExportProperties {
        private String directory = "${user.home}/.golemcore/router/rlhf_exports";
        private double evalRatio = 0.1;
    }

    @Data
    public static class InferenceProperties {
        /** {@code langchain4j} or {@code none}. */
        private String provider = "none";
        private String baseUrl = "http://localhost:11434/v1";
        private String apiKey = "ollama";
        private long timeoutMs = 30000;
        private int maxRetries = 3;
        private double defaultTemperature = 0.7;
        private int defaultMaxTokens = 1024;
    }

    @Data
    public static class CatalogProperties {
        /** Optional filesystem override for the bundled models.yml. */
        private String modelsPath = "";

        /** Optional filesystem override for the bundled prompt-templates.yml. */
        private String templatesPath = "";
    }
}
