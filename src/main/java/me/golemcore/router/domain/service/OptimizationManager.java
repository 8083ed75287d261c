package me.golemcore.router.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.analysis.QueryAnalyzer;
import me.golemcore.router.domain.model.DiscussionRequest;
import me.golemcore.router.domain.model.DiscussionResult;
import me.golemcore.router.domain.model.ExportOptions;
import me.golemcore.router.domain.model.FeedbackScore;
import me.golemcore.router.domain.model.FeedbackSubmission;
import me.golemcore.router.domain.model.OptimizationResult;
import me.golemcore.router.domain.model.OptimizationStats;
import me.golemcore.router.domain.model.QueryProfile;
import me.golemcore.router.domain.model.TemplateDefinition;
import me.golemcore.router.infrastructure.cache.BoundedLruCache;
import me.golemcore.router.infrastructure.config.ModelCatalogService;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.FeedbackStorePort;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the routing layer. Coordinates query analysis, prompt
 * composition, model selection and the feedback loop, and degrades to
 * pass-through behavior when optimization is switched off or a component
 * fails.
 */
@Service
@Slf4j
public class OptimizationManager {

    static final String FEEDBACK_SCORE_STAT = "feedback_score";
    static final double POSITIVE_THRESHOLD = 0.7;
    static final double NEGATIVE_THRESHOLD = 0.3;

    private final QueryAnalyzer queryAnalyzer;
    private final TemplateSelector templateSelector;
    private final PromptComposer promptComposer;
    private final PreferenceOptimizer preferenceOptimizer;
    private final FeedbackCollector feedbackCollector;
    private final GroupDiscussionOrchestrator discussionOrchestrator;
    private final FeedbackStorePort feedbackStore;
    private final ModelCatalogService modelCatalog;
    private final AtomicBoolean enabled;
    private final BoundedLruCache<String, String> templateMemory;

    public OptimizationManager(QueryAnalyzer queryAnalyzer, TemplateSelector templateSelector,
            PromptComposer promptComposer, PreferenceOptimizer preferenceOptimizer,
            FeedbackCollector feedbackCollector, GroupDiscussionOrchestrator discussionOrchestrator,
            FeedbackStorePort feedbackStore, ModelCatalogService modelCatalog, RouterProperties properties) {
        this.queryAnalyzer = queryAnalyzer;
        this.templateSelector = templateSelector;
        this.promptComposer = promptComposer;
        this.preferenceOptimizer = preferenceOptimizer;
        this.feedbackCollector = feedbackCollector;
        this.discussionOrchestrator = discussionOrchestrator;
        this.feedbackStore = feedbackStore;
        this.modelCatalog = modelCatalog;
        this.enabled = new AtomicBoolean(properties.getOptimization().isEnabled());
        this.templateMemory = new BoundedLruCache<>(properties.getOptimization().getTemplateMemorySize());
    }

    public OptimizationResult optimizeQuery(String query) {
        if (!enabled.get()) {
            return OptimizationResult.passThrough(query);
        }
        try {
            String text = query == null ? "" : query;
            QueryProfile profile = queryAnalyzer.analyze(text);
            TemplateDefinition template = templateSelector.select(profile);
            String prompt = promptComposer.compose(text, profile, template);
            templateMemory.put(text, template.getName());
            return OptimizationResult.builder()
                    .profile(profile)
                    .templateUsed(template.getName())
                    .optimizedPrompt(prompt)
                    .optimized(true)
                    .build();
        } catch (RuntimeException e) {
            log.error("[Optimization] Failed to optimize query, passing through: {}", e.getMessage(), e);
            return OptimizationResult.passThrough(query);
        }
    }

    /**
     * Picks the model to answer a query.
     *
     * @param profile
     *            precomputed profile, or null to analyze the query
     * @param candidates
     *            models to choose from, or null/empty for every catalog model
     */
    public Optional<String> selectBestModel(String query, QueryProfile profile, List<String> candidates) {
        if (!enabled.get()) {
            return Optional.empty();
        }
        try {
            QueryProfile effective = profile != null ? profile : queryAnalyzer.analyze(query);
            List<String> pool = candidates != null && !candidates.isEmpty()
                    ? candidates
                    : modelCatalog.listModelNames();
            return preferenceOptimizer.selectBestModel(effective, pool);
        } catch (RuntimeException e) {
            log.error("[Optimization] Failed to select model: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    public boolean shouldRequestFeedback(String conversationId) {
        if (!enabled.get()) {
            return false;
        }
        try {
            return feedbackCollector.shouldRequestFeedback(conversationId);
        } catch (RuntimeException e) {
            log.error("[Optimization] Failed to decide on feedback request: {}", e.getMessage(), e);
            return false;
        }
    }

    /**
     * Stores feedback and folds it into model weights and template
     * performance.
     *
     * @return true when the feedback was stored and applied
     */
    public boolean processFeedback(FeedbackSubmission submission) {
        if (!enabled.get() || submission == null) {
            return false;
        }
        try {
            Optional<String> feedbackId = feedbackCollector.collectFeedback(submission);
            if (feedbackId.isEmpty()) {
                return false;
            }
            FeedbackScore score = submission.getScore() != null ? submission.getScore() : FeedbackScore.absent();
            OptionalDouble value = score.value();
            preferenceOptimizer.updateWeightsFromFeedback(submission.getQuery(), submission.getResponses(),
                    submission.getSelectedModel(), value);

            if (value.isPresent()) {
                String query = submission.getQuery() == null ? "" : submission.getQuery();
                String template = templateMemory.get(query).orElse(TemplateDefinition.IDENTITY_NAME);
                templateSelector.recordPerformance(template, value.getAsDouble());

                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("feedback_id", feedbackId.get());
                metadata.put("model", submission.getSelectedModel());
                metadata.put("template", template);
                feedbackStore.updateStat(FEEDBACK_SCORE_STAT, value.getAsDouble(), metadata);
            }
            return true;
        } catch (RuntimeException e) {
            log.error("[Optimization] Failed to process feedback: {}", e.getMessage(), e);
            return false;
        }
    }

    public Optional<Path> exportFeedbackData(Path directory, ExportOptions options) {
        if (!enabled.get()) {
            return Optional.empty();
        }
        try {
            return feedbackCollector.exportFeedbackData(directory, options);
        } catch (RuntimeException e) {
            log.error("[Optimization] Failed to export feedback: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    public DiscussionResult conductDiscussion(DiscussionRequest request) {
        try {
            return discussionOrchestrator.conductDiscussion(request);
        } catch (RuntimeException e) {
            log.error("[Optimization] Discussion failed: {}", e.getMessage(), e);
            return DiscussionResult.failure(e.getMessage());
        }
    }

    public OptimizationStats getStats() {
        long scored = feedbackStore.getCountByScore(null, null);
        long positive = feedbackStore.getCountByScore(POSITIVE_THRESHOLD, null);
        long negative = feedbackStore.getCountByScore(null, NEGATIVE_THRESHOLD);
        return OptimizationStats.builder()
                .optimizationEnabled(enabled.get())
                .feedbackCollectionEnabled(feedbackCollector.isEnabled())
                .totalFeedback(feedbackStore.getTotalCount())
                .positiveFeedback(positive)
                .negativeFeedback(negative)
                .neutralFeedback(Math.max(0, scored - positive - negative))
                .modelWeights(preferenceOptimizer.getModelWeights())
                .modelStats(preferenceOptimizer.getModelStats())
                .templatePerformance(templateSelector.getPerformance())
                .build();
    }

    public void toggleOptimization(boolean enable) {
        enabled.set(enable);
        log.info("[Optimization] Optimization {}", enable ? "enabled" : "disabled");
    }

    public boolean isOptimizationEnabled() {
        return enabled.get();
    }

    public void toggleFeedbackCollection(boolean enable) {
        feedbackCollector.toggleCollection(enable);
    }

    public void clearCaches() {
        queryAnalyzer.clearCache();
        preferenceOptimizer.clearCache();
        templateMemory.clear();
        log.info("[Optimization] Caches cleared");
    }
}
