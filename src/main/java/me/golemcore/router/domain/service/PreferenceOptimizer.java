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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.analysis.QueryAnalyzer;
import me.golemcore.router.domain.model.Capability;
import me.golemcore.router.domain.model.ModelDefinition;
import me.golemcore.router.domain.model.ModelProfile;
import me.golemcore.router.domain.model.QueryProfile;
import me.golemcore.router.domain.model.RunningScore;
import me.golemcore.router.infrastructure.cache.BoundedLruCache;
import me.golemcore.router.infrastructure.config.ModelCatalogService;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Online routing model: scores candidate models against the capabilities a
 * query needs and re-weights models from user feedback.
 *
 * <p>
 * Win rates follow an adaptive moving average whose decay grows with the
 * number of observations, so new models move quickly and settle later. The
 * selected model's weight then moves by
 * {@code (winRate * winRateWeight + avgScore * scoreWeight - 0.5) * factor},
 * clamped to the configured bounds.
 *
 * <p>
 * All state is guarded by this instance's monitor.
 */
@Service
@Slf4j
public class PreferenceOptimizer {

    private static final double DISCUSSION_DEFAULT_STRENGTH = 0.7;
    private static final double DEFAULT_STRENGTH = 0.5;
    private static final int DECAY_SAMPLE_CAP = 100;
    private static final double DECAY_OFFSET = 10.0;
    private static final double SCORE_HISTORY_WEIGHT = 0.9;
    private static final double SCORE_NEW_WEIGHT = 0.1;
    private static final double PERFORMANCE_PIVOT = 0.5;
    private static final int MIN_KEYWORD_LENGTH = 3;
    private static final String TYPE_KEY_PREFIX = "type:";
    private static final Set<String> STOP_WORDS = Set.of(
            "\u662F", "\u548C", "\u7684", "\u4E3A", "\u5728", "\u4E00\u4E2A", "\u4E00\u4E9B", "\u90A3\u4E9B",
            "\u5173\u4E8E", "\u4E0E", "\u6709", "\u88AB", "\u4E0D", "\u50CF", "\u4ECE", "\u5230",
            "\u6211", "\u4F60", "\u6211\u4EEC", "\u4ED6\u4EEC", "\u81EA\u5DF1", "\u8FD9\u4E2A", "\u5F53", "\u505A", "\u4E3A\u4E86",
            "the", "and", "for", "this", "that", "with", "are", "you", "what", "does");

    private final ModelCatalogService modelCatalog;
    private final RouterProperties properties;
    private final QueryAnalyzer queryAnalyzer;

    private final Map<String, ModelProfile> profiles = new LinkedHashMap<>();
    private final BoundedLruCache<String, Map<String, RunningScore>> performanceCache;

    public PreferenceOptimizer(ModelCatalogService modelCatalog, RouterProperties properties,
            QueryAnalyzer queryAnalyzer) {
        this.modelCatalog = modelCatalog;
        this.properties = properties;
        this.queryAnalyzer = queryAnalyzer;
        this.performanceCache = new BoundedLruCache<>(
                Math.max(1, properties.getPreference().getPerformanceCacheSize()));
    }

    @PostConstruct
    public synchronized void init() {
        profiles.clear();
        double defaultWeight = properties.getPreference().getDefaultWeight();
        for (ModelDefinition definition : modelCatalog.getModels()) {
            profiles.put(definition.getName(), newProfile(definition.getName(), definition.getStrengths(),
                    DEFAULT_STRENGTH, defaultWeight));
        }
        String discussionName = properties.getDiscussion().getName();
        if (discussionName != null && !discussionName.isBlank() && !profiles.containsKey(discussionName)) {
            profiles.put(discussionName, newProfile(discussionName, properties.getDiscussion().getStrengths(),
                    DISCUSSION_DEFAULT_STRENGTH, defaultWeight));
        }
        log.info("[PreferenceOptimizer] Initialized {} model profiles", profiles.size());
    }

    /**
     * Picks the candidate whose strengths best cover the profile's needs,
     * scaled by its learned weight. Unknown candidates are skipped; ties go to
     * the earlier candidate.
     */
    public synchronized Optional<String> selectBestModel(QueryProfile profile, List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        Map<Capability, Double> required = StrengthRequirementRules.requiredStrengths(profile);

        ModelProfile best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (String candidate : candidates) {
            ModelProfile model = profiles.get(candidate);
            if (model == null) {
                log.debug("[PreferenceOptimizer] Skipping unknown candidate {}", candidate);
                continue;
            }
            double ranking = capabilityScore(model, required) * model.getWeight();
            if (ranking > bestScore) {
                bestScore = ranking;
                best = model;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        best.setSelectionCount(best.getSelectionCount() + 1);
        log.debug("[PreferenceOptimizer] Selected {} (score {})", best.getName(), bestScore);
        return Optional.of(best.getName());
    }

    /**
     * Applies one feedback event. Unknown or blank selected models are
     * ignored.
     */
    public synchronized void updateWeightsFromFeedback(String query, Map<String, String> responses,
            String selectedModel, OptionalDouble score) {
        if (selectedModel == null || selectedModel.isBlank() || !profiles.containsKey(selectedModel)) {
            log.debug("[PreferenceOptimizer] Ignoring feedback for unknown model {}", selectedModel);
            return;
        }
        Map<String, String> participants = responses != null ? responses : Map.of();
        if (participants.size() > 1 && participants.containsKey(selectedModel)) {
            for (String model : participants.keySet()) {
                ModelProfile profile = profiles.get(model);
                if (profile != null) {
                    updateWinRate(profile, model.equals(selectedModel));
                }
            }
        }

        ModelProfile selected = profiles.get(selectedModel);
        OptionalDouble clampedScore = score != null && score.isPresent()
                ? OptionalDouble.of(clamp01(score.getAsDouble()))
                : OptionalDouble.empty();
        if (clampedScore.isPresent()) {
            double avg = SCORE_HISTORY_WEIGHT * selected.getAvgScore() + SCORE_NEW_WEIGHT * clampedScore.getAsDouble();
            selected.setAvgScore(clamp01(avg));
        }

        RouterProperties.PreferenceProperties config = properties.getPreference();
        double performance = selected.getWinRate() * config.getWinRateWeight()
                + selected.getAvgScore() * config.getScoreWeight();
        double weight = selected.getWeight() + (performance - PERFORMANCE_PIVOT) * config.getWeightUpdateFactor();
        selected.setWeight(Math.max(config.getMinWeight(), Math.min(config.getMaxWeight(), weight)));
        log.debug("[PreferenceOptimizer] {} -> weight {}, winRate {}, avgScore {}", selectedModel,
                selected.getWeight(), selected.getWinRate(), selected.getAvgScore());

        if (clampedScore.isPresent()) {
            updatePerformanceCache(query, selectedModel, clampedScore.getAsDouble());
        }
    }

    public synchronized Map<String, Double> getModelWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        profiles.forEach((name, profile) -> weights.put(name, profile.getWeight()));
        return weights;
    }

    public synchronized Map<String, ModelProfile> getModelStats() {
        Map<String, ModelProfile> stats = new LinkedHashMap<>();
        profiles.forEach((name, profile) -> stats.put(name, profile.copy()));
        return stats;
    }

    public synchronized Optional<ModelProfile> getProfile(String model) {
        ModelProfile profile = profiles.get(model);
        return profile != null ? Optional.of(profile.copy()) : Optional.empty();
    }

    public synchronized Map<String, Map<String, RunningScore>> getPerformanceCache() {
        Map<String, Map<String, RunningScore>> copy = new LinkedHashMap<>();
        performanceCache.snapshot().forEach((key, models) -> copy.put(key, new LinkedHashMap<>(models)));
        return copy;
    }

    public synchronized void resetWeights() {
        double defaultWeight = properties.getPreference().getDefaultWeight();
        profiles.values().forEach(profile -> profile.setWeight(defaultWeight));
        log.info("[PreferenceOptimizer] Weights reset to {}", defaultWeight);
    }

    public synchronized void clearCache() {
        performanceCache.clear();
    }

    static double capabilityScore(ModelProfile model, Map<Capability, Double> required) {
        double weighted = 0.0;
        double totalImportance = 0.0;
        for (Map.Entry<Capability, Double> entry : required.entrySet()) {
            double importance = entry.getValue();
            if (importance > StrengthRequirementRules.BASELINE_IMPORTANCE) {
                weighted += model.strength(entry.getKey()) * importance;
                totalImportance += importance;
            }
        }
        if (totalImportance == 0.0) {
            return model.getStrengths().values().stream()
                    .mapToDouble(Double::doubleValue)
                    .average()
                    .orElse(DEFAULT_STRENGTH);
        }
        return weighted / totalImportance;
    }

    private void updateWinRate(ModelProfile profile, boolean win) {
        long count = profile.getSelectionCount() + 1;
        double capped = Math.min(DECAY_SAMPLE_CAP, count);
        double decay = capped / (capped + DECAY_OFFSET);
        double rate = profile.getWinRate() * decay + (win ? 1.0 : 0.0) * (1 - decay);
        profile.setWinRate(clamp01(rate));
        profile.setSelectionCount(count);
    }

    private void updatePerformanceCache(String query, String model, double score) {
        List<String> keys = new ArrayList<>(extractKeywords(query));
        keys.add(TYPE_KEY_PREFIX + queryAnalyzer.analyze(query).getQueryType().wireName());
        for (String key : keys) {
            Map<String, RunningScore> byModel = performanceCache.computeIfAbsent(key, k -> new HashMap<>());
            byModel.merge(model, RunningScore.initial().add(score), (current, ignored) -> current.add(score));
        }
    }

    static List<String> extractKeywords(String query) {
        List<String> keywords = new ArrayList<>();
        if (query == null) {
            return keywords;
        }
        for (String word : query.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (word.codePointCount(0, word.length()) >= MIN_KEYWORD_LENGTH && !STOP_WORDS.contains(word)
                    && !keywords.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    private static ModelProfile newProfile(String name, Map<String, Double> configured, double fallback,
            double weight) {
        Map<Capability, Double> strengths = new EnumMap<>(Capability.class);
        for (Capability capability : Capability.values()) {
            strengths.put(capability, fallback);
        }
        if (configured != null) {
            configured.forEach((key, value) -> {
                Optional<Capability> capability = Capability.fromKey(key);
                if (capability.isPresent() && value != null) {
                    strengths.put(capability.get(), clamp01(value));
                } else {
                    log.warn("[PreferenceOptimizer] Ignoring unknown strength '{}' for model {}", key, name);
                }
            });
        }
        return ModelProfile.builder()
                .name(name)
                .strengths(strengths)
                .weight(weight)
                .build();
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
