package me.golemcore.router.domain.service;

import me.golemcore.router.domain.analysis.QueryAnalyzer;
import me.golemcore.router.domain.model.Capability;
import me.golemcore.router.domain.model.ModelDefinition;
import me.golemcore.router.domain.model.ModelProfile;
import me.golemcore.router.domain.model.QueryProfile;
import me.golemcore.router.domain.model.RunningScore;
import me.golemcore.router.infrastructure.config.ModelCatalogService;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PreferenceOptimizerTest {

    private static final String MODEL_A = "model-a";
    private static final String MODEL_B = "model-b";

    private RouterProperties properties;
    private QueryAnalyzer analyzer;
    private PreferenceOptimizer optimizer;

    @BeforeEach
    void setUp() {
        properties = new RouterProperties();
        properties.getDiscussion().setStrengths(Map.of("comprehensive", 0.9));
        ModelCatalogService catalog = new ModelCatalogService(properties);
        catalog.replaceModels(List.of(
                model(MODEL_A, Map.of("programming", 0.9, "reasoning", 0.5)),
                model(MODEL_B, Map.of("programming", 0.3, "reasoning", 0.9))));
        analyzer = new QueryAnalyzer(properties);
        optimizer = new PreferenceOptimizer(catalog, properties, analyzer);
        optimizer.init();
    }

    @Test
    void shouldRouteDebuggingQuestionToProgrammingModel() {
        QueryProfile profile = analyzer.analyze("Why does memory leak in this code? Please explain step by step");

        Optional<String> selected = optimizer.selectBestModel(profile, List.of(MODEL_A, MODEL_B));

        assertEquals(Optional.of(MODEL_A), selected);
        assertEquals(1, optimizer.getProfile(MODEL_A).orElseThrow().getSelectionCount());
    }

    @Test
    void shouldReturnEmptyForNoCandidates() {
        assertTrue(optimizer.selectBestModel(QueryProfile.neutral(), List.of()).isEmpty());
        assertTrue(optimizer.selectBestModel(QueryProfile.neutral(), null).isEmpty());
        assertTrue(optimizer.selectBestModel(QueryProfile.neutral(), List.of("unknown")).isEmpty());
    }

    @Test
    void shouldReturnSingleCandidate() {
        assertEquals(Optional.of(MODEL_B), optimizer.selectBestModel(QueryProfile.neutral(), List.of(MODEL_B)));
    }

    @Test
    void shouldPreferFirstCandidateOnTie() {
        // only conciseness and clarity matter here, where both models sit at the default
        QueryProfile profile = QueryProfile.neutral();

        assertEquals(Optional.of(MODEL_B), optimizer.selectBestModel(profile, List.of(MODEL_B, MODEL_A)));
    }

    @Test
    void shouldSeedDiscussionProfileFromConfiguration() {
        ModelProfile discussion = optimizer.getProfile("group_discussion").orElseThrow();

        assertEquals(0.9, discussion.strength(Capability.COMPREHENSIVE));
        assertEquals(0.7, discussion.strength(Capability.PROGRAMMING));
        assertEquals(1.0, discussion.getWeight());
    }

    @Test
    void shouldKeepStateWithinBoundsAfterManyUpdates() {
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            String selected = random.nextBoolean() ? MODEL_A : MODEL_B;
            OptionalDouble score = random.nextInt(4) == 0
                    ? OptionalDouble.empty()
                    : OptionalDouble.of(random.nextDouble() * 3 - 1);
            optimizer.updateWeightsFromFeedback("query " + i, Map.of(MODEL_A, "a", MODEL_B, "b"), selected, score);
        }

        RouterProperties.PreferenceProperties bounds = properties.getPreference();
        for (ModelProfile profile : optimizer.getModelStats().values()) {
            assertTrue(profile.getWeight() >= bounds.getMinWeight() && profile.getWeight() <= bounds.getMaxWeight(),
                    profile.getName());
            assertTrue(profile.getWinRate() >= 0.0 && profile.getWinRate() <= 1.0, profile.getName());
            assertTrue(profile.getAvgScore() >= 0.0 && profile.getAvgScore() <= 1.0, profile.getName());
        }
    }

    @Test
    void shouldRaiseWeightOfConsistentlyPreferredModel() {
        for (int i = 0; i < 50; i++) {
            optimizer.updateWeightsFromFeedback("sort a list", Map.of(MODEL_A, "a", MODEL_B, "b"), MODEL_A,
                    OptionalDouble.of(1.0));
        }

        Map<String, Double> weights = optimizer.getModelWeights();
        assertEquals(properties.getPreference().getMaxWeight(), weights.get(MODEL_A));
        assertEquals(1.0, weights.get(MODEL_B));
        assertTrue(optimizer.getProfile(MODEL_B).orElseThrow().getWinRate() < 0.5);
    }

    @Test
    void shouldBlendScoreIntoAverage() {
        optimizer.updateWeightsFromFeedback("q", Map.of(MODEL_A, "a"), MODEL_A, OptionalDouble.of(1.0));

        assertEquals(0.55, optimizer.getProfile(MODEL_A).orElseThrow().getAvgScore(), 1e-9);
    }

    @Test
    void shouldIgnoreUnknownSelectedModel() {
        Map<String, Double> before = optimizer.getModelWeights();

        optimizer.updateWeightsFromFeedback("q", Map.of("ghost", "x"), "ghost", OptionalDouble.of(1.0));

        assertEquals(before, optimizer.getModelWeights());
    }

    @Test
    void shouldRecordPerformanceByKeywordAndQueryType() {
        optimizer.updateWeightsFromFeedback("Why does the parser fail?", Map.of(MODEL_A, "a"), MODEL_A,
                OptionalDouble.of(0.8));

        Map<String, Map<String, RunningScore>> cache = optimizer.getPerformanceCache();
        assertTrue(cache.containsKey("parser"));
        assertTrue(cache.containsKey("type:why"));
        assertEquals(0.8, cache.get("type:why").get(MODEL_A).score(), 1e-9);
    }

    @Test
    void shouldSkipPerformanceCacheWithoutScore() {
        optimizer.updateWeightsFromFeedback("Why does the parser fail?", Map.of(MODEL_A, "a"), MODEL_A,
                OptionalDouble.empty());

        assertTrue(optimizer.getPerformanceCache().isEmpty());
    }

    @Test
    void shouldResetWeights() {
        optimizer.updateWeightsFromFeedback("q", Map.of(MODEL_A, "a", MODEL_B, "b"), MODEL_A,
                OptionalDouble.of(1.0));

        optimizer.resetWeights();

        assertEquals(1.0, optimizer.getModelWeights().get(MODEL_A));
    }

    @Test
    void shouldDropStopWordsAndShortTokens() {
        assertEquals(List.of("why", "parser", "fail?"), PreferenceOptimizer.extractKeywords("Why does the parser fail?"));
    }

    private static ModelDefinition model(String name, Map<String, Double> strengths) {
        return ModelDefinition.builder()
                .name(name)
                .role("assistant")
                .strengths(strengths)
                .build();
    }
}
