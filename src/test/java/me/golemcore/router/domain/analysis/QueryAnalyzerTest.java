package me.golemcore.router.domain.analysis;

import me.golemcore.router.domain.model.FormatRequirement;
import me.golemcore.router.domain.model.QueryProfile;
import me.golemcore.router.domain.model.QueryType;
import me.golemcore.router.domain.model.Sentiment;
import me.golemcore.router.domain.model.Urgency;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryAnalyzerTest {

    private static final String MEMORY_LEAK_QUERY = "Why does memory leak in this code? Please explain step by step";

    private QueryAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        RouterProperties properties = new RouterProperties();
        properties.getAnalysis().setCacheSize(4);
        analyzer = new QueryAnalyzer(properties);
    }

    @Test
    void shouldProfileDebuggingQuestion() {
        QueryProfile profile = analyzer.analyze(MEMORY_LEAK_QUERY);

        assertEquals("technology", profile.getDomain());
        assertEquals(QueryType.WHY, profile.getQueryType());
        assertTrue(profile.hasFormat(FormatRequirement.STEP_BY_STEP));
        assertTrue(profile.isRequiresCode());
        assertTrue(profile.isRequiresReasoning());
        assertFalse(profile.isRequiresCreativity());
        assertEquals(1.92, profile.getComplexity(), 1e-9);
        assertEquals(Set.of("english"), profile.getLanguages());
        assertTrue(profile.getTopics().contains("code"));
    }

    @Test
    void shouldReturnCachedProfileForSameText() {
        QueryProfile first = analyzer.analyze("How to design a database schema?");
        QueryProfile second = analyzer.analyze("How to design a database schema?");

        assertSame(first, second);
        assertEquals(1, analyzer.cacheSize());
    }

    @Test
    void shouldProduceEqualProfilesAfterCacheClear() {
        QueryProfile first = analyzer.analyze(MEMORY_LEAK_QUERY);
        analyzer.clearCache();
        QueryProfile second = analyzer.analyze(MEMORY_LEAK_QUERY);

        assertEquals(first, second);
    }

    @Test
    void shouldKeepCacheBounded() {
        for (int i = 0; i < 10; i++) {
            analyzer.analyze("query number " + i);
        }

        assertEquals(4, analyzer.cacheSize());
    }

    @Test
    void shouldTreatNullAsEmptyQuery() {
        QueryProfile profile = analyzer.analyze(null);

        assertEquals(QueryProfile.GENERAL_DOMAIN, profile.getDomain());
        assertEquals(QueryType.STATEMENT, profile.getQueryType());
        assertEquals(0.0, profile.getComplexity());
        assertEquals(Set.of(QueryProfile.UNKNOWN_LANGUAGE), profile.getLanguages());
    }

    @Test
    void shouldAlwaysReportAtLeastOneLanguage() {
        String[] queries = { "", "12345 ?!", "hello", "\u4f60\u597d", "Python \u4ee3\u7801" };
        for (String query : queries) {
            assertFalse(analyzer.analyze(query).getLanguages().isEmpty(), query);
        }
    }

    @Test
    void shouldDetectChineseAndEnglishTogether() {
        QueryProfile profile = analyzer.analyze("Python \u4ee3\u7801");

        assertEquals(Set.of("chinese", "english"), profile.getLanguages());
    }

    @Test
    void shouldMatchKeywordsOnlyAtWordStart() {
        QueryProfile profile = analyzer.analyze("Let us start the engine");

        assertFalse(profile.getTopics().contains("art"));
        assertEquals(QueryProfile.GENERAL_DOMAIN, profile.getDomain());
    }

    @Test
    void shouldMatchShortKeywordsOnlyAsWholeWords() {
        QueryProfile profile = analyzer.analyze("We aim to research air quality");

        assertFalse(profile.getTopics().contains("ai"));
        assertEquals("science", profile.getDomain());

        QueryProfile aiProfile = analyzer.analyze("Which AI tools help with writing?");
        assertTrue(aiProfile.getTopics().contains("ai"));
        assertEquals("technology", aiProfile.getDomain());
    }

    @Test
    void shouldKeepPrefixMatchingForLongerKeywords() {
        assertTrue(QueryRules.matches("a musical evening", "music"));
        assertFalse(QueryRules.matches("the airline", "ai"));
        assertTrue(QueryRules.matches("ai, ml and data", "ai"));
        assertTrue(QueryRules.matches("really?", "?"));
    }

    @Test
    void shouldCapComplexityAtTen() {
        String longQuery = "why explain analyze compare evaluate, ".repeat(60);

        assertEquals(10.0, analyzer.analyze(longQuery).getComplexity());
    }

    @Test
    void shouldDetectSentimentAndUrgency() {
        QueryProfile profile = analyzer.analyze("I need an urgent fix, the last answer was bad and poor");

        assertEquals(Sentiment.NEGATIVE, profile.getSentiment());
        assertEquals(Urgency.HIGH, profile.getUrgency());
    }

    @Test
    void shouldPreferEarlierDomainOnTie() {
        QueryProfile profile = analyzer.analyze("software for business");

        assertEquals("technology", profile.getDomain());
    }

    @Test
    void shouldClassifyPlainQuestionMark() {
        assertEquals(QueryType.QUESTION, analyzer.analyze("Is it raining?").getQueryType());
    }
}
