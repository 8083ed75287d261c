package me.golemcore.router.domain.service;

import me.golemcore.router.domain.model.QueryProfile;
import me.golemcore.router.domain.model.QueryType;
import me.golemcore.router.domain.model.RunningScore;
import me.golemcore.router.domain.model.TemplateDefinition;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.infrastructure.config.TemplateCatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateSelectorTest {

    private RouterProperties properties;
    private TemplateCatalogService catalog;
    private TemplateSelector selector;

    @BeforeEach
    void setUp() {
        properties = new RouterProperties();
        catalog = new TemplateCatalogService(properties);
        catalog.replaceTemplates(List.of(
                template("general", List.of("general"), List.of(), "medium"),
                template("programming", List.of("technology"), List.of("code", "how_to"), "medium"),
                template("creative", List.of("arts"), List.of("creative"), "medium")));
        selector = new TemplateSelector(catalog, properties);
    }

    @Test
    void shouldPreferDomainAndUseCaseMatch() {
        QueryProfile profile = QueryProfile.builder()
                .domain("technology")
                .queryType(QueryType.HOW_TO)
                .requiresCode(true)
                .complexity(5.0)
                .build();

        assertEquals("programming", selector.select(profile).getName());
    }

    @Test
    void shouldScoreDomainUseCaseAndTier() {
        QueryProfile profile = QueryProfile.builder()
                .domain("technology")
                .queryType(QueryType.HOW_TO)
                .requiresCode(true)
                .complexity(5.0)
                .build();
        TemplateDefinition programming = catalog.getTemplates().get(1);

        // domain 3 + how_to 2 + code 2 + medium tier 2
        assertEquals(9, selector.scoreBestMatch(profile, programming));
    }

    @Test
    void shouldFallBackToGeneralTemplate() {
        QueryProfile profile = QueryProfile.builder().domain("health").complexity(5.0).build();

        assertEquals("general", selector.select(profile).getName());
    }

    @Test
    void shouldKeepFirstTemplateOnTie() {
        catalog.replaceTemplates(List.of(
                template("first", List.of("science"), List.of(), "low"),
                template("second", List.of("science"), List.of(), "low")));
        QueryProfile profile = QueryProfile.builder().domain("science").complexity(1.0).build();

        assertEquals("first", selector.select(profile).getName());
    }

    @Test
    void shouldReturnIdentityTemplateWhenCatalogEmpty() {
        catalog.replaceTemplates(List.of());

        TemplateDefinition selected = selector.select(QueryProfile.neutral());

        assertEquals(TemplateDefinition.IDENTITY_NAME, selected.getName());
        assertEquals("{query}", selected.getTemplate());
    }

    @Test
    void shouldPickBestPerformingMatchingTemplate() {
        properties.getPrompt().setTemplateSelectionStrategy("performance_based");
        selector.recordPerformance("general", 0.2);
        selector.recordPerformance("programming", 0.9);
        QueryProfile profile = QueryProfile.builder().domain("technology").complexity(5.0).build();

        assertEquals("programming", selector.select(profile).getName());
    }

    @Test
    void shouldAverageRecordedScoresAndClamp() {
        selector.recordPerformance("general", 1.0);
        selector.recordPerformance("general", 5.0);
        selector.recordPerformance("general", 0.0);

        RunningScore score = selector.getPerformance().get("general");
        assertEquals(3, score.count());
        assertEquals(2.0 / 3.0, score.score(), 1e-9);
    }

    @Test
    void shouldIgnoreBlankTemplateNames() {
        selector.recordPerformance(" ", 1.0);
        selector.recordPerformance(null, 1.0);

        assertTrue(selector.getPerformance().isEmpty());
    }

    private static TemplateDefinition template(String name, List<String> domains, List<String> useCases,
            String complexity) {
        return TemplateDefinition.builder()
                .name(name)
                .template("[" + name + "] {query}")
                .domains(domains)
                .useCases(useCases)
                .complexity(complexity)
                .build();
    }
}
