package me.golemcore.router.domain.service;

import me.golemcore.router.domain.model.FormatRequirement;
import me.golemcore.router.domain.model.QueryProfile;
import me.golemcore.router.domain.model.QueryType;
import me.golemcore.router.domain.model.TemplateDefinition;
import me.golemcore.router.domain.model.Urgency;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptComposerTest {

    private RouterProperties properties;
    private PromptComposer composer;

    @BeforeEach
    void setUp() {
        properties = new RouterProperties();
        composer = new PromptComposer(properties);
    }

    @Test
    void shouldSubstitutePlaceholders() {
        properties.getPrompt().setDynamicInstructionTuning(false);
        QueryProfile profile = QueryProfile.builder()
                .domain("science")
                .complexity(4.5)
                .queryType(QueryType.WHAT_IS)
                .formatRequirements(Set.of(FormatRequirement.SUMMARY))
                .build();
        TemplateDefinition template = TemplateDefinition.builder()
                .name("analysis")
                .template("Domain: {domain} ({complexity}, {query_type}). {format_requirements}\nQ: {query}")
                .build();

        String prompt = composer.compose("What is entropy?", profile, template);

        assertEquals("Domain: science (4.5, what_is). " + FormatRequirement.SUMMARY.instruction()
                + "\nQ: What is entropy?", prompt);
    }

    @Test
    void shouldNotExpandPlaceholdersInsideQuery() {
        properties.getPrompt().setDynamicInstructionTuning(false);
        QueryProfile profile = QueryProfile.builder().domain("technology").complexity(5.0).build();
        TemplateDefinition template = TemplateDefinition.builder().name("t").template("{query}").build();

        String prompt = composer.compose("print {domain}", profile, template);

        assertEquals("print {domain}", prompt);
    }

    @Test
    void shouldAppendDynamicInstructions() {
        QueryProfile profile = QueryProfile.builder()
                .complexity(1.0)
                .requiresCode(true)
                .urgency(Urgency.HIGH)
                .build();

        String prompt = composer.compose("fix it", profile, TemplateDefinition.identity());

        assertEquals("fix it\n\n" + PromptComposer.CONCISE_INSTRUCTION + " " + PromptComposer.CODE_INSTRUCTION
                + " " + PromptComposer.URGENCY_INSTRUCTION, prompt);
    }

    @Test
    void shouldAddChineseInstructionForChineseQueries() {
        QueryProfile profile = QueryProfile.builder()
                .complexity(5.0)
                .languages(Set.of("chinese"))
                .build();

        String prompt = composer.compose("q", profile, TemplateDefinition.identity());

        assertTrue(prompt.endsWith(PromptComposer.CHINESE_INSTRUCTION));
    }

    @Test
    void shouldDropInstructionsBeforeExceedingLimit() {
        properties.getPrompt().setMaxPromptChars(40);
        QueryProfile profile = QueryProfile.builder().complexity(9.0).requiresReasoning(true).build();

        String prompt = composer.compose("short query", profile, TemplateDefinition.identity());

        assertEquals("short query", prompt);
        assertFalse(prompt.contains(PromptComposer.COMPREHENSIVE_INSTRUCTION));
    }

    @Test
    void shouldFallBackToRawQueryWhenTemplateTooLong() {
        properties.getPrompt().setMaxPromptChars(20);
        properties.getPrompt().setDynamicInstructionTuning(false);
        TemplateDefinition template = TemplateDefinition.builder()
                .name("verbose")
                .template("A very long preamble that does not fit: {query}")
                .build();

        String prompt = composer.compose("tiny", QueryProfile.neutral(), template);

        assertEquals("tiny", prompt);
    }
}
