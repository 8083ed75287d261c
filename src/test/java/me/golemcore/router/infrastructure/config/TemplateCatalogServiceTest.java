package me.golemcore.router.infrastructure.config;

import me.golemcore.router.domain.model.ComplexityTier;
import me.golemcore.router.domain.model.TemplateDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateCatalogServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadBundledTemplatesInOrder() {
        TemplateCatalogService service = new TemplateCatalogService(new RouterProperties());

        service.init();

        List<String> names = service.getTemplates().stream().map(TemplateDefinition::getName).toList();
        assertEquals(List.of("general", "programming", "step_by_step", "creative", "analysis"), names);
        TemplateDefinition programming = service.getTemplates().get(1);
        assertEquals(List.of("how_to", "code", "technical_explanation"), programming.getUseCases());
        assertTrue(programming.getTemplate().contains(TemplateDefinition.QUERY_PLACEHOLDER));
    }

    @Test
    void shouldReadOverrideFile() throws IOException {
        Path file = tempDir.resolve("templates.yml");
        Files.writeString(file, """
                templates:
                  - name: terse
                    complexity: low
                    template: "Answer briefly: {query}"
                  - name: broken
                """);
        RouterProperties properties = new RouterProperties();
        properties.getCatalog().setTemplatesPath(file.toString());
        TemplateCatalogService service = new TemplateCatalogService(properties);

        service.init();

        assertEquals(1, service.getTemplates().size());
        TemplateDefinition terse = service.getTemplates().get(0);
        assertEquals("terse", terse.getName());
        assertEquals(ComplexityTier.LOW, terse.tier());
    }

    @Test
    void shouldSkipInvalidDefinitions() {
        TemplateCatalogService service = new TemplateCatalogService(new RouterProperties());

        service.replaceTemplates(Arrays.asList(null, TemplateDefinition.builder().name("x").build(),
                TemplateDefinition.identity()));

        assertEquals(List.of(TemplateDefinition.identity()), service.getTemplates());
    }
}
