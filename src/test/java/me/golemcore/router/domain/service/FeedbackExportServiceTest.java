package me.golemcore.router.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.router.domain.model.ComparisonRecord;
import me.golemcore.router.domain.model.ExportFormat;
import me.golemcore.router.domain.model.ExportOptions;
import me.golemcore.router.domain.model.FeedbackEntry;
import me.golemcore.router.domain.model.FeedbackRecord;
import me.golemcore.router.domain.model.FeedbackScore;
import me.golemcore.router.infrastructure.config.AutoConfiguration;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.FeedbackStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FeedbackExportServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    @TempDir
    Path tempDir;

    private FeedbackStorePort store;
    private RouterProperties properties;
    private ObjectMapper objectMapper;
    private FeedbackExportService exportService;

    @BeforeEach
    void setUp() {
        store = mock(FeedbackStorePort.class);
        properties = new RouterProperties();
        properties.getExport().setDirectory(tempDir.resolve("default-exports").toString());
        objectMapper = AutoConfiguration.objectMapper();
        exportService = new FeedbackExportService(store, objectMapper, properties, Clock.fixed(NOW, ZoneOffset.UTC),
                new Random(3));
    }

    @Test
    void shouldWriteJsonBundleWithTrainingFields() throws IOException {
        when(store.getAllFeedback()).thenReturn(List.of(feedback("fb_1", 0.9), comparison("cmp_1")));

        Path file = exportService.export(tempDir, ExportOptions.defaults()).orElseThrow();

        assertTrue(file.getFileName().toString().startsWith("feedback_export_"));
        assertTrue(file.getFileName().toString().endsWith(".json"));
        JsonNode root = objectMapper.readTree(file.toFile());
        assertEquals("1.0", root.path("metadata").path("version").asText());
        assertEquals(2, root.path("metadata").path("record_count").asInt());
        assertFalse(root.path("metadata").path("split").asBoolean());

        JsonNode item = root.path("feedback").get(0);
        assertEquals("fb_1", item.path("id").asText());
        assertEquals("How do I sort?", item.path("prompt").asText());
        assertEquals("use sorted()", item.path("response").asText());
        assertEquals(0.9, item.path("score").asDouble());
        assertEquals("A", item.path("model").asText());
        assertEquals("conv-1", item.path("conversation_id").asText());

        JsonNode pair = root.path("comparisons").get(0);
        assertEquals("A", pair.path("chosen_model").asText());
        assertEquals("B", pair.path("rejected_model").asText());
        assertEquals("loop", pair.path("rejected").asText());
        assertFalse(root.has("train"));
    }

    @Test
    void shouldSplitIntoTrainAndEval() throws IOException {
        List<FeedbackEntry> entries = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            entries.add(feedback("fb_" + i, 0.5));
        }
        when(store.getAllFeedback()).thenReturn(entries);
        ExportOptions options = ExportOptions.builder().split(true).evalRatio(0.2).build();

        Path file = exportService.export(tempDir, options).orElseThrow();

        JsonNode root = objectMapper.readTree(file.toFile());
        assertEquals(8, root.path("train").path("feedback").size());
        assertEquals(2, root.path("eval").path("feedback").size());
        assertTrue(root.path("metadata").path("split").asBoolean());
    }

    @Test
    void shouldKeepAtLeastOneItemInTrain() {
        List<List<String>> parts = exportService.partition(List.of("only"), 0.9);

        assertEquals(List.of("only"), parts.get(0));
        assertTrue(parts.get(1).isEmpty());
    }

    @Test
    void shouldFilterByMinScoreButKeepComparisons() {
        List<FeedbackEntry> entries = List.of(feedback("high", 0.9), feedback("low", 0.2), feedback("none", null),
                comparison("cmp_1"));
        ExportOptions options = ExportOptions.builder().minScore(0.5).build();

        List<FeedbackEntry> selected = exportService.select(entries, options);

        assertEquals(List.of("high", "cmp_1"), selected.stream().map(FeedbackEntry::getId).toList());
    }

    @Test
    void shouldLimitRecordsAndDropComparisons() {
        List<FeedbackEntry> entries = List.of(feedback("a", 0.9), comparison("cmp_1"), feedback("b", 0.4),
                feedback("c", 0.1));
        ExportOptions options = ExportOptions.builder().includeComparisons(false).maxRecords(2).build();

        List<FeedbackEntry> selected = exportService.select(entries, options);

        assertEquals(List.of("a", "b"), selected.stream().map(FeedbackEntry::getId).toList());
    }

    @Test
    void shouldWriteOneJsonObjectPerLine() throws IOException {
        when(store.getAllFeedback()).thenReturn(List.of(feedback("fb_1", 0.9), comparison("cmp_1")));
        ExportOptions options = ExportOptions.builder().format(ExportFormat.JSONL).build();

        Path file = exportService.export(tempDir, options).orElseThrow();

        assertTrue(file.toString().endsWith(".jsonl"));
        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        assertEquals("fb_1", objectMapper.readTree(lines.get(0)).path("id").asText());
        assertEquals("cmp_1", objectMapper.readTree(lines.get(1)).path("id").asText());
    }

    @Test
    void shouldUseConfiguredDirectoryByDefault() {
        when(store.getAllFeedback()).thenReturn(List.of());

        Path file = exportService.export(null, null).orElseThrow();

        assertEquals(tempDir.resolve("default-exports").toAbsolutePath().normalize(), file.getParent());
    }

    @Test
    void shouldReturnEmptyWhenDirectoryUnwritable() throws IOException {
        when(store.getAllFeedback()).thenReturn(List.of(feedback("fb_1", 0.9)));
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");

        Optional<Path> exported = exportService.export(blocker, ExportOptions.defaults());

        assertTrue(exported.isEmpty());
    }

    private static FeedbackRecord feedback(String id, Double score) {
        Map<String, String> responses = new LinkedHashMap<>();
        responses.put("A", "use sorted()");
        responses.put("B", "loop");
        return FeedbackRecord.builder()
                .id(id)
                .timestamp(NOW)
                .conversationId("conv-1")
                .query("How do I sort?")
                .responses(responses)
                .selectedModel("A")
                .score(FeedbackScore.of(score))
                .build();
    }

    private static ComparisonRecord comparison(String id) {
        return ComparisonRecord.builder()
                .id(id)
                .timestamp(NOW)
                .conversationId("conv-1")
                .query("How do I sort?")
                .chosen("use sorted()")
                .rejected("loop")
                .chosenModel("A")
                .rejectedModel("B")
                .build();
    }
}
