package me.golemcore.router.adapter.outbound.storage;

import me.golemcore.router.domain.model.ComparisonRecord;
import me.golemcore.router.domain.model.FeedbackEntry;
import me.golemcore.router.domain.model.FeedbackRecord;
import me.golemcore.router.domain.model.FeedbackScore;
import me.golemcore.router.domain.model.FeedbackSummary;
import me.golemcore.router.domain.model.StatRecord;
import me.golemcore.router.infrastructure.config.AutoConfiguration;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcFeedbackStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30.123456Z");

    @TempDir
    Path tempDir;

    private DataSource dataSource;
    private RouterProperties properties;
    private JdbcFeedbackStore store;

    @BeforeEach
    void setUp() {
        Path dbPath = tempDir.resolve("feedback");
        dataSource = AutoConfiguration.h2DataSource(dbPath);
        properties = new RouterProperties();
        properties.getStorage().setDbPath(dbPath.toString());
    }

    private JdbcFeedbackStore openStore() {
        JdbcFeedbackStore opened = new JdbcFeedbackStore(dataSource, AutoConfiguration.objectMapper(), properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        opened.init();
        return opened;
    }

    @Test
    void shouldRoundTripFeedback() {
        store = openStore();
        FeedbackRecord record = feedback("fb_1", NOW, FeedbackScore.of(0.75));
        record.setComment("clear answer");
        record.getMetadata().put("source", "test");

        assertTrue(store.saveFeedback(record));
        FeedbackRecord loaded = store.getFeedback("fb_1").orElseThrow();

        assertEquals(record, loaded);
        assertEquals(NOW, loaded.getTimestamp());
        assertEquals(List.of("A", "B"), List.copyOf(loaded.getResponses().keySet()));
    }

    @Test
    void shouldRoundTripRangeScore() {
        store = openStore();
        store.saveFeedback(feedback("fb_range", NOW, FeedbackScore.range(0.75, 0.5)));

        FeedbackRecord loaded = store.getFeedback("fb_range").orElseThrow();

        FeedbackScore.Range range = assertInstanceOf(FeedbackScore.Range.class, loaded.getScore());
        assertEquals(0.5, range.low());
        assertEquals(0.75, range.high());
        assertEquals(0.625, loaded.getScoreValue());
        assertFalse(loaded.getMetadata().containsKey(JdbcFeedbackStore.SCORE_LOW_KEY));
        assertEquals(1, store.getCountByScore(0.625, 0.625));
    }

    @Test
    void shouldRoundTripComparison() {
        store = openStore();
        ComparisonRecord comparison = comparison("cmp_1", NOW);

        assertTrue(store.saveComparison(comparison));

        assertEquals(Optional.of(comparison), store.getComparison("cmp_1"));
        assertTrue(store.getComparison("missing").isEmpty());
    }

    @Test
    void shouldListEverythingNewestFirst() {
        store = openStore();
        store.saveFeedback(feedback("old", NOW.minusSeconds(60), FeedbackScore.absent()));
        store.saveComparison(comparison("cmp_mid", NOW.minusSeconds(30)));
        store.saveFeedback(feedback("new", NOW, FeedbackScore.of(0.5)));

        List<FeedbackEntry> all = store.getAllFeedback();

        assertEquals(List.of("new", "cmp_mid", "old"), all.stream().map(FeedbackEntry::getId).toList());
        assertEquals(FeedbackEntry.TYPE_PAIRWISE_COMPARISON, all.get(1).getType());
        assertEquals(FeedbackEntry.TYPE_FEEDBACK, all.get(0).getType());
        assertEquals(3, store.getTotalCount());
    }

    @Test
    void shouldCountScoredFeedbackWithInclusiveBounds() {
        store = openStore();
        store.saveFeedback(feedback("f1", NOW, FeedbackScore.of(0.9)));
        store.saveFeedback(feedback("f2", NOW, FeedbackScore.of(0.3)));
        store.saveFeedback(feedback("f3", NOW, FeedbackScore.of(0.5)));
        store.saveFeedback(feedback("f4", NOW, FeedbackScore.absent()));

        assertEquals(3, store.getCountByScore(null, null));
        assertEquals(1, store.getCountByScore(0.7, null));
        assertEquals(1, store.getCountByScore(null, 0.3));
        assertEquals(2, store.getCountByScore(0.3, 0.5));
    }

    @Test
    void shouldDeleteAndClear() {
        store = openStore();
        store.saveFeedback(feedback("f1", NOW, FeedbackScore.of(0.9)));
        store.saveComparison(comparison("c1", NOW));
        store.updateStat("feedback_score", 0.9, Map.of());

        assertTrue(store.deleteFeedback("f1"));
        assertFalse(store.deleteFeedback("f1"));
        assertTrue(store.deleteComparison("c1"));
        assertTrue(store.clearAllData());
        assertEquals(0, store.getTotalCount());
        assertTrue(store.getStats(null, 10).isEmpty());
    }

    @Test
    void shouldRecordAndFilterStats() {
        store = openStore();
        store.updateStat("feedback_score", 0.9, Map.of("model", "A"));
        store.updateStat("latency", 120.0, Map.of());
        store.updateStat("feedback_score", 0.4, Map.of("model", "B"));

        List<StatRecord> scores = store.getStats("feedback_score", 10);

        assertEquals(2, scores.size());
        assertTrue(scores.stream().allMatch(stat -> "feedback_score".equals(stat.getStatType())));
        assertEquals(3, store.getStats(null, 0).size());
        assertEquals(1, store.getStats(null, 1).size());
        assertFalse(store.updateStat(" ", 1.0, Map.of()));
    }

    @Test
    void shouldSummarizeFeedback() {
        store = openStore();
        store.saveFeedback(feedback("f1", NOW, FeedbackScore.of(0.9)));
        store.saveFeedback(feedback("f2", NOW.minusSeconds(86_400), FeedbackScore.of(0.2)));
        store.saveFeedback(feedback("f3", NOW, FeedbackScore.of(0.5)));
        store.saveComparison(comparison("c1", NOW));

        FeedbackSummary summary = store.getFeedbackSummary();

        assertEquals(3, summary.getTotalScored());
        assertEquals(1, summary.getPositive());
        assertEquals(1, summary.getNegative());
        assertEquals(1, summary.getNeutral());
        assertEquals(1.6 / 3, summary.getAverageScore(), 1e-9);
        assertEquals(Map.of("A", 3L), summary.getModelDistribution());
        assertEquals(1, summary.getComparisonCount());
        assertEquals(2L, summary.getDailyCounts().get("2026-03-01"));
        assertEquals(1L, summary.getDailyCounts().get("2026-02-28"));
    }

    @Test
    void shouldRepairLegacyTableAndKeepRows() {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("CREATE TABLE feedback (id VARCHAR(64) PRIMARY KEY, timestamp VARCHAR(40), query VARCHAR, "
                + "responses_json VARCHAR, selected_response VARCHAR(255), feedback_score DOUBLE PRECISION, "
                + "feedback_text VARCHAR)");
        jdbc.update("INSERT INTO feedback VALUES ('legacy', '2026-02-01T00:00:00.000000Z', 'old query', "
                + "'{\"A\":\"x\"}', 'A', 0.8, NULL)");

        store = openStore();

        FeedbackRecord legacy = store.getFeedback("legacy").orElseThrow();
        assertEquals("", legacy.getConversationId());
        assertEquals("old query", legacy.getQuery());
        assertEquals(0.8, legacy.getScoreValue());
        assertEquals(Map.of("A", "x"), legacy.getResponses());
        assertTrue(legacy.getMetadata().isEmpty());
        assertTrue(store.getSchemaManager().repair().isEmpty());
    }

    @Test
    void shouldRepairAndRetryWhenColumnDisappears() {
        store = openStore();
        store.saveFeedback(feedback("before", NOW, FeedbackScore.of(0.5)));
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("DROP INDEX IF EXISTS idx_feedback_conversation");
        jdbc.execute("ALTER TABLE feedback DROP COLUMN conversation_id");

        assertTrue(store.saveFeedback(feedback("after", NOW, FeedbackScore.of(0.6))));

        assertEquals("", store.getFeedback("before").orElseThrow().getConversationId());
        assertEquals("conv-1", store.getFeedback("after").orElseThrow().getConversationId());
    }

    @Test
    void shouldDetectMissingColumnErrors() {
        store = openStore();
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        DataAccessException error = assertThrows(DataAccessException.class,
                () -> jdbc.queryForList("SELECT no_such_column FROM feedback"));

        assertTrue(SchemaManager.isMissingColumn(error));
        assertFalse(SchemaManager.isMissingColumn(new IllegalStateException("other")));
    }

    @Test
    void shouldBackupAndRestore() throws IOException {
        store = openStore();
        store.saveFeedback(feedback("kept", NOW, FeedbackScore.of(0.9)));
        Path backup = store.backupDatabase(tempDir.resolve("manual.sql")).orElseThrow();
        store.saveFeedback(feedback("later", NOW, FeedbackScore.of(0.1)));

        assertTrue(store.restoreDatabase(backup));

        assertTrue(store.getFeedback("kept").isPresent());
        assertTrue(store.getFeedback("later").isEmpty());
        try (Stream<Path> files = Files.list(store.backupDirectory())) {
            assertTrue(files.anyMatch(file -> file.getFileName().toString().startsWith("feedback_backup_")));
        }
    }

    @Test
    void shouldKeepCurrentDataWhenRestoreScriptIsInvalid() throws IOException {
        store = openStore();
        store.saveFeedback(feedback("kept", NOW, FeedbackScore.of(0.9)));
        store.saveComparison(comparison("cmp_kept", NOW));
        Path corrupt = tempDir.resolve("corrupt.sql");
        Files.writeString(corrupt, "THIS IS NOT SQL;");

        assertFalse(store.restoreDatabase(corrupt));

        assertTrue(store.getFeedback("kept").isPresent());
        assertTrue(store.getComparison("cmp_kept").isPresent());
        assertEquals(2, store.getTotalCount());
        assertTrue(store.saveFeedback(feedback("after", NOW, FeedbackScore.of(0.4))));
        assertEquals(3, store.getTotalCount());
    }

    @Test
    void shouldRefuseRestoreFromMissingFile() {
        store = openStore();

        assertFalse(store.restoreDatabase(tempDir.resolve("missing.sql")));
        assertFalse(store.restoreDatabase(null));
    }

    @Test
    void shouldRejectRecordsWithoutId() {
        store = openStore();

        assertFalse(store.saveFeedback(FeedbackRecord.builder().build()));
        assertFalse(store.saveComparison(ComparisonRecord.builder().build()));
    }

    private static FeedbackRecord feedback(String id, Instant timestamp, FeedbackScore score) {
        Map<String, String> responses = new LinkedHashMap<>();
        responses.put("A", "first answer");
        responses.put("B", "second answer");
        return FeedbackRecord.builder()
                .id(id)
                .timestamp(timestamp)
                .conversationId("conv-1")
                .query("How do I sort?")
                .responses(responses)
                .selectedModel("A")
                .score(score)
                .build();
    }

    private static ComparisonRecord comparison(String id, Instant timestamp) {
        return ComparisonRecord.builder()
                .id(id)
                .timestamp(timestamp)
                .conversationId("conv-1")
                .query("How do I sort?")
                .chosen("first answer")
                .rejected("second answer")
                .chosenModel("A")
                .rejectedModel("B")
                .build();
    }
}
