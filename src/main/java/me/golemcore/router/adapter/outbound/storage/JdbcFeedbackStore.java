package me.golemcore.router.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.ComparisonRecord;
import me.golemcore.router.domain.model.FeedbackEntry;
import me.golemcore.router.domain.model.FeedbackRecord;
import me.golemcore.router.domain.model.FeedbackScore;
import me.golemcore.router.domain.model.FeedbackSummary;
import me.golemcore.router.domain.model.StatRecord;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.FeedbackStorePort;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Feedback store on an embedded H2 file database.
 *
 * <p>
 * Every mutation runs in its own transaction. A statement that fails because
 * a column is missing triggers {@link SchemaManager#repair()} and is retried
 * once. Backup and restore take the write side of a read/write lock, so they
 * never interleave with regular operations, which share the read side.
 */
@Component
@Slf4j
public class JdbcFeedbackStore implements FeedbackStorePort {

    static final String SCORE_LOW_KEY = "score_low";
    static final String SCORE_HIGH_KEY = "score_high";

    private static final int MAX_ATTEMPTS = 2;
    private static final int DEFAULT_STATS_LIMIT = 100;
    private static final double POSITIVE_THRESHOLD = 0.8;
    private static final double NEGATIVE_THRESHOLD = 0.3;
    private static final Duration DAILY_WINDOW = Duration.ofDays(30);
    private static final DateTimeFormatter BACKUP_NAME_FORMAT = DateTimeFormatter
            .ofPattern("yyyyMMdd_HHmmss_SSS")
            .withZone(ZoneOffset.UTC);
    private static final TypeReference<LinkedHashMap<String, String>> RESPONSES_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String FEEDBACK_COLUMNS = "id, timestamp, conversation_id, query, responses_json, "
            + "selected_response, feedback_score, feedback_text, metadata_json";
    private static final String COMPARISON_COLUMNS = "id, timestamp, conversation_id, query, chosen, rejected, "
            + "chosen_model, rejected_model, metadata_json";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SchemaManager schemaManager;
    private final ObjectMapper objectMapper;
    private final RouterProperties properties;
    private final Clock clock;
    private final ReentrantReadWriteLock exclusiveLock = new ReentrantReadWriteLock();

    public JdbcFeedbackStore(DataSource dataSource, ObjectMapper objectMapper, RouterProperties properties,
            Clock clock) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.schemaManager = new SchemaManager(jdbcTemplate);
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        schemaManager.repair();
        log.info("[FeedbackStore] Initialized ({} records)", getTotalCount());
    }

    // ==================== FEEDBACK ====================

    @Override
    public boolean saveFeedback(FeedbackRecord feedback) {
        if (feedback == null || feedback.getId() == null) {
            log.warn("[FeedbackStore] Refusing to save feedback without id");
            return false;
        }
        try {
            String responsesJson = toJson(feedback.getResponses() != null ? feedback.getResponses() : Map.of());
            String metadataJson = toJson(metadataWithScore(feedback));
            Double score = feedback.getScoreValue();
            write("saveFeedback", () -> jdbcTemplate.update(
                    "MERGE INTO feedback (" + FEEDBACK_COLUMNS + ") KEY(id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    feedback.getId(),
                    StoreTimestamps.format(feedback.getTimestamp()),
                    nullToEmpty(feedback.getConversationId()),
                    nullToEmpty(feedback.getQuery()),
                    responsesJson,
                    nullToEmpty(feedback.getSelectedModel()),
                    score,
                    feedback.getComment(),
                    metadataJson));
            log.debug("[FeedbackStore] Saved feedback {}", feedback.getId());
            return true;
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to save feedback {}: {}", feedback.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean saveComparison(ComparisonRecord comparison) {
        if (comparison == null || comparison.getId() == null) {
            log.warn("[FeedbackStore] Refusing to save comparison without id");
            return false;
        }
        try {
            String metadataJson = toJson(comparison.getMetadata() != null ? comparison.getMetadata() : Map.of());
            write("saveComparison", () -> jdbcTemplate.update(
                    "MERGE INTO comparisons (" + COMPARISON_COLUMNS + ") KEY(id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    comparison.getId(),
                    StoreTimestamps.format(comparison.getTimestamp()),
                    nullToEmpty(comparison.getConversationId()),
                    nullToEmpty(comparison.getQuery()),
                    nullToEmpty(comparison.getChosen()),
                    nullToEmpty(comparison.getRejected()),
                    nullToEmpty(comparison.getChosenModel()),
                    nullToEmpty(comparison.getRejectedModel()),
                    metadataJson));
            return true;
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to save comparison {}: {}", comparison.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<FeedbackRecord> getFeedback(String id) {
        try {
            List<FeedbackRecord> rows = read("getFeedback", () -> jdbcTemplate.query(
                    "SELECT " + FEEDBACK_COLUMNS + " FROM feedback WHERE id = ?", feedbackMapper(), id));
            return rows.stream().findFirst();
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to load feedback {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<ComparisonRecord> getComparison(String id) {
        try {
            List<ComparisonRecord> rows = read("getComparison", () -> jdbcTemplate.query(
                    "SELECT " + COMPARISON_COLUMNS + " FROM comparisons WHERE id = ?", comparisonMapper(), id));
            return rows.stream().findFirst();
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to load comparison {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<FeedbackEntry> getAllFeedback() {
        try {
            return read("getAllFeedback", () -> {
                List<FeedbackEntry> entries = new ArrayList<>();
                entries.addAll(jdbcTemplate.query(
                        "SELECT " + FEEDBACK_COLUMNS + " FROM feedback ORDER BY timestamp DESC", feedbackMapper()));
                entries.addAll(jdbcTemplate.query(
                        "SELECT " + COMPARISON_COLUMNS + " FROM comparisons ORDER BY timestamp DESC",
                        comparisonMapper()));
                entries.sort(Comparator.comparing(FeedbackEntry::getTimestamp).reversed());
                return entries;
            });
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to scan feedback: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public long getTotalCount() {
        try {
            return read("getTotalCount", () -> count("SELECT COUNT(*) FROM feedback")
                    + count("SELECT COUNT(*) FROM comparisons"));
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to count records: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public long getCountByScore(Double minScore, Double maxScore) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM feedback WHERE feedback_score IS NOT NULL");
        List<Object> args = new ArrayList<>();
        if (minScore != null) {
            sql.append(" AND feedback_score >= ?");
            args.add(minScore);
        }
        if (maxScore != null) {
            sql.append(" AND feedback_score <= ?");
            args.add(maxScore);
        }
        try {
            return read("getCountByScore", () -> count(sql.toString(), args.toArray()));
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to count by score: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public boolean deleteFeedback(String id) {
        return delete("feedback", id);
    }

    @Override
    public boolean deleteComparison(String id) {
        return delete("comparisons", id);
    }

    @Override
    public boolean clearAllData() {
        try {
            write("clearAllData", () -> {
                jdbcTemplate.update("DELETE FROM feedback");
                jdbcTemplate.update("DELETE FROM comparisons");
                jdbcTemplate.update("DELETE FROM stats");
                return null;
            });
            log.info("[FeedbackStore] All data cleared");
            return true;
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to clear data: {}", e.getMessage());
            return false;
        }
    }

    // ==================== STATS ====================

    @Override
    public boolean updateStat(String statType, double value, Map<String, Object> metadata) {
        if (statType == null || statType.isBlank()) {
            return false;
        }
        try {
            String metadataJson = toJson(metadata != null ? metadata : Map.of());
            write("updateStat", () -> jdbcTemplate.update(
                    "INSERT INTO stats (id, timestamp, stat_type, value, metadata_json) VALUES (?, ?, ?, ?, ?)",
                    "stat_" + UUID.randomUUID(),
                    StoreTimestamps.format(clock.instant()),
                    statType,
                    value,
                    metadataJson));
            return true;
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to record stat {}: {}", statType, e.getMessage());
            return false;
        }
    }

    @Override
    public List<StatRecord> getStats(String statType, int limit) {
        int effectiveLimit = limit > 0 ? limit : DEFAULT_STATS_LIMIT;
        try {
            return read("getStats", () -> {
                if (statType == null || statType.isBlank()) {
                    return jdbcTemplate.query(
                            "SELECT id, timestamp, stat_type, value, metadata_json FROM stats "
                                    + "ORDER BY timestamp DESC LIMIT ?",
                            statMapper(), effectiveLimit);
                }
                return jdbcTemplate.query(
                        "SELECT id, timestamp, stat_type, value, metadata_json FROM stats WHERE stat_type = ? "
                                + "ORDER BY timestamp DESC LIMIT ?",
                        statMapper(), statType, effectiveLimit);
            });
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to load stats: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public FeedbackSummary getFeedbackSummary() {
        try {
            return read("getFeedbackSummary", () -> {
                long scored = count("SELECT COUNT(*) FROM feedback WHERE feedback_score IS NOT NULL");
                long positive = count("SELECT COUNT(*) FROM feedback WHERE feedback_score >= ?", POSITIVE_THRESHOLD);
                long negative = count("SELECT COUNT(*) FROM feedback WHERE feedback_score <= ?", NEGATIVE_THRESHOLD);
                Double average = jdbcTemplate.queryForObject(
                        "SELECT AVG(feedback_score) FROM feedback WHERE feedback_score IS NOT NULL", Double.class);

                Map<String, Long> distribution = new LinkedHashMap<>();
                jdbcTemplate.query("SELECT selected_response, COUNT(*) AS cnt FROM feedback "
                        + "GROUP BY selected_response ORDER BY cnt DESC, selected_response",
                        rs -> {
                            distribution.put(rs.getString(1), rs.getLong(2));
                        });

                Map<String, Long> daily = new LinkedHashMap<>();
                String cutoff = StoreTimestamps.format(clock.instant().minus(DAILY_WINDOW));
                jdbcTemplate.query("SELECT SUBSTRING(timestamp, 1, 10) AS day_key, COUNT(*) FROM feedback "
                        + "WHERE timestamp >= ? GROUP BY SUBSTRING(timestamp, 1, 10) ORDER BY day_key",
                        rs -> {
                            daily.put(rs.getString(1), rs.getLong(2));
                        }, cutoff);

                return FeedbackSummary.builder()
                        .totalScored(scored)
                        .positive(positive)
                        .negative(negative)
                        .neutral(Math.max(0, scored - positive - negative))
                        .averageScore(average != null ? average : 0.0)
                        .modelDistribution(distribution)
                        .comparisonCount(count("SELECT COUNT(*) FROM comparisons"))
                        .dailyCounts(daily)
                        .build();
            });
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to summarize feedback: {}", e.getMessage());
            return FeedbackSummary.empty();
        }
    }

    // ==================== BACKUP ====================

    @Override
    public Optional<Path> backupDatabase(Path target) {
        Lock lock = exclusiveLock.writeLock();
        lock.lock();
        try {
            Path file = target != null
                    ? target.toAbsolutePath()
                    : backupDirectory().resolve("feedback_backup_" + BACKUP_NAME_FORMAT.format(clock.instant())
                            + ".sql");
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            jdbcTemplate.execute("SCRIPT TO '" + sqlLiteral(file.toString()) + "'");
            log.info("[FeedbackStore] Backup written to {}", file);
            return Optional.of(file);
        } catch (IOException | DataAccessException e) {
            log.error("[FeedbackStore] Backup failed: {}", e.getMessage());
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean restoreDatabase(Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            log.error("[FeedbackStore] Backup file not found: {}", source);
            return false;
        }
        Lock lock = exclusiveLock.writeLock();
        lock.lock();
        try {
            Optional<Path> safety = backupDatabase(null);
            if (safety.isEmpty()) {
                log.error("[FeedbackStore] Restore aborted: could not back up current state");
                return false;
            }
            try {
                replaceContent(source);
                log.info("[FeedbackStore] Restored from {}", source);
                return true;
            } catch (DataAccessException e) {
                log.error("[FeedbackStore] Restore from {} failed: {}", source, e.getMessage());
                rollBackTo(safety.get());
                return false;
            }
        } finally {
            repairQuietly();
            lock.unlock();
        }
    }

    private void replaceContent(Path script) {
        jdbcTemplate.execute("DROP ALL OBJECTS");
        jdbcTemplate.execute("RUNSCRIPT FROM '" + sqlLiteral(script.toAbsolutePath().toString()) + "'");
    }

    private void rollBackTo(Path safety) {
        try {
            replaceContent(safety);
            log.warn("[FeedbackStore] Previous state reloaded from {}", safety);
        } catch (DataAccessException e) {
            log.error("[FeedbackStore] Could not reload previous state from {}: {}", safety, e.getMessage());
        }
    }

    Path backupDirectory() {
        Path dbPath = RouterProperties.resolvePath(properties.getStorage().getDbPath());
        Path parent = dbPath.getParent() != null ? dbPath.getParent() : dbPath;
        return parent.resolve(properties.getStorage().getBackupDir());
    }

    SchemaManager getSchemaManager() {
        return schemaManager;
    }

    // ==================== INTERNALS ====================

    private <T> T write(String operation, Supplier<T> action) {
        return withRepair(operation, () -> transactionTemplate.execute(status -> action.get()));
    }

    private <T> T read(String operation, Supplier<T> action) {
        return withRepair(operation, action);
    }

    private <T> T withRepair(String operation, Supplier<T> action) {
        Lock lock = exclusiveLock.readLock();
        lock.lock();
        try {
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                try {
                    return action.get();
                } catch (DataAccessException e) {
                    if (attempt < MAX_ATTEMPTS && SchemaManager.isMissingColumn(e)) {
                        log.warn("[FeedbackStore] {} hit a missing column, repairing schema and retrying",
                                operation);
                        repairQuietly();
                    } else {
                        throw new FeedbackStoreException(operation + " failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new FeedbackStoreException(operation + " failed after schema repair");
        } finally {
            lock.unlock();
        }
    }

    private void repairQuietly() {
        try {
            schemaManager.repair();
        } catch (DataAccessException e) {
            log.error("[FeedbackStore] Schema repair failed: {}", e.getMessage());
        }
    }

    private boolean delete(String table, String id) {
        try {
            Integer affected = write("delete", () -> jdbcTemplate.update("DELETE FROM " + table + " WHERE id = ?",
                    id));
            return affected != null && affected > 0;
        } catch (FeedbackStoreException e) {
            log.error("[FeedbackStore] Failed to delete {} from {}: {}", id, table, e.getMessage());
            return false;
        }
    }

    private long count(String sql, Object... args) {
        Long value = jdbcTemplate.queryForObject(sql, Long.class, args);
        return value != null ? value : 0;
    }

    private Map<String, Object> metadataWithScore(FeedbackRecord feedback) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (feedback.getMetadata() != null) {
            metadata.putAll(feedback.getMetadata());
        }
        if (feedback.getScore() instanceof FeedbackScore.Range range) {
            metadata.put(SCORE_LOW_KEY, range.low());
            metadata.put(SCORE_HIGH_KEY, range.high());
        }
        return metadata;
    }

    private RowMapper<FeedbackRecord> feedbackMapper() {
        return (rs, rowNum) -> {
            Map<String, Object> metadata = fromJson(rs.getString("metadata_json"), METADATA_TYPE);
            Object scoreValue = rs.getObject("feedback_score");
            Object low = metadata.remove(SCORE_LOW_KEY);
            Object high = metadata.remove(SCORE_HIGH_KEY);
            FeedbackScore score;
            if (low instanceof Number lowNumber && high instanceof Number highNumber) {
                score = FeedbackScore.range(lowNumber.doubleValue(), highNumber.doubleValue());
            } else if (scoreValue instanceof Number number) {
                score = FeedbackScore.of(number.doubleValue());
            } else {
                score = FeedbackScore.absent();
            }
            return FeedbackRecord.builder()
                    .id(rs.getString("id"))
                    .timestamp(StoreTimestamps.parse(rs.getString("timestamp")))
                    .conversationId(nullToEmpty(rs.getString("conversation_id")))
                    .query(nullToEmpty(rs.getString("query")))
                    .responses(fromJson(rs.getString("responses_json"), RESPONSES_TYPE))
                    .selectedModel(nullToEmpty(rs.getString("selected_response")))
                    .score(score)
                    .comment(rs.getString("feedback_text"))
                    .metadata(metadata)
                    .build();
        };
    }

    private RowMapper<ComparisonRecord> comparisonMapper() {
        return (rs, rowNum) -> ComparisonRecord.builder()
                .id(rs.getString("id"))
                .timestamp(StoreTimestamps.parse(rs.getString("timestamp")))
                .conversationId(nullToEmpty(rs.getString("conversation_id")))
                .query(nullToEmpty(rs.getString("query")))
                .chosen(nullToEmpty(rs.getString("chosen")))
                .rejected(nullToEmpty(rs.getString("rejected")))
                .chosenModel(nullToEmpty(rs.getString("chosen_model")))
                .rejectedModel(nullToEmpty(rs.getString("rejected_model")))
                .metadata(fromJson(rs.getString("metadata_json"), METADATA_TYPE))
                .build();
    }

    private RowMapper<StatRecord> statMapper() {
        return (rs, rowNum) -> StatRecord.builder()
                .id(rs.getString("id"))
                .timestamp(StoreTimestamps.parse(rs.getString("timestamp")))
                .statType(rs.getString("stat_type"))
                .value(rs.getDouble("value"))
                .metadata(fromJson(rs.getString("metadata_json"), METADATA_TYPE))
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new FeedbackStoreException("Cannot serialize value: " + e.getMessage(), e);
        }
    }

    // Corrupt JSON in a row degrades to an empty map rather than failing the scan.
    private <T extends Map<String, ?>> T fromJson(String json, TypeReference<T> type) {
        String source = json == null || json.isBlank() ? "{}" : json;
        try {
            return objectMapper.readValue(source, type);
        } catch (JsonProcessingException e) {
            log.warn("[FeedbackStore] Ignoring unreadable JSON column: {}", e.getMessage());
            try {
                return objectMapper.readValue("{}", type);
            } catch (JsonProcessingException impossible) {
                throw new FeedbackStoreException("Cannot create empty map", impossible);
            }
        }
    }

    private static String sqlLiteral(String value) {
        return value.replace("'", "''");
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
