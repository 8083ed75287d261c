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

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Creates the feedback schema and repairs tables created by older versions.
 *
 * <p>
 * A table missing any expected column is rebuilt: its rows are copied to a
 * scratch table, the table is dropped and recreated, and the rows are copied
 * back with missing text columns filled with {@code ''} and missing numeric
 * columns with {@code NULL} or {@code 0}. Indexes are recreated afterwards.
 */
@Slf4j
public class SchemaManager {

    static final String FEEDBACK_TABLE = "feedback";
    static final String COMPARISONS_TABLE = "comparisons";
    static final String STATS_TABLE = "stats";

    private static final String REPAIR_SUFFIX = "_repair";
    private static final int H2_COLUMN_NOT_FOUND = 42122;
    private static final String SQLSTATE_COLUMN_NOT_FOUND = "42S22";

    private static final String ID_FILL = "CAST(RANDOM_UUID() AS VARCHAR)";

    record ColumnSpec(String name, String definition, String fill) {
    }

    record TableSpec(String name, List<ColumnSpec> columns, List<String> indexes) {
    }

    static final List<TableSpec> TABLES = List.of(
            new TableSpec(FEEDBACK_TABLE, List.of(
                    new ColumnSpec("id", "VARCHAR(64) PRIMARY KEY", ID_FILL),
                    new ColumnSpec("timestamp", "VARCHAR(40) NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("conversation_id", "VARCHAR(255) NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("query", "VARCHAR NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("responses_json", "VARCHAR NOT NULL DEFAULT '{}'", "'{}'"),
                    new ColumnSpec("selected_response", "VARCHAR(255) NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("feedback_score", "DOUBLE PRECISION", "NULL"),
                    new ColumnSpec("feedback_text", "VARCHAR", "''"),
                    new ColumnSpec("metadata_json", "VARCHAR NOT NULL DEFAULT '{}'", "'{}'")),
                    List.of(
                            "CREATE INDEX IF NOT EXISTS idx_feedback_conversation ON feedback(conversation_id)",
                            "CREATE INDEX IF NOT EXISTS idx_feedback_timestamp ON feedback(timestamp)")),
            new TableSpec(COMPARISONS_TABLE, List.of(
                    new ColumnSpec("id", "VARCHAR(64) PRIMARY KEY", ID_FILL),
                    new ColumnSpec("timestamp", "VARCHAR(40) NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("conversation_id", "VARCHAR(255) NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("query", "VARCHAR NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("chosen", "VARCHAR NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("rejected", "VARCHAR NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("chosen_model", "VARCHAR(255) NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("rejected_model", "VARCHAR(255) NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("metadata_json", "VARCHAR NOT NULL DEFAULT '{}'", "'{}'")),
                    List.of(
                            "CREATE INDEX IF NOT EXISTS idx_comparisons_conversation "
                                    + "ON comparisons(conversation_id)")),
            new TableSpec(STATS_TABLE, List.of(
                    new ColumnSpec("id", "VARCHAR(64) PRIMARY KEY", ID_FILL),
                    new ColumnSpec("timestamp", "VARCHAR(40) NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("stat_type", "VARCHAR(100) NOT NULL DEFAULT ''", "''"),
                    new ColumnSpec("value", "DOUBLE PRECISION NOT NULL DEFAULT 0", "0"),
                    new ColumnSpec("metadata_json", "VARCHAR NOT NULL DEFAULT '{}'", "'{}'")),
                    List.of("CREATE INDEX IF NOT EXISTS idx_stats_type ON stats(stat_type)")));

    private final JdbcTemplate jdbcTemplate;

    public SchemaManager(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates missing tables, rebuilds incomplete ones and ensures indexes.
     *
     * @return names of the tables that were rebuilt
     */
    public synchronized List<String> repair() {
        List<String> rebuilt = new ArrayList<>();
        for (TableSpec table : TABLES) {
            recoverInterruptedRepair(table);
            if (!tableExists(table.name())) {
                jdbcTemplate.execute(createTableSql(table, table.name()));
                log.debug("[FeedbackStore] Created table {}", table.name());
            } else {
                Set<String> existing = existingColumns(table.name());
                List<String> missing = table.columns().stream()
                        .map(ColumnSpec::name)
                        .filter(name -> !existing.contains(name.toUpperCase(Locale.ROOT)))
                        .toList();
                if (!missing.isEmpty()) {
                    log.warn("[FeedbackStore] Table {} is missing columns {}, rebuilding", table.name(), missing);
                    rebuild(table, existing);
                    rebuilt.add(table.name());
                }
            }
            for (String index : table.indexes()) {
                jdbcTemplate.execute(index);
            }
        }
        if (!rebuilt.isEmpty()) {
            log.info("[FeedbackStore] Schema repaired: {}", rebuilt);
        }
        return rebuilt;
    }

    /**
     * Whether the failure was caused by a reference to a column the table
     * does not have.
     */
    public static boolean isMissingColumn(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SQLException sql && (sql.getErrorCode() == H2_COLUMN_NOT_FOUND
                    || SQLSTATE_COLUMN_NOT_FOUND.equals(sql.getSQLState()))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private void rebuild(TableSpec table, Set<String> existing) {
        String scratch = table.name() + REPAIR_SUFFIX;
        jdbcTemplate.execute("DROP TABLE IF EXISTS " + scratch);
        jdbcTemplate.execute("CREATE TABLE " + scratch + " AS SELECT * FROM " + table.name());
        jdbcTemplate.execute("DROP TABLE " + table.name());
        jdbcTemplate.execute(createTableSql(table, table.name()));

        List<String> targets = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        for (ColumnSpec column : table.columns()) {
            targets.add(column.name());
            if (existing.contains(column.name().toUpperCase(Locale.ROOT))) {
                sources.add("NULL".equals(column.fill())
                        ? column.name()
                        : "COALESCE(" + column.name() + ", " + column.fill() + ")");
            } else {
                sources.add(column.fill());
            }
        }
        int copied = jdbcTemplate.update("INSERT INTO " + table.name() + " (" + String.join(", ", targets)
                + ") SELECT " + String.join(", ", sources) + " FROM " + scratch);
        jdbcTemplate.execute("DROP TABLE " + scratch);
        log.info("[FeedbackStore] Rebuilt table {} ({} rows preserved)", table.name(), copied);
    }

    // A crash between dropping and refilling leaves the rows in the scratch table.
    private void recoverInterruptedRepair(TableSpec table) {
        String scratch = table.name() + REPAIR_SUFFIX;
        if (!tableExists(scratch)) {
            return;
        }
        if (!tableExists(table.name())) {
            log.warn("[FeedbackStore] Restoring {} from interrupted repair", table.name());
            jdbcTemplate.execute("ALTER TABLE " + scratch + " RENAME TO " + table.name());
        } else {
            log.warn("[FeedbackStore] Dropping stale scratch table {}", scratch);
            jdbcTemplate.execute("DROP TABLE " + scratch);
        }
    }

    private boolean tableExists(String table) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_SCHEMA = 'PUBLIC' AND TABLE_NAME = ?",
                Integer.class, table.toUpperCase(Locale.ROOT));
        return count != null && count > 0;
    }

    private Set<String> existingColumns(String table) {
        List<String> names = jdbcTemplate.queryForList(
                "SELECT COLUMN_NAME FROM INFORMATION_SCHEMA.COLUMNS WHERE TABLE_SCHEMA = 'PUBLIC' AND TABLE_NAME = ?",
                String.class, table.toUpperCase(Locale.ROOT));
        Set<String> result = new HashSet<>();
        for (String name : names) {
            result.add(name.toUpperCase(Locale.ROOT));
        }
        return result;
    }

    private static String createTableSql(TableSpec table, String name) {
        List<String> columns = new ArrayList<>();
        for (ColumnSpec column : table.columns()) {
            columns.add(column.name() + " " + column.definition());
        }
        return "CREATE TABLE " + name + " (" + String.join(", ", columns) + ")";
    }
}
