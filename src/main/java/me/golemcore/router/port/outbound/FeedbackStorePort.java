package me.golemcore.router.port.outbound;

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

import me.golemcore.router.domain.model.ComparisonRecord;
import me.golemcore.router.domain.model.FeedbackEntry;
import me.golemcore.router.domain.model.FeedbackRecord;
import me.golemcore.router.domain.model.FeedbackSummary;
import me.golemcore.router.domain.model.StatRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store for feedback records, pairwise comparisons and aggregate
 * statistics.
 *
 * <p>
 * Operations never throw: failures are logged by the implementation and
 * reported through the return value (false, empty, zero or an empty list).
 */
public interface FeedbackStorePort {

    boolean saveFeedback(FeedbackRecord feedback);

    boolean saveComparison(ComparisonRecord comparison);

    Optional<FeedbackRecord> getFeedback(String id);

    Optional<ComparisonRecord> getComparison(String id);

    /**
     * All feedback and comparison records, newest first.
     */
    List<FeedbackEntry> getAllFeedback();

    /**
     * Number of feedback plus comparison records.
     */
    long getTotalCount();

    /**
     * Number of scored feedback records whose score lies within the inclusive
     * bounds. A null bound is open.
     */
    long getCountByScore(Double minScore, Double maxScore);

    boolean deleteFeedback(String id);

    boolean deleteComparison(String id);

    boolean clearAllData();

    boolean updateStat(String statType, double value, Map<String, Object> metadata);

    /**
     * Latest stat samples, newest first, optionally filtered by type.
     */
    List<StatRecord> getStats(String statType, int limit);

    FeedbackSummary getFeedbackSummary();

    /**
     * Writes a logical dump of the database.
     *
     * @param target
     *            destination file, or null for a timestamped file in the
     *            configured backup directory
     * @return the written file
     */
    Optional<Path> backupDatabase(Path target);

    /**
     * Replaces the database content with a dump produced by
     * {@link #backupDatabase(Path)}. The current state is backed up first.
     */
    boolean restoreDatabase(Path source);
}
