package me.golemcore.router.domain.service;

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
import me.golemcore.router.domain.model.ComparisonRecord;
import me.golemcore.router.domain.model.ExportOptions;
import me.golemcore.router.domain.model.FeedbackRecord;
import me.golemcore.router.domain.model.FeedbackScore;
import me.golemcore.router.domain.model.FeedbackSubmission;
import me.golemcore.router.infrastructure.cache.BoundedLruCache;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.FeedbackStorePort;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Samples conversations for feedback, persists feedback events and derives
 * pairwise preferences from them.
 */
@Service
@Slf4j
public class FeedbackCollector {

    private final FeedbackStorePort feedbackStore;
    private final FeedbackExportService exportService;
    private final RouterProperties.FeedbackProperties settings;
    private final Random random;
    private final Clock clock;
    private final AtomicBoolean enabled;
    private final BoundedLruCache<String, Boolean> askedConversations;
    private final BoundedLruCache<String, FeedbackRecord> feedbackCache;

    public FeedbackCollector(FeedbackStorePort feedbackStore, FeedbackExportService exportService,
            RouterProperties properties, Random random, Clock clock) {
        this.feedbackStore = feedbackStore;
        this.exportService = exportService;
        this.settings = properties.getFeedback();
        this.random = random;
        this.clock = clock;
        this.enabled = new AtomicBoolean(settings.isEnabled());
        this.askedConversations = new BoundedLruCache<>(settings.getAskedConversationCapacity());
        // headroom so the batch eviction below runs before the LRU bound does
        this.feedbackCache = new BoundedLruCache<>(settings.getFeedbackCacheSize() + settings.getCacheEvictionBatch());
    }

    /**
     * Whether to ask the user of this conversation for feedback. A
     * conversation is asked at most once while it stays remembered.
     */
    public boolean shouldRequestFeedback(String conversationId) {
        if (!enabled.get()) {
            return false;
        }
        String key = conversationId == null ? "" : conversationId;
        if (askedConversations.containsKey(key)) {
            return false;
        }
        if (random.nextDouble() >= settings.getCollectionProbability()) {
            return false;
        }
        return askedConversations.putIfAbsent(key, Boolean.TRUE);
    }

    /**
     * Stores a feedback event and, when several responses were shown, one
     * comparison per rejected response.
     *
     * @return id of the stored feedback record, or empty when ignored or not
     *         stored
     */
    public Optional<String> collectFeedback(FeedbackSubmission submission) {
        if (!enabled.get()) {
            log.debug("[FeedbackCollector] Collection disabled, ignoring feedback");
            return Optional.empty();
        }
        if (submission == null || submission.getSelectedModel() == null || submission.getSelectedModel().isBlank()
                || submission.getResponses() == null || submission.getResponses().isEmpty()) {
            log.warn("[FeedbackCollector] Ignoring feedback without selected model or responses");
            return Optional.empty();
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        String conversationId = submission.getConversationId() == null ? "" : submission.getConversationId();
        String query = submission.getQuery() == null ? "" : submission.getQuery();
        Map<String, String> responses = new LinkedHashMap<>(submission.getResponses());

        FeedbackRecord record = FeedbackRecord.builder()
                .id("fb_" + UUID.randomUUID())
                .timestamp(now)
                .conversationId(conversationId)
                .query(query)
                .responses(responses)
                .selectedModel(submission.getSelectedModel())
                .score(submission.getScore() != null ? submission.getScore() : FeedbackScore.absent())
                .comment(submission.getComment())
                .metadata(submission.getMetadata() != null
                        ? new LinkedHashMap<>(submission.getMetadata())
                        : new LinkedHashMap<>())
                .build();

        if (!feedbackStore.saveFeedback(record)) {
            log.error("[FeedbackCollector] Failed to store feedback for conversation '{}'", conversationId);
            return Optional.empty();
        }
        cache(record);

        if (settings.isCollectComparisons() && responses.size() > 1) {
            int saved = saveComparisons(record, now);
            log.debug("[FeedbackCollector] Derived {} comparisons from {}", saved, record.getId());
        }
        log.info("[FeedbackCollector] Stored feedback {} for model {}", record.getId(), record.getSelectedModel());
        return Optional.of(record.getId());
    }

    private int saveComparisons(FeedbackRecord record, Instant now) {
        String chosen = record.getSelectedResponseText();
        if (chosen == null || chosen.isEmpty()) {
            return 0;
        }
        int saved = 0;
        for (Map.Entry<String, String> other : record.getResponses().entrySet()) {
            if (other.getKey().equals(record.getSelectedModel())
                    || other.getValue() == null || other.getValue().isEmpty()) {
                continue;
            }
            ComparisonRecord comparison = ComparisonRecord.builder()
                    .id("cmp_" + UUID.randomUUID())
                    .timestamp(now)
                    .conversationId(record.getConversationId())
                    .query(record.getQuery())
                    .chosen(chosen)
                    .rejected(other.getValue())
                    .chosenModel(record.getSelectedModel())
                    .rejectedModel(other.getKey())
                    .metadata(new LinkedHashMap<>(Map.of("feedback_id", record.getId())))
                    .build();
            if (feedbackStore.saveComparison(comparison)) {
                saved++;
            }
        }
        return saved;
    }

    private void cache(FeedbackRecord record) {
        feedbackCache.put(record.getId(), record);
        if (feedbackCache.size() > settings.getFeedbackCacheSize()) {
            feedbackCache.evictOldest(settings.getCacheEvictionBatch());
        }
    }

    public Optional<FeedbackRecord> getCachedFeedback(String id) {
        return id == null ? Optional.empty() : feedbackCache.get(id);
    }

    int cachedFeedbackCount() {
        return feedbackCache.size();
    }

    public void toggleCollection(boolean enable) {
        enabled.set(enable);
        log.info("[FeedbackCollector] Feedback collection {}", enable ? "enabled" : "disabled");
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    public Optional<Path> exportFeedbackData(Path directory) {
        return exportFeedbackData(directory, ExportOptions.defaults());
    }

    public Optional<Path> exportFeedbackData(Path directory, ExportOptions options) {
        return exportService.export(directory, options);
    }

    public void clearCaches() {
        feedbackCache.clear();
        askedConversations.clear();
    }
}
