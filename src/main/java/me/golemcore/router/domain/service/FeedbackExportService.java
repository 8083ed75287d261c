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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.ComparisonRecord;
import me.golemcore.router.domain.model.ExportFormat;
import me.golemcore.router.domain.model.ExportOptions;
import me.golemcore.router.domain.model.FeedbackEntry;
import me.golemcore.router.domain.model.FeedbackRecord;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.FeedbackStorePort;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Writes stored feedback as a training dataset: scalar feedback items and
 * chosen/rejected preference pairs, either as one JSON bundle (optionally
 * split into shuffled train and eval partitions) or as JSON lines.
 */
@Service
@Slf4j
public class FeedbackExportService {

    static final String FORMAT_VERSION = "1.0";

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyyMMdd_HHmmss_SSS")
            .withZone(ZoneOffset.UTC);

    private final FeedbackStorePort feedbackStore;
    private final ObjectMapper objectMapper;
    private final RouterProperties properties;
    private final Clock clock;
    private final Random random;

    public FeedbackExportService(FeedbackStorePort feedbackStore, ObjectMapper objectMapper,
            RouterProperties properties, Clock clock, Random random) {
        this.feedbackStore = feedbackStore;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.random = random;
    }

    record FeedbackItem(String id, String prompt, String response, Double score, String model, String feedback,
            @JsonProperty("conversation_id") String conversationId, String timestamp) {
    }

    record ComparisonItem(String id, String prompt, String chosen, String rejected,
            @JsonProperty("chosen_model") String chosenModel,
            @JsonProperty("rejected_model") String rejectedModel,
            @JsonProperty("conversation_id") String conversationId, String timestamp) {
    }

    /**
     * Exports into {@code directory}, or the configured export directory when
     * null.
     *
     * @return the written file, or empty if writing failed
     */
    public Optional<Path> export(Path directory, ExportOptions options) {
        ExportOptions effective = options != null ? options : ExportOptions.defaults();
        Path targetDir = directory != null
                ? directory
                : RouterProperties.resolvePath(properties.getExport().getDirectory());
        Path file = targetDir.resolve("feedback_export_" + FILE_TIMESTAMP.format(clock.instant()) + "."
                + effective.getFormat().extension());

        List<FeedbackEntry> entries = select(feedbackStore.getAllFeedback(), effective);
        try {
            Files.createDirectories(targetDir);
            if (effective.getFormat() == ExportFormat.JSONL) {
                writeJsonLines(file, entries);
            } else {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), bundle(entries, effective));
            }
            log.info("[FeedbackExport] Exported {} records to {}", entries.size(), file);
            return Optional.of(file);
        } catch (IOException e) {
            log.error("[FeedbackExport] Failed to export to {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    List<FeedbackEntry> select(List<FeedbackEntry> entries, ExportOptions options) {
        List<FeedbackEntry> selected = new ArrayList<>();
        for (FeedbackEntry entry : entries) {
            if (entry instanceof ComparisonRecord) {
                if (options.isIncludeComparisons()) {
                    selected.add(entry);
                }
            } else if (entry instanceof FeedbackRecord feedback && passesScoreFilter(feedback, options)) {
                selected.add(entry);
            }
        }
        Integer max = options.getMaxRecords();
        if (max != null && max > 0 && selected.size() > max) {
            return new ArrayList<>(selected.subList(0, max));
        }
        return selected;
    }

    Map<String, Object> bundle(List<FeedbackEntry> entries, ExportOptions options) {
        List<FeedbackItem> feedback = new ArrayList<>();
        List<ComparisonItem> comparisons = new ArrayList<>();
        for (FeedbackEntry entry : entries) {
            if (entry instanceof ComparisonRecord comparison) {
                comparisons.add(toItem(comparison));
            } else if (entry instanceof FeedbackRecord record) {
                feedback.add(toItem(record));
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", clock.instant().toString());
        metadata.put("version", FORMAT_VERSION);
        metadata.put("record_count", entries.size());
        metadata.put("split", options.isSplit());

        Map<String, Object> bundle = new LinkedHashMap<>();
        bundle.put("metadata", metadata);
        bundle.put("feedback", feedback);
        bundle.put("comparisons", comparisons);

        if (options.isSplit()) {
            double evalRatio = options.getEvalRatio() != null
                    ? options.getEvalRatio()
                    : properties.getExport().getEvalRatio();
            List<List<FeedbackItem>> feedbackParts = partition(feedback, evalRatio);
            List<List<ComparisonItem>> comparisonParts = partition(comparisons, evalRatio);
            bundle.put("train", Map.of("feedback", feedbackParts.get(0), "comparisons", comparisonParts.get(0)));
            bundle.put("eval", Map.of("feedback", feedbackParts.get(1), "comparisons", comparisonParts.get(1)));
        }
        return bundle;
    }

    /**
     * Shuffles and splits into train and eval lists. A non-empty input keeps
     * at least one item in train.
     */
    <T> List<List<T>> partition(List<T> items, double evalRatio) {
        List<T> shuffled = new ArrayList<>(items);
        Collections.shuffle(shuffled, random);
        if (shuffled.isEmpty()) {
            return List.of(List.of(), List.of());
        }
        double ratio = Math.max(0.0, Math.min(1.0, evalRatio));
        int splitIndex = Math.max(1, (int) (shuffled.size() * (1 - ratio)));
        return List.of(
                new ArrayList<>(shuffled.subList(0, splitIndex)),
                new ArrayList<>(shuffled.subList(splitIndex, shuffled.size())));
    }

    private void writeJsonLines(Path file, List<FeedbackEntry> entries) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (FeedbackEntry entry : entries) {
                Object item = entry instanceof ComparisonRecord comparison
                        ? toItem(comparison)
                        : toItem((FeedbackRecord) entry);
                writer.write(objectMapper.writeValueAsString(item));
                writer.newLine();
            }
        }
    }

    private static boolean passesScoreFilter(FeedbackRecord feedback, ExportOptions options) {
        if (options.getMinScore() == null) {
            return true;
        }
        Double score = feedback.getScoreValue();
        return score != null && score >= options.getMinScore();
    }

    private static FeedbackItem toItem(FeedbackRecord record) {
        return new FeedbackItem(record.getId(), record.getQuery(), record.getSelectedResponseText(),
                record.getScoreValue(), record.getSelectedModel(), record.getComment(), record.getConversationId(),
                record.getTimestamp() != null ? record.getTimestamp().toString() : "");
    }

    private static ComparisonItem toItem(ComparisonRecord comparison) {
        return new ComparisonItem(comparison.getId(), comparison.getQuery(), comparison.getChosen(),
                comparison.getRejected(), comparison.getChosenModel(), comparison.getRejectedModel(),
                comparison.getConversationId(),
                comparison.getTimestamp() != null ? comparison.getTimestamp().toString() : "");
    }
}
