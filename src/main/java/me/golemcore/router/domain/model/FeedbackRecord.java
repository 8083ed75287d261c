package me.golemcore.router.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One feedback event: the query, every candidate response seen for it, the
 * model whose response the user picked and an optional rating and comment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRecord implements FeedbackEntry {

    private String id;
    private Instant timestamp;

    @Builder.Default
    private String conversationId = "";

    private String query;

    @Builder.Default
    private Map<String, String> responses = new LinkedHashMap<>();

    private String selectedModel;

    @JsonIgnore
    @Builder.Default
    private FeedbackScore score = FeedbackScore.absent();

    private String comment;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Override
    public String getType() {
        return TYPE_FEEDBACK;
    }

    /**
     * Point value of the rating, for serialization and score filters.
     */
    public Double getScoreValue() {
        if (score == null) {
            return null;
        }
        return score.value().isPresent() ? score.value().getAsDouble() : null;
    }

    /**
     * Text of the selected model's response, or empty.
     */
    @JsonIgnore
    public String getSelectedResponseText() {
        if (responses == null || selectedModel == null) {
            return "";
        }
        return responses.getOrDefault(selectedModel, "");
    }
}
