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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pairwise preference derived from a feedback event: the response the user
 * chose and one response from another model that was not chosen.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonRecord implements FeedbackEntry {

    private String id;
    private Instant timestamp;

    @Builder.Default
    private String conversationId = "";

    private String query;
    private String chosen;
    private String rejected;
    private String chosenModel;
    private String rejectedModel;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Override
    public String getType() {
        return TYPE_PAIRWISE_COMPARISON;
    }
}
