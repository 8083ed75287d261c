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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Feedback event as submitted by a caller, before it is persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackSubmission {

    private String conversationId;
    private String query;

    @Builder.Default
    private Map<String, String> responses = new LinkedHashMap<>();

    private String selectedModel;

    @Builder.Default
    private FeedbackScore score = FeedbackScore.absent();

    private String comment;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
