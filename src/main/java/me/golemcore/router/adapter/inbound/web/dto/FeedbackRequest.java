package me.golemcore.router.adapter.inbound.web.dto;

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
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Feedback submitted over HTTP. A rating is either {@code score} or the
 * {@code scoreLow}/{@code scoreHigh} pair; both are optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {
    private String conversationId;
    private String query;
    private Map<String, String> responses = new LinkedHashMap<>();
    private String selectedModel;
    private Double score;
    private Double scoreLow;
    private Double scoreHigh;
    private String comment;
}
