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

import java.util.List;

/**
 * Parameters of a group discussion. Every field except the query is
 * optional; missing values fall back to configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscussionRequest {

    private String query;
    private String discussionId;
    private List<String> models;
    private Integer rounds;
    private Double temperature;
    private Integer maxTokens;

    public static DiscussionRequest of(String query) {
        return DiscussionRequest.builder().query(query).build();
    }
}
