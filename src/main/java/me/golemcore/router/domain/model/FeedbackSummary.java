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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Aggregated view of stored feedback: score buckets, per-model selection
 * counts, comparison count and daily volume.
 */
@Data
@Builder
public class FeedbackSummary {

    private long totalScored;
    private long positive;
    private long negative;
    private long neutral;
    private double averageScore;
    private Map<String, Long> modelDistribution;
    private long comparisonCount;
    private Map<String, Long> dailyCounts;

    public static FeedbackSummary empty() {
        return FeedbackSummary.builder()
                .modelDistribution(Map.of())
                .dailyCounts(Map.of())
                .build();
    }
}
