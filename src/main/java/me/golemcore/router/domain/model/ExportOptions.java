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

/**
 * Options for exporting stored feedback as a training dataset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportOptions {

    @Builder.Default
    private ExportFormat format = ExportFormat.JSON;

    @Builder.Default
    private boolean includeComparisons = true;

    private boolean split;

    /** Fraction of records placed in the eval partition; null means configured default. */
    private Double evalRatio;

    /** When set, feedback records without a score or scored below it are skipped. */
    private Double minScore;

    /** Cap on exported records, newest first; null or non-positive means unlimited. */
    private Integer maxRecords;

    public static ExportOptions defaults() {
        return ExportOptions.builder().build();
    }
}
