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

import java.util.Locale;

/**
 * Complexity band declared by prompt templates and derived from a query's
 * complexity score: below 3 is low, 3 to 7 inclusive is medium, above 7 is
 * high.
 */
public enum ComplexityTier {

    LOW,
    MEDIUM,
    HIGH;

    private static final double LOW_UPPER_BOUND = 3.0;
    private static final double HIGH_LOWER_BOUND = 7.0;

    public static ComplexityTier of(double complexity) {
        if (complexity < LOW_UPPER_BOUND) {
            return LOW;
        }
        if (complexity > HIGH_LOWER_BOUND) {
            return HIGH;
        }
        return MEDIUM;
    }

    /**
     * Parses a template's declared tier. Unknown or missing values mean medium.
     */
    public static ComplexityTier fromKey(String key) {
        if (key == null || key.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
