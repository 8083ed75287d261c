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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse intent of a query. Detected by ordered keyword rules, first match
 * wins.
 */
public enum QueryType {

    HOW_TO,
    WHY,
    WHAT_IS,
    COMPARISON,
    EXAMPLE,
    LIST,
    OPINION,
    PREDICTION,
    QUESTION,
    STATEMENT;

    /**
     * Name used in template use-case lists and in exported data, e.g.
     * {@code how_to}.
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
