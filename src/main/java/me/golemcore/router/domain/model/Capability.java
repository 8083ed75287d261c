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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed vocabulary of capability categories a model can be good at. Model
 * strength vectors and query requirement vectors are both keyed by these.
 */
public enum Capability {

    PROGRAMMING,
    ANALYSIS,
    CREATIVE,
    REASONING,
    MATH,
    LANGUAGE,
    TECHNICAL_EXPLANATION,
    EVALUATION,
    CRITICAL_THINKING,
    PROBLEM_SOLVING,
    ALGORITHMS,
    CONCISENESS,
    CLARITY,
    SUMMARIZATION,
    GENERAL_KNOWLEDGE,
    COMMUNICATION,
    BALANCED,
    COMPREHENSIVE,
    THOROUGH;

    /**
     * Key used in configuration files and API payloads, e.g.
     * {@code critical_thinking}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Capability> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.name().equals(normalized))
                .findFirst();
    }
}
