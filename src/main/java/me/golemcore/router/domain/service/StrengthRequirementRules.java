package me.golemcore.router.domain.service;

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

import me.golemcore.router.domain.model.Capability;
import me.golemcore.router.domain.model.FormatRequirement;
import me.golemcore.router.domain.model.QueryProfile;
import me.golemcore.router.domain.model.QueryType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Maps a query profile to the capability importances a model should cover.
 * Rules apply in order and later rules overwrite earlier values; categories
 * no rule sets keep {@link #BASELINE_IMPORTANCE}.
 */
public final class StrengthRequirementRules {

    public static final double BASELINE_IMPORTANCE = 0.1;

    /** A named condition and the importances it sets. */
    public record Rule(String name, Predicate<QueryProfile> condition, Map<Capability, Double> importances) {
    }

    public static final List<Rule> RULES = List.of(
            rule("requires_code", QueryProfile::isRequiresCode,
                    Capability.PROGRAMMING, 0.9, Capability.ALGORITHMS, 0.7,
                    Capability.TECHNICAL_EXPLANATION, 0.6),
            rule("requires_reasoning", QueryProfile::isRequiresReasoning,
                    Capability.REASONING, 0.8, Capability.CRITICAL_THINKING, 0.7,
                    Capability.ANALYSIS, 0.7, Capability.EVALUATION, 0.6),
            rule("requires_creativity", QueryProfile::isRequiresCreativity,
                    Capability.CREATIVE, 0.9),
            rule("high_complexity", p -> p.getComplexity() > 7,
                    Capability.COMPREHENSIVE, 0.8, Capability.THOROUGH, 0.7, Capability.BALANCED, 0.6),
            rule("low_complexity", p -> p.getComplexity() < 3,
                    Capability.CONCISENESS, 0.8, Capability.CLARITY, 0.7),
            rule("type_how_to", p -> p.getQueryType() == QueryType.HOW_TO,
                    Capability.TECHNICAL_EXPLANATION, 0.7, Capability.CLARITY, 0.7),
            rule("type_comparison", p -> p.getQueryType() == QueryType.COMPARISON,
                    Capability.BALANCED, 0.8, Capability.ANALYSIS, 0.7),
            rule("type_what_is", p -> p.getQueryType() == QueryType.WHAT_IS,
                    Capability.GENERAL_KNOWLEDGE, 0.7, Capability.CLARITY, 0.6),
            rule("type_opinion", p -> p.getQueryType() == QueryType.OPINION,
                    Capability.CRITICAL_THINKING, 0.8, Capability.EVALUATION, 0.7),
            rule("type_list", p -> p.getQueryType() == QueryType.LIST,
                    Capability.COMPREHENSIVE, 0.7, Capability.CLARITY, 0.6),
            rule("format_step_by_step", p -> p.hasFormat(FormatRequirement.STEP_BY_STEP),
                    Capability.CLARITY, 0.8),
            rule("format_examples", p -> p.hasFormat(FormatRequirement.EXAMPLES),
                    Capability.TECHNICAL_EXPLANATION, 0.7),
            rule("format_comparison", p -> p.hasFormat(FormatRequirement.COMPARISON),
                    Capability.BALANCED, 0.8, Capability.ANALYSIS, 0.7),
            rule("domain_technology", p -> "technology".equals(p.getDomain()),
                    Capability.TECHNICAL_EXPLANATION, 0.8, Capability.PROGRAMMING, 0.7),
            rule("domain_science", p -> "science".equals(p.getDomain()),
                    Capability.ANALYSIS, 0.8, Capability.REASONING, 0.7),
            rule("domain_business", p -> "business".equals(p.getDomain()),
                    Capability.ANALYSIS, 0.7, Capability.BALANCED, 0.7),
            rule("domain_arts", p -> "arts".equals(p.getDomain()),
                    Capability.CREATIVE, 0.8));

    private StrengthRequirementRules() {
    }

    /**
     * Importance of every capability for the profile.
     */
    public static Map<Capability, Double> requiredStrengths(QueryProfile profile) {
        Map<Capability, Double> required = new EnumMap<>(Capability.class);
        for (Capability capability : Capability.values()) {
            required.put(capability, BASELINE_IMPORTANCE);
        }
        for (Rule rule : RULES) {
            if (rule.condition().test(profile)) {
                required.putAll(rule.importances());
            }
        }
        return required;
    }

    private static Rule rule(String name, Predicate<QueryProfile> condition, Object... pairs) {
        Map<Capability, Double> importances = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            importances.put((Capability) pairs[i], (Double) pairs[i + 1]);
        }
        return new Rule(name, condition, Collections.unmodifiableMap(importances));
    }
}
