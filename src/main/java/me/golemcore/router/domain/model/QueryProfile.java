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
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Structured profile of a query: how complex it is, which domain it belongs
 * to, what kind of answer it expects and which capabilities it needs.
 *
 * <p>
 * Profiles are immutable and derived purely from the query text, so they can
 * be cached by exact text.
 *
 * @since 1.0
 */
@Value
@Builder
public class QueryProfile {

    public static final String GENERAL_DOMAIN = "general";
    public static final String UNKNOWN_LANGUAGE = "unknown";

    double complexity;

    @Builder.Default
    String domain = GENERAL_DOMAIN;

    @Builder.Default
    Set<String> topics = Collections.emptySet();

    @Builder.Default
    QueryType queryType = QueryType.STATEMENT;

    @Builder.Default
    Set<FormatRequirement> formatRequirements = Collections.emptySet();

    boolean requiresCode;
    boolean requiresReasoning;
    boolean requiresCreativity;

    @Builder.Default
    Set<String> languages = Set.of(UNKNOWN_LANGUAGE);

    @Builder.Default
    Sentiment sentiment = Sentiment.NEUTRAL;

    @Builder.Default
    Urgency urgency = Urgency.NORMAL;

    public boolean hasFormat(FormatRequirement requirement) {
        return formatRequirements.contains(requirement);
    }

    /**
     * Profile used when optimization is disabled or analysis is unavailable.
     */
    public static QueryProfile neutral() {
        return QueryProfile.builder().build();
    }

    /**
     * Builder helper producing unmodifiable, order-preserving copies of the
     * collection fields.
     */
    public static QueryProfile of(double complexity, String domain, Set<String> topics, QueryType queryType,
            Set<FormatRequirement> formats, boolean code, boolean reasoning, boolean creativity,
            Set<String> languages, Sentiment sentiment, Urgency urgency) {
        Set<FormatRequirement> formatCopy = formats.isEmpty()
                ? EnumSet.noneOf(FormatRequirement.class)
                : EnumSet.copyOf(formats);
        Set<String> languageCopy = languages == null || languages.isEmpty()
                ? Set.of(UNKNOWN_LANGUAGE)
                : Collections.unmodifiableSet(new LinkedHashSet<>(languages));
        return QueryProfile.builder()
                .complexity(complexity)
                .domain(domain)
                .topics(Collections.unmodifiableSet(new LinkedHashSet<>(topics)))
                .queryType(queryType)
                .formatRequirements(Collections.unmodifiableSet(formatCopy))
                .requiresCode(code)
                .requiresReasoning(reasoning)
                .requiresCreativity(creativity)
                .languages(languageCopy)
                .sentiment(sentiment)
                .urgency(urgency)
                .build();
    }
}
