package me.golemcore.router.domain.analysis;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.FormatRequirement;
import me.golemcore.router.domain.model.QueryProfile;
import me.golemcore.router.domain.model.QueryType;
import me.golemcore.router.domain.model.Sentiment;
import me.golemcore.router.domain.model.Urgency;
import me.golemcore.router.infrastructure.cache.BoundedLruCache;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw query text into a {@link QueryProfile}.
 *
 * <p>
 * Analysis is a pure function of the text driven by {@link QueryRules}.
 * Profiles are cached by exact query text in a bounded LRU cache, so repeated
 * queries return the same instance.
 */
@Service
@Slf4j
public class QueryAnalyzer {

    private static final double MAX_COMPLEXITY = 10.0;
    private static final double LENGTH_DIVISOR = 100.0;
    private static final double COMMA_WEIGHT = 0.1;
    private static final double QUESTION_MARK_WEIGHT = 0.3;
    private static final double KEYWORD_WEIGHT = 0.5;

    static final String CHINESE = "chinese";
    static final String ENGLISH = "english";

    private final BoundedLruCache<String, QueryProfile> cache;

    public QueryAnalyzer(RouterProperties properties) {
        this.cache = new BoundedLruCache<>(Math.max(1, properties.getAnalysis().getCacheSize()));
    }

    public QueryProfile analyze(String query) {
        String text = query != null ? query : "";
        return cache.computeIfAbsent(text, this::computeProfile);
    }

    public void clearCache() {
        cache.clear();
        log.debug("[QueryAnalyzer] Cache cleared");
    }

    public int cacheSize() {
        return cache.size();
    }

    private QueryProfile computeProfile(String query) {
        String lower = query.toLowerCase(Locale.ROOT);

        Set<String> topics = new LinkedHashSet<>();
        String domain = detectDomain(lower, topics);

        Set<FormatRequirement> formats = EnumSet.noneOf(FormatRequirement.class);
        for (Map.Entry<FormatRequirement, List<String>> rule : QueryRules.FORMAT_KEYWORDS.entrySet()) {
            if (QueryRules.matchesAny(lower, rule.getValue())) {
                formats.add(rule.getKey());
            }
        }

        return QueryProfile.of(
                complexity(query, lower),
                domain,
                topics,
                queryType(lower),
                formats,
                QueryRules.matchesAny(lower, QueryRules.CODE_KEYWORDS),
                QueryRules.matchesAny(lower, QueryRules.REASONING_KEYWORDS),
                QueryRules.matchesAny(lower, QueryRules.CREATIVITY_KEYWORDS),
                languages(query),
                sentiment(lower),
                QueryRules.matchesAny(lower, QueryRules.URGENCY_KEYWORDS) ? Urgency.HIGH : Urgency.NORMAL);
    }

    static double complexity(String query, String lower) {
        double score = query.length() / LENGTH_DIVISOR
                + COMMA_WEIGHT * count(query, ',')
                + QUESTION_MARK_WEIGHT * count(query, '?')
                + KEYWORD_WEIGHT * QueryRules.countMatches(lower, QueryRules.COMPLEXITY_KEYWORDS);
        return Math.min(MAX_COMPLEXITY, score);
    }

    private static String detectDomain(String lower, Set<String> topics) {
        String best = QueryProfile.GENERAL_DOMAIN;
        int bestScore = 0;
        for (Map.Entry<String, List<String>> entry : QueryRules.DOMAIN_KEYWORDS.entrySet()) {
            int score = 0;
            for (String keyword : entry.getValue()) {
                if (QueryRules.matches(lower, keyword)) {
                    score++;
                    topics.add(keyword);
                }
            }
            if (score > bestScore) {
                bestScore = score;
                best = entry.getKey();
            }
        }
        return best;
    }

    private static QueryType queryType(String lower) {
        for (QueryRules.TypeRule rule : QueryRules.QUERY_TYPE_RULES) {
            if (QueryRules.matchesAny(lower, rule.keywords())) {
                return rule.type();
            }
        }
        return QueryType.STATEMENT;
    }

    static Set<String> languages(String query) {
        boolean chinese = false;
        boolean english = false;
        for (int i = 0; i < query.length(); i++) {
            char c = query.charAt(i);
            if (c >= '\u4E00' && c <= '\u9FFF') {
                chinese = true;
            } else if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
                english = true;
            }
        }
        Set<String> result = new LinkedHashSet<>();
        if (chinese) {
            result.add(CHINESE);
        }
        if (english) {
            result.add(ENGLISH);
        }
        if (result.isEmpty()) {
            result.add(QueryProfile.UNKNOWN_LANGUAGE);
        }
        return result;
    }

    private static Sentiment sentiment(String lower) {
        int positive = QueryRules.countMatches(lower, QueryRules.POSITIVE_WORDS);
        int negative = QueryRules.countMatches(lower, QueryRules.NEGATIVE_WORDS);
        if (positive > negative) {
            return Sentiment.POSITIVE;
        }
        if (negative > positive) {
            return Sentiment.NEGATIVE;
        }
        return Sentiment.NEUTRAL;
    }

    private static int count(String text, char target) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == target) {
                count++;
            }
        }
        return count;
    }
}
