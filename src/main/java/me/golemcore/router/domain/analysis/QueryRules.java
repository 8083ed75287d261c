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

import me.golemcore.router.domain.model.FormatRequirement;
import me.golemcore.router.domain.model.QueryType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword tables driving {@link QueryAnalyzer}.
 *
 * <p>
 * Keywords starting with a letter match only at the start of a word in the
 * lower-cased query ("music" matches "musical" but not "amusic"). Keywords of
 * at most three characters must also end a word ("ai" matches "ai" but not
 * "air"). Any other keyword, such as {@code "?"}, matches anywhere.
 */
public final class QueryRules {

    private static final int SHORT_KEYWORD_LENGTH = 3;

    /** A query type and the keywords that select it. */
    public record TypeRule(QueryType type, List<String> keywords) {
    }

    public static final List<String> COMPLEXITY_KEYWORDS = List.of(
            "why", "explain", "analyze", "compare", "evaluate",
            "cause", "consequence", "impact", "strategy", "comprehensive solution");

    /** Domains in tie-break order. */
    public static final Map<String, List<String>> DOMAIN_KEYWORDS;

    /** Evaluated in order; the first rule with a matching keyword wins. */
    public static final List<TypeRule> QUERY_TYPE_RULES = List.of(
            new TypeRule(QueryType.HOW_TO, List.of("how to", "how do", "way to")),
            new TypeRule(QueryType.WHY, List.of("why", "reason")),
            new TypeRule(QueryType.WHAT_IS, List.of("what is", "definition", "explain")),
            new TypeRule(QueryType.COMPARISON, List.of("compare", "difference", "similarity")),
            new TypeRule(QueryType.EXAMPLE, List.of("example", "illustrate")),
            new TypeRule(QueryType.LIST, List.of("list", "enumeration", "types")),
            new TypeRule(QueryType.OPINION, List.of("evaluate", "opinion", "comment")),
            new TypeRule(QueryType.PREDICTION, List.of("predict", "future", "will")),
            new TypeRule(QueryType.QUESTION, List.of("?")));

    public static final Map<FormatRequirement, List<String>> FORMAT_KEYWORDS;

    public static final List<String> CODE_KEYWORDS = List.of(
            "code", "programming", "function", "class", "implement",
            "algorithm", "script", "module", "debug", "fix", "error");

    public static final List<String> REASONING_KEYWORDS = List.of(
            "why", "reason", "explain", "analyze",
            "evaluate", "opinion", "conclusion", "inference");

    public static final List<String> CREATIVITY_KEYWORDS = List.of(
            "creative", "idea", "design", "imagine", "write",
            "compose", "story", "fiction", "art", "unique");

    public static final List<String> POSITIVE_WORDS = List.of(
            "good", "great", "excellent", "like", "happy", "satisfied");

    public static final List<String> NEGATIVE_WORDS = List.of(
            "bad", "poor", "sad", "disappointed", "uncomfortable", "dislike");

    public static final List<String> URGENCY_KEYWORDS = List.of(
            "urgent", "immediate", "quick", "soon", "as soon as possible");

    static {
        Map<String, List<String>> domains = new LinkedHashMap<>();
        domains.put("technology", List.of("computer", "software", "technology", "programming", "code", "ai",
                "application"));
        domains.put("business", List.of("business", "marketing", "finance", "management", "strategy",
                "investment"));
        domains.put("science", List.of("science", "physics", "chemistry", "biology", "mathematics", "research"));
        domains.put("health", List.of("health", "medical", "disease", "medicine", "treatment", "nutrition"));
        domains.put("education", List.of("education", "learning", "school", "university", "knowledge",
                "teaching"));
        domains.put("arts", List.of("art", "music", "film", "literature", "design", "creativity"));
        domains.put("lifestyle", List.of("lifestyle", "travel", "cuisine", "fashion", "sports"));
        DOMAIN_KEYWORDS = Collections.unmodifiableMap(domains);

        Map<FormatRequirement, List<String>> formats = new EnumMap<>(FormatRequirement.class);
        formats.put(FormatRequirement.LIST, List.of("list", "enumeration", "points"));
        formats.put(FormatRequirement.STEP_BY_STEP, List.of("step by step", "detailed", "guide"));
        formats.put(FormatRequirement.EXAMPLES, List.of("example", "illustrate", "sample"));
        formats.put(FormatRequirement.SUMMARY, List.of("summary", "overview", "brief"));
        formats.put(FormatRequirement.COMPARISON, List.of("compare", "contrast", "difference"));
        formats.put(FormatRequirement.PROS_CONS, List.of("advantage", "disadvantage", "benefit", "limitation"));
        formats.put(FormatRequirement.TABLE, List.of("table", "chart"));
        formats.put(FormatRequirement.DIAGRAM, List.of("diagram", "chart", "figure"));
        FORMAT_KEYWORDS = Collections.unmodifiableMap(formats);
    }

    private QueryRules() {
    }

    /**
     * Whether {@code keyword} occurs in the already lower-cased text.
     */
    public static boolean matches(String lowerText, String keyword) {
        if (keyword.isEmpty()) {
            return false;
        }
        if (!Character.isLetter(keyword.charAt(0))) {
            return lowerText.contains(keyword);
        }
        int from = 0;
        while (true) {
            int index = lowerText.indexOf(keyword, from);
            if (index < 0) {
                return false;
            }
            if (startsWord(lowerText, index) && (keyword.length() > SHORT_KEYWORD_LENGTH
                    || endsWord(lowerText, index + keyword.length()))) {
                return true;
            }
            from = index + 1;
        }
    }

    private static boolean startsWord(String text, int index) {
        return index == 0 || !Character.isLetterOrDigit(text.charAt(index - 1));
    }

    private static boolean endsWord(String text, int end) {
        return end >= text.length() || !Character.isLetterOrDigit(text.charAt(end));
    }

    public static boolean matchesAny(String lowerText, List<String> keywords) {
        for (String keyword : keywords) {
            if (matches(lowerText, keyword)) {
                return true;
            }
        }
        return false;
    }

    public static int countMatches(String lowerText, List<String> keywords) {
        int count = 0;
        for (String keyword : keywords) {
            if (matches(lowerText, keyword)) {
                count++;
            }
        }
        return count;
    }
}
