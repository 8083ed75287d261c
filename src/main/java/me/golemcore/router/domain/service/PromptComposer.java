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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.FormatRequirement;
import me.golemcore.router.domain.model.QueryProfile;
import me.golemcore.router.domain.model.TemplateDefinition;
import me.golemcore.router.domain.model.Urgency;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills a template's placeholders from a query profile and optionally appends
 * instructions tuned to the profile.
 *
 * <p>
 * Unknown placeholders are left as literal text. The query is substituted
 * last, so braces inside the user's text are never expanded.
 */
@Component
@Slf4j
public class PromptComposer {

    static final String COMPREHENSIVE_INSTRUCTION = "Analyze the issue comprehensively, considering multiple "
            + "aspects and providing in-depth analysis.";
    static final String CONCISE_INSTRUCTION = "Provide concise, clear, and easy-to-understand answers.";
    static final String CODE_INSTRUCTION = "Provide clear, commented code adhering to clean code principles.";
    static final String REASONING_INSTRUCTION = "Explain the logic and reasoning in detail, providing "
            + "well-founded arguments.";
    static final String CREATIVITY_INSTRUCTION = "Demonstrate creativity, originality, and out-of-the-box "
            + "thinking.";
    static final String CHINESE_INSTRUCTION = "Respond in Chinese, using appropriate terminology and natural "
            + "language style.";
    static final String URGENCY_INSTRUCTION = "Prioritize providing essential information and quick solutions.";

    private static final double HIGH_COMPLEXITY = 7.0;
    private static final double LOW_COMPLEXITY = 3.0;

    private final RouterProperties properties;

    public PromptComposer(RouterProperties properties) {
        this.properties = properties;
    }

    public String compose(String query, QueryProfile profile, TemplateDefinition template) {
        String text = query != null ? query : "";
        String skeleton = template != null && template.getTemplate() != null
                ? template.getTemplate()
                : TemplateDefinition.QUERY_PLACEHOLDER;

        String prompt = substitute(skeleton, text, profile);
        String instructions = properties.getPrompt().isDynamicInstructionTuning()
                ? additionalInstructions(profile)
                : "";
        String composed = instructions.isEmpty() ? prompt : prompt + "\n\n" + instructions;

        int maxChars = properties.getPrompt().getMaxPromptChars();
        if (maxChars <= 0 || composed.length() <= maxChars) {
            return composed;
        }
        if (prompt.length() <= maxChars) {
            log.debug("[PromptComposer] Dropping tuned instructions to respect {} char limit", maxChars);
            return prompt;
        }
        log.debug("[PromptComposer] Template output exceeds {} chars, using raw query", maxChars);
        return text;
    }

    String substitute(String skeleton, String query, QueryProfile profile) {
        Map<String, String> replacements = new LinkedHashMap<>();
        replacements.put("{domain}", profile.getDomain());
        replacements.put("{complexity}", formatComplexity(profile.getComplexity()));
        replacements.put("{query_type}", profile.getQueryType().wireName());
        replacements.put("{topics}", String.join(", ", profile.getTopics()));
        replacements.put("{requires_code}", String.valueOf(profile.isRequiresCode()));
        replacements.put("{requires_reasoning}", String.valueOf(profile.isRequiresReasoning()));
        replacements.put("{requires_creativity}", String.valueOf(profile.isRequiresCreativity()));
        replacements.put("{format_requirements}", formatRequirements(profile));
        replacements.put("{sentiment}", profile.getSentiment().wireName());
        replacements.put("{urgency}", profile.getUrgency().wireName());
        replacements.put("{languages}", String.join(", ", profile.getLanguages()));

        String result = skeleton;
        for (Map.Entry<String, String> entry : replacements.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result.replace(TemplateDefinition.QUERY_PLACEHOLDER, query);
    }

    String additionalInstructions(QueryProfile profile) {
        List<String> instructions = new ArrayList<>();
        if (profile.getComplexity() > HIGH_COMPLEXITY) {
            instructions.add(COMPREHENSIVE_INSTRUCTION);
        } else if (profile.getComplexity() < LOW_COMPLEXITY) {
            instructions.add(CONCISE_INSTRUCTION);
        }
        if (profile.isRequiresCode()) {
            instructions.add(CODE_INSTRUCTION);
        }
        if (profile.isRequiresReasoning()) {
            instructions.add(REASONING_INSTRUCTION);
        }
        if (profile.isRequiresCreativity()) {
            instructions.add(CREATIVITY_INSTRUCTION);
        }
        if (profile.getLanguages().contains("chinese")) {
            instructions.add(CHINESE_INSTRUCTION);
        }
        if (profile.getUrgency() == Urgency.HIGH) {
            instructions.add(URGENCY_INSTRUCTION);
        }
        return String.join(" ", instructions);
    }

    private static String formatRequirements(QueryProfile profile) {
        List<String> instructions = new ArrayList<>();
        for (FormatRequirement requirement : FormatRequirement.values()) {
            if (profile.hasFormat(requirement)) {
                instructions.add(requirement.instruction());
            }
        }
        return String.join(" ", instructions);
    }

    private static String formatComplexity(double complexity) {
        return BigDecimal.valueOf(complexity).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros()
                .toPlainString();
    }
}
