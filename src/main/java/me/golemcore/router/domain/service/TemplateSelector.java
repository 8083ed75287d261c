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
import me.golemcore.router.domain.model.ComplexityTier;
import me.golemcore.router.domain.model.QueryProfile;
import me.golemcore.router.domain.model.RunningScore;
import me.golemcore.router.domain.model.TemplateDefinition;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.infrastructure.config.TemplateCatalogService;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks the prompt template for a query profile and tracks how well each
 * template performs according to user feedback.
 */
@Service
@Slf4j
public class TemplateSelector {

    public enum Strategy {
        BEST_MATCH,
        PERFORMANCE_BASED;

        public static Strategy fromKey(String key) {
            if (key != null && "performance_based".equals(key.trim().toLowerCase(Locale.ROOT))) {
                return PERFORMANCE_BASED;
            }
            return BEST_MATCH;
        }
    }

    private static final int DOMAIN_MATCH_SCORE = 3;
    private static final int GENERAL_DOMAIN_SCORE = 1;
    private static final int USE_CASE_SCORE = 2;
    private static final int TIER_SCORE = 2;

    private final TemplateCatalogService templateCatalog;
    private final RouterProperties properties;
    private final Map<String, RunningScore> performance = new ConcurrentHashMap<>();

    public TemplateSelector(TemplateCatalogService templateCatalog, RouterProperties properties) {
        this.templateCatalog = templateCatalog;
        this.properties = properties;
    }

    public TemplateDefinition select(QueryProfile profile) {
        List<TemplateDefinition> templates = templateCatalog.getTemplates();
        if (templates.isEmpty()) {
            return TemplateDefinition.identity();
        }
        Strategy strategy = Strategy.fromKey(properties.getPrompt().getTemplateSelectionStrategy());
        TemplateDefinition selected = strategy == Strategy.PERFORMANCE_BASED
                ? selectByPerformance(profile, templates)
                : selectBestMatch(profile, templates);
        log.debug("[TemplateSelector] {} selected template '{}' for domain {}", strategy, selected.getName(),
                profile.getDomain());
        return selected;
    }

    /**
     * Folds a feedback score into the template's running average.
     */
    public void recordPerformance(String templateName, double score) {
        if (templateName == null || templateName.isBlank()) {
            return;
        }
        double clamped = Math.max(0.0, Math.min(1.0, score));
        performance.merge(templateName, RunningScore.initial().add(clamped),
                (current, ignored) -> current.add(clamped));
    }

    public Map<String, RunningScore> getPerformance() {
        return new LinkedHashMap<>(performance);
    }

    public void clearPerformance() {
        performance.clear();
    }

    int scoreBestMatch(QueryProfile profile, TemplateDefinition template) {
        int score = 0;
        List<String> domains = template.getDomains() != null ? template.getDomains() : List.of();
        if (domains.contains(profile.getDomain())) {
            score += DOMAIN_MATCH_SCORE;
        } else if (domains.contains(QueryProfile.GENERAL_DOMAIN)) {
            score += GENERAL_DOMAIN_SCORE;
        }

        List<String> useCases = template.getUseCases() != null ? template.getUseCases() : List.of();
        for (String useCase : useCases) {
            if (useCase.equals(profile.getQueryType().wireName())) {
                score += USE_CASE_SCORE;
            }
            if (("code".equals(useCase) && profile.isRequiresCode())
                    || ("reasoning".equals(useCase) && profile.isRequiresReasoning())
                    || ("creative".equals(useCase) && profile.isRequiresCreativity())) {
                score += USE_CASE_SCORE;
            }
        }

        if (template.tier() == ComplexityTier.of(profile.getComplexity())) {
            score += TIER_SCORE;
        }
        return score;
    }

    private TemplateDefinition selectBestMatch(QueryProfile profile, List<TemplateDefinition> templates) {
        TemplateDefinition best = templates.get(0);
        int bestScore = Integer.MIN_VALUE;
        for (TemplateDefinition template : templates) {
            int score = scoreBestMatch(profile, template);
            if (score > bestScore) {
                bestScore = score;
                best = template;
            }
        }
        return best;
    }

    private TemplateDefinition selectByPerformance(QueryProfile profile, List<TemplateDefinition> templates) {
        List<TemplateDefinition> matching = new ArrayList<>();
        for (TemplateDefinition template : templates) {
            List<String> domains = template.getDomains() != null ? template.getDomains() : List.of();
            if (domains.contains(profile.getDomain()) || domains.contains(QueryProfile.GENERAL_DOMAIN)) {
                matching.add(template);
            }
        }
        if (matching.isEmpty()) {
            matching = templates;
        }

        TemplateDefinition best = matching.get(0);
        double bestScore = Double.NEGATIVE_INFINITY;
        for (TemplateDefinition template : matching) {
            double score = performance.getOrDefault(template.getName(), RunningScore.initial()).score();
            if (score > bestScore) {
                bestScore = score;
                best = template;
            }
        }
        return best;
    }
}
