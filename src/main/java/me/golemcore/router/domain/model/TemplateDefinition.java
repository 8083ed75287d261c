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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Prompt template loaded from {@code prompt-templates.yml}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplateDefinition {

    public static final String IDENTITY_NAME = "default";
    public static final String QUERY_PLACEHOLDER = "{query}";

    private String name;
    private String description;
    private String template;

    @Builder.Default
    private List<String> domains = new ArrayList<>();

    @JsonProperty("use_cases")
    @Builder.Default
    private List<String> useCases = new ArrayList<>();

    @Builder.Default
    private String complexity = "medium";

    public ComplexityTier tier() {
        return ComplexityTier.fromKey(complexity);
    }

    /**
     * Pass-through template used when no templates are configured.
     */
    public static TemplateDefinition identity() {
        return TemplateDefinition.builder()
                .name(IDENTITY_NAME)
                .description("Pass-through template")
                .template(QUERY_PLACEHOLDER)
                .domains(new ArrayList<>(List.of(QueryProfile.GENERAL_DOMAIN)))
                .build();
    }
}
