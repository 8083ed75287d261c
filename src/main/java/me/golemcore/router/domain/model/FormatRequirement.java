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
 * Output format the user asked for, with the instruction appended to prompts
 * that carry the {@code {format_requirements}} placeholder.
 */
public enum FormatRequirement {

    LIST("Present the results in a structured list format."),
    STEP_BY_STEP("Provide detailed step-by-step instructions."),
    EXAMPLES("Include specific examples to illustrate."),
    SUMMARY("Include a brief summary of key points."),
    COMPARISON("Clearly compare different aspects."),
    PROS_CONS("List pros and cons."),
    TABLE("Present data in a table format if applicable."),
    DIAGRAM("Describe using diagrams or charts if possible.");

    private final String instruction;

    FormatRequirement(String instruction) {
        this.instruction = instruction;
    }

    public String instruction() {
        return instruction;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
