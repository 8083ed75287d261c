package me.golemcore.router;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Router.
 *
 * <p>
 * GolemCore Router is a feedback-driven routing layer that sits in front of
 * several interchangeable text-generation models. It analyzes incoming
 * queries, picks a prompt template and a model, can run a multi-round group
 * discussion between models, and learns from user feedback which model to
 * prefer for which kind of query.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        -> OptimizationController, DiscussionController
 * Domain Layer       -> QueryAnalyzer, TemplateSelector, PreferenceOptimizer,
 *                      FeedbackCollector, GroupDiscussionOrchestrator,
 *                      OptimizationManager
 * Infrastructure     -> H2 feedback store, langchain4j inference adapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code router.*} prefix, plus the {@code models.yml} and
 * {@code prompt-templates.yml} catalogs.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(RouterApplication.class, args);
    }

}
