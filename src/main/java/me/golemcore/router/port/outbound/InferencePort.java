package me.golemcore.router.port.outbound;

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

import me.golemcore.router.domain.model.InferenceRequest;
import me.golemcore.router.domain.model.InferenceResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port to the text-generation engine. Implementations report failures as
 * {@link InferenceResponse#failure(String, String)} rather than completing
 * the future exceptionally, although callers tolerate both.
 */
public interface InferencePort {

    /**
     * Returns the provider identifier (e.g., "langchain4j", "none").
     */
    String getProviderId();

    /**
     * Generates a single completion for the request.
     */
    CompletableFuture<InferenceResponse> generate(InferenceRequest request);

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
