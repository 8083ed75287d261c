package me.golemcore.router.adapter.outbound.inference;

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
import me.golemcore.router.domain.model.InferenceRequest;
import me.golemcore.router.domain.model.InferenceResponse;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Inference adapter used when no generation engine is configured. Every call
 * fails with a descriptive error, so callers exercise their fallback paths.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpInferenceAdapter implements InferenceProviderAdapter {

    static final String PROVIDER_ID = "none";

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<InferenceResponse> generate(InferenceRequest request) {
        log.warn("[Inference] generate() called for model {} but no provider is configured", request.getModel());
        return CompletableFuture.completedFuture(
                InferenceResponse.failure(request.getModel(), "No inference provider configured"));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
