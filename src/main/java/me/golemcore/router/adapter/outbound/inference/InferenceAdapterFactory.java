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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.InferenceRequest;
import me.golemcore.router.domain.model.InferenceResponse;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.InferencePort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active inference adapter from {@code router.inference.provider}
 * and delegates every call to it. Unknown providers fall back to the no-op
 * adapter.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class InferenceAdapterFactory implements InferencePort {

    private final RouterProperties properties;
    private final List<InferenceProviderAdapter> adapters;

    private final Map<String, InferenceProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private InferenceProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (InferenceProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
        }

        String provider = properties.getInference().getProvider();
        activeAdapter = adaptersByProvider.get(provider);
        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(NoOpInferenceAdapter.PROVIDER_ID);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("[Inference] Provider '{}' not found, using: {}", provider,
                    activeAdapter != null ? activeAdapter.getProviderId() : NoOpInferenceAdapter.PROVIDER_ID);
        } else {
            log.info("[Inference] Active provider: {}", provider);
        }
        if (activeAdapter != null) {
            activeAdapter.initialize();
        }
    }

    public InferencePort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : NoOpInferenceAdapter.PROVIDER_ID;
    }

    @Override
    public CompletableFuture<InferenceResponse> generate(InferenceRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.completedFuture(
                    InferenceResponse.failure(request.getModel(), "No inference adapter registered"));
        }
        return activeAdapter.generate(request);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
