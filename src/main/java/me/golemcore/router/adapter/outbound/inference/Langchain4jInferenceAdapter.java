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

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.domain.model.InferenceRequest;
import me.golemcore.router.domain.model.InferenceResponse;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Inference through an OpenAI-compatible chat endpoint via langchain4j. With
 * the default base URL this talks to a local Ollama server's {@code /v1} API.
 *
 * <p>
 * One {@link ChatModel} is built per (model, temperature, max tokens)
 * combination and reused. Timeout and retry count come from
 * {@code router.inference.*}.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@Slf4j
public class Langchain4jInferenceAdapter implements InferenceProviderAdapter {

    static final String PROVIDER_ID = "langchain4j";

    private final RouterProperties properties;
    private final Map<String, ChatModel> chatModels = new ConcurrentHashMap<>();

    public Langchain4jInferenceAdapter(RouterProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public void initialize() {
        RouterProperties.InferenceProperties config = properties.getInference();
        log.info("[Inference] langchain4j endpoint: {} (timeout {}ms, retries {})",
                config.getBaseUrl(), config.getTimeoutMs(), config.getMaxRetries());
    }

    @Override
    public CompletableFuture<InferenceResponse> generate(InferenceRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel();
            try {
                ChatModel chatModel = chatModelFor(request);
                ChatResponse response = chatModel.chat(toMessages(request));
                String text = response.aiMessage() != null ? response.aiMessage().text() : null;
                int tokens = 0;
                if (response.tokenUsage() != null && response.tokenUsage().totalTokenCount() != null) {
                    tokens = response.tokenUsage().totalTokenCount();
                }
                return InferenceResponse.success(model, text != null ? text : "", tokens);
            } catch (RuntimeException e) {
                log.error("[Inference] Generation failed for model {}: {}", model, e.getMessage());
                return InferenceResponse.failure(model, e.getMessage() != null ? e.getMessage() : e.toString());
            }
        });
    }

    @Override
    public boolean isAvailable() {
        String baseUrl = properties.getInference().getBaseUrl();
        return baseUrl != null && !baseUrl.isBlank();
    }

    List<ChatMessage> toMessages(InferenceRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        messages.add(UserMessage.from(request.getPrompt() != null ? request.getPrompt() : ""));
        return messages;
    }

    private ChatModel chatModelFor(InferenceRequest request) {
        RouterProperties.InferenceProperties config = properties.getInference();
        double temperature = request.getTemperature() != null
                ? request.getTemperature()
                : config.getDefaultTemperature();
        int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : config.getDefaultMaxTokens();
        String key = request.getModel() + "|" + temperature + "|" + maxTokens;
        return chatModels.computeIfAbsent(key, k -> {
            log.debug("[Inference] Creating chat model {} (temperature {}, maxTokens {})",
                    request.getModel(), temperature, maxTokens);
            return OpenAiChatModel.builder()
                    .baseUrl(config.getBaseUrl())
                    .apiKey(config.getApiKey())
                    .modelName(request.getModel())
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .maxRetries(config.getMaxRetries())
                    .timeout(Duration.ofMillis(config.getTimeoutMs()))
                    .build();
        });
    }
}
