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
import me.golemcore.router.domain.model.DiscussionLog;
import me.golemcore.router.domain.model.DiscussionRequest;
import me.golemcore.router.domain.model.DiscussionResult;
import me.golemcore.router.domain.model.DiscussionRound;
import me.golemcore.router.domain.model.InferenceRequest;
import me.golemcore.router.domain.model.InferenceResponse;
import me.golemcore.router.domain.model.ModelDefinition;
import me.golemcore.router.domain.model.QueryProfile;
import me.golemcore.router.infrastructure.cache.BoundedLruCache;
import me.golemcore.router.infrastructure.config.ModelCatalogService;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.port.outbound.InferencePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Runs multi-round discussions between the configured models and
 * synthesizes their final-round opinions into one answer.
 *
 * <p>
 * Each round sends the same context to every participant concurrently and
 * waits for all of them before building the next round's context from the
 * answers. A participant that fails is left out of that round only.
 */
@Service
@Slf4j
public class GroupDiscussionOrchestrator {

    static final String NO_FINAL_RESPONSES = "No responses in final discussion round.";
    static final String NO_PARTICIPANTS = "No suitable models found for discussion";
    private static final String FALLBACK_ROLE = "expert";
    private static final double SUITABLE_COMPLEXITY = 6.0;

    private final InferencePort inferencePort;
    private final ModelCatalogService modelCatalog;
    private final RouterProperties.DiscussionProperties settings;
    private final Random random;
    private final Clock clock;
    private final BoundedLruCache<String, DiscussionLog> discussions;

    public GroupDiscussionOrchestrator(InferencePort inferencePort, ModelCatalogService modelCatalog,
            RouterProperties properties, Random random, Clock clock) {
        this.inferencePort = inferencePort;
        this.modelCatalog = modelCatalog;
        this.settings = properties.getDiscussion();
        this.random = random;
        this.clock = clock;
        this.discussions = new BoundedLruCache<>(settings.getHistorySize());
    }

    /**
     * Whether a query is worth the cost of a discussion.
     */
    public boolean isSuitable(QueryProfile profile) {
        return profile != null && (profile.getComplexity() > SUITABLE_COMPLEXITY
                || profile.isRequiresReasoning() || profile.isRequiresCreativity());
    }

    public DiscussionResult conductDiscussion(DiscussionRequest request) {
        long startMillis = clock.millis();
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            return DiscussionResult.failure("Query must not be empty");
        }
        String query = request.getQuery();
        String discussionId = request.getDiscussionId() != null && !request.getDiscussionId().isBlank()
                ? request.getDiscussionId()
                : "disc_" + UUID.randomUUID();
        int requestedRounds = request.getRounds() != null && request.getRounds() > 0
                ? request.getRounds()
                : settings.getDefaultRounds();
        int maxRounds = Math.max(1, settings.getMaxRounds());
        if (requestedRounds > maxRounds) {
            log.warn("[Discussion] Requested {} rounds, capping at {}", requestedRounds, maxRounds);
        }
        int rounds = Math.min(requestedRounds, maxRounds);
        double temperature = request.getTemperature() != null ? request.getTemperature() : settings.getTemperature();
        int maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : settings.getMaxTokens();

        List<String> participants = selectParticipants(request.getModels());
        if (participants.isEmpty()) {
            log.warn("[Discussion] No participants for discussion {}", discussionId);
            return DiscussionResult.failure(NO_PARTICIPANTS);
        }
        log.info("[Discussion] Starting {} with {} models over {} rounds", discussionId, participants.size(), rounds);

        List<DiscussionRound> history = new ArrayList<>();
        Set<String> modelsUsed = new LinkedHashSet<>();
        String context = query;
        for (int round = 0; round < rounds; round++) {
            Map<String, String> responses = runRound(participants, context, round, temperature, maxTokens);
            modelsUsed.addAll(responses.keySet());
            history.add(new DiscussionRound(round + 1, responses));
            if (round < rounds - 1) {
                context = nextRoundContext(query, responses, round);
            }
        }

        String finalResponse = synthesize(query, history.get(history.size() - 1).responses());
        discussions.put(discussionId, DiscussionLog.builder()
                .id(discussionId)
                .query(query)
                .rounds(List.copyOf(history))
                .finalResponse(finalResponse)
                .createdAt(Instant.ofEpochMilli(startMillis))
                .build());

        return DiscussionResult.builder()
                .response(finalResponse)
                .discussionId(discussionId)
                .modelsUsed(new ArrayList<>(modelsUsed))
                .rounds(rounds)
                .completionTime((clock.millis() - startMillis) / 1000.0)
                .success(true)
                .build();
    }

    private List<String> selectParticipants(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return modelCatalog.listModelNames();
        }
        List<String> known = new ArrayList<>();
        for (String name : requested) {
            if (modelCatalog.isKnown(name) && !known.contains(name)) {
                known.add(name);
            }
        }
        return known;
    }

    private Map<String, String> runRound(List<String> participants, String context, int round,
            double temperature, int maxTokens) {
        Map<String, CompletableFuture<InferenceResponse>> pending = new LinkedHashMap<>();
        for (String model : participants) {
            InferenceRequest request = InferenceRequest.builder()
                    .model(model)
                    .prompt(context)
                    .systemPrompt(expertSystemPrompt(model, round))
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .build();
            pending.put(model, call(request));
        }
        CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();

        Map<String, String> responses = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<InferenceResponse>> entry : pending.entrySet()) {
            InferenceResponse response = entry.getValue().join();
            if (response.isSuccess()) {
                responses.put(entry.getKey(), response.getText() == null ? "" : response.getText());
            } else {
                log.warn("[Discussion] Model {} failed in round {}: {}", entry.getKey(), round + 1,
                        response.getError());
            }
        }
        return responses;
    }

    private CompletableFuture<InferenceResponse> call(InferenceRequest request) {
        CompletableFuture<InferenceResponse> future;
        try {
            future = inferencePort.generate(request);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.completedFuture(
                    InferenceResponse.failure(request.getModel(), "Inference returned no result"));
        }
        return future.handle((response, error) -> {
            if (error != null) {
                return InferenceResponse.failure(request.getModel(), error.getMessage());
            }
            return response != null
                    ? response
                    : InferenceResponse.failure(request.getModel(), "Inference returned no result");
        });
    }

    String expertSystemPrompt(String model, int round) {
        Optional<ModelDefinition> definition = modelCatalog.findModel(model);
        if (definition.isEmpty()) {
            return "";
        }
        String role = definition.get().getRole();
        String base = definition.get().getSystemPrompt() == null ? "" : definition.get().getSystemPrompt();
        String opening = base + "\n\nYou are participating in a group discussion as a " + role + " expert. ";
        if (round == 0) {
            return opening + "Please answer the question based on your expertise. "
                    + "Focus on your strengths as a " + role + " expert.";
        }
        return opening + "Please consider opinions from other experts and provide additional insights "
                + "from your professional perspective. "
                + "Focus on improving the answer based on your " + role + " expertise.";
    }

    String nextRoundContext(String query, Map<String, String> responses, int round) {
        List<String> parts = new ArrayList<>();
        parts.add("Original question: " + query);
        parts.add("\nDiscussion round " + (round + 1) + " has completed. Here are expert opinions:");
        responses.forEach((model, text) -> {
            parts.add("\n--- Opinion from " + modelCatalog.roleOf(model) + " expert ---");
            parts.add(text);
        });
        parts.add("\n\nDiscussion round " + (round + 2) + ":");
        parts.add("Please consider the above opinions and provide additional insights "
                + "from your professional perspective.");
        parts.add("Focus on improving and clarifying points that need further elaboration.");
        return String.join("\n", parts);
    }

    private String synthesize(String query, Map<String, String> finalResponses) {
        if (finalResponses.isEmpty()) {
            return NO_FINAL_RESPONSES;
        }
        List<String> parts = new ArrayList<>();
        parts.add("Question: " + query);
        parts.add("\nA group discussion has taken place between experts. Here are their final opinions:");
        finalResponses.forEach((model, text) -> {
            parts.add("\n--- " + modelCatalog.roleOf(model) + " expert ---");
            parts.add(text);
        });
        parts.add("\nPlease synthesize the above opinions into a comprehensive and balanced answer.");

        String synthesizer = selectSynthesizer(new ArrayList<>(finalResponses.keySet()));
        InferenceRequest request = InferenceRequest.builder()
                .model(synthesizer)
                .prompt(String.join("\n", parts))
                .systemPrompt(settings.getSystemPrompt())
                .temperature(settings.getSynthesisTemperature())
                .maxTokens(settings.getSynthesisMaxTokens())
                .build();
        InferenceResponse response = call(request).join();
        if (response.hasText()) {
            return response.getText();
        }
        log.warn("[Discussion] Synthesis by {} failed, combining final opinions: {}", synthesizer,
                response.getError());
        return combine(finalResponses);
    }

    String selectSynthesizer(List<String> participants) {
        for (ModelDefinition model : modelCatalog.getModels()) {
            if (settings.getSynthesisRole().equals(model.getRole())) {
                return model.getName();
            }
        }
        if (!participants.isEmpty()) {
            return participants.get(random.nextInt(participants.size()));
        }
        List<String> known = modelCatalog.listModelNames();
        return known.isEmpty() ? "" : known.get(0);
    }

    private String combine(Map<String, String> finalResponses) {
        List<String> blocks = new ArrayList<>();
        finalResponses.forEach((model, text) -> {
            String role = modelCatalog.findModel(model).map(ModelDefinition::getRole).orElse(FALLBACK_ROLE);
            blocks.add("From " + role + " perspective:\n" + text);
        });
        return String.join("\n\n", blocks);
    }

    public Optional<DiscussionLog> getDiscussion(String discussionId) {
        return discussionId == null ? Optional.empty() : discussions.get(discussionId);
    }

    public List<String> listDiscussions() {
        return discussions.keys();
    }

    public void clearDiscussions() {
        discussions.clear();
        log.info("[Discussion] Cleared discussion history");
    }
}
