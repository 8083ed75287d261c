package me.golemcore.router.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.router.adapter.inbound.web.dto.ExportRequest;
import me.golemcore.router.adapter.inbound.web.dto.ExportResponse;
import me.golemcore.router.adapter.inbound.web.dto.FeedbackRequest;
import me.golemcore.router.adapter.inbound.web.dto.ModelSelectionRequest;
import me.golemcore.router.adapter.inbound.web.dto.ModelSelectionResponse;
import me.golemcore.router.adapter.inbound.web.dto.OptimizeRequest;
import me.golemcore.router.adapter.inbound.web.dto.ToggleRequest;
import me.golemcore.router.domain.model.ExportFormat;
import me.golemcore.router.domain.model.ExportOptions;
import me.golemcore.router.domain.model.FeedbackScore;
import me.golemcore.router.domain.model.FeedbackSubmission;
import me.golemcore.router.domain.model.OptimizationResult;
import me.golemcore.router.domain.model.OptimizationStats;
import me.golemcore.router.domain.service.OptimizationManager;
import me.golemcore.router.domain.service.PreferenceOptimizer;
import me.golemcore.router.infrastructure.config.ModelCatalogService;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Query optimization, model routing and feedback endpoints.
 */
@RestController
@RequestMapping("/api/optimization")
@RequiredArgsConstructor
@Slf4j
public class OptimizationController {

    private final OptimizationManager optimizationManager;
    private final ModelCatalogService modelCatalog;
    private final PreferenceOptimizer preferenceOptimizer;
    private final RouterProperties properties;

    @PostMapping("/optimize")
    public Mono<ResponseEntity<OptimizationResult>> optimize(@RequestBody OptimizeRequest request) {
        String query = requireQuery(request != null ? request.getQuery() : null);
        return Mono.just(ResponseEntity.ok(optimizationManager.optimizeQuery(query)));
    }

    @PostMapping("/select-model")
    public Mono<ResponseEntity<ModelSelectionResponse>> selectModel(@RequestBody ModelSelectionRequest request) {
        String query = requireQuery(request != null ? request.getQuery() : null);
        Optional<String> model = optimizationManager.selectBestModel(query, null, request.getCandidates());
        ModelSelectionResponse body = ModelSelectionResponse.builder()
                .model(model.orElse(null))
                .selected(model.isPresent())
                .build();
        return Mono.just(ResponseEntity.ok(body));
    }

    @GetMapping("/feedback/should-request")
    public Mono<ResponseEntity<Map<String, Boolean>>> shouldRequestFeedback(
            @RequestParam String conversationId) {
        boolean ask = optimizationManager.shouldRequestFeedback(conversationId);
        return Mono.just(ResponseEntity.ok(Map.of("shouldRequest", ask)));
    }

    @PostMapping("/feedback")
    public Mono<ResponseEntity<Map<String, Boolean>>> submitFeedback(@RequestBody FeedbackRequest request) {
        if (request == null || request.getSelectedModel() == null || request.getSelectedModel().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "selectedModel is required");
        }
        if (request.getResponses() == null || request.getResponses().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "responses must not be empty");
        }
        boolean accepted = optimizationManager.processFeedback(toSubmission(request));
        return Mono.just(ResponseEntity.ok(Map.of("accepted", accepted)));
    }

    @PostMapping("/export")
    public Mono<ResponseEntity<ExportResponse>> export(@RequestBody(required = false) ExportRequest request) {
        ExportRequest effective = request != null ? request : new ExportRequest();
        if (effective.getEvalRatio() != null && (effective.getEvalRatio() < 0 || effective.getEvalRatio() > 1)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "evalRatio must be between 0 and 1");
        }
        Path directory = resolveExportDirectory(effective.getDirectory());
        ExportOptions options = ExportOptions.builder()
                .format(ExportFormat.fromKey(effective.getFormat()))
                .includeComparisons(effective.getIncludeComparisons() == null || effective.getIncludeComparisons())
                .split(effective.isSplit())
                .evalRatio(effective.getEvalRatio())
                .minScore(effective.getMinScore())
                .maxRecords(effective.getMaxRecords())
                .build();
        Optional<Path> exported = optimizationManager.exportFeedbackData(directory, options);
        if (exported.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Export failed or disabled");
        }
        return Mono.just(ResponseEntity.ok(new ExportResponse(exported.get().toString())));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<OptimizationStats>> getStats() {
        return Mono.just(ResponseEntity.ok(optimizationManager.getStats()));
    }

    @GetMapping("/models")
    public Mono<ResponseEntity<List<ModelSummaryDto>>> listModels() {
        Map<String, Double> weights = preferenceOptimizer.getModelWeights();
        List<ModelSummaryDto> models = modelCatalog.getModels().stream()
                .map(model -> new ModelSummaryDto(model.getName(), model.getRole(),
                        weights.getOrDefault(model.getName(), 0.0)))
                .toList();
        return Mono.just(ResponseEntity.ok(models));
    }

    @PutMapping("/enabled")
    public Mono<ResponseEntity<Map<String, Boolean>>> toggleOptimization(@RequestBody ToggleRequest request) {
        boolean enabled = requireFlag(request);
        optimizationManager.toggleOptimization(enabled);
        return Mono.just(ResponseEntity.ok(Map.of("enabled", enabled)));
    }

    @PutMapping("/feedback-collection")
    public Mono<ResponseEntity<Map<String, Boolean>>> toggleFeedbackCollection(
            @RequestBody ToggleRequest request) {
        boolean enabled = requireFlag(request);
        optimizationManager.toggleFeedbackCollection(enabled);
        return Mono.just(ResponseEntity.ok(Map.of("enabled", enabled)));
    }

    @PostMapping("/cache/clear")
    public Mono<ResponseEntity<Void>> clearCaches() {
        optimizationManager.clearCaches();
        return Mono.just(ResponseEntity.ok().build());
    }

    private static String requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "query is required");
        }
        return query;
    }

    // Requested directories are relative to router.export.directory and may not leave it.
    private Path resolveExportDirectory(String requested) {
        if (requested == null || requested.isBlank()) {
            return null;
        }
        Path root = RouterProperties.resolvePath(properties.getExport().getDirectory());
        Path candidate;
        try {
            candidate = root.resolve(requested.trim()).normalize();
        } catch (InvalidPathException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "directory is not a valid path");
        }
        if (!candidate.startsWith(root)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "directory must stay inside the export directory");
        }
        return candidate;
    }

    private static boolean requireFlag(ToggleRequest request) {
        if (request == null || request.getEnabled() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "enabled is required");
        }
        return request.getEnabled();
    }

    private static FeedbackSubmission toSubmission(FeedbackRequest request) {
        FeedbackScore score;
        if (request.getScoreLow() != null && request.getScoreHigh() != null) {
            score = FeedbackScore.range(request.getScoreLow(), request.getScoreHigh());
        } else {
            score = FeedbackScore.of(request.getScore());
        }
        return FeedbackSubmission.builder()
                .conversationId(request.getConversationId())
                .query(request.getQuery())
                .responses(new LinkedHashMap<>(request.getResponses()))
                .selectedModel(request.getSelectedModel())
                .score(score)
                .comment(request.getComment())
                .build();
    }

    public record ModelSummaryDto(String name, String role, double weight) {
    }
}
