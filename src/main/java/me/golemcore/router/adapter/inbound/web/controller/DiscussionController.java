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
import me.golemcore.router.domain.model.DiscussionLog;
import me.golemcore.router.domain.model.DiscussionRequest;
import me.golemcore.router.domain.model.DiscussionResult;
import me.golemcore.router.domain.service.GroupDiscussionOrchestrator;
import me.golemcore.router.domain.service.OptimizationManager;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Group discussion endpoints. Discussions block on model calls, so they run
 * on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/discussions")
@RequiredArgsConstructor
public class DiscussionController {

    private final OptimizationManager optimizationManager;
    private final GroupDiscussionOrchestrator discussionOrchestrator;
    private final RouterProperties properties;

    @PostMapping
    public Mono<ResponseEntity<DiscussionResult>> startDiscussion(@RequestBody DiscussionRequest request) {
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "query is required");
        }
        if (request.getRounds() != null && request.getRounds() < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "rounds must be positive");
        }
        int maxRounds = properties.getDiscussion().getMaxRounds();
        if (request.getRounds() != null && request.getRounds() > maxRounds) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "rounds must not exceed " + maxRounds);
        }
        return Mono.fromCallable(() -> optimizationManager.conductDiscussion(request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping
    public Mono<ResponseEntity<List<String>>> listDiscussions() {
        return Mono.just(ResponseEntity.ok(discussionOrchestrator.listDiscussions()));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<DiscussionLog>> getDiscussion(@PathVariable String id) {
        DiscussionLog discussion = discussionOrchestrator.getDiscussion(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Discussion '" + id + "' not found"));
        return Mono.just(ResponseEntity.ok(discussion));
    }
}
