package me.golemcore.discovery.adapter.inbound.web.controller;

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
import me.golemcore.discovery.adapter.inbound.web.dto.DiscoveryRequestDto;
import me.golemcore.discovery.domain.model.AgentRecord;
import me.golemcore.discovery.domain.model.AgentScore;
import me.golemcore.discovery.domain.model.DiscoveryResult;
import me.golemcore.discovery.domain.model.PerformanceMetrics;
import me.golemcore.discovery.domain.service.AgentDiscoveryService;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Agent discovery endpoints. Discovery performs blocking registry calls, so
 * those handlers run on the bounded-elastic scheduler.
 */
@RestController
@RequestMapping("/api/discovery")
@RequiredArgsConstructor
public class DiscoveryController {

    private final AgentDiscoveryService discoveryService;
    private final DiscoveryProperties properties;

    @PostMapping
    public Mono<ResponseEntity<DiscoveryResult>> discover(@RequestBody DiscoveryRequestDto request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(runDiscovery(request)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/explain")
    public Mono<ResponseEntity<Map<String, String>>> explain(@RequestBody DiscoveryRequestDto request) {
        return Mono.fromCallable(() -> {
            DiscoveryResult result = runDiscovery(request);
            return ResponseEntity.ok(Map.of("explanation", discoveryService.explainRecommendations(result)));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/agents/{agentId}")
    public Mono<ResponseEntity<AgentRecord>> getAgent(@PathVariable String agentId) {
        return Mono.fromCallable(() -> discoveryService.getAgentDetails(agentId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/agents/{agentId}/similar")
    public Mono<ResponseEntity<List<AgentScore>>> similarAgents(
            @PathVariable String agentId, @RequestParam(defaultValue = "3") int limit) {
        if (limit < 0) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must not be negative"));
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(discoveryService.getSimilarAgents(agentId, limit)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping("/agents/{agentId}/performance")
    public Mono<ResponseEntity<Map<String, String>>> updatePerformance(
            @PathVariable String agentId, @RequestBody PerformanceMetrics metrics) {
        discoveryService.updatePerformanceData(agentId, metrics);
        return Mono.just(ResponseEntity.ok(Map.of("status", "updated")));
    }

    @GetMapping("/registry/health")
    public Mono<ResponseEntity<Map<String, Boolean>>> registryHealth() {
        return Mono.fromCallable(() -> ResponseEntity.ok(Map.of("healthy", discoveryService.isRegistryHealthy())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private DiscoveryResult runDiscovery(DiscoveryRequestDto request) {
        if (request == null || request.getTask() == null || request.getTask().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "task is required");
        }
        DiscoveryProperties.RankingProperties ranking = properties.getRanking();
        int limit = request.getLimit() != null ? request.getLimit() : ranking.getDefaultLimit();
        double minScore = request.getMinScore() != null ? request.getMinScore() : ranking.getDefaultMinScore();
        return discoveryService.discoverAgents(request.getTask(), limit, minScore, request.getFilters());
    }
}
