package me.golemcore.discovery.domain.service;

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
import me.golemcore.discovery.domain.model.AgentRecord;
import me.golemcore.discovery.domain.model.AgentScore;
import me.golemcore.discovery.domain.model.DiscoveryFilters;
import me.golemcore.discovery.domain.model.DiscoveryResult;
import me.golemcore.discovery.domain.model.PerformanceMetrics;
import me.golemcore.discovery.domain.model.TaskAnalysis;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import me.golemcore.discovery.port.outbound.RegistryPort;
import me.golemcore.discovery.port.outbound.TaskAnalyzerPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for agent discovery: analyzes a task description, gathers
 * candidates from the registry, ranks them and assembles an explainable
 * {@link DiscoveryResult}.
 *
 * <p>
 * Pipeline:
 *
 * <pre>
 * TaskAnalyzerPort → CandidateRetrievalService → AgentRanker.rank
 *                  → AgentRanker.topN → SuggestionGenerator
 * </pre>
 *
 * <p>
 * Holds no mutable state across calls apart from the shared
 * {@link PerformanceCache}, so independent discoveries may run in parallel.
 */
@Service
@Slf4j
public class AgentDiscoveryService {

    private final TaskAnalyzerPort taskAnalyzer;
    private final RegistryPort registryPort;
    private final CandidateRetrievalService candidateRetrieval;
    private final AgentRanker ranker;
    private final SuggestionGenerator suggestionGenerator;
    private final RecommendationExplainer explainer;
    private final PerformanceCache performanceCache;
    private final DiscoveryProperties.RankingProperties ranking;

    public AgentDiscoveryService(TaskAnalyzerPort taskAnalyzer, RegistryPort registryPort,
            CandidateRetrievalService candidateRetrieval, AgentRanker ranker,
            SuggestionGenerator suggestionGenerator, RecommendationExplainer explainer,
            PerformanceCache performanceCache, DiscoveryProperties properties) {
        this.taskAnalyzer = taskAnalyzer;
        this.registryPort = registryPort;
        this.candidateRetrieval = candidateRetrieval;
        this.ranker = ranker;
        this.suggestionGenerator = suggestionGenerator;
        this.explainer = explainer;
        this.performanceCache = performanceCache;
        this.ranking = properties.getRanking();
    }

    /**
     * Discover agents using the configured default limit and minimum score.
     */
    public DiscoveryResult discoverAgents(String taskDescription) {
        return discoverAgents(taskDescription, ranking.getDefaultLimit(), ranking.getDefaultMinScore(),
                DiscoveryFilters.none());
    }

    /**
     * Discover the agents best suited to a task.
     *
     * @param taskDescription
     *            free-form task text
     * @param limit
     *            maximum number of recommendations
     * @param minScore
     *            minimum combined score for a recommendation
     * @param filters
     *            optional candidate filters, may be null
     */
    public DiscoveryResult discoverAgents(String taskDescription, int limit, double minScore,
            DiscoveryFilters filters) {
        if (taskDescription == null || taskDescription.isBlank()) {
            throw new IllegalArgumentException("Task description must not be blank");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }

        long startNanos = System.nanoTime();
        TaskAnalysis task = taskAnalyzer.analyzeTask(taskDescription);
        log.debug("[Discovery] Task analyzed: type={}, domain={}, complexity={}, capabilities={}",
                task.getTaskType(), task.getDomain(), task.getComplexity(), task.getRequiredCapabilities());

        List<AgentRecord> candidates = candidateRetrieval.gatherCandidates(task, filters);
        Map<String, PerformanceMetrics> performance = performanceCache.snapshot();

        List<AgentScore> ranked = ranker.rank(candidates, task, performance);
        List<AgentScore> recommendations = ranker.topN(ranked, limit, minScore);
        List<String> suggestions = suggestionGenerator.generate(task, recommendations);

        double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        log.info("[Discovery] Evaluated {} agents, recommended {} in {}s",
                candidates.size(), recommendations.size(), String.format("%.3f", elapsedSeconds));

        return DiscoveryResult.builder()
                .taskAnalysis(task)
                .recommendedAgents(recommendations)
                .totalAgentsEvaluated(candidates.size())
                .searchTimeSeconds(elapsedSeconds)
                .suggestions(List.copyOf(suggestions))
                .build();
    }

    public String explainRecommendations(DiscoveryResult result) {
        return explainer.explain(result);
    }

    /**
     * Find agents similar to the given one by discovering agents for a synthetic
     * task built from its domain and capabilities. The agent itself is never part
     * of the result.
     */
    public List<AgentScore> getSimilarAgents(String agentId, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        Optional<AgentRecord> target = registryPort.getAgentMetadata(agentId);
        if (target.isEmpty()) {
            log.debug("[Discovery] Agent {} not found, no similar agents", agentId);
            return List.of();
        }

        AgentRecord agent = target.get();
        StringBuilder description = new StringBuilder("Task requiring ")
                .append(agent.hasDomain() ? agent.getDomain() : TaskAnalysis.GENERAL_DOMAIN)
                .append(" domain expertise");
        if (agent.hasCapabilities()) {
            description.append(" with capabilities: ").append(String.join(", ", agent.getCapabilities()));
        }

        // one extra slot because the target usually ranks first among its own peers
        int searchLimit = limit < Integer.MAX_VALUE ? limit + 1 : limit;
        DiscoveryResult result = discoverAgents(description.toString(), searchLimit,
                ranking.getDefaultMinScore(), DiscoveryFilters.none());
        return result.getRecommendedAgents().stream()
                .filter(score -> !agentId.equals(score.getAgentId()))
                .limit(limit)
                .toList();
    }

    public List<AgentRecord> searchAgentsByCapabilities(List<String> capabilities) {
        return registryPort.searchAgents(null, capabilities, null).getAgents();
    }

    public List<AgentRecord> searchAgentsByDomain(String domain) {
        return registryPort.searchAgents(domain, null, null).getAgents();
    }

    public Optional<AgentRecord> getAgentDetails(String agentId) {
        return registryPort.getAgentMetadata(agentId);
    }

    public void updatePerformanceData(String agentId, PerformanceMetrics metrics) {
        performanceCache.update(agentId, metrics);
    }

    public boolean isRegistryHealthy() {
        return registryPort.isHealthy();
    }
}
