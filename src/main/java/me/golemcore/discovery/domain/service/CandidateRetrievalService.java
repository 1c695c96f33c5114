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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.discovery.domain.model.AgentRecord;
import me.golemcore.discovery.domain.model.DiscoveryFilters;
import me.golemcore.discovery.domain.model.RegistryQueryResult;
import me.golemcore.discovery.domain.model.TaskAnalysis;
import me.golemcore.discovery.port.outbound.RegistryPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Gathers the candidate agents for a task from the registry.
 *
 * <p>
 * Up to three queries are issued:
 * <ol>
 * <li>by required capabilities (skipped when the task requires none)</li>
 * <li>by domain text (skipped for the {@code general} domain)</li>
 * <li>by the three most salient keywords joined with spaces (skipped when there
 * are none)</li>
 * </ol>
 * Results are unioned in retrieval order and deduplicated by full-record
 * equality, so records that differ in any field stay distinct. The
 * {@code status} filter compares against {@link AgentRecord#statusText()}
 * exactly. Caller filters are applied to the union; if nothing survives, the
 * full unfiltered registry listing is used instead.
 *
 * <p>
 * A failed query contributes nothing and never aborts the discovery call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CandidateRetrievalService {

    static final int KEYWORD_QUERY_SIZE = 3;

    private final RegistryPort registryPort;

    public List<AgentRecord> gatherCandidates(TaskAnalysis task, DiscoveryFilters filters) {
        Set<AgentRecord> union = new LinkedHashSet<>();

        if (!task.getRequiredCapabilities().isEmpty()) {
            List<String> capabilities = new ArrayList<>(task.getRequiredCapabilities());
            addAll(union, registryPort.searchAgents(null, capabilities, null), "capabilities");
        }

        if (!task.isGeneralDomain()) {
            addAll(union, registryPort.searchAgents(task.getDomain(), null, null), "domain");
        }

        if (!task.getKeywords().isEmpty()) {
            List<String> topKeywords = task.getKeywords()
                    .subList(0, Math.min(KEYWORD_QUERY_SIZE, task.getKeywords().size()));
            addAll(union, registryPort.searchAgents(String.join(" ", topKeywords), null, null), "keywords");
        }

        List<AgentRecord> candidates = new ArrayList<>(union);
        if (filters != null && !filters.isEmpty()) {
            candidates = applyFilters(candidates, filters);
        }

        if (candidates.isEmpty()) {
            log.debug("[Retrieval] No targeted candidates, falling back to full listing");
            candidates = registryPort.listAgents().getAgents();
        }

        log.debug("[Retrieval] Gathered {} candidates", candidates.size());
        return candidates;
    }

    List<AgentRecord> applyFilters(List<AgentRecord> agents, DiscoveryFilters filters) {
        List<AgentRecord> filtered = agents;

        String wantedStatus = filters.getStatus();
        if (wantedStatus != null && !wantedStatus.isBlank()) {
            filtered = filtered.stream()
                    .filter(agent -> wantedStatus.equals(agent.statusText()))
                    .toList();
        }

        // filters.getMinScore() is intentionally not applied: no scores exist yet at
        // this stage. Score thresholds are enforced by AgentRanker#topN.

        Set<String> excluded = filters.getExcludeAgents();
        if (excluded != null && !excluded.isEmpty()) {
            filtered = filtered.stream()
                    .filter(agent -> !excluded.contains(agent.getAgentId()))
                    .toList();
        }

        if (filters.getDomain() != null) {
            String domain = filters.getDomain().toLowerCase(Locale.ROOT);
            filtered = filtered.stream()
                    .filter(agent -> agent.getDomain() != null
                            && agent.getDomain().toLowerCase(Locale.ROOT).equals(domain))
                    .toList();
        }

        return filtered;
    }

    private void addAll(Set<AgentRecord> union, RegistryQueryResult result, String queryKind) {
        if (!result.isSuccess()) {
            log.warn("[Retrieval] {} query failed: {}", queryKind, result.getError());
            return;
        }
        // records equal in every field collapse, first occurrence keeps its position
        union.addAll(result.getAgents());
    }
}
