package me.golemcore.discovery.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable snapshot of one discovery call.
 *
 * <p>
 * An empty {@code recommendedAgents} list with a positive
 * {@code totalAgentsEvaluated} means agents exist but none matched; a zero
 * count means the registry returned nothing at all.
 */
@Value
@Builder
public class DiscoveryResult {

    TaskAnalysis taskAnalysis;

    @Builder.Default
    List<AgentScore> recommendedAgents = List.of();

    int totalAgentsEvaluated;

    double searchTimeSeconds;

    @Builder.Default
    List<String> suggestions = List.of();

    public boolean hasRecommendations() {
        return recommendedAgents != null && !recommendedAgents.isEmpty();
    }
}
