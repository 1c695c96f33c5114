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
import me.golemcore.discovery.domain.model.AgentScore;
import me.golemcore.discovery.domain.model.AgentStatus;
import me.golemcore.discovery.domain.model.PerformanceMetrics;
import me.golemcore.discovery.domain.model.ScoringWeights;
import me.golemcore.discovery.domain.model.TaskAnalysis;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Multi-factor scoring engine that rates how well a single agent fits a parsed
 * task.
 *
 * <p>
 * Six independent sub-scores, each in [0, 1], are combined with the injected
 * {@link ScoringWeights}:
 *
 * <pre>
 *   capability   - share of required capabilities the agent declares (+ breadth bonus)
 *   domain       - exact, clustered or unrelated expertise domain
 *   keyword      - task keywords found in agent keywords or description
 *   performance  - success rate, response time and reliability from telemetry
 *   availability - reported status, else recency of last-seen
 *   load         - 1 - current load
 * </pre>
 *
 * <p>
 * Confidence reflects how much metadata the agent exposes and is capped by the
 * confidence of the task parse itself.
 *
 * <p>
 * Stateless apart from the injected weights and clock; safe to call
 * concurrently.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentScorer {

    static final double NEUTRAL_SCORE = 0.7;
    static final double NO_CAPABILITIES_SCORE = 0.3;
    static final double GENERAL_AGENT_DOMAIN_SCORE = 0.5;
    static final double RELATED_DOMAIN_THRESHOLD = 0.5;
    static final double DEFAULT_AVAILABILITY = 0.5;

    private static final double BONUS_PER_EXTRA_CAPABILITY = 0.05;
    private static final double MAX_CAPABILITY_BONUS = 0.2;
    private static final double MAX_RESPONSE_TIME_SECONDS = 30.0;

    private static final double BASE_CONFIDENCE = 0.5;

    private final ScoringWeights weights;
    private final Clock clock;

    /**
     * Score an agent against a task.
     *
     * @param agent
     *            candidate agent
     * @param task
     *            parsed task
     * @param performance
     *            telemetry snapshot keyed by agent id, may be null or empty
     */
    public AgentScore score(AgentRecord agent, TaskAnalysis task, Map<String, PerformanceMetrics> performance) {
        List<String> matchReasons = new ArrayList<>();

        double capabilityScore = scoreCapabilities(agent, task, matchReasons);
        double domainScore = scoreDomain(agent, task, matchReasons);
        double keywordScore = scoreKeywords(agent, task, matchReasons);
        double performanceScore = scorePerformance(agent, performance);
        double availabilityScore = scoreAvailability(agent);
        double loadScore = scoreLoad(agent);

        double total = capabilityScore * weights.capability()
                + domainScore * weights.domain()
                + keywordScore * weights.keyword()
                + performanceScore * weights.performance()
                + availabilityScore * weights.availability()
                + loadScore * weights.load();

        Map<String, Double> metadata = new LinkedHashMap<>();
        metadata.put(AgentScore.CAPABILITY_SCORE, capabilityScore);
        metadata.put(AgentScore.DOMAIN_SCORE, domainScore);
        metadata.put(AgentScore.KEYWORD_SCORE, keywordScore);
        metadata.put(AgentScore.PERFORMANCE_SCORE, performanceScore);
        metadata.put(AgentScore.AVAILABILITY_SCORE, availabilityScore);
        metadata.put(AgentScore.LOAD_SCORE, loadScore);

        return AgentScore.builder()
                .agentId(agent.getAgentId() != null ? agent.getAgentId() : "unknown")
                .score(total)
                .confidence(calculateConfidence(agent, task))
                .matchReasons(List.copyOf(matchReasons))
                .metadata(metadata)
                .build();
    }

    double scoreCapabilities(AgentRecord agent, TaskAnalysis task, List<String> matchReasons) {
        Set<String> required = task.getRequiredCapabilities();
        if (required.isEmpty()) {
            return NEUTRAL_SCORE;
        }
        Set<String> declared = agent.getCapabilities();
        if (declared.isEmpty()) {
            return NO_CAPABILITIES_SCORE;
        }

        Set<String> matching = new LinkedHashSet<>(required);
        matching.retainAll(declared);
        double ratio = (double) matching.size() / required.size();

        if (!matching.isEmpty()) {
            matchReasons.add("Matching capabilities: " + String.join(", ", matching));
        }

        if (matching.size() == required.size()) {
            int extra = declared.size() - required.size();
            ratio += Math.min(MAX_CAPABILITY_BONUS, extra * BONUS_PER_EXTRA_CAPABILITY);
        }
        return clip(ratio);
    }

    double scoreDomain(AgentRecord agent, TaskAnalysis task, List<String> matchReasons) {
        String agentDomain = agent.getDomain() != null ? agent.getDomain().toLowerCase(Locale.ROOT) : "";
        String taskDomain = task.getDomain();

        if (TaskAnalysis.GENERAL_DOMAIN.equals(taskDomain)) {
            return NEUTRAL_SCORE;
        }
        if (agentDomain.isEmpty() || TaskAnalysis.GENERAL_DOMAIN.equals(agentDomain)) {
            return GENERAL_AGENT_DOMAIN_SCORE;
        }
        if (agentDomain.equals(taskDomain)) {
            matchReasons.add("Domain expertise: " + taskDomain);
            return 1.0;
        }

        double similarity = DomainClusters.similarity(agentDomain, taskDomain);
        if (similarity > RELATED_DOMAIN_THRESHOLD) {
            matchReasons.add("Related domain: " + agentDomain);
        }
        return similarity;
    }

    double scoreKeywords(AgentRecord agent, TaskAnalysis task, List<String> matchReasons) {
        Set<String> taskKeywords = new LinkedHashSet<>();
        for (String keyword : task.getKeywords()) {
            taskKeywords.add(keyword.toLowerCase(Locale.ROOT));
        }
        if (taskKeywords.isEmpty()) {
            return NEUTRAL_SCORE;
        }

        Set<String> agentKeywords = new LinkedHashSet<>();
        for (String keyword : agent.getKeywords()) {
            agentKeywords.add(keyword.toLowerCase(Locale.ROOT));
        }
        String description = agent.getDescription() != null
                ? agent.getDescription().toLowerCase(Locale.ROOT)
                : "";

        Set<String> matches = new LinkedHashSet<>();
        for (String keyword : taskKeywords) {
            if (agentKeywords.contains(keyword) || description.contains(keyword)) {
                matches.add(keyword);
            }
        }

        if (!matches.isEmpty()) {
            matchReasons.add("Keyword matches: " + String.join(", ", matches));
        }
        return clip((double) matches.size() / taskKeywords.size());
    }

    double scorePerformance(AgentRecord agent, Map<String, PerformanceMetrics> performance) {
        if (performance == null || performance.isEmpty()) {
            return NEUTRAL_SCORE;
        }
        PerformanceMetrics metrics = performance.get(agent.getAgentId());
        if (metrics == null) {
            return NEUTRAL_SCORE;
        }

        double timeScore = Math.max(0.0, 1.0 - metrics.avgResponseTimeOrDefault() / MAX_RESPONSE_TIME_SECONDS);
        double combined = metrics.successRateOrDefault() * 0.5
                + timeScore * 0.3
                + metrics.reliabilityOrDefault() * 0.2;
        return clip(combined);
    }

    double scoreAvailability(AgentRecord agent) {
        AgentStatus status = agent.getStatus();
        if (status != null) {
            switch (status) {
                case OFFLINE:
                    return 0.0;
                case BUSY:
                    return 0.3;
                case AVAILABLE:
                case ONLINE:
                    return 1.0;
                default:
                    break;
            }
        }

        if (!agent.hasLastSeen()) {
            return DEFAULT_AVAILABILITY;
        }
        Instant lastSeen = parseLastSeen(agent.getLastSeen());
        if (lastSeen == null) {
            log.debug("[Scorer] Unparseable last_seen '{}' for agent {}, using default availability",
                    agent.getLastSeen(), agent.getAgentId());
            return DEFAULT_AVAILABILITY;
        }

        Duration sinceSeen = Duration.between(lastSeen, clock.instant());
        if (sinceSeen.compareTo(Duration.ofMinutes(5)) < 0) {
            return 1.0;
        }
        if (sinceSeen.compareTo(Duration.ofHours(1)) < 0) {
            return 0.8;
        }
        if (sinceSeen.compareTo(Duration.ofDays(1)) < 0) {
            return 0.5;
        }
        return 0.2;
    }

    double scoreLoad(AgentRecord agent) {
        return clip(1.0 - agent.getCurrentLoad());
    }

    double calculateConfidence(AgentRecord agent, TaskAnalysis task) {
        double confidence = BASE_CONFIDENCE;
        if (agent.hasCapabilities()) {
            confidence += 0.2;
        }
        if (agent.hasDescription()) {
            confidence += 0.1;
        }
        if (agent.hasDomain()) {
            confidence += 0.1;
        }
        if (agent.hasLastSeen()) {
            confidence += 0.05;
        }
        if (agent.getStatus() != null) {
            confidence += 0.05;
        }
        return Math.min(1.0, confidence * task.getConfidence());
    }

    /**
     * Accepts ISO-8601 instants with an offset or {@code Z}, and local date-times
     * without one, which are read in the clock's zone.
     */
    private Instant parseLastSeen(String value) {
        String text = value.trim();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).atZone(clock.getZone()).toInstant();
            } catch (DateTimeParseException nested) {
                return null;
            }
        }
    }

    private static double clip(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
