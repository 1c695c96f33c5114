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
import me.golemcore.discovery.domain.model.PerformanceMetrics;
import me.golemcore.discovery.domain.model.TaskAnalysis;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders scored candidates and trims them down to recommendations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRanker {

    /**
     * Minimum confidence a score needs to be recommended, regardless of the
     * caller's {@code minScore}.
     */
    public static final double CONFIDENCE_FLOOR = 0.4;

    private final AgentScorer scorer;

    /**
     * Score every agent and sort by score, highest first. Agents with equal scores
     * keep their input order.
     */
    public List<AgentScore> rank(List<AgentRecord> agents, TaskAnalysis task,
            Map<String, PerformanceMetrics> performance) {
        List<AgentScore> scores = new ArrayList<>(agents.size());
        for (AgentRecord agent : agents) {
            AgentScore score = scorer.score(agent, task, performance);
            log.trace("[Ranker] {} scored {} (confidence {})", score.getAgentId(),
                    String.format("%.3f", score.getScore()), String.format("%.2f", score.getConfidence()));
            scores.add(score);
        }
        // List.sort is a stable merge sort
        scores.sort(Comparator.comparingDouble(AgentScore::getScore).reversed());
        return scores;
    }

    /**
     * Keep scores with {@code score >= minScore} and
     * {@code confidence >= }{@value #CONFIDENCE_FLOOR}, then truncate to
     * {@code limit}. Input order is preserved.
     */
    public List<AgentScore> topN(List<AgentScore> scores, int limit, double minScore) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        return scores.stream()
                .filter(score -> score.getScore() >= minScore && score.getConfidence() >= CONFIDENCE_FLOOR)
                .limit(limit)
                .toList();
    }
}
