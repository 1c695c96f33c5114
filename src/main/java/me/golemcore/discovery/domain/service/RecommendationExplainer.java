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

import me.golemcore.discovery.domain.model.AgentScore;
import me.golemcore.discovery.domain.model.DiscoveryResult;
import me.golemcore.discovery.domain.model.TaskAnalysis;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders discovery results and individual scores as plain text for reports and
 * debugging. Pure presentation: no scoring decisions are made here.
 */
@Component
public class RecommendationExplainer {

    private static final int MAX_KEYWORDS_SHOWN = 5;

    /**
     * Render a full discovery result: task summary, search statistics, ranked
     * agents with their match reasons, and suggestions.
     */
    public String explain(DiscoveryResult result) {
        StringBuilder sb = new StringBuilder();
        TaskAnalysis task = result.getTaskAnalysis();

        sb.append("=== Task Analysis ===\n");
        if (task != null) {
            List<String> keywords = task.getKeywords();
            sb.append("Task Type: ").append(task.getTaskType()).append('\n');
            sb.append("Domain: ").append(task.getDomain()).append('\n');
            sb.append("Complexity: ").append(task.getComplexity().value()).append('\n');
            sb.append("Required Capabilities: ").append(String.join(", ", task.getRequiredCapabilities()))
                    .append('\n');
            sb.append("Key Keywords: ")
                    .append(String.join(", ", keywords.subList(0, Math.min(MAX_KEYWORDS_SHOWN, keywords.size()))))
                    .append('\n');
            sb.append("Analysis Confidence: ").append(format(task.getConfidence())).append('\n');
        }
        sb.append('\n');

        sb.append("=== Search Results ===\n");
        sb.append("Total Agents Evaluated: ").append(result.getTotalAgentsEvaluated()).append('\n');
        sb.append("Agents Recommended: ").append(result.getRecommendedAgents().size()).append('\n');
        sb.append("Search Time: ").append(format(result.getSearchTimeSeconds())).append(" seconds\n");
        sb.append('\n');

        if (result.hasRecommendations()) {
            sb.append("=== Recommended Agents ===\n");
            int position = 1;
            for (AgentScore score : result.getRecommendedAgents()) {
                sb.append('\n').append(position++).append(". Agent: ").append(score.getAgentId()).append('\n');
                sb.append("   Score: ").append(format(score.getScore())).append('\n');
                sb.append("   Confidence: ").append(format(score.getConfidence())).append('\n');
                if (!score.getMatchReasons().isEmpty()) {
                    sb.append("   Match Reasons:\n");
                    for (String reason : score.getMatchReasons()) {
                        sb.append("     - ").append(reason).append('\n');
                    }
                }
            }
        } else {
            sb.append("=== No Agents Found ===\n");
        }

        if (!result.getSuggestions().isEmpty()) {
            sb.append("\n=== Suggestions ===\n");
            for (String suggestion : result.getSuggestions()) {
                sb.append("- ").append(suggestion).append('\n');
            }
        }

        return sb.toString().stripTrailing();
    }

    /**
     * Render the breakdown of one agent's score: overall score and confidence,
     * match reasons, and all six sub-scores.
     */
    public String explainScore(AgentScore score) {
        StringBuilder sb = new StringBuilder();
        sb.append("Overall score: ").append(format(score.getScore()))
                .append(" (confidence: ").append(format(score.getConfidence())).append(")\n");

        if (!score.getMatchReasons().isEmpty()) {
            sb.append("Match reasons:\n");
            for (String reason : score.getMatchReasons()) {
                sb.append("  - ").append(reason).append('\n');
            }
        }

        sb.append("Score breakdown:\n");
        sb.append("  - Capability match: ").append(format(score.subScore(AgentScore.CAPABILITY_SCORE))).append('\n');
        sb.append("  - Domain expertise: ").append(format(score.subScore(AgentScore.DOMAIN_SCORE))).append('\n');
        sb.append("  - Keyword relevance: ").append(format(score.subScore(AgentScore.KEYWORD_SCORE))).append('\n');
        sb.append("  - Performance: ").append(format(score.subScore(AgentScore.PERFORMANCE_SCORE))).append('\n');
        sb.append("  - Availability: ").append(format(score.subScore(AgentScore.AVAILABILITY_SCORE))).append('\n');
        sb.append("  - Load: ").append(format(score.subScore(AgentScore.LOAD_SCORE)));
        return sb.toString();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
