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
import me.golemcore.discovery.domain.model.TaskAnalysis;
import me.golemcore.discovery.domain.model.TaskComplexity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives actionable hints from the shape of a discovery result.
 *
 * <p>
 * The first three rules (no results, a single result, a complex task) are
 * alternatives; the task-type and weak-top-score rules fire independently.
 */
@Component
public class SuggestionGenerator {

    static final double MODERATE_SCORE_THRESHOLD = 0.7;

    public List<String> generate(TaskAnalysis task, List<AgentScore> recommendations) {
        List<String> suggestions = new ArrayList<>();

        if (recommendations.isEmpty()) {
            suggestions.add("No agents found matching your requirements");
            suggestions.add("Try searching for agents with '" + task.getDomain() + "' domain expertise");
            suggestions.add("Consider breaking down your task into smaller components");
            suggestions.add("Check if your required capabilities are too specific");
        } else if (recommendations.size() == 1) {
            suggestions.add("Only one agent found - consider broadening your search criteria");
        } else if (task.getComplexity() == TaskComplexity.COMPLEX) {
            suggestions.add("This appears to be a complex task");
            suggestions.add("Consider using multiple agents for different components");
            suggestions.add("Review the top agents' capabilities to ensure full coverage");
        }

        if ("data_analysis".equals(task.getTaskType())) {
            suggestions.add("For data analysis tasks, ensure agents have visualization capabilities");
        } else if ("automation".equals(task.getTaskType())) {
            suggestions.add("For automation, look for agents with workflow management features");
        }

        if (!recommendations.isEmpty() && recommendations.get(0).getScore() < MODERATE_SCORE_THRESHOLD) {
            suggestions.add("Match confidence is moderate - review agent details carefully");
        }

        return suggestions;
    }
}
