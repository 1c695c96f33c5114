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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structured interpretation of a natural-language task request, produced by a
 * {@link me.golemcore.discovery.port.outbound.TaskAnalyzerPort}.
 *
 * <p>
 * Keywords are ordered by relevance, most salient first. Domain is lowercase
 * and defaults to {@code "general"}.
 */
@Value
public class TaskAnalysis {

    public static final String GENERAL_DOMAIN = "general";

    String taskType;
    String domain;
    TaskComplexity complexity;
    Set<String> requiredCapabilities;
    List<String> keywords;
    double confidence;

    @Builder
    public TaskAnalysis(String taskType, String domain, TaskComplexity complexity,
            Collection<String> requiredCapabilities, List<String> keywords, double confidence) {
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Task confidence must be within [0, 1]: " + confidence);
        }
        this.taskType = taskType != null ? taskType : "general";
        this.domain = domain != null && !domain.isBlank()
                ? domain.trim().toLowerCase(Locale.ROOT)
                : GENERAL_DOMAIN;
        this.complexity = complexity != null ? complexity : TaskComplexity.MODERATE;
        this.requiredCapabilities = requiredCapabilities != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(requiredCapabilities))
                : Set.of();
        this.keywords = keywords != null ? List.copyOf(keywords) : List.of();
        this.confidence = confidence;
    }

    public boolean isGeneralDomain() {
        return GENERAL_DOMAIN.equals(domain);
    }
}
