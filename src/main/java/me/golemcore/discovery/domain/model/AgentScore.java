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
import java.util.Map;

/**
 * Outcome of scoring one agent against one task.
 *
 * <p>
 * {@code score} is the weighted sum of six sub-scores, each in [0, 1], so it is
 * bounded by the sum of weights. {@code metadata} keeps every raw sub-score
 * under its {@code *_score} key for auditing.
 */
@Value
@Builder
public class AgentScore {

    public static final String CAPABILITY_SCORE = "capability_score";
    public static final String DOMAIN_SCORE = "domain_score";
    public static final String KEYWORD_SCORE = "keyword_score";
    public static final String PERFORMANCE_SCORE = "performance_score";
    public static final String AVAILABILITY_SCORE = "availability_score";
    public static final String LOAD_SCORE = "load_score";

    String agentId;
    double score;
    double confidence;

    @Builder.Default
    List<String> matchReasons = List.of();

    @Builder.Default
    Map<String, Double> metadata = Map.of();

    public double subScore(String key) {
        return metadata.getOrDefault(key, 0.0);
    }
}
