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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Historical performance of an agent as reported by telemetry. Any component
 * may be null, in which case scoring substitutes its default.
 *
 * <ul>
 * <li>{@code successRate} - share of successfully completed tasks, [0, 1]</li>
 * <li>{@code avgResponseTimeSeconds} - mean response latency in seconds</li>
 * <li>{@code reliability} - uptime/consistency estimate, [0, 1]</li>
 * </ul>
 */
public record PerformanceMetrics(
        @JsonProperty("success_rate") Double successRate,
        @JsonProperty("avg_response_time") Double avgResponseTimeSeconds,
        @JsonProperty("reliability") Double reliability) {

    public static final double DEFAULT_SUCCESS_RATE = 0.7;
    public static final double DEFAULT_RESPONSE_TIME_SECONDS = 5.0;
    public static final double DEFAULT_RELIABILITY = 0.7;

    public double successRateOrDefault() {
        return successRate != null ? successRate : DEFAULT_SUCCESS_RATE;
    }

    public double avgResponseTimeOrDefault() {
        return avgResponseTimeSeconds != null ? avgResponseTimeSeconds : DEFAULT_RESPONSE_TIME_SECONDS;
    }

    public double reliabilityOrDefault() {
        return reliability != null ? reliability : DEFAULT_RELIABILITY;
    }
}
