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

import me.golemcore.discovery.domain.model.PerformanceMetrics;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory telemetry cache of per-agent performance metrics. Written
 * out-of-band as telemetry arrives; scoring reads an immutable
 * {@link #snapshot()} so a discovery call sees a consistent view.
 */
@Component
public class PerformanceCache {

    private final Map<String, PerformanceMetrics> metricsByAgent = new ConcurrentHashMap<>();

    public void update(String agentId, PerformanceMetrics metrics) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        if (metrics == null) {
            metricsByAgent.remove(agentId);
            return;
        }
        metricsByAgent.put(agentId, metrics);
    }

    public Map<String, PerformanceMetrics> snapshot() {
        return Map.copyOf(metricsByAgent);
    }

    public void clear() {
        metricsByAgent.clear();
    }
}
