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

import java.util.Set;

/**
 * Normalized, read-only view of a registry entry describing one addressable
 * agent.
 *
 * <p>
 * Collections are never null. {@code domain} is lowercase and may be empty or
 * {@code "general"}. {@code status} and {@code lastSeen} are null when the
 * registry did not report them; {@code lastSeen} keeps the raw ISO-8601 text as
 * reported, and is interpreted only when availability is scored.
 * {@code reportedStatus} is the status text exactly as the registry sent it.
 *
 * <p>
 * Equality covers every field, with collections compared regardless of order.
 * Candidate deduplication relies on it.
 */
@Value
@Builder
public class AgentRecord {

    public static final double DEFAULT_LOAD = 0.5;

    String agentId;

    @Builder.Default
    Set<String> capabilities = Set.of();

    @Builder.Default
    String domain = "";

    @Builder.Default
    Set<String> keywords = Set.of();

    @Builder.Default
    Set<String> tags = Set.of();

    @Builder.Default
    String description = "";

    String agentUrl;

    AgentStatus status;

    String reportedStatus;

    String lastSeen;

    @Builder.Default
    double currentLoad = DEFAULT_LOAD;

    public boolean hasCapabilities() {
        return capabilities != null && !capabilities.isEmpty();
    }

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }

    public boolean hasLastSeen() {
        return lastSeen != null && !lastSeen.isBlank();
    }

    public boolean hasDomain() {
        return domain != null && !domain.isBlank();
    }

    /**
     * Status text used for exact status filtering: the raw registry value when
     * known, otherwise the parsed status name.
     */
    public String statusText() {
        if (reportedStatus != null) {
            return reportedStatus;
        }
        return status != null ? status.value() : null;
    }
}
