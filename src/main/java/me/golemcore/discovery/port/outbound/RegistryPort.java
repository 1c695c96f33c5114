package me.golemcore.discovery.port.outbound;

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

import me.golemcore.discovery.domain.model.AgentRecord;
import me.golemcore.discovery.domain.model.RegistryQueryResult;

import java.util.List;
import java.util.Optional;

/**
 * Port for the agent registry (directory service). All operations are
 * best-effort: implementations never throw to callers and report failures
 * through {@link RegistryQueryResult} or an empty {@link Optional}.
 */
public interface RegistryPort {

    /**
     * Search agents by free-text query, capabilities and tags. Any argument may be
     * null or empty to leave that criterion out.
     *
     * @param query
     *            free-text query matched against agent id and description
     * @param capabilities
     *            agents declaring any of these capabilities match
     * @param tags
     *            agents carrying any of these tags match
     */
    RegistryQueryResult searchAgents(String query, List<String> capabilities, List<String> tags);

    /**
     * List every registered agent.
     */
    RegistryQueryResult listAgents();

    /**
     * Look up a single agent by id.
     */
    Optional<AgentRecord> getAgentMetadata(String agentId);

    /**
     * Check whether the registry answers its health endpoint.
     */
    boolean isHealthy();
}
