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

/**
 * Result of a single registry query. Distinguishes "the registry answered with
 * nothing" from "the query failed"; callers that do not care read
 * {@link #getAgents()}, which is empty in both cases.
 */
@Value
@Builder
public class RegistryQueryResult {

    boolean success;

    @Builder.Default
    List<AgentRecord> agents = List.of();

    String error;

    public static RegistryQueryResult success(List<AgentRecord> agents) {
        return RegistryQueryResult.builder()
                .success(true)
                .agents(agents != null ? List.copyOf(agents) : List.of())
                .build();
    }

    public static RegistryQueryResult failure(String error) {
        return RegistryQueryResult.builder()
                .success(false)
                .error(error)
                .build();
    }
}
