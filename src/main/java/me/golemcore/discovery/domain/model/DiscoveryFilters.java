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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Optional caller filters applied to the candidate set before scoring.
 *
 * <p>
 * {@code status} must equal the status text reported by the registry; a blank
 * value places no constraint. {@code minScore} is accepted for compatibility but has no effect at the
 * candidate stage because nothing has been scored yet; use the
 * {@code minScore} argument of discovery instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryFilters {

    private String status;

    @Builder.Default
    private Set<String> excludeAgents = new HashSet<>();

    private String domain;

    private Double minScore;

    public static DiscoveryFilters none() {
        return new DiscoveryFilters();
    }

    public boolean isEmpty() {
        return (status == null || status.isBlank())
                && (excludeAgents == null || excludeAgents.isEmpty())
                && domain == null
                && minScore == null;
    }
}
