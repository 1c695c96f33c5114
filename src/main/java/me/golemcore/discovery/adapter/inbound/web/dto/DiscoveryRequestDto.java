package me.golemcore.discovery.adapter.inbound.web.dto;

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
import me.golemcore.discovery.domain.model.DiscoveryFilters;

/**
 * Request body for discovery endpoints. Missing {@code limit} and
 * {@code minScore} fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryRequestDto {
    private String task;
    private Integer limit;
    private Double minScore;
    private DiscoveryFilters filters;
}
