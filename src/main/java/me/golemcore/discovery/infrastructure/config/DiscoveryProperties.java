package me.golemcore.discovery.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the discovery service, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code discovery.*} prefix:
 * <ul>
 * <li>{@link RegistryProperties} - agent registry endpoint</li>
 * <li>{@link HttpProperties} - shared HTTP client settings</li>
 * <li>{@link RankingProperties} - default limits and scoring weights</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "discovery")
@Data
public class DiscoveryProperties {

    private RegistryProperties registry = new RegistryProperties();
    private HttpProperties http = new HttpProperties();
    private RankingProperties ranking = new RankingProperties();

    @Data
    public static class RegistryProperties {
        private boolean enabled = true;
        private String url = "https://registry.chat39.com";
        private String apiKey;
        private int timeoutSeconds = 10;
        /**
         * Filter the full listing client-side when the search endpoint answers with
         * a non-2xx status or cannot be reached.
         */
        private boolean localFilterFallback = true;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class RankingProperties {
        private int defaultLimit = 5;
        private double defaultMinScore = 0.3;
        private WeightsProperties weights = new WeightsProperties();
    }

    @Data
    public static class WeightsProperties {
        private double capability = 0.35;
        private double domain = 0.25;
        private double keyword = 0.20;
        private double performance = 0.10;
        private double availability = 0.05;
        private double load = 0.05;
    }
}
