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

import java.util.Locale;

/**
 * Reported presence of an agent in the registry.
 */
public enum AgentStatus {

    ONLINE,

    AVAILABLE,

    BUSY,

    OFFLINE,

    /**
     * Status was reported but not recognized.
     */
    UNKNOWN;

    /**
     * Parses a registry status string. Blank input means the status is absent and
     * yields {@code null}; any other unrecognized value maps to {@link #UNKNOWN}.
     */
    public static AgentStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return AgentStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
