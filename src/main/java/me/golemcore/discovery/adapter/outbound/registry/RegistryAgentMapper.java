package me.golemcore.discovery.adapter.outbound.registry;

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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.discovery.domain.model.AgentRecord;
import me.golemcore.discovery.domain.model.AgentStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps registry JSON entries onto {@link AgentRecord}.
 *
 * <p>
 * The registry is loosely typed, so mapping is lenient: list fields accept
 * either a JSON array or a comma-separated string, the domain is lowercased,
 * and a missing, non-numeric or non-finite {@code current_load} becomes the
 * default load.
 * Entries without an {@code agent_id} are skipped.
 */
class RegistryAgentMapper {

    List<AgentRecord> toRecords(JsonNode root) {
        JsonNode entries = root;
        if (root != null && root.isObject() && root.has("agents")) {
            entries = root.get("agents");
        }
        if (entries == null || !entries.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array of agents");
        }

        List<AgentRecord> records = new ArrayList<>();
        for (JsonNode entry : entries) {
            AgentRecord record = toRecord(entry);
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    AgentRecord toRecord(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String agentId = text(node, "agent_id");
        if (agentId == null || agentId.isBlank()) {
            return null;
        }

        String domain = text(node, "domain");
        String status = text(node, "status");
        return AgentRecord.builder()
                .agentId(agentId)
                .capabilities(stringSet(node.get("capabilities")))
                .domain(domain != null ? domain.trim().toLowerCase(Locale.ROOT) : "")
                .keywords(stringSet(node.get("keywords")))
                .tags(stringSet(node.get("tags")))
                .description(text(node, "description") != null ? text(node, "description") : "")
                .agentUrl(text(node, "agent_url"))
                .status(AgentStatus.fromValue(status))
                .reportedStatus(status)
                .lastSeen(text(node, "last_seen"))
                .currentLoad(load(node.get("current_load")))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static Set<String> stringSet(JsonNode value) {
        if (value == null || value.isNull()) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        if (value.isArray()) {
            for (JsonNode item : value) {
                addTrimmed(result, item.asText());
            }
        } else {
            for (String item : value.asText().split(",")) {
                addTrimmed(result, item);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private static void addTrimmed(Set<String> target, String item) {
        if (item != null && !item.isBlank()) {
            target.add(item.trim());
        }
    }

    private static double load(JsonNode value) {
        if (value == null || value.isNull()) {
            return AgentRecord.DEFAULT_LOAD;
        }
        double load;
        if (value.isNumber()) {
            load = value.asDouble();
        } else {
            try {
                load = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return AgentRecord.DEFAULT_LOAD;
            }
        }
        return Double.isFinite(load) ? load : AgentRecord.DEFAULT_LOAD;
    }
}
