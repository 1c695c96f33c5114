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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.discovery.domain.model.AgentRecord;
import me.golemcore.discovery.domain.model.RegistryQueryResult;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import me.golemcore.discovery.port.outbound.RegistryPort;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Agent registry adapter that talks to the registry REST API over HTTP.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /search?q=&amp;capabilities=&amp;tags= - Filtered agent search
 * <li>GET /list - Full agent listing
 * <li>GET /lookup/{agentId} - Single agent metadata
 * <li>GET /health - Health check
 * </ul>
 *
 * <p>
 * Calls are blocking and bounded by {@code discovery.registry.timeout-seconds}.
 * Nothing is thrown to callers: transport errors and non-2xx answers become
 * {@link RegistryQueryResult#failure(String)}. When search itself fails, the
 * adapter can filter the full listing locally instead (see
 * {@code discovery.registry.local-filter-fallback}).
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code discovery.registry.enabled} - Disabled registry answers every
 * query with an empty success
 * <li>{@code discovery.registry.url} - Registry base URL
 * <li>{@code discovery.registry.api-key} - Optional bearer token
 * </ul>
 *
 * @see me.golemcore.discovery.port.outbound.RegistryPort
 */
@Component
@Slf4j
public class HttpRegistryAdapter implements RegistryPort {

    private final DiscoveryProperties.RegistryProperties registry;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RegistryAgentMapper mapper = new RegistryAgentMapper();

    public HttpRegistryAdapter(DiscoveryProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.registry = properties.getRegistry();
        this.objectMapper = objectMapper;

        // Dedicated client with registry-specific timeout
        int timeoutSeconds = registry.getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public RegistryQueryResult searchAgents(String query, List<String> capabilities, List<String> tags) {
        if (!registry.isEnabled()) {
            return RegistryQueryResult.success(List.of());
        }

        HttpUrl base = endpoint("search");
        if (base == null) {
            return RegistryQueryResult.failure("Invalid registry URL: " + registry.getUrl());
        }
        HttpUrl.Builder url = base.newBuilder();
        if (query != null && !query.isEmpty()) {
            url.addQueryParameter("q", query);
        }
        if (capabilities != null && !capabilities.isEmpty()) {
            url.addQueryParameter("capabilities", String.join(",", capabilities));
        }
        if (tags != null && !tags.isEmpty()) {
            url.addQueryParameter("tags", String.join(",", tags));
        }

        RegistryQueryResult result = fetchAgents(url.build());
        if (result.isSuccess() || !registry.isLocalFilterFallback()) {
            return result;
        }

        log.debug("[Registry] Search unavailable ({}), filtering listing locally", result.getError());
        return filterLocally(query, capabilities, tags);
    }

    @Override
    public RegistryQueryResult listAgents() {
        if (!registry.isEnabled()) {
            return RegistryQueryResult.success(List.of());
        }
        HttpUrl url = endpoint("list");
        if (url == null) {
            return RegistryQueryResult.failure("Invalid registry URL: " + registry.getUrl());
        }
        return fetchAgents(url);
    }

    @Override
    public Optional<AgentRecord> getAgentMetadata(String agentId) {
        if (!registry.isEnabled() || agentId == null || agentId.isBlank()) {
            return Optional.empty();
        }
        HttpUrl base = endpoint("lookup");
        if (base == null) {
            return Optional.empty();
        }
        HttpUrl url = base.newBuilder().addPathSegment(agentId).build();

        try (Response response = httpClient.newCall(request(url)).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.debug("[Registry] Lookup of {} failed: HTTP {}", agentId, response.code());
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(body.string());
            AgentRecord record = mapper.toRecord(withAgentId(node, agentId));
            return Optional.ofNullable(record);
        } catch (IOException e) {
            log.warn("[Registry] Lookup of {} error: {}", agentId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean isHealthy() {
        if (!registry.isEnabled()) {
            return false;
        }
        HttpUrl url = endpoint("health");
        if (url == null) {
            return false;
        }
        try (Response response = httpClient.newCall(request(url)).execute()) {
            return response.isSuccessful();
        } catch (IOException e) {
            log.debug("[Registry] Health check failed: {}", e.getMessage());
            return false;
        }
    }

    private RegistryQueryResult fetchAgents(HttpUrl url) {
        try (Response response = httpClient.newCall(request(url)).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.warn("[Registry] {} failed: HTTP {}", url.encodedPath(), response.code());
                return RegistryQueryResult.failure("HTTP " + response.code());
            }
            JsonNode root = objectMapper.readTree(body.string());
            return RegistryQueryResult.success(mapper.toRecords(root));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("[Registry] {} error: {}", url.encodedPath(), e.getMessage());
            return RegistryQueryResult.failure(e.getMessage());
        }
    }

    private RegistryQueryResult filterLocally(String query, List<String> capabilities, List<String> tags) {
        RegistryQueryResult listing = listAgents();
        if (!listing.isSuccess()) {
            return listing;
        }

        String needle = query != null ? query.toLowerCase(Locale.ROOT) : "";
        List<AgentRecord> filtered = new ArrayList<>();
        for (AgentRecord agent : listing.getAgents()) {
            if (!needle.isEmpty()) {
                String haystack = (agent.getAgentId() + " " + agent.getDescription()).toLowerCase(Locale.ROOT);
                if (!haystack.contains(needle)) {
                    continue;
                }
            }
            if (capabilities != null && !capabilities.isEmpty()
                    && capabilities.stream().noneMatch(agent.getCapabilities()::contains)) {
                continue;
            }
            if (tags != null && !tags.isEmpty()
                    && tags.stream().noneMatch(agent.getTags()::contains)) {
                continue;
            }
            filtered.add(agent);
        }
        return RegistryQueryResult.success(filtered);
    }

    private JsonNode withAgentId(JsonNode node, String agentId) {
        if (node != null && node.isObject() && !node.hasNonNull("agent_id")) {
            ((ObjectNode) node).put("agent_id", agentId);
        }
        return node;
    }

    private HttpUrl endpoint(String path) {
        String base = registry.getUrl();
        if (base == null || base.isBlank()) {
            return null;
        }
        String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return HttpUrl.parse(trimmed + "/" + path);
    }

    private Request request(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url).get();
        String apiKey = registry.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }
}
