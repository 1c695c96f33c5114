package me.golemcore.discovery.adapter.outbound.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.discovery.domain.model.AgentRecord;
import me.golemcore.discovery.domain.model.AgentStatus;
import me.golemcore.discovery.domain.model.RegistryQueryResult;
import me.golemcore.discovery.infrastructure.config.DiscoveryProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HttpRegistryAdapterTest {

    private static final String LISTING = """
            [
              {"agent_id": "search-bot", "capabilities": ["search", "nlp"], "domain": "Technology",
               "description": "Semantic search agent", "tags": ["retrieval"], "status": "online",
               "current_load": 0.2},
              {"agent_id": "ledger", "capabilities": "accounting, reporting", "domain": "finance",
               "description": "Bookkeeping helper", "tags": ["books"]}
            ]
            """;

    private MockWebServer mockServer;
    private DiscoveryProperties properties;
    private OkHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        client = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(5, TimeUnit.SECONDS)
                .build();

        properties = new DiscoveryProperties();
        properties.getRegistry().setUrl(mockServer.url("/").toString());
        properties.getRegistry().setTimeoutSeconds(5);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    private HttpRegistryAdapter adapter() {
        return new HttpRegistryAdapter(properties, client, new ObjectMapper());
    }

    private static MockResponse json(String body) {
        return new MockResponse().setBody(body).addHeader("Content-Type", "application/json");
    }

    @Test
    void searchSendsQueryParametersAndMapsAgents() throws Exception {
        mockServer.enqueue(json(LISTING));

        RegistryQueryResult result = adapter().searchAgents("semantic search", List.of("search", "nlp"),
                List.of("retrieval"));

        assertTrue(result.isSuccess());
        assertEquals(2, result.getAgents().size());
        AgentRecord first = result.getAgents().get(0);
        assertEquals("search-bot", first.getAgentId());
        assertEquals("technology", first.getDomain());
        assertEquals(AgentStatus.ONLINE, first.getStatus());
        assertEquals(0.2, first.getCurrentLoad());
        assertEquals(Set.of("accounting", "reporting"), result.getAgents().get(1).getCapabilities());

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("GET", request.getMethod());
        assertEquals("/search", request.getRequestUrl().encodedPath());
        assertEquals("semantic search", request.getRequestUrl().queryParameter("q"));
        assertEquals("search,nlp", request.getRequestUrl().queryParameter("capabilities"));
        assertEquals("retrieval", request.getRequestUrl().queryParameter("tags"));
        assertNull(request.getHeader("Authorization"));
    }

    @Test
    void searchOmitsEmptyParameters() throws Exception {
        mockServer.enqueue(json("{\"agents\": []}"));

        RegistryQueryResult result = adapter().searchAgents(null, List.of("nlp"), null);

        assertTrue(result.isSuccess());
        assertTrue(result.getAgents().isEmpty());
        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNull(request.getRequestUrl().queryParameter("q"));
        assertNull(request.getRequestUrl().queryParameter("tags"));
        assertEquals("nlp", request.getRequestUrl().queryParameter("capabilities"));
    }

    @Test
    void failedSearchFallsBackToLocalFiltering() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));
        mockServer.enqueue(json(LISTING));

        RegistryQueryResult byQuery = adapter().searchAgents("bookkeeping", null, null);

        assertTrue(byQuery.isSuccess());
        assertEquals(List.of("ledger"), byQuery.getAgents().stream().map(AgentRecord::getAgentId).toList());
        assertEquals("/search", mockServer.takeRequest(1, TimeUnit.SECONDS).getRequestUrl().encodedPath());
        assertEquals("/list", mockServer.takeRequest(1, TimeUnit.SECONDS).getRequestUrl().encodedPath());
    }

    @Test
    void localFilteringMatchesAnyCapabilityOrTag() {
        mockServer.enqueue(new MockResponse().setResponseCode(500));
        mockServer.enqueue(json(LISTING));
        mockServer.enqueue(new MockResponse().setResponseCode(500));
        mockServer.enqueue(json(LISTING));

        HttpRegistryAdapter adapter = adapter();
        RegistryQueryResult byCapability = adapter.searchAgents(null, List.of("vision", "reporting"), null);
        RegistryQueryResult byTag = adapter.searchAgents(null, null, List.of("retrieval"));

        assertEquals(List.of("ledger"), byCapability.getAgents().stream().map(AgentRecord::getAgentId).toList());
        assertEquals(List.of("search-bot"), byTag.getAgents().stream().map(AgentRecord::getAgentId).toList());
    }

    @Test
    void failedSearchWithoutFallbackReportsFailure() {
        properties.getRegistry().setLocalFilterFallback(false);
        mockServer.enqueue(new MockResponse().setResponseCode(500));

        RegistryQueryResult result = adapter().searchAgents("x", null, null);

        assertFalse(result.isSuccess());
        assertEquals("HTTP 500", result.getError());
        assertEquals(1, mockServer.getRequestCount());
    }

    @Test
    void malformedPayloadIsAFailure() {
        mockServer.enqueue(json("{\"unexpected\": true}"));

        RegistryQueryResult result = adapter().listAgents();

        assertFalse(result.isSuccess());
        assertNotNull(result.getError());
    }

    @Test
    void unreachableRegistryIsAFailure() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        properties.getRegistry().setUrl(stopped.url("/").toString());
        stopped.shutdown();

        HttpRegistryAdapter adapter = adapter();
        RegistryQueryResult result = adapter.listAgents();

        assertFalse(result.isSuccess());
        assertTrue(result.getAgents().isEmpty());
        assertFalse(adapter.isHealthy());
    }

    @Test
    void lookupReturnsAgentAndFillsMissingId() throws Exception {
        mockServer.enqueue(json("{\"capabilities\": [\"nlp\"], \"last_seen\": \"2026-01-15T11:00:00Z\"}"));

        Optional<AgentRecord> agent = adapter().getAgentMetadata("writer");

        assertTrue(agent.isPresent());
        assertEquals("writer", agent.get().getAgentId());
        assertEquals("2026-01-15T11:00:00Z", agent.get().getLastSeen());
        assertEquals("/lookup/writer", mockServer.takeRequest(1, TimeUnit.SECONDS).getPath());
    }

    @Test
    void lookupOfMissingAgentIsEmpty() {
        mockServer.enqueue(new MockResponse().setResponseCode(404));

        assertTrue(adapter().getAgentMetadata("ghost").isEmpty());
    }

    @Test
    void healthReflectsStatusCode() {
        mockServer.enqueue(new MockResponse().setResponseCode(200));
        mockServer.enqueue(new MockResponse().setResponseCode(500));

        HttpRegistryAdapter adapter = adapter();
        assertTrue(adapter.isHealthy());
        assertFalse(adapter.isHealthy());
    }

    @Test
    void disabledRegistryAnswersEmptyWithoutCalls() {
        properties.getRegistry().setEnabled(false);
        HttpRegistryAdapter adapter = adapter();

        assertTrue(adapter.searchAgents("x", List.of("nlp"), null).isSuccess());
        assertTrue(adapter.listAgents().getAgents().isEmpty());
        assertTrue(adapter.getAgentMetadata("a").isEmpty());
        assertFalse(adapter.isHealthy());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void apiKeyIsSentAsBearerToken() throws Exception {
        properties.getRegistry().setApiKey("secret");
        mockServer.enqueue(json("[]"));

        adapter().listAgents();

        assertEquals("Bearer secret", mockServer.takeRequest(1, TimeUnit.SECONDS).getHeader("Authorization"));
    }
}
