package me.golemcore.discovery.domain.service;

import me.golemcore.discovery.domain.model.AgentRecord;
import me.golemcore.discovery.domain.model.AgentStatus;
import me.golemcore.discovery.domain.model.DiscoveryFilters;
import me.golemcore.discovery.domain.model.RegistryQueryResult;
import me.golemcore.discovery.domain.model.TaskAnalysis;
import me.golemcore.discovery.port.outbound.RegistryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CandidateRetrievalServiceTest {

    private static final AgentRecord NLP_AGENT = AgentRecord.builder()
            .agentId("nlp-1").capabilities(Set.of("nlp")).domain("technology").status(AgentStatus.ONLINE).build();
    private static final AgentRecord FINANCE_AGENT = AgentRecord.builder()
            .agentId("fin-1").domain("finance").status(AgentStatus.BUSY).build();
    private static final AgentRecord KEYWORD_AGENT = AgentRecord.builder()
            .agentId("kw-1").description("stock forecasts").domain("Finance").status(AgentStatus.ONLINE).build();

    private RegistryPort registryPort;
    private CandidateRetrievalService service;

    @BeforeEach
    void setUp() {
        registryPort = mock(RegistryPort.class);
        when(registryPort.searchAgents(any(), any(), any())).thenReturn(RegistryQueryResult.success(List.of()));
        when(registryPort.listAgents()).thenReturn(RegistryQueryResult.success(List.of()));
        service = new CandidateRetrievalService(registryPort);
    }

    private static TaskAnalysis task(Set<String> capabilities, String domain, List<String> keywords) {
        return TaskAnalysis.builder()
                .requiredCapabilities(capabilities)
                .domain(domain)
                .keywords(keywords)
                .confidence(0.8)
                .build();
    }

    private void stubQueries() {
        when(registryPort.searchAgents(isNull(), eq(List.of("nlp")), isNull()))
                .thenReturn(RegistryQueryResult.success(List.of(NLP_AGENT)));
        when(registryPort.searchAgents(eq("finance"), isNull(), isNull()))
                .thenReturn(RegistryQueryResult.success(List.of(FINANCE_AGENT)));
        when(registryPort.searchAgents(eq("stock price forecast"), isNull(), isNull()))
                .thenReturn(RegistryQueryResult.success(List.of(KEYWORD_AGENT, NLP_AGENT)));
    }

    @Test
    void shouldQueryByCapabilitiesDomainAndTopKeywords() {
        stubQueries();

        List<AgentRecord> candidates = service.gatherCandidates(
                task(Set.of("nlp"), "finance", List.of("stock", "price", "forecast", "daily")), null);

        assertEquals(List.of(NLP_AGENT, FINANCE_AGENT, KEYWORD_AGENT), candidates);
        verify(registryPort).searchAgents(null, List.of("nlp"), null);
        verify(registryPort).searchAgents("finance", null, null);
        verify(registryPort).searchAgents("stock price forecast", null, null);
        verify(registryPort, never()).listAgents();
    }

    @Test
    void shouldSkipQueriesWithNothingToAsk() {
        List<AgentRecord> all = List.of(NLP_AGENT, FINANCE_AGENT);
        when(registryPort.listAgents()).thenReturn(RegistryQueryResult.success(all));

        List<AgentRecord> candidates = service.gatherCandidates(task(Set.of(), "general", List.of()), null);

        assertEquals(all, candidates);
        verify(registryPort, never()).searchAgents(any(), any(), any());
    }

    @Test
    void shouldKeepRecordsThatDifferOnlyInVolatileFields() {
        AgentRecord reloaded = AgentRecord.builder()
                .agentId("nlp-1").capabilities(Set.of("nlp")).domain("technology").status(AgentStatus.ONLINE)
                .currentLoad(0.9).build();
        when(registryPort.searchAgents(isNull(), anyList(), isNull()))
                .thenReturn(RegistryQueryResult.success(List.of(NLP_AGENT)));
        when(registryPort.searchAgents(eq("technology"), isNull(), isNull()))
                .thenReturn(RegistryQueryResult.success(List.of(NLP_AGENT, reloaded)));

        List<AgentRecord> candidates = service.gatherCandidates(task(Set.of("nlp"), "technology", List.of()),
                null);

        assertEquals(List.of(NLP_AGENT, reloaded), candidates);
    }

    @Test
    void shouldTolerateFailedQueries() {
        stubQueries();
        when(registryPort.searchAgents(isNull(), eq(List.of("nlp")), isNull()))
                .thenReturn(RegistryQueryResult.failure("timeout"));

        List<AgentRecord> candidates = service.gatherCandidates(
                task(Set.of("nlp"), "finance", List.of("stock", "price", "forecast")), null);

        assertEquals(List.of(FINANCE_AGENT, KEYWORD_AGENT, NLP_AGENT), candidates);
    }

    @Test
    void shouldFallBackToFullListingWhenQueriesFindNothing() {
        when(registryPort.searchAgents(any(), any(), any())).thenReturn(RegistryQueryResult.failure("down"));
        when(registryPort.listAgents()).thenReturn(RegistryQueryResult.success(List.of(FINANCE_AGENT)));

        List<AgentRecord> candidates = service.gatherCandidates(task(Set.of("nlp"), "finance", List.of("x")),
                null);

        assertEquals(List.of(FINANCE_AGENT), candidates);
    }

    @Test
    void shouldReturnEmptyWhenListingFailsToo() {
        when(registryPort.listAgents()).thenReturn(RegistryQueryResult.failure("down"));

        assertTrue(service.gatherCandidates(task(Set.of("nlp"), "general", List.of()), null).isEmpty());
    }

    @Test
    void shouldFilterByStatus() {
        stubQueries();
        DiscoveryFilters filters = DiscoveryFilters.builder().status("online").build();

        List<AgentRecord> candidates = service.gatherCandidates(
                task(Set.of("nlp"), "finance", List.of("stock", "price", "forecast")), filters);

        assertEquals(List.of(NLP_AGENT, KEYWORD_AGENT), candidates);
    }

    @Test
    void shouldFilterByExcludedAgentsAndDomainIgnoringCase() {
        stubQueries();
        DiscoveryFilters filters = DiscoveryFilters.builder()
                .excludeAgents(Set.of("fin-1"))
                .domain("FINANCE")
                .build();

        List<AgentRecord> candidates = service.gatherCandidates(
                task(Set.of("nlp"), "finance", List.of("stock", "price", "forecast")), filters);

        assertEquals(List.of(KEYWORD_AGENT), candidates);
    }

    @Test
    void minScoreFilterDoesNotRemoveCandidates() {
        stubQueries();
        DiscoveryFilters filters = DiscoveryFilters.builder().minScore(0.99).build();

        List<AgentRecord> candidates = service.gatherCandidates(
                task(Set.of("nlp"), "finance", List.of("stock", "price", "forecast")), filters);

        assertEquals(3, candidates.size());
    }

    @Test
    void shouldFallBackToUnfilteredListingWhenFiltersRemoveEverything() {
        stubQueries();
        List<AgentRecord> all = List.of(NLP_AGENT, FINANCE_AGENT, KEYWORD_AGENT);
        when(registryPort.listAgents()).thenReturn(RegistryQueryResult.success(all));
        DiscoveryFilters filters = DiscoveryFilters.builder().status("offline").build();

        List<AgentRecord> candidates = service.gatherCandidates(
                task(Set.of("nlp"), "finance", List.of("stock", "price", "forecast")), filters);

        assertEquals(all, candidates);
    }

    @Test
    void shouldKeepLookalikeRecordsDistinct() {
        List<AgentRecord> lookalikes = List.of(
                AgentRecord.builder().agentId("a").capabilities(Set.of("a, b")).build(),
                AgentRecord.builder().agentId("a").capabilities(Set.of("a", "b")).build(),
                AgentRecord.builder().agentId("u").build(),
                AgentRecord.builder().agentId("u").agentUrl("null").build(),
                AgentRecord.builder().agentId("d").description("helper").build(),
                AgentRecord.builder().agentId("d").description("helper\nagentUrl=x").build());
        when(registryPort.searchAgents(isNull(), anyList(), isNull()))
                .thenReturn(RegistryQueryResult.success(lookalikes));
        when(registryPort.searchAgents(eq("technology"), isNull(), isNull()))
                .thenReturn(RegistryQueryResult.success(lookalikes));

        List<AgentRecord> candidates = service.gatherCandidates(task(Set.of("nlp"), "technology", List.of()),
                null);

        assertEquals(lookalikes, candidates);
    }

    @Test
    void statusFilterMatchesReportedTextExactly() {
        AgentRecord sleeping = AgentRecord.builder().agentId("s")
                .status(AgentStatus.UNKNOWN).reportedStatus("sleeping").build();
        AgentRecord idle = AgentRecord.builder().agentId("i")
                .status(AgentStatus.UNKNOWN).reportedStatus("idle").build();
        List<AgentRecord> agents = List.of(sleeping, idle, NLP_AGENT);

        assertEquals(List.of(idle),
                service.applyFilters(agents, DiscoveryFilters.builder().status("idle").build()));
        assertTrue(service.applyFilters(agents, DiscoveryFilters.builder().status("resting").build()).isEmpty());
        assertEquals(List.of(NLP_AGENT),
                service.applyFilters(agents, DiscoveryFilters.builder().status("online").build()));
    }

    @Test
    void blankStatusFilterPlacesNoConstraint() {
        AgentRecord silent = AgentRecord.builder().agentId("x").build();
        List<AgentRecord> agents = List.of(silent, NLP_AGENT, FINANCE_AGENT);
        DiscoveryFilters filters = DiscoveryFilters.builder().status("  ").build();

        assertEquals(agents, service.applyFilters(agents, filters));
        assertTrue(filters.isEmpty());
    }
}
