package me.golemcore.discovery.domain.service;

import me.golemcore.discovery.domain.model.AgentRecord;
import me.golemcore.discovery.domain.model.AgentScore;
import me.golemcore.discovery.domain.model.TaskAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentRankerTest {

    private AgentScorer scorer;
    private AgentRanker ranker;
    private TaskAnalysis task;

    @BeforeEach
    void setUp() {
        scorer = mock(AgentScorer.class);
        ranker = new AgentRanker(scorer);
        task = TaskAnalysis.builder().confidence(0.8).build();
    }

    private static AgentScore score(String agentId, double score, double confidence) {
        return AgentScore.builder().agentId(agentId).score(score).confidence(confidence).build();
    }

    private void stubScore(AgentRecord agent, double value) {
        when(scorer.score(eq(agent), any(), any())).thenReturn(score(agent.getAgentId(), value, 0.8));
    }

    @Test
    void shouldSortByScoreDescending() {
        AgentRecord low = AgentRecord.builder().agentId("low").build();
        AgentRecord high = AgentRecord.builder().agentId("high").build();
        AgentRecord mid = AgentRecord.builder().agentId("mid").build();
        stubScore(low, 0.2);
        stubScore(high, 0.9);
        stubScore(mid, 0.5);

        List<AgentScore> ranked = ranker.rank(List.of(low, high, mid), task, null);

        assertEquals(List.of("high", "mid", "low"), ranked.stream().map(AgentScore::getAgentId).toList());
    }

    @Test
    void shouldKeepInputOrderForEqualScores() {
        AgentRecord first = AgentRecord.builder().agentId("first").build();
        AgentRecord second = AgentRecord.builder().agentId("second").build();
        AgentRecord third = AgentRecord.builder().agentId("third").build();
        stubScore(first, 0.6);
        stubScore(second, 0.6);
        stubScore(third, 0.7);

        List<AgentScore> ranked = ranker.rank(List.of(first, second, third), task, null);

        assertEquals(List.of("third", "first", "second"), ranked.stream().map(AgentScore::getAgentId).toList());
    }

    @Test
    void shouldReturnEmptyRankingForNoCandidates() {
        assertTrue(ranker.rank(List.of(), task, null).isEmpty());
    }

    @Test
    void topNAppliesMinScoreConfidenceFloorAndLimit() {
        List<AgentScore> ranked = List.of(
                score("a", 0.9, 0.8),
                score("b", 0.8, 0.8),
                score("c", 0.6, 0.3),
                score("d", 0.5, 0.8),
                score("e", 0.35, 0.8),
                score("f", 0.31, 0.8),
                score("g", 0.2, 0.8));

        List<AgentScore> top = ranker.topN(ranked, 5, 0.3);

        assertEquals(List.of("a", "b", "d", "e", "f"), top.stream().map(AgentScore::getAgentId).toList());
    }

    @Test
    void confidenceFloorAppliesEvenWithZeroMinScore() {
        List<AgentScore> ranked = List.of(score("sure", 0.1, 0.4), score("unsure", 0.9, 0.39));

        List<AgentScore> top = ranker.topN(ranked, 10, 0.0);

        assertEquals(List.of("sure"), top.stream().map(AgentScore::getAgentId).toList());
    }

    @Test
    void topNWithZeroLimitIsEmpty() {
        assertTrue(ranker.topN(List.of(score("a", 0.9, 0.9)), 0, 0.0).isEmpty());
    }

    @Test
    void topNRejectsNegativeLimit() {
        List<AgentScore> ranked = List.of();
        assertThrows(IllegalArgumentException.class, () -> ranker.topN(ranked, -1, 0.0));
    }
}
