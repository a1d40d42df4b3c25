package com.duckide.practice.orchestrator;

import com.duckide.practice.config.PracticeProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PracticeWorkspaceRegistryTest {
    private final PracticeOrchestratorFactory factory = mock(PracticeOrchestratorFactory.class);
    private final PracticeWorkspaceRegistry registry = new PracticeWorkspaceRegistry(factory, new PracticeProperties(
            new PracticeProperties.Catalog("classpath:exercises/sql-basics.exdoc"),
            new PracticeProperties.Engine("jdbc:duckdb:"),
            new PracticeProperties.Ledger(10, 10, 200),
            new PracticeProperties.Progress(10),
            new PracticeProperties.Workspace(Duration.ofMinutes(30))));

    private PracticeOrchestrator workspace(String learnerId, PracticeState state, Duration idle) {
        PracticeOrchestrator orchestrator = mock(PracticeOrchestrator.class);
        when(orchestrator.state()).thenReturn(state);
        when(orchestrator.idleTime()).thenReturn(idle);
        when(orchestrator.snapshot()).thenReturn(new WorkspaceState(learnerId, PracticeState.NOT_STARTED, null, null, 0));
        when(factory.create(learnerId)).thenReturn(orchestrator);
        return orchestrator;
    }

    @Test
    void forLearnerReusesTheSameWorkspace() {
        workspace("a", PracticeState.READY, Duration.ZERO);

        assertSame(registry.forLearner("a"), registry.forLearner("a"));
        verify(factory, times(1)).create("a");
        assertEquals(1, registry.size());
    }

    @Test
    void exitRemovesTheWorkspace() {
        PracticeOrchestrator a = workspace("a", PracticeState.READY, Duration.ZERO);
        workspace("b", PracticeState.READY, Duration.ZERO);
        registry.forLearner("a");
        registry.forLearner("b");

        WorkspaceState state = registry.exit("a");

        assertEquals(PracticeState.NOT_STARTED, state.state());
        verify(a).exit();
        assertFalse(registry.contains("a"));
        assertTrue(registry.contains("b"));
        assertEquals(1, registry.size());
    }

    @Test
    void exitWithoutWorkspaceStillDeactivatesAndKeepsNothing() {
        PracticeOrchestrator fresh = workspace("ghost", PracticeState.NOT_STARTED, Duration.ZERO);

        registry.exit("ghost");

        verify(fresh).exit();
        assertEquals(0, registry.size());
    }

    @Test
    void releaseClosesAndForgets() {
        PracticeOrchestrator a = workspace("a", PracticeState.ALL_COMPLETE, Duration.ZERO);
        registry.forLearner("a");

        registry.release("a");
        registry.release("a");

        verify(a, times(1)).close();
        assertEquals(0, registry.size());
    }

    @Test
    void evictsOnlyIdleWorkspacesThatAreNotLoading() {
        PracticeOrchestrator idle = workspace("idle", PracticeState.READY, Duration.ofMinutes(31));
        PracticeOrchestrator busy = workspace("busy", PracticeState.SUBMITTED, Duration.ofMinutes(2));
        PracticeOrchestrator loading = workspace("loading", PracticeState.LOADING, Duration.ofHours(1));
        registry.forLearner("idle");
        registry.forLearner("busy");
        registry.forLearner("loading");

        assertEquals(1, registry.evictIdle());

        verify(idle).close();
        verify(busy, never()).close();
        verify(loading, never()).close();
        assertFalse(registry.contains("idle"));
        assertEquals(2, registry.size());
    }

    @Test
    void closeAllEmptiesTheRegistry() {
        PracticeOrchestrator a = workspace("a", PracticeState.READY, Duration.ZERO);
        PracticeOrchestrator b = workspace("b", PracticeState.NOT_STARTED, Duration.ZERO);
        registry.forLearner("a");
        registry.forLearner("b");

        registry.closeAll();

        verify(a).close();
        verify(b).close();
        assertEquals(0, registry.size());
    }
}
