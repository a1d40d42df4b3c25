package com.duckide.practice.orchestrator;

import com.duckide.practice.config.PracticeProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One orchestrator per learner, created on first use. A workspace is dropped when the learner
 * exits or finishes every exercise, or once it has been idle longer than
 * {@code practice.workspace.idle-timeout}.
 */
@Component
public class PracticeWorkspaceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PracticeWorkspaceRegistry.class);

    private final PracticeOrchestratorFactory factory;
    private final Duration idleTimeout;
    private final Map<String, PracticeOrchestrator> workspaces = new ConcurrentHashMap<>();

    public PracticeWorkspaceRegistry(PracticeOrchestratorFactory factory, PracticeProperties properties) {
        this.factory = factory;
        this.idleTimeout = properties.workspace().idleTimeout();
    }

    public PracticeOrchestrator forLearner(String learnerId) {
        return workspaces.computeIfAbsent(learnerId, factory::create);
    }

    /** Exits practice and forgets the learner's workspace. */
    public WorkspaceState exit(String learnerId) {
        PracticeOrchestrator orchestrator = workspaces.remove(learnerId);
        if (orchestrator == null) {
            orchestrator = factory.create(learnerId);
        }
        orchestrator.exit();
        return orchestrator.snapshot();
    }

    public void release(String learnerId) {
        PracticeOrchestrator removed = workspaces.remove(learnerId);
        if (removed != null) {
            removed.close();
        }
    }

    public boolean contains(String learnerId) {
        return workspaces.containsKey(learnerId);
    }

    public int size() {
        return workspaces.size();
    }

    @Scheduled(fixedDelayString = "${practice.workspace.sweep-interval-ms:60000}")
    public void scheduledEviction() {
        evictIdle();
    }

    /** Closes workspaces idle for at least the configured timeout. A workspace still loading is kept. */
    public int evictIdle() {
        int evicted = 0;
        for (Map.Entry<String, PracticeOrchestrator> entry : workspaces.entrySet()) {
            PracticeOrchestrator orchestrator = entry.getValue();
            if (orchestrator.state() == PracticeState.LOADING || orchestrator.idleTime().compareTo(idleTimeout) < 0) {
                continue;
            }
            if (workspaces.remove(entry.getKey(), orchestrator)) {
                orchestrator.close();
                evicted++;
            }
        }
        if (evicted > 0) {
            logger.info("Evicted {} idle practice workspace(s)", evicted);
        }
        return evicted;
    }

    @PreDestroy
    public void closeAll() {
        logger.info("Closing {} practice workspace(s)", workspaces.size());
        workspaces.values().forEach(PracticeOrchestrator::close);
        workspaces.clear();
    }
}
