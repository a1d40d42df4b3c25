package com.duckide.practice.orchestrator;

import com.duckide.practice.catalog.ExerciseCatalog;
import com.duckide.practice.engine.SqlEngine;
import com.duckide.practice.practice.PracticeService;
import com.duckide.practice.session.SessionTracker;
import com.duckide.practice.verification.Verifier;
import org.springframework.stereotype.Component;

@Component
public class PracticeOrchestratorFactory {
    private final ExerciseCatalog catalog;
    private final SqlEngine engine;
    private final Verifier verifier;
    private final SessionTracker sessions;
    private final PracticeService practice;

    public PracticeOrchestratorFactory(ExerciseCatalog catalog,
                                       SqlEngine engine,
                                       Verifier verifier,
                                       SessionTracker sessions,
                                       PracticeService practice) {
        this.catalog = catalog;
        this.engine = engine;
        this.verifier = verifier;
        this.sessions = sessions;
        this.practice = practice;
    }

    public PracticeOrchestrator create(String learnerId) {
        return new PracticeOrchestrator(learnerId, catalog, engine, verifier, sessions, practice, System::nanoTime);
    }
}
