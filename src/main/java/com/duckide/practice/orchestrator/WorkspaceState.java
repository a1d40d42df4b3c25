package com.duckide.practice.orchestrator;

import com.duckide.practice.verification.Verdict;

/** Point-in-time view of one orchestrator, safe to hand out. */
public record WorkspaceState(String learnerId,
                             PracticeState state,
                             Integer exerciseId,
                             Verdict lastVerdict,
                             long elapsedSeconds) {}
