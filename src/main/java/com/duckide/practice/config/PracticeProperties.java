package com.duckide.practice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "practice")
public record PracticeProperties(@DefaultValue Catalog catalog,
                                 @DefaultValue Engine engine,
                                 @DefaultValue Ledger ledger,
                                 @DefaultValue Progress progress,
                                 @DefaultValue Workspace workspace) {

    public record Catalog(@DefaultValue("classpath:exercises/sql-basics.exdoc") String location) {}

    public record Engine(@DefaultValue("jdbc:duckdb:") String url) {}

    /**
     * Retry policy for sequence-number races when recording attempts.
     */
    public record Ledger(@DefaultValue("10") int maxAttempts,
                         @DefaultValue("10") long baseBackoffMs,
                         @DefaultValue("200") long maxBackoffMs) {}

    public record Progress(@DefaultValue("10") int recentLimit) {}

    /**
     * Workspaces idle this long are closed by the next sweep ({@code practice.workspace.sweep-interval-ms}).
     */
    public record Workspace(@DefaultValue("30m") Duration idleTimeout) {}
}
