package io.insights.runtime;

/**
 * Counts from one pipeline run.
 */
public record RunStats(long recordsIn, long recordsOut, long elapsedNanos) {}
