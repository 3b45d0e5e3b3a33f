package com.gitpr.manager.evaluation;

/**
 * Outcome of evaluating a pull request.
 * <ul>
 *   <li>{@link #READY}: eligible for merge</li>
 *   <li>{@link #SKIPPED}: filtered out by configuration (author, labels, age)</li>
 *   <li>{@link #BLOCKED}: a confident negative decision about the PR itself</li>
 *   <li>{@link #ERRORED}: the decision is unknown because a provider call failed</li>
 * </ul>
 */
public enum Readiness {
    READY,
    SKIPPED,
    BLOCKED,
    ERRORED
}
