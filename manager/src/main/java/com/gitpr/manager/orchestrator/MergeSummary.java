package com.gitpr.manager.orchestrator;

import java.util.List;

/**
 * Aggregated summary of a merge run, in slot order.
 */
public record MergeSummary(
        List<MergeResult> results,
        long totalDurationMs,
        boolean dryRun
) {

    public int successCount() {
        return (int) results.stream().filter(MergeResult::success).count();
    }

    public int failureCount() {
        return (int) results.stream().filter(MergeResult::failed).count();
    }

    public int skippedCount() {
        return (int) results.stream().filter(MergeResult::skipped).count();
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(MergeResult::failed);
    }
}
