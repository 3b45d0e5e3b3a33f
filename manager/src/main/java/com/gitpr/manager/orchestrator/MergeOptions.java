package com.gitpr.manager.orchestrator;

/**
 * @param dryRun         decide and report without calling the provider
 * @param force          also merge pull requests the evaluator blocked
 * @param deleteBranches delete head branches after merging, on top of per-repository settings
 * @param customMessage  commit message used instead of the generated one, or {@code null}
 */
public record MergeOptions(
        boolean dryRun,
        boolean force,
        boolean deleteBranches,
        String customMessage
) {

    public static MergeOptions defaults() {
        return new MergeOptions(false, false, false, null);
    }
}
