package com.gitpr.manager.model;

public enum MergeMethod {
    MERGE("merge"),
    SQUASH("squash"),
    REBASE("rebase");

    private final String value;

    MergeMethod(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves a configured strategy name, defaulting to {@link #SQUASH}
     * for blank or unknown values.
     */
    public static MergeMethod fromStrategy(String strategy) {
        if (strategy != null) {
            for (MergeMethod method : values()) {
                if (method.value.equalsIgnoreCase(strategy.trim())) {
                    return method;
                }
            }
        }
        return SQUASH;
    }

    public static boolean isValidStrategy(String strategy) {
        if (strategy == null) {
            return false;
        }
        for (MergeMethod method : values()) {
            if (method.value.equalsIgnoreCase(strategy.trim())) {
                return true;
            }
        }
        return false;
    }
}
