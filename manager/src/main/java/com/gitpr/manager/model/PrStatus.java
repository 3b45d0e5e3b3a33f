package com.gitpr.manager.model;

public record PrStatus(
        StatusState state,
        String description,
        String context
) {

    public boolean isSuccessful() {
        return state == StatusState.SUCCESS;
    }
}
