package com.gitpr.manager.model;

public enum PrState {
    OPEN,
    CLOSED,
    MERGED
}
