package com.bookharvest.core.model;

public enum PageStatus {
    PENDING, FETCHING, FETCHED, PARSING, PARSED, PERSISTED, FAILED;

    public boolean isTerminal() {
        return this == PERSISTED || this == FAILED;
    }
}
