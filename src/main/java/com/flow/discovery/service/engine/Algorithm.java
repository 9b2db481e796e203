package com.flow.discovery.service.engine;

/**
 * Supported discovery algorithms.
 */
public enum Algorithm {
    INDUCTIVE("Inductive Miner", "Recursive cut detection with base cases and flower-model fallthrough"),
    INFREQUENT("Inductive Miner - infrequent", "Detects cuts on a noise-filtered directly-follows graph"),
    APPROXIMATE("Inductive Miner - approximate",
            "Samples and bins the log, simplifies the graph and validates cut quality");

    private final String displayName;
    private final String description;

    Algorithm(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
