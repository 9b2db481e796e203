package com.flow.discovery.service.engine;

/**
 * Switches for the relaxations of the approximate miner.
 */
public record ApproximationOptions(boolean binningEnabled, boolean simplificationEnabled, boolean validationEnabled) {

    public static ApproximationOptions allEnabled() {
        return new ApproximationOptions(true, true, true);
    }
}
