package com.flow.discovery.service.log;

import com.flow.discovery.service.engine.MiningException;

/**
 * Thrown when an event log is malformed: null or blank activity labels,
 * null traces or non-positive trace frequencies.
 */
public class InvalidLogException extends MiningException {

    public static final String ERROR_CODE = "INVALID_LOG";

    public InvalidLogException(String message) {
        super(message, ERROR_CODE);
    }
}
