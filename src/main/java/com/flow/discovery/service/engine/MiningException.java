package com.flow.discovery.service.engine;

/**
 * Exception thrown when a discovery request cannot be processed.
 */
public class MiningException extends RuntimeException {

    private final String errorCode;

    public MiningException(String message) {
        super(message);
        this.errorCode = "MINING_ERROR";
    }

    public MiningException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "MINING_ERROR";
    }

    public MiningException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public MiningException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
