package com.agentcrew.orchestrator.sourcehost;

/** The git host rejected a call or could not be reached. */
public class SourceHostException extends RuntimeException {

    private final int statusCode;

    public SourceHostException(int statusCode, String message) {
        super("Source host error %d: %s".formatted(statusCode, message));
        this.statusCode = statusCode;
    }

    public SourceHostException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when no response was received. */
    public int statusCode() { return statusCode; }
}
