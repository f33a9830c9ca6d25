package com.tasklang.playground.exception;

/**
 * Base type for every error raised by a compiler stage. The {@code reason} is the
 * bare diagnostic, while {@link #getMessage()} also carries the source position.
 */
public abstract class CompilationException extends Exception {

    private final String reason;

    protected CompilationException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Short name of the pipeline stage that failed, as reported to API clients.
     */
    public abstract String getStage();
}
