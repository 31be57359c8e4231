package io.schedlens.core;

/**
 * Raised when the scheduling engine fails to answer a query.
 */
public class SchedulerEngineException extends RuntimeException {

    public SchedulerEngineException(String message) {
        super(message);
    }

    public SchedulerEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
