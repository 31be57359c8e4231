package io.schedlens.core;

/**
 * The engine knows the job but cannot materialize its definition here, typically a remote
 * scheduler whose job class is not on the local classpath.
 */
public class JobDetailUnavailableException extends SchedulerEngineException {

    public JobDetailUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
