package com.williamcallahan.series_sync_engine.exception;

/**
 * Base exception for pipeline job failures.
 * The retryable flag tells the queue whether another attempt may succeed.
 *
 * @author William Callahan
 */
public abstract class PipelineException extends RuntimeException {
    private final boolean retryable;

    protected PipelineException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Exceptions outside this hierarchy are assumed to be transient.
     */
    public static boolean isRetryable(Throwable error) {
        return !(error instanceof PipelineException pipelineException) || pipelineException.isRetryable();
    }
}
