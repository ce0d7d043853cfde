package com.williamcallahan.series_sync_engine.exception;

/**
 * Thrown when a job payload is missing required fields or cannot be parsed.
 * Never retried: the same payload will fail the same way.
 *
 * @author William Callahan
 */
public class InvalidJobPayloadException extends PipelineException {

    private final String jobId;

    public InvalidJobPayloadException(String jobId, String message) {
        this(jobId, message, null);
    }

    public InvalidJobPayloadException(String jobId, String message, Throwable cause) {
        super("Invalid payload for job " + jobId + ": " + message, false, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
