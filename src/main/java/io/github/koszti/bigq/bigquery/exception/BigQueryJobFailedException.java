package io.github.koszti.bigq.bigquery.exception;

import java.util.Objects;

/**
 * BigQuery finished the job but reported an error result.
 */
public class BigQueryJobFailedException extends RuntimeException {

    private final String jobId;

    public BigQueryJobFailedException(String jobId, String message) {
        super(message);
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
    }

    public String getJobId() {
        return jobId;
    }
}
