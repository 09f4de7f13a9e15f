package io.github.koszti.bigq.bigquery;

import java.util.Objects;

/**
 * Outcome of a query submission.
 *
 * @param firstPage rows returned with the submission; null unless {@code jobComplete}
 */
public record SubmitResult(boolean jobComplete, String jobId, RowPage firstPage)
{
    public SubmitResult {
        Objects.requireNonNull(jobId, "jobId must not be null");
    }

    public static SubmitResult complete(String jobId, RowPage firstPage) {
        return new SubmitResult(true, jobId, firstPage);
    }

    public static SubmitResult pending(String jobId) {
        return new SubmitResult(false, jobId, null);
    }
}
