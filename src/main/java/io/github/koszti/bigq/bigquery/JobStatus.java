package io.github.koszti.bigq.bigquery;

import java.util.Objects;

/**
 * @param errorMessage set when a finished job failed
 */
public record JobStatus(JobState state, String errorMessage)
{
    public JobStatus {
        Objects.requireNonNull(state, "state must not be null");
    }

    public static JobStatus running() {
        return new JobStatus(JobState.RUNNING, null);
    }

    public static JobStatus done() {
        return new JobStatus(JobState.DONE, null);
    }

    public static JobStatus failed(String errorMessage) {
        return new JobStatus(JobState.DONE, Objects.requireNonNull(errorMessage, "errorMessage must not be null"));
    }

    public boolean isDone() {
        return state == JobState.DONE;
    }

    public boolean isFailed() {
        return isDone() && errorMessage != null;
    }
}
