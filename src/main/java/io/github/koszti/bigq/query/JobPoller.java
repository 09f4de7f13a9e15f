package io.github.koszti.bigq.query;

import io.github.koszti.bigq.bigquery.BigQueryBackend;
import io.github.koszti.bigq.bigquery.JobStatus;
import io.github.koszti.bigq.bigquery.exception.BigQueryJobFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Blocks until a BigQuery job is DONE, checking its status at a fixed interval.
 * <p>
 * There is no timeout: the wait ends only when the job finishes, fails, or a status call fails.
 */
public class JobPoller
{
    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(300);

    private final BigQueryBackend backend;
    private final Duration pollInterval;
    private final Sleeper sleeper;

    public JobPoller(BigQueryBackend backend) {
        this(backend, DEFAULT_POLL_INTERVAL, Sleeper.THREAD);
    }

    public JobPoller(BigQueryBackend backend, Duration pollInterval, Sleeper sleeper) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        if (pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must not be negative: " + pollInterval);
        }
    }

    /**
     * @throws BigQueryJobFailedException when the job finishes with an error result
     * @throws io.github.koszti.bigq.bigquery.exception.BigQueryBackendException when a status call fails
     */
    public void awaitCompletion(String projectId, String jobId) {
        int polls = 0;
        while (true) {
            JobStatus status = backend.getJobStatus(projectId, jobId);
            polls++;

            if (status.isDone()) {
                if (status.isFailed()) {
                    throw new BigQueryJobFailedException(jobId, status.errorMessage());
                }
                log.debug("BigQuery job {} done after {} status checks", jobId, polls);
                return;
            }

            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while polling BigQuery for job " + jobId, ie);
            }
        }
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    /**
     * Pause between status checks; swapped out in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
