package io.github.koszti.bigq.bigquery;

/**
 * The three BigQuery calls the query service needs: submit, job status and results paging.
 * <p>
 * Implementations throw {@link io.github.koszti.bigq.bigquery.exception.BigQueryBackendException}
 * (or a subclass) on any communication failure.
 */
public interface BigQueryBackend
{
    /**
     * Submits {@code sql} with {@code datasetId} as the default dataset.
     *
     * @param maxResultsHint rows per page to ask for; 0 leaves the page size to BigQuery
     */
    SubmitResult submitQuery(String projectId, String datasetId, String sql, long maxResultsHint);

    JobStatus getJobStatus(String projectId, String jobId);

    /**
     * Fetches one page of the results of a finished query job.
     *
     * @param startIndex zero-based row to start from
     * @param maxResults page size; 0 leaves the page size to BigQuery
     */
    RowPage fetchResultsPage(String projectId, String jobId, long startIndex, long maxResults);
}
