package io.github.koszti.bigq.bigquery;

import io.github.koszti.bigq.bigquery.dto.ErrorProto;
import io.github.koszti.bigq.bigquery.dto.JobResponse;
import io.github.koszti.bigq.bigquery.dto.QueryRequest;
import io.github.koszti.bigq.bigquery.dto.QueryResponse;
import io.github.koszti.bigq.bigquery.exception.BigQueryBackendException;
import io.github.koszti.bigq.bigquery.exception.BigQueryRequestRejectedException;
import io.github.koszti.bigq.bigquery.exception.BigQueryUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link BigQueryBackend} over the BigQuery v2 REST API.
 * <p>
 * The {@link RestClient} must already carry the base URL and whatever auth the endpoint needs.
 */
public class RestBigQueryBackend implements BigQueryBackend
{
    private static final Logger log = LoggerFactory.getLogger(RestBigQueryBackend.class);

    private final RestClient restClient;
    private final String baseUrl;
    private final Boolean useLegacySql;

    public RestBigQueryBackend(RestClient restClient, String baseUrl, Boolean useLegacySql) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.useLegacySql = useLegacySql;
    }

    @Override
    public SubmitResult submitQuery(String projectId, String datasetId, String sql, long maxResultsHint) {
        Objects.requireNonNull(sql, "sql must not be null");

        QueryRequest request = new QueryRequest();
        request.setQuery(sql);
        request.setDefaultDataset(new QueryRequest.DatasetReference(projectId, datasetId));
        if (maxResultsHint > 0) {
            request.setMaxResults(maxResultsHint);
        }
        request.setUseLegacySql(useLegacySql);

        log.debug("Submitting query to BigQuery project {}: {}", projectId, sql);

        QueryResponse response = call("jobs.query", () -> restClient
                .post()
                .uri("/projects/{projectId}/queries", projectId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(QueryResponse.class));

        if (response == null || response.getJobReference() == null || response.getJobReference().getJobId() == null) {
            throw new BigQueryBackendException("BigQuery jobs.query returned no job reference");
        }

        String jobId = response.getJobReference().getJobId();
        if (!response.isJobComplete()) {
            log.debug("BigQuery job {} not complete after submission", jobId);
            return SubmitResult.pending(jobId);
        }
        return SubmitResult.complete(jobId, toRowPage(response));
    }

    @Override
    public JobStatus getJobStatus(String projectId, String jobId) {
        JobResponse job = call("jobs.get", () -> restClient
                .get()
                .uri("/projects/{projectId}/jobs/{jobId}", projectId, jobId)
                .retrieve()
                .body(JobResponse.class));

        if (job == null || job.getStatus() == null) {
            throw new BigQueryBackendException("BigQuery jobs.get returned no status for job " + jobId);
        }

        JobResponse.Status status = job.getStatus();
        JobState state = JobState.fromApi(status.getState());
        if (state == JobState.DONE && status.getErrorResult() != null) {
            return JobStatus.failed(status.getErrorResult().describe());
        }
        return new JobStatus(state, null);
    }

    @Override
    public RowPage fetchResultsPage(String projectId, String jobId, long startIndex, long maxResults) {
        QueryResponse response = call("jobs.getQueryResults", () -> restClient
                .get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/projects/{projectId}/queries/{jobId}")
                            .queryParam("startIndex", startIndex);
                    if (maxResults > 0) {
                        uriBuilder.queryParam("maxResults", maxResults);
                    }
                    return uriBuilder.build(projectId, jobId);
                })
                .retrieve()
                .body(QueryResponse.class));

        if (response == null) {
            throw new BigQueryBackendException("BigQuery jobs.getQueryResults returned no body for job " + jobId);
        }
        // warnings only; whether the job failed is decided by its status
        if (response.getErrors() != null && !response.getErrors().isEmpty() && log.isDebugEnabled()) {
            log.debug("BigQuery reported messages for job {}: {}", jobId, response.getErrors().stream()
                    .map(ErrorProto::describe)
                    .collect(Collectors.joining("; ")));
        }
        return toRowPage(response);
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            String msg = "BigQuery " + operation + " failed (HTTP " + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString();
            throw new BigQueryRequestRejectedException(e.getStatusCode().value(), msg, e);
        } catch (ResourceAccessException e) {
            throw new BigQueryUnavailableException(baseUrl, e);
        } catch (RestClientException e) {
            throw new BigQueryBackendException("Could not read BigQuery " + operation + " response: " + e.getMessage(), e);
        }
    }

    static RowPage toRowPage(QueryResponse response) {
        List<Row> rows = response.getRows() == null ? List.of() : response.getRows().stream()
                .map(RestBigQueryBackend::toRow)
                .collect(Collectors.toList());

        List<RowPage.Column> schema = List.of();
        if (response.getSchema() != null && response.getSchema().getFields() != null) {
            schema = response.getSchema().getFields().stream()
                    .map(f -> new RowPage.Column(f.getName(), f.getType(), f.getMode()))
                    .collect(Collectors.toList());
        }

        return new RowPage(rows, response.getPageToken(), response.getTotalRows(), schema);
    }

    private static Row toRow(QueryResponse.TableRow tableRow) {
        if (tableRow == null || tableRow.getF() == null) {
            return new Row(List.of());
        }
        return new Row(tableRow.getF().stream()
                .map(cell -> cell == null ? null : cell.getV())
                .collect(Collectors.toList()));
    }
}
