package io.github.koszti.bigq.query;

import io.github.koszti.bigq.bigquery.BackendFactory;
import io.github.koszti.bigq.bigquery.BigQueryBackend;
import io.github.koszti.bigq.bigquery.RowPage;
import io.github.koszti.bigq.bigquery.SubmitResult;
import io.github.koszti.bigq.query.exception.ClientInitException;
import io.github.koszti.bigq.query.exception.ServiceConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs SQL against one BigQuery project and dataset and hands back a {@link QueryCursor}
 * once the job is done.
 * <p>
 * Safe to share between threads as long as the backend is; every call is independent.
 */
public class QueryService
{
    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final ServiceConfig config;
    private final BigQueryBackend backend;
    private final JobPoller jobPoller;

    public QueryService(BigQueryBackend backend, ServiceConfig config, JobPoller jobPoller) {
        this.config = validate(config);
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.jobPoller = Objects.requireNonNull(jobPoller, "jobPoller must not be null");
    }

    /**
     * Validates {@code config}, then builds the backend with {@code backendFactory}.
     *
     * @throws ServiceConfigException when the project or dataset is blank; the factory is not called
     * @throws ClientInitException when the factory fails
     */
    public static QueryService create(BackendFactory backendFactory, ServiceConfig config) {
        Objects.requireNonNull(backendFactory, "backendFactory must not be null");
        validate(config);

        BigQueryBackend backend;
        try {
            backend = backendFactory.createBackend();
        } catch (Exception e) {
            throw new ClientInitException("Unable to create BigQuery client: " + e.getMessage(), e);
        }
        if (backend == null) {
            throw new ClientInitException("BigQuery client factory returned no client", null);
        }
        return new QueryService(backend, config, new JobPoller(backend));
    }

    private static ServiceConfig validate(ServiceConfig config) {
        if (config == null || isBlank(config.projectId()) || isBlank(config.datasetId())) {
            throw new ServiceConfigException("dataset and project can not be empty");
        }
        return config;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public QueryCursor query(String sql) {
        return query(sql, QueryOptions.DEFAULTS);
    }

    /**
     * Positional form: no arguments, {@code offset}, or {@code offset, pageSize}.
     *
     * @throws io.github.koszti.bigq.query.exception.QueryArgumentException for more than two arguments
     */
    public QueryCursor query(String sql, long... args) {
        return query(sql, QueryOptions.fromArgs(args));
    }

    /**
     * Submits {@code sql}, waits for the job to finish and returns a cursor over its rows.
     *
     * @throws io.github.koszti.bigq.bigquery.exception.BigQueryJobFailedException when the job fails
     * @throws io.github.koszti.bigq.bigquery.exception.BigQueryBackendException when a call to BigQuery fails
     */
    public QueryCursor query(String sql, QueryOptions options) {
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(options, "options must not be null");

        SubmitResult submitted = backend.submitQuery(config.projectId(), config.datasetId(), sql, options.pageSize());
        String jobId = submitted.jobId();

        RowPage firstPage = submitted.firstPage();
        if (!submitted.jobComplete()) {
            jobPoller.awaitCompletion(config.projectId(), jobId);
            firstPage = null;
        }

        log.info("BigQuery query finished. jobId={}, offset={}, pageSize={}",
                jobId, options.offset(), options.pageSize());
        return new QueryCursor(backend, config.projectId(), jobId, firstPage, options.offset(), options.pageSize());
    }

    public ServiceConfig getConfig() {
        return config;
    }
}
