package io.github.koszti.bigq.query;

import io.github.koszti.bigq.bigquery.BigQueryBackend;
import io.github.koszti.bigq.bigquery.Row;
import io.github.koszti.bigq.bigquery.RowPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Forward-only iterator over the rows of a finished query job, fetching pages on demand.
 * <p>
 * Each page after the first is read at the previous start index plus the page size, or plus the
 * number of rows actually returned when no page size was set. Reading stops when a page comes back
 * without a page token.
 * <p>
 * Not thread-safe, and rows are yielded once.
 */
public class QueryCursor implements Iterator<Row>
{
    private static final Logger log = LoggerFactory.getLogger(QueryCursor.class);

    private final BigQueryBackend backend;
    private final String projectId;
    private final String jobId;
    private final long offset;
    private final long pageSize;

    private List<Row> rows = List.of();
    private int index;
    private long nextStartIndex;
    private boolean morePages;
    private List<RowPage.Column> schema = List.of();
    private Long totalRows;

    /**
     * @param firstPage rows already returned by the submission, read from row 0; null if none
     */
    QueryCursor(BigQueryBackend backend, String projectId, String jobId, RowPage firstPage,
            long offset, long pageSize) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.projectId = Objects.requireNonNull(projectId, "projectId must not be null");
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        this.offset = offset;
        this.pageSize = pageSize;

        if (firstPage != null && offset == 0) {
            accept(firstPage, 0);
        } else {
            // the submission's rows start at row 0 and cannot serve a later offset
            nextStartIndex = offset;
            morePages = true;
        }
    }

    @Override
    public boolean hasNext() {
        while (index >= rows.size()) {
            if (!morePages) {
                return false;
            }
            fetchNextPage();
        }
        return true;
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more rows for BigQuery job " + jobId);
        }
        return rows.get(index++);
    }

    private void fetchNextPage() {
        long startIndex = nextStartIndex;
        log.debug("Fetching results of BigQuery job {} from row {}", jobId, startIndex);
        RowPage page = backend.fetchResultsPage(projectId, jobId, startIndex, pageSize);
        accept(page, startIndex);
    }

    private void accept(RowPage page, long startIndex) {
        rows = page.rows();
        index = 0;
        if (!page.schema().isEmpty()) {
            schema = page.schema();
        }
        if (page.totalRows() != null) {
            totalRows = page.totalRows();
        }

        long advance = pageSize > 0 ? pageSize : rows.size();
        nextStartIndex = startIndex + advance;
        // an empty page without a page size cannot move the start index forward
        morePages = page.hasMore() && advance > 0;
    }

    public String getJobId() {
        return jobId;
    }

    public String getProjectId() {
        return projectId;
    }

    public long getOffset() {
        return offset;
    }

    public long getPageSize() {
        return pageSize;
    }

    /**
     * Columns of the result set, empty until a page carrying the schema has been read.
     */
    public List<RowPage.Column> getSchema() {
        return schema;
    }

    /**
     * Total rows as last reported by BigQuery, or null if no page reported it yet.
     */
    public Long getTotalRows() {
        return totalRows;
    }
}
