package io.github.koszti.bigq.bigquery;

import java.util.List;

/**
 * A page of query results.
 *
 * @param pageToken non-null when more rows follow this page
 * @param totalRows total rows of the result set, when BigQuery reported it
 */
public record RowPage(List<Row> rows, String pageToken, Long totalRows, List<Column> schema)
{
    public RowPage {
        rows = rows == null ? List.of() : List.copyOf(rows);
        schema = schema == null ? List.of() : List.copyOf(schema);
    }

    public static RowPage of(List<Row> rows, String pageToken) {
        return new RowPage(rows, pageToken, null, List.of());
    }

    public boolean hasMore() {
        return pageToken != null && !pageToken.isEmpty();
    }

    public record Column(String name, String type, String mode) {}
}
