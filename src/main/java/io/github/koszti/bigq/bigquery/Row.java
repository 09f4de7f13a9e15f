package io.github.koszti.bigq.bigquery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One result row, cell values in column order exactly as BigQuery sent them: strings for scalars,
 * null for NULL, lists and maps for repeated and record cells.
 */
public record Row(List<Object> values)
{
    public Row {
        // cells may be null, so List.copyOf is out
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Row of(Object... values) {
        List<Object> cells = new ArrayList<>(values.length);
        Collections.addAll(cells, values);
        return new Row(cells);
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }
}
