package io.github.koszti.bigq.bigquery.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Minimal view of the response of {@code jobs.query} and {@code jobs.getQueryResults}.
 * Both calls share this shape.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryResponse
{
    private JobReference jobReference;
    private boolean jobComplete;
    private Schema schema;
    /**
     * BigQuery sends this int64 as a JSON string; Jackson coerces it.
     */
    private Long totalRows;
    private String pageToken;
    private List<TableRow> rows;
    private List<ErrorProto> errors;

    public JobReference getJobReference() {
        return jobReference;
    }

    public void setJobReference(JobReference jobReference) {
        this.jobReference = jobReference;
    }

    public boolean isJobComplete() {
        return jobComplete;
    }

    public void setJobComplete(boolean jobComplete) {
        this.jobComplete = jobComplete;
    }

    public Schema getSchema() {
        return schema;
    }

    public void setSchema(Schema schema) {
        this.schema = schema;
    }

    public Long getTotalRows() {
        return totalRows;
    }

    public void setTotalRows(Long totalRows) {
        this.totalRows = totalRows;
    }

    public String getPageToken() {
        return pageToken;
    }

    public void setPageToken(String pageToken) {
        this.pageToken = pageToken;
    }

    public List<TableRow> getRows() {
        return rows;
    }

    public void setRows(List<TableRow> rows) {
        this.rows = rows;
    }

    public List<ErrorProto> getErrors() {
        return errors;
    }

    public void setErrors(List<ErrorProto> errors) {
        this.errors = errors;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobReference {
        private String projectId;
        private String jobId;
        private String location;

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getJobId() {
            return jobId;
        }

        public void setJobId(String jobId) {
            this.jobId = jobId;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Schema {
        private List<Field> fields;

        public List<Field> getFields() {
            return fields;
        }

        public void setFields(List<Field> fields) {
            this.fields = fields;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Field {
        private String name;
        private String type;
        private String mode; // NULLABLE, REQUIRED, REPEATED

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }

    /**
     * {@code {"f": [{"v": ...}, ...]}}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TableRow {
        private List<TableCell> f;

        public List<TableCell> getF() {
            return f;
        }

        public void setF(List<TableCell> f) {
            this.f = f;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TableCell {
        /**
         * Scalars arrive as strings; repeated and record cells as arrays and objects.
         */
        private Object v;

        public Object getV() {
            return v;
        }

        public void setV(Object v) {
            this.v = v;
        }
    }
}
