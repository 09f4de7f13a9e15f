package io.github.koszti.bigq.bigquery.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of BigQuery's {@code jobs.query} call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryRequest
{
    private String query;
    private DatasetReference defaultDataset;
    private Long maxResults;
    private Boolean useLegacySql;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public DatasetReference getDefaultDataset() {
        return defaultDataset;
    }

    public void setDefaultDataset(DatasetReference defaultDataset) {
        this.defaultDataset = defaultDataset;
    }

    public Long getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(Long maxResults) {
        this.maxResults = maxResults;
    }

    public Boolean getUseLegacySql() {
        return useLegacySql;
    }

    public void setUseLegacySql(Boolean useLegacySql) {
        this.useLegacySql = useLegacySql;
    }

    public static class DatasetReference {
        private String projectId;
        private String datasetId;

        public DatasetReference() {
        }

        public DatasetReference(String projectId, String datasetId) {
            this.projectId = projectId;
            this.datasetId = datasetId;
        }

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getDatasetId() {
            return datasetId;
        }

        public void setDatasetId(String datasetId) {
            this.datasetId = datasetId;
        }
    }
}
