package io.github.koszti.bigq.config;

import io.github.koszti.bigq.bigquery.ClientOptions;
import io.github.koszti.bigq.query.JobPoller;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

@ConfigurationProperties(prefix = "bigq")
public class BigqProperties {

    /**
     * GCP project the queries run in (and are billed to).
     */
    private String projectId;

    /**
     * Dataset unqualified table names resolve against.
     */
    private String datasetId;

    /**
     * BigQuery REST base URL. Point it at an emulator for local runs.
     */
    private String baseUrl = ClientOptions.DEFAULT_BASE_URL;

    /**
     * Optional service account key (JSON). Takes precedence over application default credentials.
     */
    private Path credentialsFile;

    /**
     * Use Application Default Credentials when no key file is configured.
     */
    private boolean applicationDefaultCredentials = true;

    /**
     * Null leaves the dialect to BigQuery's default (legacy SQL).
     */
    private Boolean useLegacySql;

    /**
     * Pause between job status checks.
     */
    private Duration pollInterval = JobPoller.DEFAULT_POLL_INTERVAL;

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofMinutes(1);

    /**
     * Run "SELECT 1" at startup to check connectivity.
     */
    private boolean smokeTest = false;

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

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Path getCredentialsFile() {
        return credentialsFile;
    }

    public void setCredentialsFile(Path credentialsFile) {
        this.credentialsFile = credentialsFile;
    }

    public boolean isApplicationDefaultCredentials() {
        return applicationDefaultCredentials;
    }

    public void setApplicationDefaultCredentials(boolean applicationDefaultCredentials) {
        this.applicationDefaultCredentials = applicationDefaultCredentials;
    }

    public Boolean getUseLegacySql() {
        return useLegacySql;
    }

    public void setUseLegacySql(Boolean useLegacySql) {
        this.useLegacySql = useLegacySql;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public boolean isSmokeTest() {
        return smokeTest;
    }

    public void setSmokeTest(boolean smokeTest) {
        this.smokeTest = smokeTest;
    }
}
