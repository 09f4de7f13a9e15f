package io.github.koszti.bigq.bigquery.exception;

import java.util.Objects;

public class BigQueryUnavailableException extends BigQueryBackendException {

    private final String baseUrl;

    public BigQueryUnavailableException(String baseUrl, Throwable cause) {
        super("BigQuery is unavailable at " + baseUrl + ": " + (cause != null ? cause.getMessage() : "(no cause)"), cause);
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
