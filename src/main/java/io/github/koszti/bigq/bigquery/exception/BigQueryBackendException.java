package io.github.koszti.bigq.bigquery.exception;

/**
 * Any failure while talking to BigQuery: submission, status polling or page fetches.
 */
public class BigQueryBackendException extends RuntimeException {

    public BigQueryBackendException(String message) {
        super(message);
    }

    public BigQueryBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
