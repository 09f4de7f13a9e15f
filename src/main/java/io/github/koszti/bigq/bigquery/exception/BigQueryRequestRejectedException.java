package io.github.koszti.bigq.bigquery.exception;

public class BigQueryRequestRejectedException extends BigQueryBackendException {
    private final int statusCode;

    public BigQueryRequestRejectedException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
