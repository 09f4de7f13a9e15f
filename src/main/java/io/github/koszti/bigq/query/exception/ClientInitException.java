package io.github.koszti.bigq.query.exception;

/**
 * The BigQuery client could not be built, e.g. credentials failed to load.
 */
public class ClientInitException extends RuntimeException {

    public ClientInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
