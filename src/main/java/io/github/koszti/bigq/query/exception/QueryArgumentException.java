package io.github.koszti.bigq.query.exception;

public class QueryArgumentException extends IllegalArgumentException {

    public QueryArgumentException(String message) {
        super(message);
    }
}
