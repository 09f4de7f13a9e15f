package io.github.koszti.bigq.query.exception;

public class ServiceConfigException extends RuntimeException {

    public ServiceConfigException(String message) {
        super(message);
    }
}
