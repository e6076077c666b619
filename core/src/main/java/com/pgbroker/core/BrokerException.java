package com.pgbroker.core;

public class BrokerException extends RuntimeException {
    private final ErrorKind kind;

    public BrokerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BrokerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static BrokerException precondition(String message) {
        return new BrokerException(ErrorKind.PRECONDITION, message);
    }

    public static BrokerException notFound(String message) {
        return new BrokerException(ErrorKind.NOT_FOUND, message);
    }

    public static BrokerException validation(String message) {
        return new BrokerException(ErrorKind.VALIDATION, message);
    }
}
