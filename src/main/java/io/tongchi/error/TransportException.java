package io.tongchi.error;

public class TransportException extends Exception {
    private final int statusCode;

    public TransportException(String message) {
        this(message, -1, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TransportException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
