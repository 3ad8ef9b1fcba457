package io.tongchi.error;

public class InvariantViolationException extends IllegalStateException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
