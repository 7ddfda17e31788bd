package io.maubotoperator.supervisor;

public final class ApplyFailedException extends RuntimeException {
    public ApplyFailedException(String message) {
        super(message);
    }

    public ApplyFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
