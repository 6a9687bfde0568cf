package de.leidenheit.ate.core.exception;

public class AteException extends RuntimeException {

    public AteException() {
        super();
    }

    public AteException(final String message) {
        super(message);
    }

    public AteException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public AteException(final Throwable cause) {
        super(cause);
    }
}
