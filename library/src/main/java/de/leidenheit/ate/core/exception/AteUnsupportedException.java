package de.leidenheit.ate.core.exception;

public class AteUnsupportedException extends AteException {

    public AteUnsupportedException() {
        super();
    }

    public AteUnsupportedException(final String message) {
        super(message);
    }

    public AteUnsupportedException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public AteUnsupportedException(final Throwable cause) {
        super(cause);
    }
}
