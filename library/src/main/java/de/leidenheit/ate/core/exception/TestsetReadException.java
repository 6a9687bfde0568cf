package de.leidenheit.ate.core.exception;

public class TestsetReadException extends AteException {

    public TestsetReadException(final String message) {
        super(message);
    }

    public TestsetReadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
