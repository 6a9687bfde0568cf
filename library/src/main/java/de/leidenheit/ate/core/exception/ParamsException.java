package de.leidenheit.ate.core.exception;

public class ParamsException extends AteException {

    public ParamsException(final String message) {
        super(message);
    }
}
