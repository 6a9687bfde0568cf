package de.leidenheit.ate.core.exception;

import lombok.Getter;

/**
 * Raised when a function binding expression does not name a callable of an imported module.
 */
@Getter
public class FunctionBindException extends AteException {

    private final String functionName;

    public FunctionBindException(final String functionName, final String message) {
        super(message);
        this.functionName = functionName;
    }
}
