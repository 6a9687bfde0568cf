package de.leidenheit.ate.core.exception;

import lombok.Getter;

/**
 * Raised when a variable bind references an unknown function or the function invocation fails.
 */
@Getter
public class VariableBindException extends AteException {

    private final String variableName;

    public VariableBindException(final String variableName, final String message) {
        super(message);
        this.variableName = variableName;
    }

    public VariableBindException(final String variableName, final String message, final Throwable cause) {
        super(message, cause);
        this.variableName = variableName;
    }
}
