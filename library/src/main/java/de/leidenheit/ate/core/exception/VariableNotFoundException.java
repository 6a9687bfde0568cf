package de.leidenheit.ate.core.exception;

import lombok.Getter;

/**
 * Raised when a placeholder references a variable that is not bound in the context.
 */
@Getter
public class VariableNotFoundException extends AteException {

    private final String variableName;
    private final String path;

    public VariableNotFoundException(final String variableName, final String path) {
        super("Variable '%s' referenced at '%s' is not bound".formatted(variableName, path));
        this.variableName = variableName;
        this.path = path;
    }
}
