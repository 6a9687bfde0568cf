package de.leidenheit.ate.core.exception;

import lombok.Getter;

@Getter
public class FunctionNotFoundException extends AteException {

    private final String functionName;
    private final String path;

    public FunctionNotFoundException(final String functionName, final String path) {
        super("Function '%s' called at '%s' is not bound".formatted(functionName, path));
        this.functionName = functionName;
        this.path = path;
    }
}
