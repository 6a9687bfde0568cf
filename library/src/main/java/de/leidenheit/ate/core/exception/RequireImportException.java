package de.leidenheit.ate.core.exception;

import lombok.Getter;

/**
 * Raised when a module named in {@code requires} is unknown to the function module registry.
 */
@Getter
public class RequireImportException extends AteException {

    private final String moduleName;

    public RequireImportException(final String moduleName) {
        super("Required module '%s' could not be found".formatted(moduleName));
        this.moduleName = moduleName;
    }
}
