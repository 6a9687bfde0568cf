package de.leidenheit.ate.core.execution.function;

import com.google.common.base.Strings;
import de.leidenheit.ate.core.exception.RequireImportException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of function modules that may be imported by name. Custom modules are added through
 * {@link #register(FunctionModule)}.
 */
public class FunctionModuleRegistry {

    private final Map<String, FunctionModule> modules = new LinkedHashMap<>();

    public FunctionModuleRegistry() {
        // register default modules
        List.of(
                new RandomFunctions(),
                new HashFunctions(),
                new TimeFunctions(),
                new EncodingFunctions()
        ).forEach(this::register);
    }

    public static FunctionModuleRegistry ofDefault() {
        return new FunctionModuleRegistry();
    }

    public void register(final FunctionModule module) {
        if (Strings.isNullOrEmpty(module.getName())) {
            throw new IllegalArgumentException("Function module must have a name");
        }
        modules.put(module.getName(), module);
    }

    public Optional<FunctionModule> find(final String moduleName) {
        return Optional.ofNullable(modules.get(moduleName));
    }

    public FunctionModule lookup(final String moduleName) {
        return find(moduleName).orElseThrow(() -> new RequireImportException(moduleName));
    }
}
