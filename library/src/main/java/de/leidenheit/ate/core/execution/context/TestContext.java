package de.leidenheit.ate.core.execution.context;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.google.common.base.Strings;
import de.leidenheit.ate.core.exception.FunctionBindException;
import de.leidenheit.ate.core.exception.VariableBindException;
import de.leidenheit.ate.core.execution.function.AteFunction;
import de.leidenheit.ate.core.execution.function.FunctionModule;
import de.leidenheit.ate.core.execution.function.FunctionModuleRegistry;
import de.leidenheit.ate.core.execution.resolving.PlaceholderTemplateResolver;
import de.leidenheit.ate.core.execution.resolving.TemplateResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Variables and functions bound during a run.
 * <p>
 * Bindings are only ever added or overwritten; a later or more specific scope wins on a name
 * collision. A context is reset by creating a new instance. Not thread-safe: one context per
 * runner.
 */
@Slf4j
public class TestContext {

    private static final String FUNC_KEY = "func";
    private static final String ARGS_KEY = "args";

    private final Map<String, JsonNode> variables = new LinkedHashMap<>();
    private final Map<String, AteFunction> functions = new LinkedHashMap<>();
    private final Set<String> requires = new LinkedHashSet<>();

    private final FunctionModuleRegistry moduleRegistry;
    private final TemplateResolver resolver;

    public TestContext() {
        this(FunctionModuleRegistry.ofDefault(), new PlaceholderTemplateResolver());
    }

    public TestContext(final FunctionModuleRegistry moduleRegistry, final TemplateResolver resolver) {
        this.moduleRegistry = moduleRegistry;
        this.resolver = resolver;
    }

    public void importRequires(final Collection<String> moduleNames) {
        if (Objects.isNull(moduleNames)) return;

        for (String moduleName : moduleNames) {
            if (requires.contains(moduleName)) continue;

            moduleRegistry.lookup(moduleName);
            requires.add(moduleName);
            log.debug("Imported function module '{}'", moduleName);
        }
    }

    /**
     * Binds functions of imported modules under new names. An expression is either
     * {@code module.function} or a bare {@code function} name, searched in the imported modules
     * in import order and then among the already bound functions.
     */
    public void bindFunctions(final Map<String, String> functionBinds) {
        if (Objects.isNull(functionBinds)) return;

        functionBinds.forEach((name, expression) -> {
            functions.put(name, lookupFunction(name, expression));
            log.debug("Bound function '{}' to '{}'", name, expression);
        });
    }

    public void registerFunction(final String name, final AteFunction function) {
        if (Strings.isNullOrEmpty(name)) throw new IllegalArgumentException("Function name must not be empty");
        functions.put(name, Objects.requireNonNull(function));
    }

    /**
     * Binds variables in the given order. Each entry is a single-key mapping whose value is
     * either a literal, resolved against the variables bound so far, or a
     * {@code {func: name, args: [...]}} invocation of a bound function.
     */
    public void bindVariables(final List<Map<String, JsonNode>> variableBinds) {
        if (Objects.isNull(variableBinds)) return;

        for (Map<String, JsonNode> variableBind : variableBinds) {
            variableBind.forEach((name, spec) -> {
                var value = evaluateVariable(name, spec);
                variables.put(name, value);
                log.debug("Bound variable '{}' = {}", name, value);
            });
        }
    }

    public void updateVariables(final Map<String, JsonNode> mapping) {
        if (Objects.isNull(mapping)) return;
        mapping.forEach((name, value) -> variables.put(name, Objects.requireNonNullElse(value, NullNode.getInstance())));
    }

    public JsonNode resolve(final JsonNode content, final String path) {
        return resolver.resolve(content, path, variables, functions);
    }

    public Optional<JsonNode> findVariable(final String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public Map<String, JsonNode> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public Map<String, AteFunction> getFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    public Set<String> getRequires() {
        return Collections.unmodifiableSet(requires);
    }

    private AteFunction lookupFunction(final String name, final String expression) {
        if (Strings.isNullOrEmpty(expression)) {
            throw new FunctionBindException(name, "Function '%s' has an empty binding expression".formatted(name));
        }

        var separator = expression.lastIndexOf('.');
        if (separator > 0) {
            var moduleName = expression.substring(0, separator);
            var functionName = expression.substring(separator + 1);
            if (!requires.contains(moduleName)) {
                throw new FunctionBindException(name, "Function '%s' refers to module '%s' which has not been imported"
                        .formatted(name, moduleName));
            }
            return Optional.ofNullable(moduleRegistry.lookup(moduleName).getFunctions().get(functionName))
                    .orElseThrow(() -> new FunctionBindException(name, "Module '%s' has no function '%s'"
                            .formatted(moduleName, functionName)));
        }

        for (String moduleName : requires) {
            FunctionModule module = moduleRegistry.lookup(moduleName);
            var function = module.getFunctions().get(expression);
            if (Objects.nonNull(function)) return function;
        }
        if (functions.containsKey(expression)) return functions.get(expression);

        throw new FunctionBindException(name, "Expression '%s' of function '%s' does not name a callable of the imported modules %s"
                .formatted(expression, name, requires));
    }

    private JsonNode evaluateVariable(final String name, final JsonNode spec) {
        if (Objects.nonNull(spec) && spec.isObject() && spec.has(FUNC_KEY)) {
            return invokeFunction(name, spec);
        }
        return resolver.resolve(spec, "variable_binds." + name, variables, functions);
    }

    private JsonNode invokeFunction(final String name, final JsonNode spec) {
        var functionName = spec.get(FUNC_KEY).asText();
        var function = functions.get(functionName);
        if (Objects.isNull(function)) {
            throw new VariableBindException(name, "Variable '%s' refers to unknown function '%s'".formatted(name, functionName));
        }

        var resolvedArgs = resolver.resolve(spec.get(ARGS_KEY), "variable_binds.%s.args".formatted(name), variables, functions);
        List<JsonNode> args = new ArrayList<>();
        if (resolvedArgs.isArray()) {
            resolvedArgs.forEach(args::add);
        } else if (!resolvedArgs.isNull()) {
            args.add(resolvedArgs);
        }

        try {
            var result = function.apply(args);
            return Objects.requireNonNullElse(result, NullNode.getInstance());
        } catch (RuntimeException e) {
            throw new VariableBindException(name, "Invocation of '%s' for variable '%s' failed: %s"
                    .formatted(functionName, name, e.getMessage()), e);
        }
    }
}
