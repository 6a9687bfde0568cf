package de.leidenheit.ate.core.execution.function;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A named callable that can be bound in a test context and invoked from variable binds or templates.
 */
@FunctionalInterface
public interface AteFunction {

    JsonNode apply(final List<JsonNode> args);
}
