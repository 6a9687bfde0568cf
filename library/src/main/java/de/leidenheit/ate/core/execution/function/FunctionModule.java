package de.leidenheit.ate.core.execution.function;

import java.util.Map;

/**
 * A group of functions made available to a context through {@code requires}.
 */
public interface FunctionModule {

    String getName();

    Map<String, AteFunction> getFunctions();
}
