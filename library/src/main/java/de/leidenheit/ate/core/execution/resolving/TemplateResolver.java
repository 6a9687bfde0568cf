package de.leidenheit.ate.core.execution.resolving;

import com.fasterxml.jackson.databind.JsonNode;
import de.leidenheit.ate.core.execution.function.AteFunction;

import java.util.Map;

public interface TemplateResolver {

    String ROOT_PATH = "$";

    /**
     * Produces a resolved deep copy of {@code content}; the input is never modified.
     *
     * @param content   arbitrary nested value
     * @param path      location of {@code content}, used in error messages
     * @param variables variables visible to placeholders
     * @param functions functions visible to call placeholders
     * @return structurally identical copy without placeholders
     */
    JsonNode resolve(final JsonNode content,
                     final String path,
                     final Map<String, JsonNode> variables,
                     final Map<String, AteFunction> functions);

    default JsonNode resolve(final JsonNode content,
                             final Map<String, JsonNode> variables,
                             final Map<String, AteFunction> functions) {
        return resolve(content, ROOT_PATH, variables, functions);
    }
}
