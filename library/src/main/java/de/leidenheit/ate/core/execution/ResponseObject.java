package de.leidenheit.ate.core.execution;

import com.fasterxml.jackson.databind.JsonNode;
import de.leidenheit.ate.core.execution.context.TestContext;
import de.leidenheit.ate.core.model.ValidationResult;
import de.leidenheit.ate.core.model.ValidatorSpec;

import java.util.List;
import java.util.Map;

public interface ResponseObject {

    /**
     * Derives named values from the response.
     *
     * @param extractBinds variable name to extraction path
     * @param context      context used to resolve placeholders inside extraction paths
     * @return extracted values in declaration order
     */
    Map<String, JsonNode> extract(final Map<String, String> extractBinds, final TestContext context);

    /**
     * Runs the validators against the response. Expected values are resolved against the context.
     */
    ValidationResult validate(final List<ValidatorSpec> validators, final TestContext context);
}
