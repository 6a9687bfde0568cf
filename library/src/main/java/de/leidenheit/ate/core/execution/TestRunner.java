package de.leidenheit.ate.core.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.leidenheit.ate.core.exception.ParamsException;
import de.leidenheit.ate.core.execution.context.TestContext;
import de.leidenheit.ate.core.model.BindingScope;
import de.leidenheit.ate.core.model.ContextLevel;
import de.leidenheit.ate.core.model.ResolvedRequest;
import de.leidenheit.ate.core.model.TestResult;
import de.leidenheit.ate.core.model.Testcase;
import de.leidenheit.ate.core.model.Testset;
import de.leidenheit.ate.core.model.TestsetConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runs testsets and testcases sequentially against one {@link TestContext}.
 * <p>
 * The context is not reset between testsets: variables bound or extracted by one testset stay
 * visible to the following ones. Use a separate runner with its own context for every unit that
 * runs concurrently.
 */
@Slf4j
public class TestRunner {

    private static final String URL_KEY = "url";
    private static final String METHOD_KEY = "method";
    private static final String REQUEST_PATH = "request";

    private final HttpTransport transport;
    private final TestContext context;
    private ObjectNode testsetRequestDefaults = JsonNodeFactory.instance.objectNode();

    public TestRunner(final HttpTransport transport) {
        this(transport, new TestContext());
    }

    public TestRunner(final HttpTransport transport, final TestContext context) {
        this.transport = Objects.requireNonNull(transport);
        this.context = Objects.requireNonNull(context);
    }

    /**
     * Applies requires, function binds and variable binds of the scope. On testset level the
     * scope's request is additionally remembered as the defaults inherited by its testcases.
     */
    public void updateContext(final BindingScope scope, final ContextLevel level) {
        log.debug("Applying {} bindings of '{}'", level.getValue(), scope.getName());
        if (ContextLevel.TESTSET.equals(level)) {
            // a failing binding below must not leave the previous testset's defaults in place
            testsetRequestDefaults = JsonNodeFactory.instance.objectNode();
        }

        context.importRequires(scope.getRequires());
        context.bindFunctions(scope.getFunctionBinds());
        context.bindVariables(scope.getVariableBinds());

        if (ContextLevel.TESTSET.equals(level)) {
            testsetRequestDefaults = Objects.isNull(scope.getRequest())
                    ? JsonNodeFactory.instance.objectNode()
                    : scope.getRequest().deepCopy();
        }
    }

    public TestResult runTest(final Testcase testcase) {
        log.info("Running testcase '{}'", testcase.getName());
        updateContext(testcase, ContextLevel.TESTCASE);

        var request = buildRequest(testcase);
        log.debug("Dispatching {} {}", request.getMethod(), request.getUrl());
        var response = transport.dispatch(request);

        var extracted = response.extract(testcase.getExtractBinds(), context);
        context.updateVariables(extracted);

        var validationResult = response.validate(testcase.getValidators(), context);
        log.info("Testcase '{}' {}", testcase.getName(), validationResult.isSuccess() ? "passed" : "failed");

        return TestResult.builder()
                .name(testcase.getName())
                .success(validationResult.isSuccess())
                .diffContent(validationResult.getDiffContent())
                .build();
    }

    public List<TestResult> runTestset(final Testset testset) {
        log.info("Running testset '{}'", testset.getName());
        var config = Objects.requireNonNullElseGet(testset.getConfig(), () -> TestsetConfig.builder().build());
        updateContext(config, ContextLevel.TESTSET);

        List<TestResult> results = new ArrayList<>();
        for (Testcase testcase : Objects.requireNonNullElse(testset.getTestcases(), Collections.<Testcase>emptyList())) {
            results.add(runTest(testcase));
        }
        return results;
    }

    public List<List<TestResult>> runTestsets(final List<Testset> testsets) {
        List<List<TestResult>> results = new ArrayList<>();
        for (Testset testset : testsets) {
            results.add(runTestset(testset));
        }
        return results;
    }

    public TestContext getContext() {
        return context;
    }

    public ObjectNode getTestsetRequestDefaults() {
        return testsetRequestDefaults.deepCopy();
    }

    /**
     * Merges the inherited request defaults with the testcase request, resolves the result and
     * checks the required fields. Top-level keys of the testcase win; the defaults are copied,
     * never modified.
     */
    ResolvedRequest buildRequest(final Testcase testcase) {
        ObjectNode merged = testsetRequestDefaults.deepCopy();
        if (Objects.nonNull(testcase.getRequest())) {
            merged.setAll(testcase.getRequest().deepCopy());
        }

        JsonNode resolved = context.resolve(merged, REQUEST_PATH);
        if (!(resolved instanceof ObjectNode resolvedRequest)
                || !resolvedRequest.hasNonNull(URL_KEY)
                || !resolvedRequest.hasNonNull(METHOD_KEY)) {
            throw new ParamsException("URL or METHOD missed!");
        }

        var url = resolvedRequest.remove(URL_KEY).asText();
        var method = resolvedRequest.remove(METHOD_KEY).asText();
        return ResolvedRequest.builder()
                .url(url)
                .method(method)
                .options(resolvedRequest)
                .build();
    }
}
