package de.leidenheit.ate.integration;

import de.leidenheit.ate.core.execution.TestRunner;
import de.leidenheit.ate.core.model.ContextLevel;
import de.leidenheit.ate.core.model.DiffRecord;
import de.leidenheit.ate.core.model.Testcase;
import de.leidenheit.ate.core.model.Testset;
import de.leidenheit.ate.core.model.TestsetConfig;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns testsets into JUnit dynamic tests. All tests share the given runner and are executed in
 * declaration order, so extracted variables flow from one testcase to the next. A failing or
 * erroring testcase fails its dynamic test; the remaining ones still run. If the config of a
 * testset fails, all of its testcases fail without being run.
 */
@Slf4j
public class AteDynamicTest {

    private final TestRunner runner;

    public AteDynamicTest(final TestRunner runner) {
        this.runner = runner;
    }

    public Stream<DynamicNode> generateTestsetTests(final List<Testset> testsets) {
        return testsets.stream().map(this::createContainerForTestset);
    }

    private DynamicContainer createContainerForTestset(final Testset testset) {
        List<DynamicNode> nodes = new ArrayList<>();
        var config = Objects.requireNonNullElseGet(testset.getConfig(), () -> TestsetConfig.builder().build());
        var configApplied = new AtomicBoolean(false);
        nodes.add(DynamicTest.dynamicTest("Config of testset '%s'".formatted(testset.getName()), () -> {
            log.info("Applying config of testset '{}'", testset.getName());
            runner.updateContext(config, ContextLevel.TESTSET);
            configApplied.set(true);
        }));

        var testcases = Objects.requireNonNullElse(testset.getTestcases(), Collections.<Testcase>emptyList());
        testcases.forEach(testcase -> nodes.add(DynamicTest.dynamicTest(
                "Testcase '%s'".formatted(testcase.getName()),
                () -> {
                    if (!configApplied.get()) {
                        Assertions.fail("Config of testset '%s' failed; testcase '%s' not run"
                                .formatted(testset.getName(), testcase.getName()));
                    }
                    executeTestcase(testcase);
                })));

        return DynamicContainer.dynamicContainer("Testset '%s'".formatted(testset.getName()), nodes);
    }

    private void executeTestcase(final Testcase testcase) {
        var result = runner.runTest(testcase);
        if (!result.isSuccess()) {
            Assertions.fail("Testcase '%s' failed:%n%s".formatted(testcase.getName(), describe(result.getDiffContent())));
        }
    }

    private String describe(final List<DiffRecord> diffContent) {
        return diffContent.stream()
                .map(diff -> "  %s %s %s, actual: %s".formatted(
                        diff.getValidator().getCheck(),
                        diff.getValidator().getComparator(),
                        diff.getExpected(),
                        diff.getActual()))
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
