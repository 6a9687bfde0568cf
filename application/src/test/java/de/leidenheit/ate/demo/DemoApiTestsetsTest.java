package de.leidenheit.ate.demo;

import com.fasterxml.jackson.databind.node.TextNode;
import de.leidenheit.ate.core.execution.TestRunner;
import de.leidenheit.ate.core.execution.context.TestContext;
import de.leidenheit.ate.core.model.ContextLevel;
import de.leidenheit.ate.core.model.TestResult;
import de.leidenheit.ate.core.model.Testcase;
import de.leidenheit.ate.core.model.Testset;
import de.leidenheit.ate.infrastructure.http.RestAssuredTransport;
import de.leidenheit.ate.infrastructure.http.TransportOptions;
import de.leidenheit.ate.infrastructure.io.TestsetReadOptions;
import de.leidenheit.ate.infrastructure.io.TestsetReader;
import de.leidenheit.ate.integration.AteDynamicTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class DemoApiTestsetsTest {

    private static final String TESTSETS_LOCATION = "testsets/demo-api.yml";

    @LocalServerPort
    private int port;

    private List<Testset> testsets;

    @BeforeEach
    void setUp() {
        testsets = new TestsetReader()
                .readLocation(TESTSETS_LOCATION, TestsetReadOptions.ofDefault())
                .getTestsetsOrThrow();
    }

    @Test
    void shouldPassAllTestcasesOfDemoApi() {
        // given
        var runner = new TestRunner(new RestAssuredTransport(), contextWithBaseUrl());

        // when
        var results = runner.runTestsets(testsets);

        // then
        assertThat(results).singleElement().satisfies(testsetResults -> {
            assertThat(testsetResults).hasSize(10);
            assertThat(testsetResults)
                    .allSatisfy(result -> assertThat(result.isSuccess())
                            .describedAs("testcase '%s': %s", result.getName(), result.getDiffContent())
                            .isTrue());
        });
        assertThat(runner.getContext().findVariable("token"))
                .hasValueSatisfying(token -> assertThat(token.asText()).hasSize(16));
        assertThat(runner.getContext().findVariable("user_name")).hasValue(TextNode.valueOf("user1"));
    }

    @Test
    void shouldReportDiffsOfFailingTestcase() {
        // given
        var runner = new TestRunner(new RestAssuredTransport(), contextWithBaseUrl());
        var getToken = testsets.get(0).getTestcases().get(0);
        var forged = Testcase.builder()
                .name("get token with forged sign")
                .request(getToken.getRequest())
                .validators(getToken.getValidators().subList(0, 2))
                .build();
        runner.updateContext(testsets.get(0).getConfig(), ContextLevel.TESTSET);
        runner.getContext().updateVariables(Map.of("sign", TextNode.valueOf("forged")));

        // when
        TestResult result = runner.runTest(forged);

        // then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDiffContent())
                .extracting(diff -> diff.getValidator().getCheck())
                .containsExactly("status_code", "content.success");
        assertThat(result.getDiffContent().get(0).getActual().asInt()).isEqualTo(403);
    }

    @TestFactory
    Stream<DynamicNode> runDemoApiTestsets() {
        var transport = new RestAssuredTransport(TransportOptions.builder()
                .logResponses(true)
                .build());
        return new AteDynamicTest(new TestRunner(transport, contextWithBaseUrl()))
                .generateTestsetTests(testsets);
    }

    private TestContext contextWithBaseUrl() {
        var context = new TestContext();
        context.updateVariables(Map.of("base_url", TextNode.valueOf("http://localhost:" + port)));
        return context;
    }
}
