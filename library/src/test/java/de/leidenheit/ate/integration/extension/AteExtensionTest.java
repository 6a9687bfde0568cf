package de.leidenheit.ate.integration.extension;

import de.leidenheit.ate.core.execution.RecordingTransport;
import de.leidenheit.ate.core.execution.TestRunner;
import de.leidenheit.ate.core.model.Testset;
import de.leidenheit.ate.integration.AteDynamicTest;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the testsets named by {@code ate.testsets.file} (set by the build) against canned responses.
 */
@ExtendWith(AteExtension.class)
class AteExtensionTest {

    @Test
    void shouldInjectTestsetsFromSystemProperty(final List<Testset> testsets) {
        // then
        assertThat(testsets).extracting(Testset::getName).containsExactly("login", "logout");
    }

    @TestFactory
    Stream<DynamicNode> runTestsets(final List<Testset> testsets) {
        var transport = new RecordingTransport(request -> RecordingTransport.response(200,
                "{\"token\": \"baNLX1zhFYP11Seb\"}", Map.of("Content-Type", "application/json")));
        return new AteDynamicTest(new TestRunner(transport)).generateTestsetTests(testsets);
    }
}
