package de.leidenheit.ate.integration.extension;

import com.google.common.base.Strings;
import de.leidenheit.ate.core.exception.TestsetReadException;
import de.leidenheit.ate.core.model.Testset;
import de.leidenheit.ate.infrastructure.io.TestsetReadOptions;
import de.leidenheit.ate.infrastructure.io.TestsetReader;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;

import java.lang.reflect.ParameterizedType;
import java.util.List;
import java.util.Optional;

/**
 * Loads the testsets named by the system property {@value #PROPERTY_TESTSETS_FILE} once per test
 * class and injects them into parameters of type {@code List<Testset>}.
 */
@Slf4j
public class AteExtension implements BeforeAllCallback, ParameterResolver {

    public static final String PROPERTY_TESTSETS_FILE = "ate.testsets.file";

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(AteExtension.class);
    private static final String TESTSETS_KEY = "testsets";

    @Override
    public void beforeAll(final ExtensionContext context) {
        var location = readFromSystemProperties(PROPERTY_TESTSETS_FILE)
                .orElseThrow(() -> new TestsetReadException("System property '%s' is not set".formatted(PROPERTY_TESTSETS_FILE)));
        context.getStore(NAMESPACE).put(TESTSETS_KEY, loadTestsets(location));
    }

    @Override
    public boolean supportsParameter(final ParameterContext parameterContext, final ExtensionContext extensionContext)
            throws ParameterResolutionException {
        var parameter = parameterContext.getParameter();
        return List.class.equals(parameter.getType())
                && parameter.getParameterizedType() instanceof ParameterizedType parameterizedType
                && Testset.class.equals(parameterizedType.getActualTypeArguments()[0]);
    }

    @Override
    public Object resolveParameter(final ParameterContext parameterContext, final ExtensionContext extensionContext)
            throws ParameterResolutionException {
        return extensionContext.getStore(NAMESPACE).get(TESTSETS_KEY, List.class);
    }

    private Optional<String> readFromSystemProperties(final String property) {
        var propertyValue = System.getProperty(property);
        if (Strings.isNullOrEmpty(propertyValue)) return Optional.empty();

        log.info("Reading system property '{}': {}", property, propertyValue);
        return Optional.of(propertyValue);
    }

    private List<Testset> loadTestsets(final String location) {
        var readResult = new TestsetReader().readLocation(location, TestsetReadOptions.ofDefault());
        if (readResult.isInvalid()) {
            throw new TestsetReadException("Reading testsets from '%s' failed: %s".formatted(location, readResult.getMessages()));
        }
        return readResult.getTestsets();
    }
}
