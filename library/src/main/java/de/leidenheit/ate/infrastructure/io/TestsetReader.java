package de.leidenheit.ate.infrastructure.io;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import de.leidenheit.ate.core.model.Testcase;
import de.leidenheit.ate.core.model.Testset;
import de.leidenheit.ate.core.model.TestsetConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Reads testsets from YAML or JSON.
 * <p>
 * Accepted documents are a testset {@code {name, config, testcases}}, a list of testsets, or a
 * list of items {@code [{config: ...}, {test: ...}, ...]} where every {@code config} item starts
 * a new testset and the following {@code test} items become its testcases.
 */
@Slf4j
public class TestsetReader {

    private static final Charset ENCODING = StandardCharsets.UTF_8;
    private static final String[] EXTENSIONS = {"yml", "yaml", "json"};
    private static final String CONFIG_KEY = "config";
    private static final String TEST_KEY = "test";
    private static final String TESTCASES_KEY = "testcases";

    private static final ObjectMapper JSON_MAPPER = configure(new ObjectMapper());
    private static final ObjectMapper YAML_MAPPER = configure(new YAMLMapper());

    /**
     * Reads a file, every testset file of a directory (recursively, in path order) or a
     * classpath resource.
     */
    public TestsetReadResult readLocation(final String location, final TestsetReadOptions options) {
        try {
            var path = toPath(location);
            if (Files.isDirectory(path)) {
                return readDirectory(path.toFile(), options);
            }
            var content = readContentFromLocation(location, path);
            return readContents(content, options, location);
        } catch (Exception e) {
            return TestsetReadResult.ofError("location:%s; msg=%s".formatted(location, e.getMessage()));
        }
    }

    public TestsetReadResult readContents(final String content, final TestsetReadOptions options, final String location) {
        if (Objects.isNull(content) || content.trim().isEmpty()) {
            return TestsetReadResult.ofError("Null or empty definition at '%s'".formatted(location));
        }

        try {
            var mapper = getMapper(content);
            JsonNode rootNode = mapper.readTree(content);
            var result = parseRootNode(rootNode, mapper, FilenameUtils.getBaseName(location));
            validate(result, options);
            return result;
        } catch (Exception e) {
            return TestsetReadResult.ofError("location:%s; msg=%s".formatted(location, e.getMessage()));
        }
    }

    private TestsetReadResult readDirectory(final File directory, final TestsetReadOptions options) throws IOException {
        var aggregated = TestsetReadResult.builder().build();
        var files = new ArrayList<>(FileUtils.listFiles(directory, EXTENSIONS, true));
        files.sort(Comparator.comparing(File::getPath));

        for (File file : files) {
            log.debug("Reading testsets from '{}'", file);
            var result = readContents(FileUtils.readFileToString(file, ENCODING), options, file.getPath());
            if (result.isInvalid()) aggregated.setInvalid(true);
            aggregated.getMessages().addAll(result.getMessages());
            aggregated.getTestsets().addAll(result.getTestsets());
        }
        return aggregated;
    }

    private TestsetReadResult parseRootNode(final JsonNode rootNode, final ObjectMapper mapper, final String defaultName)
            throws JsonProcessingException {
        var result = TestsetReadResult.builder().build();

        if (rootNode.isObject()) {
            result.getTestsets().add(toTestset(rootNode, mapper, defaultName));
        } else if (rootNode.isArray() && isTestsetList(rootNode)) {
            for (JsonNode testsetNode : rootNode) {
                result.getTestsets().add(toTestset(testsetNode, mapper, defaultName));
            }
        } else if (rootNode.isArray()) {
            parseItemList(rootNode, mapper, defaultName, result);
        } else {
            result.setInvalid(true);
            result.getMessages().add("Expected a mapping or a list but got '%s'".formatted(rootNode.getNodeType()));
        }
        return result;
    }

    private void parseItemList(final JsonNode items,
                               final ObjectMapper mapper,
                               final String defaultName,
                               final TestsetReadResult result) throws JsonProcessingException {
        Testset current = null;
        for (int i = 0; i < items.size(); i++) {
            var item = items.get(i);
            if (item.has(CONFIG_KEY)) {
                var config = mapper.treeToValue(item.get(CONFIG_KEY), TestsetConfig.class);
                current = Testset.builder()
                        .name(Objects.requireNonNullElse(config.getName(), defaultName))
                        .config(config)
                        .testcases(new ArrayList<>())
                        .build();
                result.getTestsets().add(current);
            } else if (item.has(TEST_KEY)) {
                if (Objects.isNull(current)) {
                    current = Testset.builder()
                            .name(defaultName)
                            .config(TestsetConfig.builder().build())
                            .testcases(new ArrayList<>())
                            .build();
                    result.getTestsets().add(current);
                }
                current.getTestcases().add(mapper.treeToValue(item.get(TEST_KEY), Testcase.class));
            } else {
                result.setInvalid(true);
                result.getMessages().add("Item %d must contain either '%s' or '%s'".formatted(i, CONFIG_KEY, TEST_KEY));
            }
        }
    }

    private Testset toTestset(final JsonNode node, final ObjectMapper mapper, final String defaultName)
            throws JsonProcessingException {
        var testset = mapper.treeToValue(node, Testset.class);
        if (Objects.isNull(testset.getName())) {
            var configName = Objects.isNull(testset.getConfig()) ? null : testset.getConfig().getName();
            testset.setName(Objects.requireNonNullElse(configName, defaultName));
        }
        if (Objects.isNull(testset.getConfig())) testset.setConfig(TestsetConfig.builder().build());
        if (Objects.isNull(testset.getTestcases())) testset.setTestcases(new ArrayList<>());
        return testset;
    }

    private void validate(final TestsetReadResult result, final TestsetReadOptions options) {
        for (Testset testset : result.getTestsets()) {
            if (testset.getTestcases().isEmpty() && !options.isAllowEmptyTestsets()) {
                result.setInvalid(true);
                result.getMessages().add("Testset '%s' has no testcases".formatted(testset.getName()));
            }
            for (int i = 0; i < testset.getTestcases().size(); i++) {
                if (Objects.isNull(testset.getTestcases().get(i))) {
                    result.setInvalid(true);
                    result.getMessages().add("Testcase %d of testset '%s' is empty".formatted(i, testset.getName()));
                }
            }
        }
    }

    private boolean isTestsetList(final JsonNode rootNode) {
        for (JsonNode item : rootNode) {
            if (!item.isObject() || !item.has(TESTCASES_KEY)) return false;
        }
        return !rootNode.isEmpty();
    }

    private Path toPath(final String location) {
        final String adjustedLocation = location.replace("\\\\", "/");
        return adjustedLocation.toLowerCase().startsWith("file:")
                ? Paths.get(URI.create(adjustedLocation))
                : Paths.get(adjustedLocation);
    }

    private String readContentFromLocation(final String location, final Path path) throws IOException {
        if (Files.exists(path)) {
            return FileUtils.readFileToString(path.toFile(), ENCODING);
        }
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(location)) {
            if (Objects.isNull(is)) throw new IOException("Resource not found: " + location);
            return new String(is.readAllBytes(), ENCODING);
        }
    }

    private ObjectMapper getMapper(final String data) {
        var trimmed = data.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            return JSON_MAPPER;
        }
        return YAML_MAPPER;
    }

    private static <M extends ObjectMapper> M configure(final M mapper) {
        mapper
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                .enable(JsonParser.Feature.ALLOW_COMMENTS)
                .enable(JsonParser.Feature.ALLOW_SINGLE_QUOTES);
        return mapper;
    }
}
