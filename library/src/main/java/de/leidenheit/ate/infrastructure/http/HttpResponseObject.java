package de.leidenheit.ate.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.Strings;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.JsonPathException;
import de.leidenheit.ate.core.exception.ParamsException;
import de.leidenheit.ate.core.execution.ResponseObject;
import de.leidenheit.ate.core.execution.context.TestContext;
import de.leidenheit.ate.core.model.DiffRecord;
import de.leidenheit.ate.core.model.ValidationResult;
import de.leidenheit.ate.core.model.ValidatorSpec;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Response of a dispatched request.
 * <p>
 * Extraction paths:
 * <ul>
 *     <li>{@code status_code}, {@code elapsed} (milliseconds), {@code text} (raw body)</li>
 *     <li>{@code headers} or {@code headers.<name>} (case-insensitive)</li>
 *     <li>{@code cookies} or {@code cookies.<name>}</li>
 *     <li>{@code content} / {@code body} / {@code json}, optionally followed by a dotted path,
 *     e.g. {@code content.users.0.name}</li>
 *     <li>a JsonPath expression starting with {@code $.} or {@code $[}</li>
 * </ul>
 */
@Slf4j
@Getter
@Builder
public class HttpResponseObject implements ResponseObject {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int statusCode;
    private final Map<String, String> headers;
    private final Map<String, String> cookies;
    private final String body;
    private final long elapsedMillis;

    @Override
    public Map<String, JsonNode> extract(final Map<String, String> extractBinds, final TestContext context) {
        Map<String, JsonNode> extracted = new LinkedHashMap<>();
        if (Objects.isNull(extractBinds)) return extracted;

        extractBinds.forEach((name, path) -> {
            var resolvedPath = context.resolve(TextNode.valueOf(path), "extract_binds." + name).asText();
            var value = extractField(resolvedPath);
            log.debug("Extracted '{}' from '{}': {}", name, resolvedPath, value);
            extracted.put(name, value);
        });
        return extracted;
    }

    @Override
    public ValidationResult validate(final List<ValidatorSpec> validators, final TestContext context) {
        List<DiffRecord> diffContent = new ArrayList<>();
        var validatorList = Objects.requireNonNullElse(validators, Collections.<ValidatorSpec>emptyList());

        for (int i = 0; i < validatorList.size(); i++) {
            var validator = validatorList.get(i);
            if (Strings.isNullOrEmpty(validator.getCheck())) {
                throw new ParamsException("Validator at position %d has no 'check'".formatted(i));
            }

            var comparator = ValidatorComparator.fromValue(
                    Objects.requireNonNullElse(validator.getComparator(), ValidatorSpec.DEFAULT_COMPARATOR));
            var actual = resolveCheck(validator.getCheck(), context, i);
            var expected = context.resolve(
                    Objects.requireNonNullElse(validator.getExpect(), NullNode.getInstance()),
                    "validators[%d].expect".formatted(i));

            if (!comparator.test(actual, expected)) {
                log.info("Validator failed: {} {} {} (actual: {})", validator.getCheck(), comparator.getValue(), expected, actual);
                diffContent.add(DiffRecord.builder()
                        .validator(validator)
                        .expected(expected)
                        .actual(actual)
                        .passed(false)
                        .build());
            }
        }

        return ValidationResult.builder()
                .success(diffContent.isEmpty())
                .diffContent(diffContent)
                .build();
    }

    /**
     * Parsed body; a body that is no JSON is returned as text, an empty body as null.
     */
    public JsonNode getContent() {
        if (Strings.isNullOrEmpty(body) || body.isBlank()) return NullNode.getInstance();
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    public JsonNode extractField(final String field) {
        if (field.startsWith("$.") || field.startsWith("$[")) {
            return extractJsonPath(field);
        }

        var parts = field.split("\\.", 2);
        var root = parts[0];
        var subPath = parts.length > 1 ? parts[1] : null;

        return switch (root) {
            case "status_code" -> requireLeaf(field, subPath, IntNode.valueOf(statusCode));
            case "elapsed" -> requireLeaf(field, subPath, LongNode.valueOf(elapsedMillis));
            case "text" -> requireLeaf(field, subPath, TextNode.valueOf(Strings.nullToEmpty(body)));
            case "headers" -> extractFromMap(field, subPath, headers);
            case "cookies" -> extractFromMap(field, subPath, cookies);
            case "content", "body", "json" -> Objects.isNull(subPath)
                    ? getContent()
                    : extractNested(field, getContent(), subPath);
            default -> throw new ParamsException("Unsupported extraction path '%s'".formatted(field));
        };
    }

    private JsonNode resolveCheck(final String check, final TestContext context, final int index) {
        if (check.contains("${")) {
            return context.resolve(TextNode.valueOf(check), "validators[%d].check".formatted(index));
        }
        return extractField(check);
    }

    private JsonNode requireLeaf(final String field, final String subPath, final JsonNode value) {
        if (Objects.nonNull(subPath)) throw new ParamsException("Extraction path '%s' cannot be followed".formatted(field));
        return value;
    }

    private JsonNode extractFromMap(final String field, final String key, final Map<String, String> source) {
        var values = Objects.requireNonNullElse(source, Collections.<String, String>emptyMap());
        if (Objects.isNull(key)) {
            ObjectNode node = MAPPER.createObjectNode();
            values.forEach(node::put);
            return node;
        }
        var value = values.get(key);
        if (Objects.isNull(value)) throw new ParamsException("Failed to extract '%s' from response".formatted(field));
        return TextNode.valueOf(value);
    }

    private JsonNode extractNested(final String field, final JsonNode content, final String subPath) {
        JsonNode current = content;
        for (String key : subPath.split("\\.")) {
            if (current.isArray() && key.matches("\\d+") && Integer.parseInt(key) < current.size()) {
                current = current.get(Integer.parseInt(key));
            } else if (current.isObject() && current.has(key)) {
                current = current.get(key);
            } else {
                throw new ParamsException("Failed to extract '%s' from response".formatted(field));
            }
        }
        return current;
    }

    private JsonNode extractJsonPath(final String expression) {
        try {
            Object value = JsonPath.read(Strings.nullToEmpty(body), expression);
            return Objects.isNull(value) ? NullNode.getInstance() : MAPPER.valueToTree(value);
        } catch (JsonPathException | IllegalArgumentException e) {
            throw new ParamsException("Failed to extract '%s' from response: %s".formatted(expression, e.getMessage()));
        }
    }
}
