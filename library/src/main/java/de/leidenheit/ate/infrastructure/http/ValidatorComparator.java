package de.leidenheit.ate.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import de.leidenheit.ate.core.exception.AteException;
import de.leidenheit.ate.core.exception.AteUnsupportedException;
import de.leidenheit.ate.core.exception.ParamsException;
import lombok.Getter;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.StreamSupport;

/**
 * Comparators available to validators. The first argument is the actual value taken from the
 * response, the second the expected value.
 */
@Getter
public enum ValidatorComparator {
    EQUALS("eq", List.of("equals", "==", "is"), ValidatorComparator::isEqual),
    NOT_EQUALS("ne", List.of("!=", "not_equals"), (actual, expected) -> !isEqual(actual, expected)),
    LESS_THAN("lt", List.of("less_than", "<"), (actual, expected) -> compare(actual, expected) < 0),
    LESS_OR_EQUALS("le", List.of("less_than_or_equals", "<="), (actual, expected) -> compare(actual, expected) <= 0),
    GREATER_THAN("gt", List.of("greater_than", ">"), (actual, expected) -> compare(actual, expected) > 0),
    GREATER_OR_EQUALS("ge", List.of("greater_than_or_equals", ">="), (actual, expected) -> compare(actual, expected) >= 0),
    STRING_EQUALS("str_eq", List.of("string_equals"), (actual, expected) -> stringify(actual).equals(stringify(expected))),
    LENGTH_EQUALS("len_eq", List.of("length_equals", "count_eq"), (actual, expected) -> length(actual) == expected.asInt()),
    LENGTH_GREATER_THAN("len_gt", List.of("length_greater_than", "count_gt"), (actual, expected) -> length(actual) > expected.asInt()),
    LENGTH_GREATER_OR_EQUALS("len_ge", List.of("length_greater_than_or_equals", "count_ge"), (actual, expected) -> length(actual) >= expected.asInt()),
    LENGTH_LESS_THAN("len_lt", List.of("length_less_than", "count_lt"), (actual, expected) -> length(actual) < expected.asInt()),
    LENGTH_LESS_OR_EQUALS("len_le", List.of("length_less_than_or_equals", "count_le"), (actual, expected) -> length(actual) <= expected.asInt()),
    CONTAINS("contains", List.of(), ValidatorComparator::contains),
    CONTAINED_BY("contained_by", List.of(), (actual, expected) -> contains(expected, actual)),
    TYPE("type", List.of("type_match"), ValidatorComparator::isOfType),
    REGEX("regex", List.of("regex_match"), (actual, expected) -> compileRegex(expected.asText()).matcher(stringify(actual)).find()),
    STARTS_WITH("startswith", List.of("starts_with"), (actual, expected) -> stringify(actual).startsWith(stringify(expected))),
    ENDS_WITH("endswith", List.of("ends_with"), (actual, expected) -> stringify(actual).endsWith(stringify(expected)));

    private static final Comparator<JsonNode> NUMERIC_AWARE = (left, right) -> {
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue());
        }
        return left.equals(right) ? 0 : 1;
    };

    private final String value;
    private final List<String> aliases;
    private final BiPredicate<JsonNode, JsonNode> predicate;

    ValidatorComparator(final String value, final List<String> aliases, final BiPredicate<JsonNode, JsonNode> predicate) {
        this.value = value;
        this.aliases = aliases;
        this.predicate = predicate;
    }

    public boolean test(final JsonNode actual, final JsonNode expected) {
        return predicate.test(actual, expected);
    }

    public static ValidatorComparator fromValue(final String comparator) {
        var normalized = comparator.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(candidate -> candidate.value.equals(normalized) || candidate.aliases.contains(normalized))
                .findFirst()
                .orElseThrow(() -> new AteUnsupportedException("Unsupported comparator '%s'".formatted(comparator)));
    }

    private static boolean isEqual(final JsonNode actual, final JsonNode expected) {
        return actual.equals(NUMERIC_AWARE, expected);
    }

    private static int compare(final JsonNode actual, final JsonNode expected) {
        if (actual.isNumber() && expected.isNumber()) {
            return actual.decimalValue().compareTo(expected.decimalValue());
        } else if (actual.isTextual() && expected.isTextual()) {
            return actual.asText().compareTo(expected.asText());
        }
        throw new AteException("Incomparable types: %s and %s".formatted(actual, expected));
    }

    private static Pattern compileRegex(final String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ParamsException("Invalid regex '%s': %s".formatted(regex, e.getDescription()));
        }
    }

    private static int length(final JsonNode value) {
        if (value.isTextual()) return value.asText().length();
        if (value.isContainerNode()) return value.size();
        throw new AteException("Value %s has no length".formatted(value));
    }

    private static boolean contains(final JsonNode container, final JsonNode item) {
        if (container.isTextual()) {
            return container.asText().contains(stringify(item));
        } else if (container.isArray()) {
            return StreamSupport.stream(container.spliterator(), false)
                    .anyMatch(element -> isEqual(element, item));
        } else if (container.isObject()) {
            return container.has(stringify(item));
        }
        return false;
    }

    private static boolean isOfType(final JsonNode actual, final JsonNode expected) {
        return switch (expected.asText().toLowerCase(Locale.ROOT)) {
            case "str", "string" -> actual.isTextual();
            case "int", "integer" -> actual.isIntegralNumber();
            case "float", "number" -> actual.isNumber();
            case "bool", "boolean" -> actual.isBoolean();
            case "list", "array" -> actual.isArray();
            case "dict", "object" -> actual.isObject();
            case "none", "null" -> Objects.isNull(actual) || actual.isNull();
            default -> throw new AteUnsupportedException("Unsupported type name '%s'".formatted(expected.asText()));
        };
    }

    private static String stringify(final JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
