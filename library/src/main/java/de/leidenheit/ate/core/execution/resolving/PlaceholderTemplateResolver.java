package de.leidenheit.ate.core.execution.resolving;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import de.leidenheit.ate.core.exception.AteException;
import de.leidenheit.ate.core.exception.FunctionNotFoundException;
import de.leidenheit.ate.core.exception.VariableNotFoundException;
import de.leidenheit.ate.core.execution.function.AteFunction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${variable}} and {@code ${function(arg, ...)}} placeholders.
 * <p>
 * A string consisting of exactly one placeholder is replaced by the native value, so numbers,
 * booleans and nested structures keep their type. Placeholders embedded in other text are
 * replaced by their string form. Function arguments are {@code $variable}, {@code ${variable}},
 * numbers, {@code true}, {@code false}, {@code null} or strings, optionally quoted; they must not
 * contain commas or parentheses. Any other {@code ${...}} token is rejected.
 */
@Slf4j
public class PlaceholderTemplateResolver implements TemplateResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{(?<name>\\w+)(?:\\((?<args>[^()]*)\\))?}");
    private static final Pattern TOKEN = Pattern.compile("\\$\\{[^}]*}?");
    private static final Pattern ARG_VARIABLE = Pattern.compile("^\\$(?:\\{(?<braced>\\w+)}|(?<plain>\\w+))$");
    private static final Pattern ARG_INTEGER = Pattern.compile("^-?\\d+$");
    private static final Pattern ARG_DECIMAL = Pattern.compile("^-?\\d+\\.\\d+$");

    private final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;

    @Override
    public JsonNode resolve(final JsonNode content,
                            final String path,
                            final Map<String, JsonNode> variables,
                            final Map<String, AteFunction> functions) {
        if (Objects.isNull(content)) return NullNode.getInstance();

        return switch (content.getNodeType()) {
            case OBJECT -> resolveObject((ObjectNode) content, path, variables, functions);
            case ARRAY -> resolveArray((ArrayNode) content, path, variables, functions);
            case STRING -> resolveText(content.asText(), path, variables, functions);
            case NUMBER, BOOLEAN, NULL, BINARY, POJO, MISSING -> content.deepCopy();
        };
    }

    private ObjectNode resolveObject(final ObjectNode node,
                                     final String path,
                                     final Map<String, JsonNode> variables,
                                     final Map<String, AteFunction> functions) {
        var resolved = nodeFactory.objectNode();
        node.fields().forEachRemaining(entry -> resolved.set(
                entry.getKey(),
                resolve(entry.getValue(), path + "." + entry.getKey(), variables, functions)));
        return resolved;
    }

    private ArrayNode resolveArray(final ArrayNode node,
                                   final String path,
                                   final Map<String, JsonNode> variables,
                                   final Map<String, AteFunction> functions) {
        var resolved = nodeFactory.arrayNode(node.size());
        for (int i = 0; i < node.size(); i++) {
            resolved.add(resolve(node.get(i), "%s[%d]".formatted(path, i), variables, functions));
        }
        return resolved;
    }

    private JsonNode resolveText(final String text,
                                 final String path,
                                 final Map<String, JsonNode> variables,
                                 final Map<String, AteFunction> functions) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        rejectMalformedTokens(matcher.replaceAll(""), path);
        matcher.reset();
        if (matcher.matches()) {
            return evaluate(matcher, path, variables, functions);
        }

        matcher.reset();
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            var value = evaluate(matcher, path, variables, functions);
            matcher.appendReplacement(result, Matcher.quoteReplacement(stringify(value)));
        }
        matcher.appendTail(result);
        return TextNode.valueOf(result.toString());
    }

    private JsonNode evaluate(final Matcher matcher,
                              final String path,
                              final Map<String, JsonNode> variables,
                              final Map<String, AteFunction> functions) {
        var name = matcher.group("name");
        var args = matcher.group("args");
        if (Objects.isNull(args)) {
            return lookupVariable(name, path, variables).deepCopy();
        }

        var function = functions.get(name);
        if (Objects.isNull(function)) throw new FunctionNotFoundException(name, path);

        var parsedArgs = parseArgs(args, path, variables);
        log.debug("Calling function '{}' with {} at '{}'", name, parsedArgs, path);
        try {
            var result = function.apply(parsedArgs);
            return Objects.isNull(result) ? NullNode.getInstance() : result;
        } catch (AteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AteException("Function '%s' called at '%s' failed: %s".formatted(name, path, e.getMessage()), e);
        }
    }

    private List<JsonNode> parseArgs(final String args, final String path, final Map<String, JsonNode> variables) {
        List<JsonNode> parsed = new ArrayList<>();
        if (args.isBlank()) return parsed;

        for (String rawArg : args.split(",")) {
            var arg = rawArg.trim();
            var variableMatcher = ARG_VARIABLE.matcher(arg);
            if (variableMatcher.matches()) {
                var name = Objects.requireNonNullElse(variableMatcher.group("braced"), variableMatcher.group("plain"));
                parsed.add(lookupVariable(name, path, variables).deepCopy());
            } else if (ARG_INTEGER.matcher(arg).matches()) {
                parsed.add(LongNode.valueOf(Long.parseLong(arg)));
            } else if (ARG_DECIMAL.matcher(arg).matches()) {
                parsed.add(DoubleNode.valueOf(Double.parseDouble(arg)));
            } else if ("true".equals(arg) || "false".equals(arg)) {
                parsed.add(BooleanNode.valueOf(Boolean.parseBoolean(arg)));
            } else if ("null".equals(arg)) {
                parsed.add(NullNode.getInstance());
            } else {
                parsed.add(TextNode.valueOf(unquote(arg)));
            }
        }
        return parsed;
    }

    private void rejectMalformedTokens(final String textWithoutPlaceholders, final String path) {
        var token = TOKEN.matcher(textWithoutPlaceholders);
        if (token.find()) throw new VariableNotFoundException(token.group(), path);
    }

    private JsonNode lookupVariable(final String name, final String path, final Map<String, JsonNode> variables) {
        if (!variables.containsKey(name)) throw new VariableNotFoundException(name, path);
        return Objects.requireNonNullElse(variables.get(name), NullNode.getInstance());
    }

    private String unquote(final String arg) {
        if (arg.length() >= 2
                && ((arg.startsWith("'") && arg.endsWith("'")) || (arg.startsWith("\"") && arg.endsWith("\"")))) {
            return arg.substring(1, arg.length() - 1);
        }
        return arg;
    }

    private String stringify(final JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
