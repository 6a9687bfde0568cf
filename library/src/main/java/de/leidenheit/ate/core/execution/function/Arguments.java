package de.leidenheit.ate.core.execution.function;

import com.fasterxml.jackson.databind.JsonNode;
import de.leidenheit.ate.core.exception.AteException;

import java.util.List;

final class Arguments {

    static void requireCount(final String function, final List<JsonNode> args, final int min, final int max) {
        if (args.size() < min || args.size() > max) {
            throw new AteException("%s() takes %d to %d arguments but %d were given"
                    .formatted(function, min, max, args.size()));
        }
    }

    static int intArg(final String function, final List<JsonNode> args, final int index) {
        var arg = args.get(index);
        if (arg.isIntegralNumber() && arg.canConvertToInt()) {
            return arg.asInt();
        }
        if (arg.isTextual() && arg.asText().matches("-?\\d+")) {
            try {
                return Integer.parseInt(arg.asText());
            } catch (NumberFormatException e) {
                throw new AteException("%s() expects an integer at position %d but got '%s'".formatted(function, index, arg), e);
            }
        }
        throw new AteException("%s() expects an integer at position %d but got '%s'".formatted(function, index, arg));
    }

    static String text(final JsonNode arg) {
        return arg.isValueNode() ? arg.asText() : arg.toString();
    }

    private Arguments() {}
}
