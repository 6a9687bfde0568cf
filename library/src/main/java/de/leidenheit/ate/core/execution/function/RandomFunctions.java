package de.leidenheit.ate.core.execution.function;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.security.SecureRandom;
import java.util.Map;
import java.util.UUID;

public class RandomFunctions implements FunctionModule {

    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final SecureRandom random = new SecureRandom();

    @Override
    public String getName() {
        return "random";
    }

    @Override
    public Map<String, AteFunction> getFunctions() {
        return Map.of(
                "gen_random_string", args -> {
                    Arguments.requireCount("gen_random_string", args, 1, 1);
                    var length = Arguments.intArg("gen_random_string", args, 0);
                    var builder = new StringBuilder(length);
                    for (int i = 0; i < length; i++) {
                        builder.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
                    }
                    return TextNode.valueOf(builder.toString());
                },
                "randint", args -> {
                    Arguments.requireCount("randint", args, 2, 2);
                    var lower = Arguments.intArg("randint", args, 0);
                    var upper = Arguments.intArg("randint", args, 1);
                    // bounds are inclusive
                    return IntNode.valueOf(lower + random.nextInt(upper - lower + 1));
                },
                "uuid4", args -> {
                    Arguments.requireCount("uuid4", args, 0, 0);
                    return TextNode.valueOf(UUID.randomUUID().toString());
                }
        );
    }
}
