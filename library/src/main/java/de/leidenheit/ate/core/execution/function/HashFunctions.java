package de.leidenheit.ate.core.execution.function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Hex digests of the concatenated arguments.
 */
public class HashFunctions implements FunctionModule {

    @Override
    public String getName() {
        return "hashlib";
    }

    @Override
    @SuppressWarnings("deprecation")
    public Map<String, AteFunction> getFunctions() {
        return Map.of(
                "md5", args -> digest(Hashing.md5(), args),
                "sha1", args -> digest(Hashing.sha1(), args),
                "sha256", args -> digest(Hashing.sha256(), args)
        );
    }

    private JsonNode digest(final HashFunction hashFunction, final List<JsonNode> args) {
        var joined = args.stream()
                .map(Arguments::text)
                .collect(Collectors.joining());
        return TextNode.valueOf(hashFunction.hashString(joined, StandardCharsets.UTF_8).toString());
    }
}
