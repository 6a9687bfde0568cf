package de.leidenheit.ate.core.execution.function;

import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.io.BaseEncoding;

import java.nio.charset.StandardCharsets;
import java.util.Map;

public class EncodingFunctions implements FunctionModule {

    @Override
    public String getName() {
        return "base64";
    }

    @Override
    public Map<String, AteFunction> getFunctions() {
        return Map.of(
                "b64encode", args -> {
                    Arguments.requireCount("b64encode", args, 1, 1);
                    var raw = Arguments.text(args.get(0)).getBytes(StandardCharsets.UTF_8);
                    return TextNode.valueOf(BaseEncoding.base64().encode(raw));
                },
                "b64decode", args -> {
                    Arguments.requireCount("b64decode", args, 1, 1);
                    var decoded = BaseEncoding.base64().decode(Arguments.text(args.get(0)));
                    return TextNode.valueOf(new String(decoded, StandardCharsets.UTF_8));
                }
        );
    }
}
