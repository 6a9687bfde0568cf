package de.leidenheit.ate.core.execution.function;

import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

public class TimeFunctions implements FunctionModule {

    private final Clock clock;

    public TimeFunctions() {
        this(Clock.systemUTC());
    }

    public TimeFunctions(final Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "time";
    }

    @Override
    public Map<String, AteFunction> getFunctions() {
        return Map.of(
                "timestamp", args -> {
                    Arguments.requireCount("timestamp", args, 0, 0);
                    return LongNode.valueOf(clock.instant().getEpochSecond());
                },
                "timestamp_millis", args -> {
                    Arguments.requireCount("timestamp_millis", args, 0, 0);
                    return LongNode.valueOf(clock.millis());
                },
                "iso_now", args -> {
                    Arguments.requireCount("iso_now", args, 0, 0);
                    return TextNode.valueOf(Instant.now(clock).toString());
                }
        );
    }
}
