package de.leidenheit.ate.infrastructure.http;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TransportOptions {

    private final boolean relaxedHttpsValidation;
    private final boolean logRequests;
    private final boolean logResponses;

    public static TransportOptions ofDefault() {
        return TransportOptions.builder().build();
    }
}
