package de.leidenheit.ate.infrastructure.io;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TestsetReadOptions {

    private final boolean allowEmptyTestsets;

    public static TestsetReadOptions ofDefault() {
        return TestsetReadOptions.builder().build();
    }
}
