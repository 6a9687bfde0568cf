package de.leidenheit.ate.infrastructure.io;

import de.leidenheit.ate.core.exception.TestsetReadException;
import de.leidenheit.ate.core.model.Testset;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestsetReadResult {
    private boolean invalid;
    @Builder.Default
    private List<String> messages = new ArrayList<>();
    @Builder.Default
    private List<Testset> testsets = new ArrayList<>();

    public static TestsetReadResult ofError(final String errorMessage) {
        return TestsetReadResult.builder()
                .messages(Collections.singletonList(errorMessage))
                .testsets(Collections.emptyList())
                .invalid(true)
                .build();
    }

    public List<Testset> getTestsetsOrThrow() {
        if (invalid) throw new TestsetReadException("Testsets are invalid: %s".formatted(messages));
        return testsets;
    }
}
