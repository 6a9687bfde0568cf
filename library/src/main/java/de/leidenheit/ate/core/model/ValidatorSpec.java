package de.leidenheit.ate.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A declared comparison between a response field and an expected value, e.g.
 * {@code {check: status_code, comparator: eq, expect: 200}}.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidatorSpec {
    public static final String DEFAULT_COMPARATOR = "eq";

    private String check;
    @Builder.Default
    private String comparator = DEFAULT_COMPARATOR;
    @JsonAlias("expected")
    private JsonNode expect;
}
