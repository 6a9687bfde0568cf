package de.leidenheit.ate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class DiffRecord {
    private ValidatorSpec validator;
    private JsonNode expected;
    private JsonNode actual;
    private boolean passed;
}
