package de.leidenheit.ate.core.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ValidationResult {
    private final boolean success;
    private final List<DiffRecord> diffContent;
}
