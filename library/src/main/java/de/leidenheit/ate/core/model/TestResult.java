package de.leidenheit.ate.core.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of a single testcase: success flag and the diff records of failed validators.
 */
@Data
@Builder
public class TestResult {
    private final String name;
    private final boolean success;
    private final List<DiffRecord> diffContent;
}
