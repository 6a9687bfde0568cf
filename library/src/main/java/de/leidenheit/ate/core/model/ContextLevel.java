package de.leidenheit.ate.core.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ContextLevel {
    TESTSET("testset"),
    TESTCASE("testcase");

    private final String value;
}
