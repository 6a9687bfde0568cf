package de.leidenheit.ate.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Data;

/**
 * A fully resolved request. {@code options} holds every key besides url and method, unchanged.
 */
@Data
@Builder
public class ResolvedRequest {
    private final String url;
    private final String method;
    private final ObjectNode options;
}
