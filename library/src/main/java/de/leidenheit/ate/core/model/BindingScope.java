package de.leidenheit.ate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Binding declarations shared by testset configs and testcases.
 */
public interface BindingScope {

    String getName();

    List<String> getRequires();

    Map<String, String> getFunctionBinds();

    List<Map<String, JsonNode>> getVariableBinds();

    ObjectNode getRequest();
}
