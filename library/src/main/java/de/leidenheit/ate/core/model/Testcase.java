package de.leidenheit.ate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Testcase implements BindingScope {
    private String name;
    private List<String> requires;
    @JsonProperty("function_binds")
    private Map<String, String> functionBinds;
    @JsonProperty("variable_binds")
    private List<Map<String, JsonNode>> variableBinds;
    private ObjectNode request;
    @JsonProperty("extract_binds")
    private Map<String, String> extractBinds;
    private List<ValidatorSpec> validators;
}
