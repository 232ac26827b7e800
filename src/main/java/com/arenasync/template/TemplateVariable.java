package com.arenasync.template;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TemplateVariable(
        String name,
        VariableType type,
        String description,
        boolean required,
        @JsonProperty("default") String defaultValue,
        String pattern,
        List<String> options,
        String min,
        String max) {
    public TemplateVariable {
        type = type == null ? VariableType.STRING : type;
        options = options == null ? List.of() : List.copyOf(options);
    }
}
