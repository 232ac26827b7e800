package com.arenasync.template;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Template(
        String name,
        String version,
        String displayName,
        String description,
        String category,
        List<String> tags,
        List<TemplateVariable> variables,
        List<TemplateFileSpec> files,
        String path) {
    public Template {
        name = name == null ? "" : name;
        version = version == null ? "" : version;
        displayName = displayName == null ? "" : displayName;
        description = description == null ? "" : description;
        category = category == null ? "" : category;
        tags = tags == null ? List.of() : List.copyOf(tags);
        variables = variables == null ? List.of() : List.copyOf(variables);
        files = files == null ? List.of() : List.copyOf(files);
        path = path == null ? "" : path;
    }
}
