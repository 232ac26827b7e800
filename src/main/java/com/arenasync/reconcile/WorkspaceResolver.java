package com.arenasync.reconcile;

import java.util.Map;

/**
 * Maps a namespace to the workspace directory its content is stored under. Unmapped namespaces
 * use their own name.
 */
public class WorkspaceResolver {
    private final Map<String, String> workspacesByNamespace;

    public WorkspaceResolver(Map<String, String> workspacesByNamespace) {
        this.workspacesByNamespace = workspacesByNamespace == null ? Map.of() : Map.copyOf(workspacesByNamespace);
    }

    public String resolve(String namespace) {
        String workspace = workspacesByNamespace.get(namespace);
        return workspace == null || workspace.isBlank() ? namespace : workspace.strip();
    }
}
