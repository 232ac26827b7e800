package com.arenasync.versioning;

public record SyncResult(String contentPath, String version) {
    private static final SyncResult EMPTY = new SyncResult("", "");

    public SyncResult {
        contentPath = contentPath == null ? "" : contentPath;
        version = version == null ? "" : version;
    }

    public static SyncResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return version.isEmpty();
    }
}
