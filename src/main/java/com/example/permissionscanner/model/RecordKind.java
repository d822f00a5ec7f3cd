package com.example.permissionscanner.model;

/**
 * Output record kinds. The prefix names the batch files of the JSON sink.
 */
public enum RecordKind {
    CONTAINERS("containers_"),
    PERMISSION_GROUPS("permission_groups_"),
    CONTAINER_ACCESS("container_access_"),
    BROKEN_ITEMS("broken_items_"),
    ITEM_ACCESS("item_access_"),
    TARGET_SUMMARY("target_summary_"),
    FAILURES("failures_");

    private final String filePrefix;

    RecordKind(String filePrefix) {
        this.filePrefix = filePrefix;
    }

    public String filePrefix() {
        return filePrefix;
    }
}
