package com.example.permissionscanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One classified input reference.
 *
 * @param url            the reference as given
 * @param kind           classification result
 * @param sequenceNumber zero-based position in the input list
 * @param webUrl         web to connect to when walking the target, null for {@link TargetKind#ERROR}
 * @param containerId    library/list id for {@link TargetKind#LIBRARY} and {@link TargetKind#FOLDER}
 * @param folderPath     server-relative folder path for {@link TargetKind#FOLDER}
 */
public record ScanTarget(
        String url,
        TargetKind kind,
        int sequenceNumber,
        String webUrl,
        String containerId,
        String folderPath
) {
    public static ScanTarget error(String url, int sequenceNumber) {
        return new ScanTarget(url, TargetKind.ERROR, sequenceNumber, null, null, null);
    }

    @JsonIgnore
    public boolean isWebTarget() {
        return kind == TargetKind.SITE || kind == TargetKind.SUBSITE;
    }
}
