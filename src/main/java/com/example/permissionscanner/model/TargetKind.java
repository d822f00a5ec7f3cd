package com.example.permissionscanner.model;

/**
 * What an input reference turned out to denote after classification.
 */
public enum TargetKind {
    SITE,
    SUBSITE,
    LIBRARY,
    FOLDER,
    ERROR
}
