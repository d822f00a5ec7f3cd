package com.example.permissionscanner.model;

public enum NodeKind {
    WEB,
    LIST,
    FOLDER,
    ITEM
}
