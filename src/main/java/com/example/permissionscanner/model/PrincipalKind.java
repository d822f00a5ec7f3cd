package com.example.permissionscanner.model;

public enum PrincipalKind {
    USER,
    CONTAINER_GROUP,
    DIRECTORY_GROUP
}
