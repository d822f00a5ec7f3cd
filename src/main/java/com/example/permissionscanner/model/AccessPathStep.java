package com.example.permissionscanner.model;

public record AccessPathStep(
        String groupId,
        GroupKind groupKind,
        String groupTitle
) {
}
