package com.example.permissionscanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A user or group as returned by the content and directory backends.
 */
public record Principal(
        String id,
        PrincipalKind kind,
        String loginName,
        String displayName,
        String email
) {
    public static Principal user(String id, String loginName, String displayName, String email) {
        return new Principal(id, PrincipalKind.USER, loginName, displayName, email);
    }

    public static Principal containerGroup(String id, String title) {
        return new Principal(id, PrincipalKind.CONTAINER_GROUP, title, title, null);
    }

    public static Principal directoryGroup(String id, String loginName, String displayName) {
        return new Principal(id, PrincipalKind.DIRECTORY_GROUP, loginName, displayName, null);
    }

    @JsonIgnore
    public boolean isGroup() {
        return kind != PrincipalKind.USER;
    }
}
