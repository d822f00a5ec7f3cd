package com.example.permissionscanner.model;

public record SiteGroup(
        String id,
        String title,
        String ownerTitle
) {
}
