package com.example.permissionscanner.model;

/**
 * Site contents listing row. Type is one of LIST, LIBRARY, SITEPAGES or SUBSITE.
 */
public record ContainerRow(
        String id,
        String type,
        String title,
        String url
) {
}
