package com.example.permissionscanner.source;

/**
 * Addresses a node whose role assignments can be read: the web itself, a container, or an item in a container.
 */
public record SecurableRef(String containerId, Long itemId) {
    private static final SecurableRef WEB = new SecurableRef(null, null);

    public static SecurableRef web() {
        return WEB;
    }

    public static SecurableRef container(String containerId) {
        return new SecurableRef(containerId, null);
    }

    public static SecurableRef item(String containerId, long itemId) {
        return new SecurableRef(containerId, itemId);
    }

    public boolean isWeb() {
        return containerId == null;
    }
}
