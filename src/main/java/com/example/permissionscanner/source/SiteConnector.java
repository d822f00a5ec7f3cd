package com.example.permissionscanner.source;

@FunctionalInterface
public interface SiteConnector {
    /**
     * Opens a session on the web at {@code webUrl}, failing if no such web exists.
     */
    SiteSession connect(String webUrl) throws SourceException;
}
