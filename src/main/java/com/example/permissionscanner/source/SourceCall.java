package com.example.permissionscanner.source;

@FunctionalInterface
public interface SourceCall<T> {
    T call() throws SourceException;
}
