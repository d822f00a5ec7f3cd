package com.example.permissionscanner;

/**
 * Per-target lifecycle. {@link #ERROR} ends the target, never the run.
 */
public enum ScanPhase {
    INIT,
    CLASSIFYING,
    CONNECTED,
    ENUMERATING,
    FLUSHING,
    DONE,
    ERROR
}
