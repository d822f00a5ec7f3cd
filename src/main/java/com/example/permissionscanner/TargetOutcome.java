package com.example.permissionscanner;

import com.example.permissionscanner.model.Checkpoint;
import com.example.permissionscanner.model.ScanTarget;

/**
 * How one target ended.
 *
 * @param phase    {@link ScanPhase#DONE}, {@link ScanPhase#ERROR}, or the phase the scan was cancelled in
 * @param progress last recorded position and counters within the target
 * @param error    failure message, null unless the target failed
 */
public record TargetOutcome(ScanTarget target, ScanPhase phase, Checkpoint progress, String error) {
    public boolean isDone() {
        return phase == ScanPhase.DONE;
    }

    public boolean isFailed() {
        return phase == ScanPhase.ERROR;
    }
}
