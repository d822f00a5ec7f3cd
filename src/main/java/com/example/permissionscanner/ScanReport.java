package com.example.permissionscanner;

import java.util.List;

public record ScanReport(List<TargetOutcome> outcomes, boolean cancelled) {
    public ScanReport {
        outcomes = List.copyOf(outcomes);
    }

    public long failedTargets() {
        return outcomes.stream().filter(TargetOutcome::isFailed).count();
    }

    public long itemsScanned() {
        return outcomes.stream().mapToLong(outcome -> outcome.progress().itemsScanned()).sum();
    }

    public long brokenPermissionCount() {
        return outcomes.stream().mapToLong(outcome -> outcome.progress().brokenPermissionCount()).sum();
    }

    public long externalUsersFound() {
        return outcomes.stream().mapToLong(outcome -> outcome.progress().externalUsersFound()).sum();
    }

    public long itemsSharedWithEveryone() {
        return outcomes.stream().mapToLong(outcome -> outcome.progress().itemsSharedWithEveryone()).sum();
    }
}
