package com.example.permissionscanner.source;

import com.example.permissionscanner.model.Principal;

import java.util.List;

public final class RetryingDirectorySource implements DirectorySource {
    private final DirectorySource delegate;
    private final RetryPolicy policy;

    public RetryingDirectorySource(DirectorySource delegate, RetryPolicy policy) {
        this.delegate = delegate;
        this.policy = policy;
    }

    @Override
    public List<Principal> getGroupMembers(String groupId) throws SourceException {
        return policy.execute("directory members " + groupId, () -> delegate.getGroupMembers(groupId));
    }
}
