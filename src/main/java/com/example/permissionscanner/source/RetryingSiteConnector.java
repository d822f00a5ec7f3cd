package com.example.permissionscanner.source;

import com.example.permissionscanner.model.ContainerDescriptor;
import com.example.permissionscanner.model.ContentNode;
import com.example.permissionscanner.model.FolderLocation;
import com.example.permissionscanner.model.ListItem;
import com.example.permissionscanner.model.Principal;
import com.example.permissionscanner.model.RoleAssignment;
import com.example.permissionscanner.model.SiteGroup;

import java.util.List;
import java.util.Optional;

/**
 * Wraps every call of a connector and its sessions in a {@link RetryPolicy}.
 */
public final class RetryingSiteConnector implements SiteConnector {
    private final SiteConnector delegate;
    private final RetryPolicy policy;

    public RetryingSiteConnector(SiteConnector delegate, RetryPolicy policy) {
        this.delegate = delegate;
        this.policy = policy;
    }

    @Override
    public SiteSession connect(String webUrl) throws SourceException {
        SiteSession session = policy.execute("connect " + webUrl, () -> delegate.connect(webUrl));
        return new RetryingSiteSession(session);
    }

    private final class RetryingSiteSession implements SiteSession {
        private final SiteSession session;

        private RetryingSiteSession(SiteSession session) {
            this.session = session;
        }

        @Override
        public String webUrl() {
            return session.webUrl();
        }

        @Override
        public ContentNode web() throws SourceException {
            return policy.execute("web " + webUrl(), session::web);
        }

        @Override
        public Optional<FolderLocation> findFolder(String serverRelativePath) throws SourceException {
            return policy.execute("findFolder " + serverRelativePath, () -> session.findFolder(serverRelativePath));
        }

        @Override
        public List<ContainerDescriptor> listContainers() throws SourceException {
            return policy.execute("listContainers " + webUrl(), session::listContainers);
        }

        @Override
        public List<ContentNode> listSubsites() throws SourceException {
            return policy.execute("listSubsites " + webUrl(), session::listSubsites);
        }

        @Override
        public List<ListItem> listItems(String containerId, String folderPath, long afterId, int pageSize) throws SourceException {
            return policy.execute("listItems " + containerId + " after " + afterId,
                    () -> session.listItems(containerId, folderPath, afterId, pageSize));
        }

        @Override
        public List<RoleAssignment> getRoleAssignments(SecurableRef securable) throws SourceException {
            return policy.execute("getRoleAssignments " + securable, () -> session.getRoleAssignments(securable));
        }

        @Override
        public List<SiteGroup> listSiteGroups() throws SourceException {
            return policy.execute("listSiteGroups " + webUrl(), session::listSiteGroups);
        }

        @Override
        public List<Principal> getGroupMembers(String groupId) throws SourceException {
            return policy.execute("getGroupMembers " + groupId, () -> session.getGroupMembers(groupId));
        }

        @Override
        public void close() {
            session.close();
        }
    }
}
