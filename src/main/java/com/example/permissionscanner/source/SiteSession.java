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
 * Read-only view of one connected web. Implementations own transport, authentication and throttling;
 * every method returns plain data.
 */
public interface SiteSession extends AutoCloseable {
    /**
     * Absolute URL of the connected web.
     */
    String webUrl();

    /**
     * The web as a {@link com.example.permissionscanner.model.NodeKind#WEB} node whose path is its absolute URL.
     */
    ContentNode web() throws SourceException;

    /**
     * Resolves a server-relative path to a folder of one of the web's containers.
     * Returns empty when the path does not denote a folder.
     */
    Optional<FolderLocation> findFolder(String serverRelativePath) throws SourceException;

    List<ContainerDescriptor> listContainers() throws SourceException;

    /**
     * Direct child webs as WEB nodes.
     */
    List<ContentNode> listSubsites() throws SourceException;

    /**
     * Returns up to {@code pageSize} items with an id strictly greater than {@code afterId}, ordered by id.
     *
     * @param folderPath restricts the listing to items below this server-relative folder, or null for the whole container
     */
    List<ListItem> listItems(String containerId, String folderPath, long afterId, int pageSize) throws SourceException;

    List<RoleAssignment> getRoleAssignments(SecurableRef securable) throws SourceException;

    List<SiteGroup> listSiteGroups() throws SourceException;

    /**
     * Direct members of a container-scoped group.
     */
    List<Principal> getGroupMembers(String groupId) throws SourceException;

    @Override
    default void close() {
        // no-op
    }
}
