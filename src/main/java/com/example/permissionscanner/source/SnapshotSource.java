package com.example.permissionscanner.source;

import com.example.permissionscanner.model.ContainerDescriptor;
import com.example.permissionscanner.model.ContentNode;
import com.example.permissionscanner.model.FolderLocation;
import com.example.permissionscanner.model.ListItem;
import com.example.permissionscanner.model.NodeKind;
import com.example.permissionscanner.model.Principal;
import com.example.permissionscanner.model.RoleAssignment;
import com.example.permissionscanner.model.SiteGroup;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves a {@link TenantSnapshot} through the backend interfaces, so that an exported tenant can be scanned offline.
 * Counts page reads and membership fetches for diagnostics.
 */
public final class SnapshotSource implements SiteConnector, DirectorySource {
    private final Map<String, TenantSnapshot.Web> websByUrl = new LinkedHashMap<>();
    private final Map<String, TenantSnapshot.DirectoryGroup> directoryGroups = new LinkedHashMap<>();
    private final AtomicInteger pageReads = new AtomicInteger();
    private final Map<String, AtomicInteger> membershipFetches = new ConcurrentHashMap<>();

    public SnapshotSource(TenantSnapshot snapshot) {
        for (TenantSnapshot.Web web : snapshot.webs()) {
            websByUrl.put(normalizeUrl(web.url()), web);
        }
        for (TenantSnapshot.DirectoryGroup group : snapshot.directoryGroups()) {
            directoryGroups.put(group.id(), group);
        }
    }

    public static SnapshotSource load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return new SnapshotSource(mapper.readValue(path.toFile(), TenantSnapshot.class));
    }

    @Override
    public SiteSession connect(String webUrl) throws SourceException {
        TenantSnapshot.Web web = websByUrl.get(normalizeUrl(webUrl));
        if (web == null) {
            throw new SourceException("No web at " + webUrl);
        }
        return new Session(web);
    }

    @Override
    public List<Principal> getGroupMembers(String groupId) throws SourceException {
        countFetch(groupId);
        TenantSnapshot.DirectoryGroup group = directoryGroups.get(groupId);
        if (group == null) {
            throw new SourceException("Unknown directory group " + groupId);
        }
        return group.members();
    }

    public int pageReads() {
        return pageReads.get();
    }

    public int membershipFetches(String groupId) {
        AtomicInteger count = membershipFetches.get(groupId);
        return count == null ? 0 : count.get();
    }

    private void countFetch(String groupId) {
        membershipFetches.computeIfAbsent(groupId, ignored -> new AtomicInteger()).incrementAndGet();
    }

    static String normalizeUrl(String url) {
        return url == null ? "" : url.replaceAll("/+$", "");
    }

    private static String serverRelative(String url) {
        String path = URI.create(url).getPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    private static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash <= 0 ? "/" : path.substring(0, slash);
    }

    private final class Session implements SiteSession {
        private final TenantSnapshot.Web web;
        private final String url;

        private Session(TenantSnapshot.Web web) {
            this.web = web;
            this.url = normalizeUrl(web.url());
        }

        @Override
        public String webUrl() {
            return url;
        }

        @Override
        public ContentNode web() {
            return new ContentNode(web.id(), NodeKind.WEB, web.title(), url, web.hasUniquePermissions());
        }

        @Override
        public Optional<FolderLocation> findFolder(String serverRelativePath) {
            String wanted = normalizeUrl(serverRelativePath);
            for (TenantSnapshot.Container container : web.containers()) {
                if (wanted.equals(normalizeUrl(container.path()))) {
                    return Optional.of(new FolderLocation(container.id(), wanted, serverRelative(url)));
                }
                for (TenantSnapshot.Item item : container.items()) {
                    if (item.folder() && wanted.equals(normalizeUrl(item.path()))) {
                        return Optional.of(new FolderLocation(container.id(), wanted, parentOf(wanted)));
                    }
                }
            }
            return Optional.empty();
        }

        @Override
        public List<ContainerDescriptor> listContainers() {
            return web.containers().stream()
                    .map(container -> new ContainerDescriptor(
                            new ContentNode(container.id(), NodeKind.LIST, container.title(), container.path(), container.hasUniquePermissions()),
                            container.baseTemplate(),
                            container.hidden()))
                    .toList();
        }

        @Override
        public List<ContentNode> listSubsites() {
            String prefix = url + "/";
            return websByUrl.entrySet().stream()
                    .filter(entry -> entry.getKey().startsWith(prefix))
                    .filter(entry -> entry.getKey().indexOf('/', prefix.length()) < 0)
                    .map(Map.Entry::getValue)
                    .map(sub -> new ContentNode(sub.id(), NodeKind.WEB, sub.title(), normalizeUrl(sub.url()), sub.hasUniquePermissions()))
                    .toList();
        }

        @Override
        public List<ListItem> listItems(String containerId, String folderPath, long afterId, int pageSize) throws SourceException {
            pageReads.incrementAndGet();
            String scope = folderPath == null ? null : normalizeUrl(folderPath) + "/";
            return container(containerId).items().stream()
                    .filter(item -> item.id() > afterId)
                    .filter(item -> scope == null || item.path().startsWith(scope))
                    .sorted(Comparator.comparingLong(TenantSnapshot.Item::id))
                    .limit(pageSize)
                    .map(item -> new ListItem(item.id(), item.title(), item.path(), item.folder(), item.hasUniquePermissions()))
                    .toList();
        }

        @Override
        public List<RoleAssignment> getRoleAssignments(SecurableRef securable) throws SourceException {
            if (securable.isWeb()) {
                return web.roleAssignments();
            }
            TenantSnapshot.Container container = container(securable.containerId());
            if (securable.itemId() == null) {
                return container.roleAssignments();
            }
            return container.items().stream()
                    .filter(item -> item.id() == securable.itemId())
                    .findFirst()
                    .map(TenantSnapshot.Item::roleAssignments)
                    .orElseThrow(() -> new SourceException("Unknown item " + securable.itemId() + " in " + securable.containerId()));
        }

        @Override
        public List<SiteGroup> listSiteGroups() {
            return web.siteGroups().stream()
                    .map(group -> new SiteGroup(group.id(), group.title(), group.ownerTitle()))
                    .toList();
        }

        @Override
        public List<Principal> getGroupMembers(String groupId) throws SourceException {
            countFetch(groupId);
            // Site groups are shared across a site collection, so look in ancestor webs as well.
            for (Map.Entry<String, TenantSnapshot.Web> entry : websByUrl.entrySet()) {
                if (!url.equals(entry.getKey()) && !url.startsWith(entry.getKey() + "/")) {
                    continue;
                }
                for (TenantSnapshot.Group group : entry.getValue().siteGroups()) {
                    if (group.id().equals(groupId)) {
                        return group.members();
                    }
                }
            }
            throw new SourceException("Unknown site group " + groupId + " in " + url);
        }

        private TenantSnapshot.Container container(String containerId) throws SourceException {
            for (TenantSnapshot.Container container : web.containers()) {
                if (container.id().equals(containerId)) {
                    return container;
                }
            }
            throw new SourceException("Unknown container " + containerId + " in " + url);
        }
    }
}
