package com.example.permissionscanner;

import com.example.permissionscanner.model.Principal;
import com.example.permissionscanner.model.RoleAssignment;
import com.example.permissionscanner.source.TenantSnapshot;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Small builders for in-memory tenants and configurations.
 */
public final class Fixtures {
    public static final String SITE = "https://contoso.sharepoint.com/sites/hr";
    public static final String SITE_PATH = "/sites/hr";
    public static final String DOCS_PATH = SITE_PATH + "/Shared Documents";

    private Fixtures() {
    }

    /**
     * Configuration for a scan of {@link #SITE}; each setting is a raw JSON member such as {@code "pageSize": 10}.
     */
    public static ScannerConfig config(Path output, String... settings) throws IOException {
        StringBuilder json = new StringBuilder("{\"targets\": [\"" + SITE + "\"], \"outputDirectory\": \"" + output + "\"");
        for (String setting : settings) {
            json.append(", ").append(setting);
        }
        return new ConfigLoader().parse(json.append('}').toString());
    }

    public static Principal user(String name) {
        return Principal.user("u-" + name, "i:0#.f|membership|" + name + "@contoso.com", name, name + "@contoso.com");
    }

    public static RoleAssignment assign(Principal principal, String... levels) {
        return new RoleAssignment(principal, Arrays.asList(levels));
    }

    public static TenantSnapshot.Group siteGroup(String id, String title, Principal... members) {
        return new TenantSnapshot.Group(id, title, title, List.of(members));
    }

    public static TenantSnapshot.DirectoryGroup directoryGroup(String id, Principal... members) {
        return new TenantSnapshot.DirectoryGroup(id, List.of(members));
    }

    public static TenantSnapshot.Item item(long id, boolean unique, RoleAssignment... assignments) {
        return new TenantSnapshot.Item(id, "Doc " + id + ".docx", DOCS_PATH + "/Doc " + id + ".docx", false, unique, List.of(assignments));
    }

    public static TenantSnapshot.Item folder(long id, String name) {
        return new TenantSnapshot.Item(id, name, DOCS_PATH + "/" + name, true, false, List.of());
    }

    public static TenantSnapshot.Item itemIn(long id, String folder, boolean unique, RoleAssignment... assignments) {
        String path = DOCS_PATH + "/" + folder + "/Doc " + id + ".docx";
        return new TenantSnapshot.Item(id, "Doc " + id + ".docx", path, false, unique, List.of(assignments));
    }

    public static List<TenantSnapshot.Item> items(int count) {
        List<TenantSnapshot.Item> items = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            items.add(item(i, false));
        }
        return items;
    }

    public static TenantSnapshot.Container documents(List<TenantSnapshot.Item> items) {
        return new TenantSnapshot.Container("docs", "Documents", DOCS_PATH, 101, false, false, List.of(), items);
    }

    public static TenantSnapshot.Web site(List<RoleAssignment> assignments,
                                          List<TenantSnapshot.Group> groups,
                                          List<TenantSnapshot.Container> containers) {
        return new TenantSnapshot.Web(SITE, "web-hr", "Human Resources", true, assignments, groups, containers);
    }

    public static TenantSnapshot tenant(TenantSnapshot.Web... webs) {
        return new TenantSnapshot(List.of(webs), List.of());
    }
}
