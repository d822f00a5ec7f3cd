package com.example.permissionscanner;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Splits a reference URL into its site collection root and the path below it.
 * The root is {@code scheme://host} followed by {@code /sites/<name>} or {@code /teams/<name>} when present.
 *
 * @param rootUrl      absolute URL of the site collection root, without trailing slash
 * @param rootPath     server-relative path of the root ("/" for the host root)
 * @param relativePath decoded path below the root without leading or trailing slash, empty if none
 */
record SiteAddress(String rootUrl, String rootPath, String relativePath) {

    static SiteAddress parse(String reference) {
        URI uri;
        try {
            uri = new URI(reference.trim());
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Not a valid URL: " + reference, ex);
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            throw new IllegalArgumentException("Not an absolute URL: " + reference);
        }
        String path = uri.getPath() == null ? "" : uri.getPath();
        String[] segments = path.replaceAll("^/+|/+$", "").split("/+");
        int rootSegments = 0;
        if (segments.length >= 2 && ("sites".equalsIgnoreCase(segments[0]) || "teams".equalsIgnoreCase(segments[0]))) {
            rootSegments = 2;
        }
        StringBuilder root = new StringBuilder();
        for (int i = 0; i < rootSegments; i++) {
            root.append('/').append(segments[i]);
        }
        StringBuilder relative = new StringBuilder();
        for (int i = rootSegments; i < segments.length; i++) {
            if (segments[i].isEmpty()) {
                continue;
            }
            if (relative.length() > 0) {
                relative.append('/');
            }
            relative.append(segments[i]);
        }
        String rootPath = root.length() == 0 ? "/" : root.toString();
        String origin = uri.getScheme() + "://" + uri.getRawAuthority();
        return new SiteAddress(origin + (root.length() == 0 ? "" : encodePath(root.toString())), rootPath, relative.toString());
    }

    boolean isRoot() {
        return relativePath.isEmpty();
    }

    /**
     * Server-relative path of the full reference.
     */
    String serverRelativePath() {
        if (isRoot()) {
            return rootPath;
        }
        return ("/".equals(rootPath) ? "" : rootPath) + "/" + relativePath;
    }

    /**
     * Absolute URL of the full reference.
     */
    String fullUrl() {
        if (isRoot()) {
            return rootUrl;
        }
        return rootUrl + encodePath("/" + relativePath);
    }

    private static String encodePath(String path) {
        try {
            return new URI(null, null, path, null).getRawPath();
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Cannot encode path " + path, ex);
        }
    }
}
