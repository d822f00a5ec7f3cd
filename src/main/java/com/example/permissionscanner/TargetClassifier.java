package com.example.permissionscanner;

import com.example.permissionscanner.model.FolderLocation;
import com.example.permissionscanner.model.ScanTarget;
import com.example.permissionscanner.model.TargetKind;
import com.example.permissionscanner.source.SiteConnector;
import com.example.permissionscanner.source.SiteSession;
import com.example.permissionscanner.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides whether a reference denotes a site, a subsite, a library or a folder by probing the backend in a
 * fixed order. A reference that matches no lookup is classified {@link TargetKind#ERROR}; nothing is thrown.
 */
public final class TargetClassifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(TargetClassifier.class);

    private final SiteConnector connector;

    public TargetClassifier(SiteConnector connector) {
        this.connector = connector;
    }

    public ScanTarget classify(String reference, int sequenceNumber) {
        SiteAddress address;
        try {
            address = SiteAddress.parse(reference);
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Target {} '{}' is not a usable URL: {}", sequenceNumber, reference, ex.getMessage());
            return ScanTarget.error(reference, sequenceNumber);
        }
        if (address.isRoot()) {
            return new ScanTarget(reference, TargetKind.SITE, sequenceNumber, address.rootUrl(), null, null);
        }

        try (SiteSession root = connector.connect(address.rootUrl())) {
            Optional<FolderLocation> folder = lookupFolder(root, address.serverRelativePath());
            if (folder.isPresent()) {
                FolderLocation location = folder.get();
                if (samePath(location.parentPath(), address.rootPath())) {
                    return new ScanTarget(reference, TargetKind.LIBRARY, sequenceNumber, address.rootUrl(), location.containerId(), null);
                }
                return new ScanTarget(reference, TargetKind.FOLDER, sequenceNumber, address.rootUrl(), location.containerId(), location.path());
            }
        } catch (SourceException ex) {
            LOGGER.error("Target {} '{}': site root {} is unreachable: {}", sequenceNumber, reference, address.rootUrl(), ex.getMessage());
            return ScanTarget.error(reference, sequenceNumber);
        }

        try (SiteSession subsite = connector.connect(address.fullUrl())) {
            return new ScanTarget(reference, TargetKind.SUBSITE, sequenceNumber, subsite.webUrl(), null, null);
        } catch (SourceException ex) {
            LOGGER.debug("Subsite lookup for '{}' failed: {}", reference, ex.getMessage());
        }
        LOGGER.error("Target {} '{}' is neither a library, a folder nor a subsite", sequenceNumber, reference);
        return ScanTarget.error(reference, sequenceNumber);
    }

    private Optional<FolderLocation> lookupFolder(SiteSession root, String serverRelativePath) {
        try {
            return root.findFolder(serverRelativePath);
        } catch (SourceException ex) {
            LOGGER.debug("Folder lookup for '{}' failed: {}", serverRelativePath, ex.getMessage());
            return Optional.empty();
        }
    }

    private static boolean samePath(String left, String right) {
        return trimSlash(left).equalsIgnoreCase(trimSlash(right));
    }

    private static String trimSlash(String path) {
        return path == null ? "" : path.replaceAll("/+$", "");
    }
}
