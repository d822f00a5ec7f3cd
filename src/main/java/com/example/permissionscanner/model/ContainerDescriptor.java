package com.example.permissionscanner.model;

/**
 * A list or library as returned by the container listing, with the attributes used to filter it.
 */
public record ContainerDescriptor(
        ContentNode node,
        int baseTemplate,
        boolean hidden
) {
    public static final int TEMPLATE_GENERIC_LIST = 100;
    public static final int TEMPLATE_DOCUMENT_LIBRARY = 101;
    public static final int TEMPLATE_SITE_PAGES = 119;

    public String typeLabel() {
        if (baseTemplate == TEMPLATE_GENERIC_LIST) {
            return "LIST";
        }
        if (baseTemplate == TEMPLATE_SITE_PAGES) {
            return "SITEPAGES";
        }
        return "LIBRARY";
    }
}
