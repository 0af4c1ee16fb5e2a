package com.framesmith.core.model;

import java.io.Serializable;

/**
 * A single route of the navigation map.
 *
 * @param slug       deterministic url slug, unique within the map
 * @param path       route path, {@code "/" + slug}
 * @param screenId   screen the route points at
 * @param screenName screen display name
 * @param ordinal    screen ordinal
 * @param entryFile  primary generated file of the screen, may be null when none was produced
 */
public record RouteEntry(
    String slug,
    String path,
    String screenId,
    String screenName,
    int ordinal,
    String entryFile
) implements Serializable {

    public RouteEntry withEntryFile(String newEntryFile) {
        return new RouteEntry(slug, path, screenId, screenName, ordinal, newEntryFile);
    }
}
