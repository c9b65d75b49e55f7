package com.largomodo.gamemeta.core.domain;

import java.nio.file.Path;

/**
 * One platform's metadata file found under a resource root.
 *
 * @param key          platform key (slug of the directory name)
 * @param displayName  directory name as found on disk
 * @param metadataFile path of the metadata file
 */
public record DiscoveredCollection(String key, String displayName, Path metadataFile) {

    public DiscoveredCollection {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        if (metadataFile == null) {
            throw new IllegalArgumentException("metadataFile must not be null");
        }
        displayName = displayName == null ? key : displayName;
    }
}
