package com.largomodo.gamemeta.core.domain;

import java.util.List;
import java.util.Optional;

/**
 * Collection-wide defaults shared by every game of one metadata file.
 * <p>
 * Absent list fields are represented as empty lists, never as null. The closure
 * normalization relies on this to treat "no extension line" and "empty extension block"
 * as the same collection.
 * </p>
 *
 * @param collection      display name of the collection (empty when the file declares none)
 * @param defaultSortKey  sort key applied to games without their own
 * @param launchBlock     default launch command template, possibly multi-line
 * @param ignoreFiles     ignore patterns in declaration order
 * @param extensions      lowercase file extensions without leading dot
 */
public record Header(String collection,
                     Optional<String> defaultSortKey,
                     Optional<String> launchBlock,
                     List<String> ignoreFiles,
                     List<String> extensions) {

    public Header {
        collection = collection == null ? "" : collection;
        defaultSortKey = defaultSortKey == null ? Optional.empty() : defaultSortKey;
        launchBlock = launchBlock == null ? Optional.empty() : launchBlock;
        ignoreFiles = ignoreFiles == null ? List.of() : List.copyOf(ignoreFiles);
        extensions = extensions == null ? List.of() : List.copyOf(extensions);
    }

    /**
     * Header of a file that declares nothing.
     */
    public static Header empty() {
        return new Header("", Optional.empty(), Optional.empty(), List.of(), List.of());
    }
}
