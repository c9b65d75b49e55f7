package com.largomodo.gamemeta.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Header reduced to its comparable form.
 */
public record NormalizedHeader(String collection,
                               Optional<String> defaultSortKey,
                               Optional<String> launchBlock,
                               List<String> ignoreFiles,
                               List<String> extensions) {

    public NormalizedHeader {
        ignoreFiles = List.copyOf(ignoreFiles);
        extensions = List.copyOf(extensions);
    }

    /**
     * Field-by-field differences, one readable line per differing field.
     *
     * @param other header to compare against
     * @return empty when both headers are equal
     */
    public List<String> differences(NormalizedHeader other) {
        List<String> diff = new ArrayList<>();
        compare(diff, "collection", collection, other.collection);
        compare(diff, "sort-by", defaultSortKey, other.defaultSortKey);
        compare(diff, "launch", launchBlock, other.launchBlock);
        compare(diff, "ignore-files", ignoreFiles, other.ignoreFiles);
        compare(diff, "extension", extensions, other.extensions);
        return diff;
    }

    private static void compare(List<String> diff, String field, Object left, Object right) {
        if (!Objects.equals(left, right)) {
            diff.add(field + ": " + left + " != " + right);
        }
    }
}
