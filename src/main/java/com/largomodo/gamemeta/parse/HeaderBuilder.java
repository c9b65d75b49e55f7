package com.largomodo.gamemeta.parse;

import com.largomodo.gamemeta.core.domain.Header;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mutable accumulator for the header lines seen before the first game.
 */
class HeaderBuilder {

    private final List<String> ignoreFiles = new ArrayList<>();
    private final List<String> extensions = new ArrayList<>();
    private String collection = "";
    private String defaultSortKey;
    private String launchBlock;

    void collection(String collection) {
        this.collection = collection;
    }

    void defaultSortKey(String sortKey) {
        this.defaultSortKey = sortKey;
    }

    void launchBlock(String launchBlock) {
        this.launchBlock = launchBlock;
    }

    void addIgnoreFile(String pattern) {
        ignoreFiles.add(pattern);
    }

    void addExtension(String extension) {
        extensions.add(extension);
    }

    Header build() {
        return new Header(collection,
                Optional.ofNullable(defaultSortKey),
                Optional.ofNullable(launchBlock),
                ignoreFiles,
                extensions);
    }
}
