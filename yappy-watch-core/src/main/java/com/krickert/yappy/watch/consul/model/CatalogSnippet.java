package com.krickert.yappy.watch.consul.model;

import java.util.List;

/**
 * A service name and the union of its tags, as returned by a catalog services listing.
 */
public record CatalogSnippet(String name, List<String> tags) {

    public CatalogSnippet {
        tags = Tags.sortedCopy(tags);
    }
}
