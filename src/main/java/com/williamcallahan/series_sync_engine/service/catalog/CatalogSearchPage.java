package com.williamcallahan.series_sync_engine.service.catalog;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One page of catalog search results.
 *
 * @param results raw catalog entries in upstream relevance order
 * @param rateLimited upstream answered 429
 * @param failed request failed for any other reason
 */
public record CatalogSearchPage(List<JsonNode> results, boolean rateLimited, boolean failed) {

    public CatalogSearchPage {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static CatalogSearchPage of(List<JsonNode> results) {
        return new CatalogSearchPage(results, false, false);
    }

    public static CatalogSearchPage rateLimitedPage() {
        return new CatalogSearchPage(List.of(), true, false);
    }

    public static CatalogSearchPage failedPage() {
        return new CatalogSearchPage(List.of(), false, true);
    }

    /**
     * @return true when paging should stop before reading results
     */
    public boolean isTerminal() {
        return rateLimited || failed;
    }
}
