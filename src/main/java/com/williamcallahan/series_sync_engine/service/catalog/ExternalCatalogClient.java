package com.williamcallahan.series_sync_engine.service.catalog;

import com.williamcallahan.series_sync_engine.types.SourceName;

/**
 * Title search against an external catalog. Never throws for upstream failures;
 * they are reported on the returned page instead.
 */
public interface ExternalCatalogClient {

    SourceName source();

    CatalogSearchPage search(String title, int offset, int limit);
}
