/**
 * Lookup of scrapers by source name
 *
 * @author William Callahan
 *
 * Features:
 * - Built once from every {@link Scraper} bean
 * - Fails startup when two scrapers claim the same source
 * - Logs known sources that have no scraper
 */

package com.williamcallahan.series_sync_engine.service.scraper;

import com.williamcallahan.series_sync_engine.types.SourceName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class ScraperRegistry {

    private final Map<SourceName, Scraper> scrapers;

    public ScraperRegistry(List<Scraper> scrapers) {
        Map<SourceName, Scraper> bySource = new EnumMap<>(SourceName.class);
        for (Scraper scraper : scrapers) {
            Scraper previous = bySource.putIfAbsent(scraper.source(), scraper);
            if (previous != null) {
                throw new IllegalStateException("Duplicate scrapers for source " + scraper.source().getKey()
                    + ": " + previous.getClass().getSimpleName() + " and " + scraper.getClass().getSimpleName());
            }
        }
        this.scrapers = Collections.unmodifiableMap(bySource);
        Arrays.stream(SourceName.values())
            .filter(source -> !bySource.containsKey(source))
            .forEach(source -> log.warn("No scraper registered for source '{}'; its links will not sync", source.getKey()));
        log.info("Scraper registry ready with sources {}", bySource.keySet());
    }

    /**
     * Case-insensitive lookup by stored source name.
     */
    public Optional<Scraper> forSource(String sourceName) {
        return SourceName.fromKey(sourceName).map(scrapers::get);
    }
}
