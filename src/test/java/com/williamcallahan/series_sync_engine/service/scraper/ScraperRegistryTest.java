package com.williamcallahan.series_sync_engine.service.scraper;

import com.williamcallahan.series_sync_engine.types.SourceName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScraperRegistryTest {

    private static Scraper stub(SourceName source) {
        return new Scraper() {
            @Override
            public SourceName source() {
                return source;
            }

            @Override
            public ScrapedSeries fetchChapters(String sourceId) {
                return new ScrapedSeries(sourceId, null, List.of());
            }
        };
    }

    @Test
    void looksUpScrapersByStoredSourceName() {
        Scraper mangaDex = stub(SourceName.MANGADEX);
        ScraperRegistry registry = new ScraperRegistry(List.of(mangaDex));

        assertThat(registry.forSource("mangadex")).containsSame(mangaDex);
        assertThat(registry.forSource("MangaDex")).containsSame(mangaDex);
        assertThat(registry.forSource("mangapark")).isEmpty();
        assertThat(registry.forSource("unknown")).isEmpty();
    }

    @Test
    void duplicateSourcesAreRejectedAtStartup() {
        List<Scraper> scrapers = List.of(stub(SourceName.MANGADEX), stub(SourceName.MANGADEX));

        assertThatThrownBy(() -> new ScraperRegistry(scrapers))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("mangadex");
    }
}
