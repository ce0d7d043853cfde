package com.williamcallahan.series_sync_engine.types;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SourceNameTest {

    @Test
    void lookupIsCaseInsensitive() {
        assertThat(SourceName.fromKey(" MangaDex ")).contains(SourceName.MANGADEX);
        assertThat(SourceName.fromKey("unknown")).isEmpty();
        assertThat(SourceName.fromKey(null)).isEmpty();
    }

    @Test
    void mangadexIsTopTrust() {
        assertThat(SourceName.topTrust()).isEqualTo(SourceName.MANGADEX);
        assertThat(SourceName.isTopTrust("mangadex")).isTrue();
        assertThat(SourceName.isTopTrust("mangapark")).isFalse();
    }

    @Test
    void allowListCoversEverySourceHost() {
        assertThat(SourceName.allowedHosts())
            .containsExactlyInAnyOrder("mangadex.org", "api.mangadex.org", "mangapark.io", "www.mangapark.io");
    }

    @Test
    void unknownTierFallsBackToCold() {
        assertThat(SyncPriority.fromValue("hot")).isEqualTo(SyncPriority.HOT);
        assertThat(SyncPriority.fromValue("lukewarm")).isEqualTo(SyncPriority.COLD);
        assertThat(SyncPriority.fromValue(null)).isEqualTo(SyncPriority.COLD);
        assertThat(SyncPriority.WARM.getInterval()).isEqualTo(Duration.ofHours(2));
    }

    @Test
    void healthFollowsFailureCount() {
        assertThat(SourceHealth.of(0)).isEqualTo(SourceHealth.HEALTHY);
        assertThat(SourceHealth.of(4)).isEqualTo(SourceHealth.DEGRADED);
        assertThat(SourceHealth.of(5)).isEqualTo(SourceHealth.CIRCUIT_OPEN);
    }
}
