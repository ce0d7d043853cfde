/**
 * A link between a canonical series and one external source that carries it
 *
 * @author William Callahan
 *
 * Features:
 * - Unique on (sourceName, sourceId)
 * - Tracks sync tier, schedule and consecutive failures for the circuit breaker
 * - Holds the per-source title, cover and match confidence
 */

package com.williamcallahan.series_sync_engine.model;

import com.williamcallahan.series_sync_engine.types.SourceHealth;
import com.williamcallahan.series_sync_engine.types.SyncPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SeriesSource {

    private String id;
    private String seriesId;
    private String sourceName;
    private String sourceId;
    private String sourceUrl;
    private String sourceTitle;
    private BigDecimal matchConfidence;
    private String coverUrl;
    private Integer coverWidth;
    private Integer coverHeight;
    private boolean primaryCover;
    private Instant coverUpdatedAt;
    @Builder.Default
    private SyncPriority syncPriority = SyncPriority.COLD;
    private Instant nextCheckAt;
    private Instant lastCheckedAt;
    private Instant lastSuccessAt;
    private int failureCount;
    private int chapterCount;

    public SourceHealth health() {
        return SourceHealth.of(failureCount);
    }
}
