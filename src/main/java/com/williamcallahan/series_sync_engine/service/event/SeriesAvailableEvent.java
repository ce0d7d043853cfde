/**
 * Event published after a discovery candidate has been canonicalized
 *
 * @author William Callahan
 *
 * Features:
 * - Carries the canonical series id and title
 * - Flags whether the series row was newly created
 */

package com.williamcallahan.series_sync_engine.service.event;

import lombok.Value;

@Value
public class SeriesAvailableEvent {
    String seriesId;
    String externalId;
    String title;
    boolean created;
}
