/**
 * Small key-value store with per-key expiry shared across pipeline processes
 *
 * @author William Callahan
 *
 * Features:
 * - Worker heartbeat and request cooldown keys
 * - Atomic set-if-absent for claiming a key
 * - Keys are logical names; implementations apply their own namespace
 */

package com.williamcallahan.series_sync_engine.service.cache;

import java.time.Duration;
import java.util.Optional;

public interface CoordinationStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * Sets the key only when it does not exist.
     *
     * @return true when this call created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    void delete(String key);
}
