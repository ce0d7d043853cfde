/**
 * Row id generation and validation
 *
 * @author William Callahan
 *
 * Features:
 * - New row ids are UUIDv7 strings, so inserts stay roughly time ordered
 * - Ids coming from job payloads are checked before they reach a ::uuid cast
 */

package com.williamcallahan.series_sync_engine.util;

import com.github.f4b6a3.uuid.UuidCreator;
import com.github.f4b6a3.uuid.util.UuidValidator;

public final class UuidUtil {

    private UuidUtil() {
    }

    /**
     * @return a new time-ordered (v7) id in canonical string form
     */
    public static String newId() {
        return UuidCreator.getTimeOrderedEpoch().toString();
    }

    /**
     * True for a canonical 36-character UUID string of any version.
     */
    public static boolean isUuid(String value) {
        return value != null && value.length() == 36 && UuidValidator.isValid(value);
    }
}
