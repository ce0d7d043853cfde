package com.williamcallahan.series_sync_engine.types;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rough classification of a user search, used to decide whether a discovery
 * job is worth enqueueing and how urgently.
 */
public enum SearchIntent {
    /** Too short or non-alphanumeric; never triggers discovery. */
    NOISE,
    /** Single generic word, explored at a lower priority. */
    KEYWORD_EXPLORATION,
    /** Looks like (part of) a title. */
    PARTIAL_TITLE;

    private static final Pattern HAS_LETTER_OR_DIGIT = Pattern.compile("[\\p{L}\\p{N}]");
    private static final int MIN_LENGTH = 2;

    /**
     * Classifies a normalized query.
     *
     * @param query lower-cased, trimmed query
     * @return detected intent
     */
    public static SearchIntent detect(String query) {
        if (query == null) {
            return NOISE;
        }
        String trimmed = query.trim().toLowerCase(Locale.ROOT);
        if (trimmed.length() < MIN_LENGTH || !HAS_LETTER_OR_DIGIT.matcher(trimmed).find()) {
            return NOISE;
        }
        if (!trimmed.contains(" ") && trimmed.length() <= 5) {
            return KEYWORD_EXPLORATION;
        }
        return PARTIAL_TITLE;
    }
}
