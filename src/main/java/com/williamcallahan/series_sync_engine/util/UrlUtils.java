package com.williamcallahan.series_sync_engine.util;

import com.williamcallahan.series_sync_engine.types.SourceName;
import org.springframework.lang.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * URL checks applied before any outbound fetch.
 */
public final class UrlUtils {

    private UrlUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Extracts the lower-cased host of an http(s) URL.
     *
     * @param url URL to parse (may be null)
     * @return host, or empty when the URL is missing, malformed or not http(s)
     */
    public static Optional<String> httpHost(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return Optional.empty();
            }
            return Optional.ofNullable(uri.getHost()).map(host -> host.toLowerCase(Locale.ROOT));
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /**
     * True when the URL parses and its host belongs to a known source.
     */
    public static boolean isAllowedSourceUrl(@Nullable String url) {
        return httpHost(url).map(SourceName.allowedHosts()::contains).orElse(false);
    }
}
