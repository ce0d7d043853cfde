package com.williamcallahan.series_sync_engine.types;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Known external sources. Each source carries the hosts its links may point at
 * and a trust rank; the highest ranked source may overwrite an existing cover.
 */
public enum SourceName {
    MANGADEX("mangadex", 10, Set.of("mangadex.org", "api.mangadex.org")),
    MANGAPARK("mangapark", 5, Set.of("mangapark.io", "www.mangapark.io"));

    private final String key;
    private final int trustRank;
    private final Set<String> hosts;

    SourceName(String key, int trustRank, Set<String> hosts) {
        this.key = key;
        this.trustRank = trustRank;
        this.hosts = hosts;
    }

    public String getKey() {
        return key;
    }

    public int getTrustRank() {
        return trustRank;
    }

    public Set<String> getHosts() {
        return hosts;
    }

    /**
     * Case-insensitive lookup by the stored source name.
     */
    public static Optional<SourceName> fromKey(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(source -> source.key.equals(normalized))
            .findFirst();
    }

    /**
     * @return the source whose cover art always wins
     */
    public static SourceName topTrust() {
        return Arrays.stream(values())
            .max(Comparator.comparingInt(SourceName::getTrustRank))
            .orElseThrow();
    }

    public static boolean isTopTrust(String raw) {
        return fromKey(raw).map(source -> source == topTrust()).orElse(false);
    }

    /**
     * @return every host a source URL may point at
     */
    public static Set<String> allowedHosts() {
        return Arrays.stream(values())
            .flatMap(source -> source.hosts.stream())
            .collect(Collectors.toUnmodifiableSet());
    }
}
