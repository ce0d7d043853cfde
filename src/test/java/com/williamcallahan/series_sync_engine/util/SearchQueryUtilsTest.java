package com.williamcallahan.series_sync_engine.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SearchQueryUtilsTest {

    @Test
    void canonicalizeLowercasesAndCollapsesWhitespace() {
        assertThat(SearchQueryUtils.canonicalize("  Solo   LEVELING \t")).isEqualTo("solo leveling");
        assertThat(SearchQueryUtils.canonicalize(null)).isNull();
    }

    @Test
    void keyHashIsStableAcrossSpellingsOfTheSameQuery() {
        String hash = SearchQueryUtils.keyHash("Solo Leveling");

        assertThat(hash).hasSize(32).matches("[0-9a-f]+");
        assertThat(SearchQueryUtils.keyHash("  solo   leveling")).isEqualTo(hash);
        assertThat(SearchQueryUtils.keyHash("solo levelling")).isNotEqualTo(hash);
    }
}
