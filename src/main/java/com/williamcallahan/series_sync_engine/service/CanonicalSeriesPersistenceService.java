/**
 * Resolves discovery candidates onto canonical series rows and links their sources
 *
 * @author William Callahan
 *
 * Features:
 * - Match cascade: external catalog id, then existing source link, then case-insensitive title
 * - Merges alternative titles and fills descriptive fields only where empty
 * - Covers overwritten only by the top-trust source, otherwise filled when missing
 * - Upserts the (source name, source id) link in the same transaction
 * - Flags the link whose cover the series shows as the primary cover
 * - Re-runs the cascade once when a concurrent insert wins the unique external id
 */

package com.williamcallahan.series_sync_engine.service;

import com.williamcallahan.series_sync_engine.dto.SeriesCandidate;
import com.williamcallahan.series_sync_engine.model.Series;
import com.williamcallahan.series_sync_engine.repository.SeriesRepository;
import com.williamcallahan.series_sync_engine.repository.SeriesSourceRepository;
import com.williamcallahan.series_sync_engine.repository.SeriesSourceRepository.SourceLinkUpsert;
import com.williamcallahan.series_sync_engine.types.SourceName;
import com.williamcallahan.series_sync_engine.util.UuidUtil;
import com.williamcallahan.series_sync_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@Service
public class CanonicalSeriesPersistenceService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CanonicalSeriesPersistenceService.class);

    private final SeriesRepository seriesRepository;
    private final SeriesSourceRepository seriesSourceRepository;
    private final Clock clock;
    private TransactionTemplate transactionTemplate;

    public CanonicalSeriesPersistenceService(SeriesRepository seriesRepository,
                                             SeriesSourceRepository seriesSourceRepository,
                                             Clock clock) {
        this.seriesRepository = seriesRepository;
        this.seriesSourceRepository = seriesSourceRepository;
        this.clock = clock;
    }

    @Autowired
    void setTransactionManager(@Nullable PlatformTransactionManager transactionManager) {
        if (transactionManager != null) {
            this.transactionTemplate = new TransactionTemplate(transactionManager);
        }
    }

    /**
     * Outcome of one canonicalization.
     *
     * @param seriesId canonical series the candidate now belongs to
     * @param title canonical title
     * @param externalId external catalog id on the canonical row
     * @param created true when a new series row was inserted
     * @param matchedBy which rule found the existing series
     */
    public record CanonicalizationResult(String seriesId, String title, String externalId,
                                         boolean created, MatchRule matchedBy) {
    }

    public enum MatchRule {
        EXTERNAL_ID,
        SOURCE_LINK,
        TITLE,
        NONE
    }

    /**
     * Creates or updates the canonical series for a candidate and links the candidate's source.
     */
    public CanonicalizationResult canonicalize(SeriesCandidate candidate) {
        try {
            return inTransaction(() -> persist(candidate));
        } catch (DuplicateKeyException race) {
            // Another worker inserted the same external id first; it is now visible to the cascade
            LOGGER.info("Concurrent insert for external id {}; re-resolving candidate '{}'",
                candidate.externalId(), candidate.title());
            return inTransaction(() -> persist(candidate));
        }
    }

    private CanonicalizationResult persist(SeriesCandidate candidate) {
        Instant now = clock.instant();
        MatchRule rule = MatchRule.NONE;
        Optional<Series> existing = Optional.empty();

        if (ValidationUtils.hasText(candidate.externalId())) {
            existing = seriesRepository.findByExternalId(candidate.externalId());
            rule = MatchRule.EXTERNAL_ID;
        }
        if (existing.isEmpty()) {
            existing = seriesRepository.findBySourceLink(candidate.sourceName(), candidate.sourceId());
            rule = MatchRule.SOURCE_LINK;
        }
        if (existing.isEmpty()) {
            existing = seriesRepository.findByTitleIgnoreCase(candidate.title());
            rule = MatchRule.TITLE;
        }

        Series series;
        boolean created;
        if (existing.isPresent()) {
            series = merge(existing.get(), candidate);
            seriesRepository.update(series);
            created = false;
            LOGGER.debug("Candidate '{}' matched series {} by {}", candidate.title(), series.getId(), rule);
        } else {
            series = newSeries(candidate);
            seriesRepository.insert(series);
            created = true;
            rule = MatchRule.NONE;
            LOGGER.info("Created series {} '{}' from {} {}", series.getId(), series.getTitle(),
                candidate.sourceName(), candidate.sourceId());
        }

        String coverUrl = ValidationUtils.nullIfBlank(candidate.coverUrl());
        boolean primaryCover = coverUrl != null && coverUrl.equals(series.getCoverUrl());
        if (primaryCover) {
            seriesSourceRepository.clearPrimaryCover(series.getId(), candidate.sourceName(), candidate.sourceId());
        }
        seriesSourceRepository.upsertLink(new SourceLinkUpsert(
            UuidUtil.newId(),
            series.getId(),
            candidate.sourceName(),
            candidate.sourceId(),
            candidate.sourceUrl(),
            candidate.title(),
            candidate.confidence() != null ? BigDecimal.valueOf(candidate.confidence()) : null,
            coverUrl,
            candidate.coverWidth(),
            candidate.coverHeight(),
            primaryCover,
            now));

        return new CanonicalizationResult(series.getId(), series.getTitle(), series.getExternalId(), created, rule);
    }

    /**
     * Applies the merge rules of an incoming candidate onto an existing series.
     * The canonical title never changes.
     */
    static Series merge(Series current, SeriesCandidate incoming) {
        Set<String> titles = new LinkedHashSet<>();
        if (current.getAlternativeTitles() != null) {
            titles.addAll(current.getAlternativeTitles());
        }
        titles.addAll(incoming.alternativeTitles());
        if (ValidationUtils.hasText(incoming.title())) {
            titles.add(incoming.title());
        }

        boolean replaceCover = ValidationUtils.hasText(incoming.coverUrl())
            && (ValidationUtils.isNullOrBlank(current.getCoverUrl()) || SourceName.isTopTrust(incoming.sourceName()));

        return current.toBuilder()
            .alternativeTitles(new ArrayList<>(titles))
            .externalId(firstNonBlank(current.getExternalId(), incoming.externalId()))
            .description(firstNonBlank(current.getDescription(), incoming.description()))
            .coverUrl(replaceCover ? incoming.coverUrl() : current.getCoverUrl())
            .type(firstNonBlank(current.getType(), incoming.type()))
            .status(firstNonBlank(current.getStatus(), incoming.status()))
            .genres(ValidationUtils.isNullOrEmpty(current.getGenres())
                ? new ArrayList<>(incoming.genres())
                : current.getGenres())
            .contentRating(firstNonBlank(current.getContentRating(), incoming.contentRating()))
            .build();
    }

    static Series newSeries(SeriesCandidate candidate) {
        Set<String> titles = new LinkedHashSet<>(candidate.alternativeTitles());
        titles.add(candidate.title());
        return Series.builder()
            .id(UuidUtil.newId())
            .title(candidate.title())
            .externalId(ValidationUtils.nullIfBlank(candidate.externalId()))
            .alternativeTitles(new ArrayList<>(titles))
            .description(candidate.description())
            .coverUrl(ValidationUtils.nullIfBlank(candidate.coverUrl()))
            .type(candidate.type())
            .status(candidate.status())
            .genres(new ArrayList<>(candidate.genres()))
            .contentRating(candidate.contentRating())
            .build();
    }

    private static String firstNonBlank(String current, String incoming) {
        return ValidationUtils.hasText(current) ? current : ValidationUtils.nullIfBlank(incoming);
    }

    private <T> T inTransaction(Supplier<T> work) {
        if (transactionTemplate != null) {
            return transactionTemplate.execute(status -> work.get());
        }
        return work.get();
    }
}
