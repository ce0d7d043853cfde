package com.williamcallahan.series_sync_engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.dto.NotificationJobData;
import com.williamcallahan.series_sync_engine.exception.InvalidJobPayloadException;
import com.williamcallahan.series_sync_engine.model.Notification;
import com.williamcallahan.series_sync_engine.model.Series;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.queue.QueuedJob;
import com.williamcallahan.series_sync_engine.repository.LibraryEntryRepository;
import com.williamcallahan.series_sync_engine.repository.NotificationRepository;
import com.williamcallahan.series_sync_engine.repository.SeriesRepository;
import com.williamcallahan.series_sync_engine.testutil.MutableClock;
import com.williamcallahan.series_sync_engine.testutil.PipelineFixtures;
import com.williamcallahan.series_sync_engine.types.NotificationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NewChapterNotificationWorkerTest {

    private static final String SERIES_ID = "0190a0c8-0000-7000-8000-000000000001";
    private static final String SOURCE_ID = "0190a0c8-1111-7000-8000-000000000002";

    @Mock
    private SeriesRepository seriesRepository;

    @Mock
    private LibraryEntryRepository libraryEntryRepository;

    @Mock
    private NotificationRepository notificationRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private NewChapterNotificationWorker worker;

    @BeforeEach
    void setUp() {
        worker = new NewChapterNotificationWorker(seriesRepository, libraryEntryRepository, notificationRepository,
            new PipelineProperties(), objectMapper, new MutableClock(PipelineFixtures.NOW));
    }

    private QueuedJob job(NotificationJobData data) {
        return PipelineFixtures.job(objectMapper, QueueName.NOTIFICATIONS, "notify-1", data);
    }

    private void seriesExists() {
        Series series = new Series();
        series.setId(SERIES_ID);
        series.setTitle("Solo Leveling");
        when(seriesRepository.findById(SERIES_ID)).thenReturn(Optional.of(series));
    }

    @Test
    void notifiesEverySubscriberNotRecentlyNotified() {
        seriesExists();
        when(libraryEntryRepository.findSubscriberIds(SERIES_ID)).thenReturn(List.of("u1", "u2", "u3"));
        when(notificationRepository.findRecentlyNotifiedUserIds(SERIES_ID, NotificationType.NEW_CHAPTER,
            PipelineFixtures.NOW.minus(Duration.ofMinutes(5)))).thenReturn(Set.of("u2"));
        when(notificationRepository.insertAll(anyList())).thenReturn(2);

        worker.handle(job(new NotificationJobData(SERIES_ID, SOURCE_ID, 3)));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Notification>> created = ArgumentCaptor.forClass(List.class);
        verify(notificationRepository).insertAll(created.capture());
        assertThat(created.getValue()).extracting(Notification::userId).containsExactly("u1", "u3");
        Notification first = created.getValue().get(0);
        assertThat(first.type()).isEqualTo(NotificationType.NEW_CHAPTER);
        assertThat(first.title()).isEqualTo("New Chapter Available");
        assertThat(first.message()).isEqualTo("3 new chapters for \"Solo Leveling\"!");
        assertThat(first.metadata())
            .containsEntry("source_id", SOURCE_ID)
            .containsEntry("chapter_count", 3)
            .containsEntry("job_id", "notify-1");
    }

    @Test
    void everySubscriberInsideWindowMeansNoInsert() {
        seriesExists();
        when(libraryEntryRepository.findSubscriberIds(SERIES_ID)).thenReturn(List.of("u1"));
        when(notificationRepository.findRecentlyNotifiedUserIds(any(), any(), any())).thenReturn(Set.of("u1"));

        worker.handle(job(new NotificationJobData(SERIES_ID, SOURCE_ID, 1)));

        verify(notificationRepository, never()).insertAll(anyList());
    }

    @Test
    void seriesWithoutSubscribersIsSkipped() {
        seriesExists();
        when(libraryEntryRepository.findSubscriberIds(SERIES_ID)).thenReturn(List.of());

        worker.handle(job(new NotificationJobData(SERIES_ID, SOURCE_ID, 1)));

        verifyNoInteractions(notificationRepository);
    }

    @Test
    void deletedSeriesIsSkipped() {
        when(seriesRepository.findById(SERIES_ID)).thenReturn(Optional.empty());

        worker.handle(job(new NotificationJobData(SERIES_ID, SOURCE_ID, 1)));

        verifyNoInteractions(libraryEntryRepository, notificationRepository);
    }

    @Test
    void nonPositiveCountIsInvalid() {
        assertThatThrownBy(() -> worker.handle(job(new NotificationJobData(SERIES_ID, SOURCE_ID, 0))))
            .isInstanceOf(InvalidJobPayloadException.class);
        verifyNoInteractions(seriesRepository);
    }

    @Test
    void missingIdsAreInvalid() {
        assertThatThrownBy(() -> worker.handle(job(new NotificationJobData(SERIES_ID, null, 2))))
            .isInstanceOf(InvalidJobPayloadException.class);
    }

    @Test
    void singleChapterMessageIsSingular() {
        assertThat(NewChapterNotificationWorker.formatMessage(1, "Berserk")).isEqualTo("1 new chapter for \"Berserk\"!");
    }

    @Test
    void multipleChapterMessageIsPlural() {
        assertThat(NewChapterNotificationWorker.formatMessage(3, "Berserk")).isEqualTo("3 new chapters for \"Berserk\"!");
    }
}
