/**
 * Queue handler fanning out new-chapter notifications to subscribed readers
 *
 * @author William Callahan
 *
 * Features:
 * - Notifies only library entries that opted in to new-chapter alerts
 * - Skips readers already notified about the series within the dedup window
 * - One bulk insert per job
 */

package com.williamcallahan.series_sync_engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.dto.NotificationJobData;
import com.williamcallahan.series_sync_engine.exception.InvalidJobPayloadException;
import com.williamcallahan.series_sync_engine.model.Notification;
import com.williamcallahan.series_sync_engine.model.Series;
import com.williamcallahan.series_sync_engine.queue.JobHandler;
import com.williamcallahan.series_sync_engine.queue.JobPayloads;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.queue.QueuedJob;
import com.williamcallahan.series_sync_engine.repository.LibraryEntryRepository;
import com.williamcallahan.series_sync_engine.repository.NotificationRepository;
import com.williamcallahan.series_sync_engine.repository.SeriesRepository;
import com.williamcallahan.series_sync_engine.types.NotificationType;
import com.williamcallahan.series_sync_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
@Slf4j
public class NewChapterNotificationWorker implements JobHandler {

    static final String NOTIFICATION_TITLE = "New Chapter Available";

    private final SeriesRepository seriesRepository;
    private final LibraryEntryRepository libraryEntryRepository;
    private final NotificationRepository notificationRepository;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public NewChapterNotificationWorker(SeriesRepository seriesRepository,
                                        LibraryEntryRepository libraryEntryRepository,
                                        NotificationRepository notificationRepository,
                                        PipelineProperties properties,
                                        ObjectMapper objectMapper,
                                        Clock clock) {
        this.seriesRepository = seriesRepository;
        this.libraryEntryRepository = libraryEntryRepository;
        this.notificationRepository = notificationRepository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public QueueName queue() {
        return QueueName.NOTIFICATIONS;
    }

    @Override
    public void handle(QueuedJob job) {
        NotificationJobData data = JobPayloads.read(objectMapper, job, NotificationJobData.class);
        validate(job.id(), data);

        Optional<Series> series = seriesRepository.findById(data.seriesId());
        if (series.isEmpty()) {
            log.warn("Series {} not found; dropping notification job {}", data.seriesId(), job.id());
            return;
        }

        List<String> subscribers = libraryEntryRepository.findSubscriberIds(data.seriesId());
        if (subscribers.isEmpty()) {
            log.debug("No subscribers for series {}", data.seriesId());
            return;
        }

        Instant since = clock.instant().minus(properties.getNotifications().getDedupWindow());
        Set<String> alreadyNotified = notificationRepository.findRecentlyNotifiedUserIds(
            data.seriesId(), NotificationType.NEW_CHAPTER, since);

        String message = formatMessage(data.newChapterCount(), series.get().getTitle());
        List<Notification> notifications = new ArrayList<>();
        for (String userId : subscribers) {
            if (alreadyNotified.contains(userId)) {
                continue;
            }
            notifications.add(new Notification(userId, data.seriesId(), NotificationType.NEW_CHAPTER,
                NOTIFICATION_TITLE, message, metadata(data, job.id())));
        }

        if (notifications.isEmpty()) {
            log.debug("All {} subscriber(s) of series {} were notified recently", subscribers.size(), data.seriesId());
            return;
        }
        int created = notificationRepository.insertAll(notifications);
        log.info("Created {} new-chapter notification(s) for series {} ({} skipped as recent)",
            created, data.seriesId(), subscribers.size() - notifications.size());
    }

    static String formatMessage(int chapterCount, String title) {
        return chapterCount + (chapterCount == 1 ? " new chapter" : " new chapters") + " for \"" + title + "\"!";
    }

    private static Map<String, Object> metadata(NotificationJobData data, String jobId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source_id", data.sourceId());
        metadata.put("chapter_count", data.newChapterCount());
        metadata.put("job_id", jobId);
        return metadata;
    }

    private static void validate(String jobId, NotificationJobData data) {
        if (ValidationUtils.isNullOrBlank(data.seriesId()) || ValidationUtils.isNullOrBlank(data.sourceId())) {
            throw new InvalidJobPayloadException(jobId, "series_id and source_id are required");
        }
        if (data.newChapterCount() <= 0) {
            throw new InvalidJobPayloadException(jobId, "new_chapter_count must be positive, got " + data.newChapterCount());
        }
    }
}
