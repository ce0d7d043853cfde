package com.williamcallahan.series_sync_engine.service;

import com.williamcallahan.series_sync_engine.service.event.SeriesAvailableEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.core.MessageSendingOperations;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SeriesAvailabilityNotifierServiceTest {

    @Mock
    private MessageSendingOperations<String> messagingTemplate;

    @InjectMocks
    private SeriesAvailabilityNotifierService notifier;

    @Test
    void broadcastsSeriesAvailablePayload() {
        notifier.handleSeriesAvailable(new SeriesAvailableEvent("series-1", "md-1", "Solo Leveling", true));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/series.available"), payload.capture());
        assertThat(payload.getValue()).isInstanceOfSatisfying(Map.class, map -> assertThat(map)
            .containsEntry("series_id", "series-1")
            .containsEntry("external_id", "md-1")
            .containsEntry("title", "Solo Leveling")
            .containsEntry("created", true));
    }

    @Test
    void eventWithoutSeriesIdIsIgnored() {
        notifier.handleSeriesAvailable(new SeriesAvailableEvent(null, null, "Ghost", false));

        verifyNoInteractions(messagingTemplate);
    }

    @Test
    void brokerFailureIsLoggedNotThrown() {
        doThrow(new MessageDeliveryException("no session")).when(messagingTemplate)
            .convertAndSend(anyString(), any(Object.class));

        assertThatCode(() -> notifier.handleSeriesAvailable(new SeriesAvailableEvent("s", "e", "t", false)))
            .doesNotThrowAnyException();
    }
}
