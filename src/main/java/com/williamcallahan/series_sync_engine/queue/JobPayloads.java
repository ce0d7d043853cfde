package com.williamcallahan.series_sync_engine.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.exception.InvalidJobPayloadException;

/**
 * Conversion between typed job payloads and the JSON stored on the queue.
 */
public final class JobPayloads {

    private JobPayloads() {
    }

    public static JsonNode toJson(ObjectMapper objectMapper, Object payload) {
        return objectMapper.valueToTree(payload);
    }

    /**
     * Reads a job payload into the given type.
     *
     * @throws InvalidJobPayloadException when the payload is missing or does not bind
     */
    public static <T> T read(ObjectMapper objectMapper, QueuedJob job, Class<T> type) {
        JsonNode payload = job.payload();
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new InvalidJobPayloadException(job.id(), "payload is empty");
        }
        try {
            T value = objectMapper.treeToValue(payload, type);
            if (value == null) {
                throw new InvalidJobPayloadException(job.id(), "payload is empty");
            }
            return value;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidJobPayloadException(job.id(), originalMessage(e), e);
        }
    }

    private static String originalMessage(Exception e) {
        if (e instanceof JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        return e.getMessage();
    }
}
