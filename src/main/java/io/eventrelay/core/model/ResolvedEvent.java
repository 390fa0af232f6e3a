package io.eventrelay.core.model;

import java.util.UUID;

/**
 * An event delivered by a persistent subscription, preserving its origin stream,
 * identity, positions and opaque payload.
 *
 * @param streamId            stream the event was written to
 * @param eventId             unique id assigned when the event was appended
 * @param eventNumber         position of the event in {@code streamId}
 * @param originalEventNumber position of the event in the subscribed (possibly projected) stream
 * @param eventType           type name
 * @param payload             serialized body, never interpreted here
 */
public record ResolvedEvent(String streamId,
                            UUID eventId,
                            long eventNumber,
                            long originalEventNumber,
                            String eventType,
                            byte[] payload) {

    public ResolvedEvent {
        if (streamId == null || eventId == null || eventType == null) {
            throw new IllegalArgumentException("streamId, eventId and eventType are required");
        }
        payload = payload == null ? new byte[0] : payload;
    }

    @Override
    public String toString() {
        return "ResolvedEvent{" + eventId + " type " + eventType + " stream [" + streamId + "] number "
                + eventNumber + " original " + originalEventNumber + "}";
    }
}
