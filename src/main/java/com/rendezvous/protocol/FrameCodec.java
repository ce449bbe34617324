package com.rendezvous.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.time.Instant;

/**
 * JSON text framing for the rendezvous protocol. Every outbound frame carries
 * {@code type} plus {@code serverTx}, the send time in fractional epoch seconds.
 */
public class FrameCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Clock clock;

    public FrameCodec(Clock clock) {
        this.clock = clock;
    }

    public FrameCodec() {
        this(Clock.systemUTC());
    }

    public JsonNode parse(String payload) {
        try {
            return MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new RendezvousException(RendezvousException.Kind.MALFORMED, "invalid JSON");
        }
    }

    public String encode(Response response) {
        var frame = MAPPER.createObjectNode();
        frame.put("type", response.type());
        frame.setAll((ObjectNode) MAPPER.valueToTree(response));
        frame.put("serverTx", now());
        try {
            return MAPPER.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + response.type() + " frame", e);
        }
    }

    /** Current server time in fractional epoch seconds. */
    public double now() {
        return toSeconds(clock.instant());
    }

    static double toSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
