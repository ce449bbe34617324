package com.rendezvous.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import static com.rendezvous.protocol.RendezvousException.Kind.MISSING_TYPE;
import static com.rendezvous.protocol.RendezvousException.Kind.UNKNOWN_TYPE;

public final class CommandDecoder {

    public static final String PING = "ping";
    public static final String BIND = "bind";
    public static final String LIST = "list";
    public static final String ALLOCATE = "allocate";
    public static final String CLAIM = "claim";
    public static final String WATCH = "watch";
    public static final String ADD = "add";
    public static final String RELEASE = "release";

    private CommandDecoder() {}

    public static String typeOf(JsonNode frame) {
        if (frame == null || !frame.isObject() || !present(frame, "type")) {
            throw new RendezvousException(MISSING_TYPE, "missing 'type'");
        }
        return frame.get("type").asText();
    }

    public static boolean allowedUnbound(String type) {
        return PING.equals(type) || BIND.equals(type);
    }

    public static Command decode(JsonNode frame) {
        var type = typeOf(frame);
        switch (type) {
            case PING:
                return new Command.Ping(require(frame, "ping", "ping requires 'ping'"));
            case BIND:
                return new Command.Bind(
                    text(frame, "appId", "bind requires 'appId'"),
                    text(frame, "side", "bind requires 'side'"));
            case LIST:
                return new Command.ListNameplates();
            case ALLOCATE:
                return new Command.Allocate();
            case CLAIM:
                return new Command.Claim(channelId(frame, type));
            case WATCH:
                return new Command.Watch(channelId(frame, type));
            case ADD: {
                var channelId = channelId(frame, type);
                var phase = text(frame, "phase", "missing 'phase'");
                var body = text(frame, "body", "missing 'body'");
                // older clients tag messages with the frame's correlation id
                var msgId = present(frame, "msgId") ? frame.get("msgId") : frame.get("id");
                return new Command.Add(channelId, phase, body, msgId);
            }
            case RELEASE:
                return new Command.Release(channelId(frame, type),
                    present(frame, "mood") ? frame.get("mood").asText() : null);
            default:
                throw new RendezvousException(UNKNOWN_TYPE, "Unknown type");
        }
    }

    private static String channelId(JsonNode frame, String type) {
        return text(frame, "channelId", type + " requires 'channelId'");
    }

    private static String text(JsonNode frame, String field, String explain) {
        return require(frame, field, explain).asText();
    }

    private static JsonNode require(JsonNode frame, String field, String explain) {
        if (!present(frame, field)) {
            throw RendezvousException.missingField(explain);
        }
        return frame.get(field);
    }

    private static boolean present(JsonNode frame, String field) {
        var value = frame.get(field);
        return value != null && !value.isNull();
    }
}
