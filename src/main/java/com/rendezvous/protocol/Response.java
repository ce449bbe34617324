package com.rendezvous.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.rendezvous.mailbox.Message;
import com.rendezvous.shared.config.WelcomeConfig;

import java.util.List;

/** Outbound frames; {@link FrameCodec} adds {@code type} and {@code serverTx}. */
public sealed interface Response
        permits Response.Welcome, Response.Ack, Response.Pong, Response.Nameplates,
                Response.Nameplate, Response.MessageDelivery, Response.Released, Response.Error {

    String type();

    record Welcome(WelcomeConfig welcome) implements Response {
        @Override public String type() { return "welcome"; }
    }

    record Ack(JsonNode id) implements Response {
        @Override public String type() { return "ack"; }
    }

    record Pong(JsonNode pong) implements Response {
        @Override public String type() { return "pong"; }
    }

    record Nameplates(List<String> nameplates) implements Response {
        @Override public String type() { return "nameplates"; }
    }

    record Nameplate(String nameplate) implements Response {
        @Override public String type() { return "nameplate"; }
    }

    record MessageDelivery(String channelId, Message message) implements Response {
        @Override public String type() { return "message"; }
    }

    record Released(String status) implements Response {
        public static final String DELETED = "deleted";
        public static final String WAITING = "waiting";

        @Override public String type() { return "released"; }
    }

    record Error(String error, JsonNode orig) implements Response {
        @Override public String type() { return "error"; }
    }
}
