package com.rendezvous.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbound client commands, decoded once from a JSON frame by {@link CommandDecoder}.
 * Every variant dispatches to its own {@link Handler} method, so adding a variant
 * forces every handler to deal with it.
 */
public sealed interface Command
        permits Command.Ping, Command.Bind, Command.ListNameplates, Command.Allocate,
                Command.Claim, Command.Watch, Command.Add, Command.Release {

    void dispatch(Handler handler);

    interface Handler {
        void onPing(Ping ping);
        void onBind(Bind bind);
        void onList(ListNameplates list);
        void onAllocate(Allocate allocate);
        void onClaim(Claim claim);
        void onWatch(Watch watch);
        void onAdd(Add add);
        void onRelease(Release release);
    }

    record Ping(JsonNode ping) implements Command {
        @Override public void dispatch(Handler handler) { handler.onPing(this); }
    }

    record Bind(String appId, String side) implements Command {
        @Override public void dispatch(Handler handler) { handler.onBind(this); }
    }

    record ListNameplates() implements Command {
        @Override public void dispatch(Handler handler) { handler.onList(this); }
    }

    record Allocate() implements Command {
        @Override public void dispatch(Handler handler) { handler.onAllocate(this); }
    }

    record Claim(String channelId) implements Command {
        @Override public void dispatch(Handler handler) { handler.onClaim(this); }
    }

    record Watch(String channelId) implements Command {
        @Override public void dispatch(Handler handler) { handler.onWatch(this); }
    }

    record Add(String channelId, String phase, String body, JsonNode msgId) implements Command {
        @Override public void dispatch(Handler handler) { handler.onAdd(this); }
    }

    record Release(String channelId, String mood) implements Command {
        @Override public void dispatch(Handler handler) { handler.onRelease(this); }
    }
}
