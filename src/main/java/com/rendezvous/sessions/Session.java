package com.rendezvous.sessions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.rendezvous.directory.AppRegistry;
import com.rendezvous.directory.Directory;
import com.rendezvous.mailbox.Mailbox;
import com.rendezvous.mailbox.Message;
import com.rendezvous.mailbox.Subscriber;
import com.rendezvous.observability.RelayMetrics;
import com.rendezvous.protocol.Command;
import com.rendezvous.protocol.CommandDecoder;
import com.rendezvous.protocol.FrameCodec;
import com.rendezvous.protocol.RendezvousException;
import com.rendezvous.protocol.Response;
import com.rendezvous.shared.config.WelcomeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.rendezvous.protocol.RendezvousException.Kind.ALREADY_ALLOCATED;
import static com.rendezvous.protocol.RendezvousException.Kind.ALREADY_BOUND;
import static com.rendezvous.protocol.RendezvousException.Kind.NOT_BOUND;

/**
 * Protocol state of one client connection. Commands are handled one at a time; closing stops
 * broadcasts but keeps claims.
 */
public class Session implements Command.Handler {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final String id;
    private final AppRegistry apps;
    private final WelcomeConfig welcome;
    private final FrameCodec codec;
    private final RelayMetrics metrics;
    private final Connection connection;

    private Directory directory;
    private String side;
    private boolean allocated;
    // both read by close(), which may run on another session's thread
    private final Map<String, Mailbox> claimed = new ConcurrentHashMap<>();
    private final Map<String, Mailbox> watching = new ConcurrentHashMap<>();

    private double receivedAt;
    private boolean closeRequested;
    private volatile boolean closed;

    public Session(String id, AppRegistry apps, WelcomeConfig welcome, FrameCodec codec,
                   RelayMetrics metrics, Connection connection) {
        this.id = id;
        this.apps = apps;
        this.welcome = welcome;
        this.codec = codec;
        this.metrics = metrics;
        this.connection = connection;
    }

    public String id() { return id; }

    public synchronized String appId() {
        return directory != null ? directory.appId() : null;
    }

    public synchronized String side() { return side; }

    public synchronized Set<String> claimedChannels() {
        return Set.copyOf(claimed.keySet());
    }

    public boolean isClosed() { return closed; }

    public void start() {
        send(new Response.Welcome(welcome));
    }

    public synchronized void receive(String payload) {
        JsonNode frame;
        try {
            frame = codec.parse(payload);
        } catch (RendezvousException e) {
            reject(e, TextNode.valueOf(payload));
            return;
        }
        receive(frame);
    }

    public synchronized void receive(JsonNode frame) {
        if (closed) return;
        receivedAt = codec.now();
        try {
            var type = CommandDecoder.typeOf(frame);
            if (frame.has("id")) {
                send(new Response.Ack(frame.get("id")));
            }
            if (directory == null && !CommandDecoder.allowedUnbound(type)) {
                throw new RendezvousException(NOT_BOUND, "Must bind first");
            }
            if (directory != null && CommandDecoder.BIND.equals(type)) {
                throw new RendezvousException(ALREADY_BOUND, "already bound");
            }
            CommandDecoder.decode(frame).dispatch(this);
        } catch (RendezvousException e) {
            reject(e, frame);
        } finally {
            if (closeRequested) {
                closeRequested = false;
                connection.close();
            }
        }
    }

    // not synchronized: the transport may report the close from another session's thread
    public void close() {
        if (closed) return;
        closed = true;
        watching.values().forEach(mailbox -> mailbox.unsubscribe(this));
        watching.clear();
        if (!claimed.isEmpty()) {
            log.debug("Session {} closed holding claims on {}", id, claimed.keySet());
        }
    }

    @Override
    public void onPing(Command.Ping ping) {
        send(new Response.Pong(ping.ping()));
    }

    @Override
    public void onBind(Command.Bind bind) {
        directory = apps.get(bind.appId());
        side = bind.side();
        log.debug("Session {} bound to app {} as side {}", id, bind.appId(), side);
    }

    @Override
    public void onList(Command.ListNameplates list) {
        send(new Response.Nameplates(directory.listWaiting()));
    }

    @Override
    public void onAllocate(Command.Allocate allocate) {
        if (allocated) {
            throw new RendezvousException(ALREADY_ALLOCATED, "You already allocated one channel, don't be greedy");
        }
        var mailbox = directory.allocate(side);
        allocated = true;
        claimed.put(mailbox.channelId(), mailbox);
        send(new Response.Nameplate(mailbox.channelId()));
    }

    @Override
    public void onClaim(Command.Claim claim) {
        if (!claimed.containsKey(claim.channelId())) {
            claimed.put(claim.channelId(), directory.claim(claim.channelId(), side));
        }
    }

    @Override
    public void onWatch(Command.Watch watch) {
        var mailbox = claimedOrThrow(watch.channelId(), "watching");
        mailbox.subscribe(this, new ChannelSubscriber(watch.channelId()));
        watching.put(watch.channelId(), mailbox);
        // close() may have swept watching before the put
        if (closed) {
            mailbox.unsubscribe(this);
        }
    }

    @Override
    public void onAdd(Command.Add add) {
        var mailbox = claimedOrThrow(add.channelId(), "adding");
        mailbox.add(new Message(side, add.phase(), add.body(), receivedAt, add.msgId()));
        metrics.messagesAdded().increment();
    }

    @Override
    public void onRelease(Command.Release release) {
        var mailbox = claimedOrThrow(release.channelId(), "releasing");
        var deleted = directory.release(mailbox, side, release.mood());
        claimed.remove(release.channelId());
        if (deleted) {
            watching.remove(release.channelId());
        }
        send(new Response.Released(deleted ? Response.Released.DELETED : Response.Released.WAITING));
    }

    private Mailbox claimedOrThrow(String channelId, String verb) {
        var mailbox = claimed.get(channelId);
        if (mailbox == null) {
            throw RendezvousException.notClaimed(verb);
        }
        return mailbox;
    }

    private void reject(RendezvousException e, JsonNode orig) {
        metrics.errors().increment();
        log.debug("Session {} rejected frame: {}", id, e.explain());
        send(new Response.Error(e.explain(), orig));
    }

    private void send(Response response) {
        if (closed) return;
        connection.send(response);
    }

    // during our own command the close waits until its responses are out
    private void mailboxDeleted(String channelId) {
        log.debug("Session {} closing: channel {} was deleted", id, channelId);
        if (Thread.holdsLock(this)) {
            closeRequested = true;
        } else {
            connection.close();
        }
    }

    private final class ChannelSubscriber implements Subscriber {

        private final String channelId;

        ChannelSubscriber(String channelId) {
            this.channelId = channelId;
        }

        @Override
        public void deliver(Message message) {
            send(new Response.MessageDelivery(channelId, message));
        }

        @Override
        public void close() {
            mailboxDeleted(channelId);
        }
    }
}
