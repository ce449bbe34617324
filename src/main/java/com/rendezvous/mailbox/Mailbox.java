package com.rendezvous.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference-counted channel. Append plus fan-out and replay plus subscribe each hold the
 * monitor, so a watcher sees every message once, in order.
 */
public class Mailbox {

    private static final Logger log = LoggerFactory.getLogger(Mailbox.class);

    private final String channelId;
    private final Map<String, Integer> claims = new HashMap<>();
    private final List<Message> messages = new ArrayList<>();
    private final Map<Object, Subscriber> subscribers = new LinkedHashMap<>();
    private boolean deleted;

    public Mailbox(String channelId) {
        this.channelId = channelId;
    }

    public String channelId() {
        return channelId;
    }

    public synchronized void claim(String side) {
        checkLive();
        claims.merge(side, 1, Integer::sum);
    }

    // true once the last claim is gone; caller then runs closeSubscribers()
    public synchronized boolean release(String side) {
        checkLive();
        var held = claims.get(side);
        if (held == null) {
            throw new IllegalStateException("Side " + side + " holds no claim on " + channelId);
        }
        if (held == 1) {
            claims.remove(side);
        } else {
            claims.put(side, held - 1);
        }
        if (claims.isEmpty()) {
            deleted = true;
            messages.clear();
        }
        return deleted;
    }

    public synchronized void subscribe(Object handle, Subscriber subscriber) {
        checkLive();
        for (var message : messages) {
            subscriber.deliver(message);
        }
        subscribers.put(handle, subscriber);
    }

    public synchronized void unsubscribe(Object handle) {
        subscribers.remove(handle);
    }

    public synchronized void add(Message message) {
        checkLive();
        messages.add(message);
        // subscribers registered during fan-out do not see this message again
        for (var subscriber : List.copyOf(subscribers.values())) {
            try {
                subscriber.deliver(message);
            } catch (RuntimeException e) {
                log.warn("Delivery on channel {} failed: {}", channelId, e.getMessage());
            }
        }
    }

    public void closeSubscribers() {
        List<Subscriber> closing;
        synchronized (this) {
            if (!deleted) {
                throw new IllegalStateException("Mailbox " + channelId + " is still claimed");
            }
            closing = List.copyOf(subscribers.values());
            subscribers.clear();
        }
        for (var subscriber : closing) {
            try {
                subscriber.close();
            } catch (RuntimeException e) {
                log.warn("Closing watcher of channel {} failed: {}", channelId, e.getMessage());
            }
        }
    }

    public synchronized List<Message> messages() {
        return List.copyOf(messages);
    }

    public synchronized int claimCount() {
        return claims.values().stream().mapToInt(Integer::intValue).sum();
    }

    public synchronized Set<String> sides() {
        return Set.copyOf(claims.keySet());
    }

    public synchronized int subscriberCount() {
        return subscribers.size();
    }

    public synchronized boolean isDeleted() {
        return deleted;
    }

    private void checkLive() {
        if (deleted) {
            throw new IllegalStateException("Mailbox " + channelId + " was deleted");
        }
    }
}
