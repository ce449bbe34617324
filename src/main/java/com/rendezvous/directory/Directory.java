package com.rendezvous.directory;

import com.rendezvous.mailbox.Mailbox;
import com.rendezvous.observability.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Channels of one app. Creation and deletion happen inside per-key compute calls, so a
 * deleted mailbox is never claimed again.
 */
public class Directory {

    private static final Logger log = LoggerFactory.getLogger(Directory.class);

    private final String appId;
    private final RelayMetrics metrics;
    private final ConcurrentHashMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();

    public Directory(String appId, RelayMetrics metrics) {
        this.appId = appId;
        this.metrics = metrics;
    }

    public String appId() {
        return appId;
    }

    public Mailbox claim(String channelId, String side) {
        var mailbox = mailboxes.compute(channelId, (id, current) -> {
            var target = current != null ? current : new Mailbox(id);
            target.claim(side);
            return target;
        });
        metrics.claims().increment();
        return mailbox;
    }

    public Mailbox allocate(String side) {
        for (int i = 1; ; i++) {
            var created = new AtomicReference<Mailbox>();
            mailboxes.computeIfAbsent(String.valueOf(i), id -> {
                var mailbox = new Mailbox(id);
                mailbox.claim(side);
                created.set(mailbox);
                return mailbox;
            });
            if (created.get() != null) {
                metrics.claims().increment();
                log.debug("[{}] allocated channel {} for side {}", appId, created.get().channelId(), side);
                return created.get();
            }
        }
    }

    /** @return true if the mailbox was deleted */
    public boolean release(Mailbox mailbox, String side, String mood) {
        var released = new AtomicBoolean();
        var deleted = new AtomicBoolean();
        mailboxes.computeIfPresent(mailbox.channelId(), (id, current) -> {
            if (current != mailbox) {
                return current;
            }
            released.set(true);
            deleted.set(mailbox.release(side));
            return deleted.get() ? null : current;
        });
        if (!released.get()) {
            throw new IllegalStateException("Channel " + mailbox.channelId() + " is no longer live in app " + appId);
        }
        metrics.releases(mood).increment();
        log.info("[{}] side {} released channel {} (mood: {})", appId, side, mailbox.channelId(), mood);
        if (deleted.get()) {
            metrics.mailboxesDeleted().increment();
            mailbox.closeSubscribers();
        }
        return deleted.get();
    }

    // exactly one distinct side: waiting for a partner
    public List<String> listWaiting() {
        return mailboxes.values().stream()
                .filter(mailbox -> mailbox.sides().size() == 1)
                .map(Mailbox::channelId)
                .sorted()
                .toList();
    }

    public Optional<Mailbox> get(String channelId) {
        return Optional.ofNullable(mailboxes.get(channelId));
    }

    public int size() {
        return mailboxes.size();
    }
}
