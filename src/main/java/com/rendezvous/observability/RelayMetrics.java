package com.rendezvous.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Set;

public class RelayMetrics {

    // moods reported by well-behaved clients; anything else is bucketed
    private static final Set<String> KNOWN_MOODS = Set.of("happy", "lonely", "scary", "errory");

    private final MeterRegistry registry;

    public RelayMetrics() {
        this(new SimpleMeterRegistry());
    }

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter connections() {
        return Counter.builder("rendezvous.connections").register(registry);
    }

    public Counter messagesAdded() {
        return Counter.builder("rendezvous.messages.added").register(registry);
    }

    public Counter claims() {
        return Counter.builder("rendezvous.claims").register(registry);
    }

    public Counter releases(String mood) {
        return Counter.builder("rendezvous.releases").tag("mood", moodTag(mood)).register(registry);
    }

    public Counter mailboxesDeleted() {
        return Counter.builder("rendezvous.mailboxes.deleted").register(registry);
    }

    public Counter errors() {
        return Counter.builder("rendezvous.errors").register(registry);
    }

    static String moodTag(String mood) {
        if (mood == null) return "none";
        return KNOWN_MOODS.contains(mood) ? mood : "other";
    }
}
