package com.rendezvous.observability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelayMetricsTest {

    @Test
    void registersAllMeters() {
        var metrics = new RelayMetrics();
        assertNotNull(metrics.registry());
        assertNotNull(metrics.connections());
        assertNotNull(metrics.messagesAdded());
        assertNotNull(metrics.claims());
        assertNotNull(metrics.releases("happy"));
        assertNotNull(metrics.mailboxesDeleted());
        assertNotNull(metrics.errors());
    }

    @Test
    void countersIncrementCorrectly() {
        var metrics = new RelayMetrics();
        metrics.messagesAdded().increment();
        metrics.messagesAdded().increment();
        assertEquals(2.0, metrics.messagesAdded().count());
    }

    @Test
    void releaseMoodsAreBucketed() {
        var metrics = new RelayMetrics();
        metrics.releases("happy").increment();
        metrics.releases("ecstatic").increment();
        metrics.releases("furious").increment();
        metrics.releases(null).increment();

        assertEquals(1.0, metrics.releases("happy").count());
        assertEquals(2.0, metrics.releases("other").count());
        assertEquals(1.0, metrics.registry().get("rendezvous.releases").tag("mood", "none").counter().count());
    }
}
