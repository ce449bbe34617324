package com.rendezvous.directory;

import com.rendezvous.observability.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Partitions the channel namespace by application id; directories are created on first bind. */
public class AppRegistry {

    private static final Logger log = LoggerFactory.getLogger(AppRegistry.class);

    private final Map<String, Directory> apps = new ConcurrentHashMap<>();
    private final RelayMetrics metrics;

    public AppRegistry(RelayMetrics metrics) {
        this.metrics = metrics;
    }

    public Directory get(String appId) {
        return apps.computeIfAbsent(appId, id -> {
            log.info("Spawning app {}", id);
            return new Directory(id, metrics);
        });
    }

    public int appCount() {
        return apps.size();
    }

    public int mailboxCount() {
        return apps.values().stream().mapToInt(Directory::size).sum();
    }
}
