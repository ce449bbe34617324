package com.rendezvous.shared.config;

public record RelayConfig(
    int serverPort,
    boolean logRequests,
    WelcomeConfig welcome
) {
    public static RelayConfig defaults() {
        return new RelayConfig(ConfigLoader.DEFAULT_PORT, false, WelcomeConfig.defaults());
    }
}
