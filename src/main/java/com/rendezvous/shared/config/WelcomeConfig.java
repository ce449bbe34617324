package com.rendezvous.shared.config;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Contents of the {@code welcome} frame. Every field is optional: out-of-date clients warn on
 * {@code currentVersion}, all clients print {@code motd}, and {@code error} makes them give up.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WelcomeConfig(
    String currentVersion,
    String motd,
    String error
) {
    public static WelcomeConfig defaults() {
        return new WelcomeConfig(null, null, null);
    }
}
