package com.rendezvous.gateway.http;

import com.rendezvous.directory.AppRegistry;
import com.rendezvous.gateway.ws.RendezvousWebSocketHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class StatusController {

    private final AppRegistry apps;
    private final RendezvousWebSocketHandler handler;

    public StatusController(AppRegistry apps, RendezvousWebSocketHandler handler) {
        this.apps = apps;
        this.handler = handler;
    }

    @GetMapping("/v1/status")
    public Map<String, Integer> status() {
        return Map.of(
            "apps", apps.appCount(),
            "mailboxes", apps.mailboxCount(),
            "connections", handler.connectionCount());
    }
}
