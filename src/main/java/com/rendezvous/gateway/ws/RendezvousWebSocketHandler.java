package com.rendezvous.gateway.ws;

import com.rendezvous.directory.AppRegistry;
import com.rendezvous.observability.RelayMetrics;
import com.rendezvous.protocol.FrameCodec;
import com.rendezvous.sessions.Session;
import com.rendezvous.shared.config.RelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class RendezvousWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RendezvousWebSocketHandler.class);

    static final String MDC_CONNECTION_ID = "rendezvous.connectionId";
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 1024 * 1024;

    private final AppRegistry apps;
    private final RelayConfig config;
    private final RelayMetrics metrics;
    private final FrameCodec codec;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public RendezvousWebSocketHandler(AppRegistry apps, RelayConfig config, RelayMetrics metrics, FrameCodec codec) {
        this.apps = apps;
        this.config = config;
        this.metrics = metrics;
        this.codec = codec;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) {
        if (config.logRequests()) {
            log.info("ws client connecting: {}", socket.getRemoteAddress());
        }
        var out = new ConcurrentWebSocketSessionDecorator(socket, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        var session = new Session(socket.getId(), apps, config.welcome(), codec, metrics,
                new WebSocketConnection(out, codec));
        sessions.put(socket.getId(), session);
        metrics.connections().increment();
        session.start();
    }

    @Override
    protected void handleTextMessage(WebSocketSession socket, TextMessage message) {
        var session = sessions.get(socket.getId());
        if (session == null) return;
        MDC.put(MDC_CONNECTION_ID, socket.getId());
        try {
            session.receive(message.getPayload());
        } finally {
            MDC.remove(MDC_CONNECTION_ID);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession socket, Throwable exception) {
        log.warn("Transport error on {}: {}", socket.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        var session = sessions.remove(socket.getId());
        if (session != null) {
            session.close();
            log.debug("Connection {} closed: {}", socket.getId(), status);
        }
    }

    public int connectionCount() {
        return sessions.size();
    }
}
