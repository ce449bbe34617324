package com.rendezvous.gateway.ws;

import com.rendezvous.protocol.FrameCodec;
import com.rendezvous.protocol.Response;
import com.rendezvous.sessions.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * Writes response frames to a WebSocket. Failures are logged and dropped: one dead peer
 * must not break fan-out to the other watchers of a mailbox.
 */
class WebSocketConnection implements Connection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);

    private final WebSocketSession socket;
    private final FrameCodec codec;

    WebSocketConnection(WebSocketSession socket, FrameCodec codec) {
        this.socket = socket;
        this.codec = codec;
    }

    @Override
    public void send(Response response) {
        if (!socket.isOpen()) return;
        try {
            socket.sendMessage(new TextMessage(codec.encode(response)));
        } catch (IOException | SessionLimitExceededException | IllegalStateException e) {
            log.warn("Failed to send {} to {}: {}", response.type(), socket.getId(), e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            socket.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", socket.getId(), e.getMessage());
        }
    }
}
