package com.rendezvous.gateway.ws;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.*;

class WebSocketConfigTest {

    @Test
    void registersHandlerOnConfiguredPathAndOrigins() {
        var handler = mock(RendezvousWebSocketHandler.class);
        var registry = mock(WebSocketHandlerRegistry.class);
        var registration = mock(WebSocketHandlerRegistration.class);
        when(registry.addHandler(handler, "/relay")).thenReturn(registration);
        when(registration.setAllowedOrigins("https://a.example", "https://b.example")).thenReturn(registration);

        new WebSocketConfig(handler, "/relay", new String[] {"https://a.example", "https://b.example"})
                .registerWebSocketHandlers(registry);

        verify(registry).addHandler(handler, "/relay");
        verify(registration).setAllowedOrigins("https://a.example", "https://b.example");
    }

    @Test
    void containerCapsTextFrames() {
        var config = new WebSocketConfig(mock(RendezvousWebSocketHandler.class), "/v1", new String[] {"*"});
        var container = config.webSocketContainer(4096);
        assertEquals(4096, container.getMaxTextMessageBufferSize());
    }
}
