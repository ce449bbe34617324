package com.rendezvous.sessions;

import com.rendezvous.protocol.Response;

/** The transport under one {@link Session}. Sends may arrive from any thread. */
public interface Connection {

    void send(Response response);

    void close();
}
