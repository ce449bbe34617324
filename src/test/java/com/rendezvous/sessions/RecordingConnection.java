package com.rendezvous.sessions;

import com.rendezvous.protocol.Response;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

class RecordingConnection implements Connection {

    final List<Response> sent = new CopyOnWriteArrayList<>();
    volatile int closes;

    @Override
    public void send(Response response) {
        sent.add(response);
    }

    @Override
    public void close() {
        closes++;
    }

    List<String> types() {
        return sent.stream().map(Response::type).collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    <T extends Response> List<T> ofType(Class<T> type) {
        return (List<T>) sent.stream().filter(type::isInstance).collect(Collectors.toList());
    }

    Response last() {
        return sent.get(sent.size() - 1);
    }

    void clear() {
        sent.clear();
    }
}
