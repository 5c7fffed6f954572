package com.hello.chatrealtime.support;

import com.hello.chatrealtime.registry.ConnectionHandle;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory connection handle that records every outbound event.
 */
public class RecordingConnectionHandle implements ConnectionHandle {

    public record SentEvent(String event, Object payload) {
    }

    private final String id;
    private final List<SentEvent> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile Integer closeCode;

    public RecordingConnectionHandle(String id) {
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String event, Object payload) {
        sent.add(new SentEvent(event, payload));
    }

    @Override
    public void close(int code, String reason) {
        open = false;
        closeCode = code;
    }

    public Integer getCloseCode() {
        return closeCode;
    }

    public List<SentEvent> getSent() {
        return List.copyOf(sent);
    }

    public List<String> eventNames() {
        return sent.stream().map(SentEvent::event).collect(Collectors.toList());
    }

    public <T> List<T> payloadsOf(String event, Class<T> type) {
        return sent.stream()
                .filter(e -> e.event().equals(event))
                .map(e -> type.cast(e.payload()))
                .collect(Collectors.toList());
    }

    public int count(String event) {
        return (int) sent.stream().filter(e -> e.event().equals(event)).count();
    }

    public void clear() {
        sent.clear();
    }
}
