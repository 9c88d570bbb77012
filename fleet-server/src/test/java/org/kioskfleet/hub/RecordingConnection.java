package org.kioskfleet.hub;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory connection that records every frame written to it.
 */
class RecordingConnection implements HubConnection {

    private final String id;
    final List<String> frames = new CopyOnWriteArrayList<>();
    volatile boolean open = true;
    volatile boolean failSends;
    volatile boolean closed;

    RecordingConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String payload) throws IOException {
        if (failSends) {
            throw new IOException("Broken pipe");
        }
        frames.add(payload);
    }

    @Override
    public void close() {
        open = false;
        closed = true;
    }
}
