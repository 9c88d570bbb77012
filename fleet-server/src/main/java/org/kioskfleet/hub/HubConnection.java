package org.kioskfleet.hub;

import java.io.IOException;

/**
 * One live real-time connection, admin console or device.
 */
public interface HubConnection {

    String id();

    boolean isOpen();

    /**
     * Writes one text frame. Must be safe to call from several threads.
     */
    void send(String payload) throws IOException;

    void close();
}
