package com.example.filedrop.session;

import java.io.IOException;

/**
 * One client connection as seen by the hub. Implementations keep frames in
 * send order and never block the caller on a slow peer.
 */
public interface Transport {

    /** Set once by the transport layer when the connection is accepted. */
    boolean ownerOrigin();

    String remoteAddress();

    /**
     * Queues {@code text} for delivery and returns without waiting for the
     * peer.
     *
     * @throws IOException if the connection is closed or the peer has fallen
     *                     too far behind
     */
    void send(String text) throws IOException;

    void close(int code, String reason);

    boolean isOpen();
}
