package com.jetlang.h3.transport;

/**
 * Outbound side of one QUIC connection. Called only from the connection's fiber.
 */
public interface QuicTransport {

    void sendStreamData(long streamId, byte[] data, boolean endStream);

    /**
     * Sends whatever has been queued. Must be cheap when nothing is pending.
     */
    void transmit();
}
