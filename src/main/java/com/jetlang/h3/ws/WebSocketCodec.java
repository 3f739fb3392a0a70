package com.jetlang.h3.ws;

import java.util.List;

/**
 * Server side of one WebSocket session carried on a single stream.
 */
public interface WebSocketCodec {

    /**
     * Parses as many complete frames as the buffered bytes allow. Partial frames are kept for the next call.
     */
    void receiveData(byte[] data) throws WebSocketProtocolException;

    /**
     * @return events decoded since the last call, in wire order.
     */
    List<WebSocketEvent> events();

    /**
     * @return the frame bytes for the event.
     */
    byte[] send(WebSocketEvent event);

    interface Factory {
        WebSocketCodec createServer();
    }
}
