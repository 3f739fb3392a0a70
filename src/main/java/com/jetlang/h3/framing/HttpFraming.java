package com.jetlang.h3.framing;

import com.jetlang.h3.transport.TransportEvent;

import java.util.List;

/**
 * Turns transport events on one connection into header/data events and frames outbound headers and data.
 * Instances are confined to the connection's fiber.
 */
public interface HttpFraming {

    FramingProtocol getProtocol();

    List<HttpEvent> handleEvent(TransportEvent event);

    void sendHeaders(long streamId, HeaderList headers);

    void sendData(long streamId, byte[] data, boolean endStream);
}
