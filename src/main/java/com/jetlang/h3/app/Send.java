package com.jetlang.h3.app;

public interface Send {

    /**
     * Frames the message and flushes the connection. Must be called from the connection's fiber.
     */
    void send(OutboundMessage message);
}
