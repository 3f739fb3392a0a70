package com.jetlang.h3.ws;

import java.net.ProtocolException;

/**
 * Raised by a codec when the peer violates RFC 6455. Carries the close code the violation maps to.
 */
public class WebSocketProtocolException extends ProtocolException {

    private final int closeCode;

    public WebSocketProtocolException(String message) {
        this(message, WebSocketEvent.CloseConnection.PROTOCOL_ERROR);
    }

    public WebSocketProtocolException(String message, int closeCode) {
        super(message);
        this.closeCode = closeCode;
    }

    public int getCloseCode() {
        return closeCode;
    }
}
