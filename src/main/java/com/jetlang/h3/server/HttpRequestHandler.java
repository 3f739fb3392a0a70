package com.jetlang.h3.server;

import com.jetlang.h3.app.Application;
import com.jetlang.h3.app.InboundMessage;
import com.jetlang.h3.app.OutboundMessage;
import com.jetlang.h3.app.Scope;
import com.jetlang.h3.framing.HeaderList;
import com.jetlang.h3.framing.HttpEvent;
import com.jetlang.h3.framing.HttpFraming;
import com.jetlang.h3.transport.QuicTransport;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One request/response exchange. The response stream is ended when the application returns.
 */
public class HttpRequestHandler extends StreamHandler {

    private static final Logger LOGGER = Logger.getLogger(HttpRequestHandler.class.getName());

    enum State {
        AWAITING_BODY, STREAMING_BODY, HALF_CLOSED, CLOSED
    }

    private State state = State.AWAITING_BODY;
    private boolean headersSent;

    private final OutboundMessage.Visitor outbound = new OutboundMessage.Visitor() {
        @Override
        public void onResponseStart(OutboundMessage.ResponseStart message) {
            if (headersSent) {
                LOGGER.fine("Ignoring second http.response.start on stream " + streamId);
                return;
            }
            HeaderList headers = responseHeaders.create(message.getStatus()).addAll(message.getHeaders());
            framing.sendHeaders(streamId, headers);
            headersSent = true;
        }

        @Override
        public void onResponseBody(OutboundMessage.ResponseBody message) {
            if (!headersSent) {
                throw new IllegalStateException("http.response.body before http.response.start on stream " + streamId);
            }
            framing.sendData(streamId, message.getBody(), false);
        }

        @Override
        public void onWebSocketAccept(OutboundMessage.WebSocketAccept message) {
            throw wrongStream(message);
        }

        @Override
        public void onWebSocketSend(OutboundMessage.WebSocketSend message) {
            throw wrongStream(message);
        }

        @Override
        public void onWebSocketClose(OutboundMessage.WebSocketClose message) {
            throw wrongStream(message);
        }
    };

    HttpRequestHandler(long streamId, Scope scope, HttpFraming framing, QuicTransport transport,
                       ResponseHeaders responseHeaders, Executor executor) {
        super(streamId, scope, framing, transport, responseHeaders, executor);
    }

    State getState() {
        return state;
    }

    @Override
    public void onFramingEvent(HttpEvent.DataReceived event) {
        if (state == State.HALF_CLOSED || state == State.CLOSED) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Dropping " + event + " after end of request");
            }
            return;
        }
        mailbox.put(new InboundMessage.Request(event.getData(), !event.isStreamEnded()));
        state = event.isStreamEnded() ? State.HALF_CLOSED : State.STREAMING_BODY;
    }

    @Override
    public void onRequestEnded() {
        mailbox.put(new InboundMessage.Request(empty, false));
        state = State.HALF_CLOSED;
    }

    @Override
    public CompletableFuture<Void> runApplication(Application application) {
        return call(application)
                .thenRun(() -> {
                    if (!isReset()) {
                        framing.sendData(streamId, empty, true);
                        transport.transmit();
                    }
                })
                .whenComplete((ignored, failed) -> state = State.CLOSED);
    }

    @Override
    protected void onStreamReset() {
        state = State.CLOSED;
        mailbox.put(InboundMessage.Disconnect.INSTANCE);
    }

    @Override
    public void send(OutboundMessage message) {
        if (isReset()) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Dropping " + message + " on reset stream " + streamId);
            }
            return;
        }
        message.accept(outbound);
        transport.transmit();
    }

    private IllegalArgumentException wrongStream(OutboundMessage message) {
        return new IllegalArgumentException(message.getType() + " cannot be sent on http stream " + streamId);
    }
}
