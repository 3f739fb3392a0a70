package com.jetlang.h3.server;

import com.jetlang.h3.app.Application;
import com.jetlang.h3.app.InboundMessage;
import com.jetlang.h3.app.OutboundMessage;
import com.jetlang.h3.app.Scope;
import com.jetlang.h3.framing.HeaderList;
import com.jetlang.h3.framing.HttpEvent;
import com.jetlang.h3.framing.HttpFraming;
import com.jetlang.h3.transport.QuicTransport;
import com.jetlang.h3.ws.WebSocketCodec;
import com.jetlang.h3.ws.WebSocketEvent;
import com.jetlang.h3.ws.WebSocketProtocolException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A websocket session bootstrapped by an extended CONNECT. The application always sees websocket.connect first
 * and the session is closed exactly once, by the application or on its behalf when it returns.
 */
public class WebSocketHandler extends StreamHandler {

    private static final Logger LOGGER = Logger.getLogger(WebSocketHandler.class.getName());

    enum State {
        CONNECTING, OPEN, CLOSING, CLOSED
    }

    private final WebSocketCodec.Factory codecFactory;
    private final List<byte[]> receivedBeforeAccept = new ArrayList<>();
    private WebSocketCodec codec;
    private State state = State.CONNECTING;
    private boolean closed;
    private boolean closeReceived;
    private boolean peerEnded;
    private WebSocketProtocolException violation;

    private final WebSocketEvent.Visitor inbound = new WebSocketEvent.Visitor() {
        @Override
        public void onText(WebSocketEvent.TextMessage event) {
            mailbox.put(InboundMessage.WebSocketReceive.text(event.getData()));
        }

        @Override
        public void onBinary(WebSocketEvent.BinaryMessage event) {
            mailbox.put(InboundMessage.WebSocketReceive.bytes(event.getData()));
        }

        @Override
        public void onClose(WebSocketEvent.CloseConnection event) {
            closeReceived = true;
            if (state == State.OPEN) {
                state = State.CLOSING;
            }
            mailbox.put(new InboundMessage.WebSocketDisconnect(event.getCode()));
        }

        @Override
        public void onPing(WebSocketEvent.Ping event) {
            if (!closed) {
                framing.sendData(streamId, codec.send(event.response()), false);
            }
        }

        @Override
        public void onPong(WebSocketEvent.Pong event) {
        }
    };

    private final OutboundMessage.Visitor outbound = new OutboundMessage.Visitor() {
        @Override
        public void onResponseStart(OutboundMessage.ResponseStart message) {
            throw wrongStream(message);
        }

        @Override
        public void onResponseBody(OutboundMessage.ResponseBody message) {
            throw wrongStream(message);
        }

        @Override
        public void onWebSocketAccept(OutboundMessage.WebSocketAccept message) {
            if (codec != null || closed) {
                throw new IllegalStateException("websocket.accept in state " + state + " on stream " + streamId);
            }
            codec = codecFactory.createServer();
            HeaderList headers = responseHeaders.create(200);
            if (message.getSubprotocol() != null) {
                headers.add("sec-websocket-protocol", message.getSubprotocol());
            }
            headers.addAll(message.getHeaders());
            framing.sendHeaders(streamId, headers);
            state = State.OPEN;
            List<byte[]> buffered = new ArrayList<>(receivedBeforeAccept);
            receivedBeforeAccept.clear();
            for (byte[] data : buffered) {
                receiveData(data);
            }
        }

        @Override
        public void onWebSocketSend(OutboundMessage.WebSocketSend message) {
            if (codec == null) {
                throw new IllegalStateException("websocket.send before websocket.accept on stream " + streamId);
            }
            if (closed) {
                LOGGER.fine("Dropping websocket.send after close on stream " + streamId);
                return;
            }
            final byte[] data;
            if (message.getText() != null) {
                data = codec.send(new WebSocketEvent.TextMessage(message.getText()));
            } else {
                data = codec.send(new WebSocketEvent.BinaryMessage(message.getBytes()));
            }
            framing.sendData(streamId, data, false);
        }

        @Override
        public void onWebSocketClose(OutboundMessage.WebSocketClose message) {
            if (closed) {
                LOGGER.fine("Ignoring repeated websocket.close on stream " + streamId);
                return;
            }
            close(message.getCode(), message.getReason());
        }
    };

    WebSocketHandler(long streamId, Scope scope, HttpFraming framing, QuicTransport transport,
                     ResponseHeaders responseHeaders, Executor executor, WebSocketCodec.Factory codecFactory) {
        super(streamId, scope, framing, transport, responseHeaders, executor);
        this.codecFactory = codecFactory;
        mailbox.put(InboundMessage.WebSocketConnect.INSTANCE);
    }

    State getState() {
        return state;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void onFramingEvent(HttpEvent.DataReceived event) {
        if (state == State.CLOSED) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Dropping " + event + " on closed websocket");
            }
            return;
        }
        if (codec == null) {
            if (event.isStreamEnded()) {
                // nothing buffered can be answered once the peer is gone
                receivedBeforeAccept.clear();
                onPeerEnded();
            } else {
                receivedBeforeAccept.add(event.getData());
            }
            return;
        }
        receiveData(event.getData());
        if (event.isStreamEnded()) {
            onPeerEnded();
        }
    }

    /**
     * The peer finished its side of the stream. Without a close frame the session ended abnormally.
     */
    private void onPeerEnded() {
        if (peerEnded) {
            return;
        }
        peerEnded = true;
        if (closeReceived || violation != null) {
            return;
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Stream " + streamId + " ended without a close frame");
        }
        if (state == State.OPEN) {
            state = State.CLOSING;
        }
        mailbox.put(new InboundMessage.WebSocketDisconnect(WebSocketEvent.CloseConnection.ABNORMAL_CLOSURE));
    }

    private void receiveData(byte[] data) {
        if (violation != null) {
            return;
        }
        try {
            codec.receiveData(data);
        } catch (WebSocketProtocolException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Protocol violation on stream " + streamId + ": " + e.getMessage());
            }
            violation = e;
        }
        for (WebSocketEvent event : codec.events()) {
            event.accept(inbound);
        }
        if (violation != null) {
            mailbox.fail(violation);
        }
    }

    @Override
    public void onRequestEnded() {
        LOGGER.fine("Extended CONNECT ended its stream before the session started: " + streamId);
        onPeerEnded();
    }

    @Override
    public CompletableFuture<Void> runApplication(Application application) {
        return call(application).whenComplete((ignored, failed) -> {
            try {
                if (!closed && !isReset()) {
                    close(violation != null ? violation.getCloseCode() : WebSocketEvent.CloseConnection.NORMAL_CLOSURE, "");
                    transport.transmit();
                }
            } finally {
                state = State.CLOSED;
            }
        });
    }

    private void close(int code, String reason) {
        closed = true;
        if (codec == null) {
            // never accepted, reject the upgrade
            framing.sendHeaders(streamId, responseHeaders.create(403));
            framing.sendData(streamId, empty, true);
        } else {
            framing.sendData(streamId, codec.send(new WebSocketEvent.CloseConnection(code, reason)), true);
        }
        state = state == State.CLOSING ? State.CLOSED : State.CLOSING;
    }

    @Override
    protected void onStreamReset() {
        state = State.CLOSED;
        mailbox.put(new InboundMessage.WebSocketDisconnect(WebSocketEvent.CloseConnection.ABNORMAL_CLOSURE));
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
        return new IllegalArgumentException(message.getType() + " cannot be sent on websocket stream " + streamId);
    }
}
