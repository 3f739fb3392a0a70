package com.jetlang.h3.app;

import java.nio.charset.StandardCharsets;

/**
 * Messages delivered to an application through {@link Receive}.
 */
public abstract class InboundMessage {

    private final String type;

    InboundMessage(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public abstract void accept(Visitor visitor);

    public interface Visitor {

        void onRequest(Request message);

        void onDisconnect(Disconnect message);

        void onWebSocketConnect(WebSocketConnect message);

        void onWebSocketReceive(WebSocketReceive message);

        void onWebSocketDisconnect(WebSocketDisconnect message);
    }

    @Override
    public String toString() {
        return type;
    }

    /**
     * A chunk of request body.
     */
    public static class Request extends InboundMessage {
        private final byte[] body;
        private final boolean moreBody;

        public Request(byte[] body, boolean moreBody) {
            super("http.request");
            this.body = body;
            this.moreBody = moreBody;
        }

        public byte[] getBody() {
            return body;
        }

        public boolean isMoreBody() {
            return moreBody;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onRequest(this);
        }

        @Override
        public String toString() {
            return "http.request{size=" + body.length + ", moreBody=" + moreBody + '}';
        }
    }

    /**
     * The stream was reset before the exchange finished.
     */
    public static class Disconnect extends InboundMessage {
        public static final Disconnect INSTANCE = new Disconnect();

        private Disconnect() {
            super("http.disconnect");
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onDisconnect(this);
        }
    }

    public static class WebSocketConnect extends InboundMessage {
        public static final WebSocketConnect INSTANCE = new WebSocketConnect();

        private WebSocketConnect() {
            super("websocket.connect");
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onWebSocketConnect(this);
        }
    }

    /**
     * Exactly one of text or bytes is set.
     */
    public static class WebSocketReceive extends InboundMessage {
        private final String text;
        private final byte[] bytes;

        private WebSocketReceive(String text, byte[] bytes) {
            super("websocket.receive");
            this.text = text;
            this.bytes = bytes;
        }

        public static WebSocketReceive text(String text) {
            return new WebSocketReceive(text, null);
        }

        public static WebSocketReceive bytes(byte[] bytes) {
            return new WebSocketReceive(null, bytes);
        }

        public String getText() {
            return text;
        }

        public byte[] getBytes() {
            return bytes;
        }

        public boolean isText() {
            return text != null;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onWebSocketReceive(this);
        }

        @Override
        public String toString() {
            return "websocket.receive{" + (isText() ? text : new String(bytes, StandardCharsets.ISO_8859_1)) + '}';
        }
    }

    public static class WebSocketDisconnect extends InboundMessage {
        private final int code;

        public WebSocketDisconnect(int code) {
            super("websocket.disconnect");
            this.code = code;
        }

        public int getCode() {
            return code;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onWebSocketDisconnect(this);
        }

        @Override
        public String toString() {
            return "websocket.disconnect{code=" + code + '}';
        }
    }
}
