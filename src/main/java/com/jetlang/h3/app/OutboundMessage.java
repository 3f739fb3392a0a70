package com.jetlang.h3.app;

import com.jetlang.h3.framing.HeaderList;

import java.nio.charset.StandardCharsets;

/**
 * Messages an application hands to {@link Send}.
 */
public abstract class OutboundMessage {

    private final String type;

    OutboundMessage(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public abstract void accept(Visitor visitor);

    public interface Visitor {

        void onResponseStart(ResponseStart message);

        void onResponseBody(ResponseBody message);

        void onWebSocketAccept(WebSocketAccept message);

        void onWebSocketSend(WebSocketSend message);

        void onWebSocketClose(WebSocketClose message);
    }

    public static ResponseStart responseStart(int status, HeaderList headers) {
        return new ResponseStart(status, headers);
    }

    public static ResponseStart responseStart(int status) {
        return new ResponseStart(status, new HeaderList());
    }

    public static ResponseBody responseBody(byte[] body) {
        return new ResponseBody(body);
    }

    public static WebSocketAccept websocketAccept(String subprotocol) {
        return new WebSocketAccept(subprotocol, new HeaderList());
    }

    public static WebSocketAccept websocketAccept() {
        return websocketAccept(null);
    }

    public static WebSocketSend sendText(String text) {
        return new WebSocketSend(text, null);
    }

    public static WebSocketSend sendBytes(byte[] bytes) {
        return new WebSocketSend(null, bytes);
    }

    public static WebSocketClose close(int code) {
        return new WebSocketClose(code, "");
    }

    @Override
    public String toString() {
        return type;
    }

    public static class ResponseStart extends OutboundMessage {
        private final int status;
        private final HeaderList headers;

        public ResponseStart(int status, HeaderList headers) {
            super("http.response.start");
            this.status = status;
            this.headers = headers;
        }

        public int getStatus() {
            return status;
        }

        public HeaderList getHeaders() {
            return headers;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onResponseStart(this);
        }

        @Override
        public String toString() {
            return "http.response.start{status=" + status + ", headers=" + headers + '}';
        }
    }

    public static class ResponseBody extends OutboundMessage {
        private final byte[] body;

        public ResponseBody(byte[] body) {
            super("http.response.body");
            this.body = body;
        }

        public byte[] getBody() {
            return body;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onResponseBody(this);
        }
    }

    public static class WebSocketAccept extends OutboundMessage {
        private final String subprotocol;
        private final HeaderList headers;

        public WebSocketAccept(String subprotocol, HeaderList headers) {
            super("websocket.accept");
            this.subprotocol = subprotocol;
            this.headers = headers;
        }

        /**
         * @return the selected subprotocol or null if none was selected.
         */
        public String getSubprotocol() {
            return subprotocol;
        }

        public HeaderList getHeaders() {
            return headers;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onWebSocketAccept(this);
        }
    }

    /**
     * Exactly one of text or bytes is set.
     */
    public static class WebSocketSend extends OutboundMessage {
        private final String text;
        private final byte[] bytes;

        public WebSocketSend(String text, byte[] bytes) {
            super("websocket.send");
            if ((text == null) == (bytes == null)) {
                throw new IllegalArgumentException("websocket.send needs exactly one of text or bytes");
            }
            this.text = text;
            this.bytes = bytes;
        }

        public String getText() {
            return text;
        }

        public byte[] getBytes() {
            return bytes;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onWebSocketSend(this);
        }
    }

    public static class WebSocketClose extends OutboundMessage {
        // control frame payload of 125 less the two byte code
        public static final int MAX_REASON_BYTES = 123;

        private final int code;
        private final String reason;

        /**
         * @throws IllegalArgumentException if the reason doesn't fit in a close frame.
         */
        public WebSocketClose(int code, String reason) {
            super("websocket.close");
            this.code = code;
            this.reason = reason == null ? "" : reason;
            int length = this.reason.getBytes(StandardCharsets.UTF_8).length;
            if (length > MAX_REASON_BYTES) {
                throw new IllegalArgumentException("close reason of " + length + " bytes exceeds " + MAX_REASON_BYTES);
            }
        }

        public int getCode() {
            return code;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onWebSocketClose(this);
        }

        @Override
        public String toString() {
            return "websocket.close{code=" + code + '}';
        }
    }
}
