package com.jetlang.h3.ws;

import java.nio.charset.StandardCharsets;

public abstract class WebSocketEvent {

    public abstract void accept(Visitor visitor);

    public interface Visitor {

        void onText(TextMessage event);

        void onBinary(BinaryMessage event);

        void onClose(CloseConnection event);

        void onPing(Ping event);

        void onPong(Pong event);
    }

    public static class TextMessage extends WebSocketEvent {
        private final String data;

        public TextMessage(String data) {
            this.data = data;
        }

        public String getData() {
            return data;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onText(this);
        }

        @Override
        public String toString() {
            return "TextMessage{" + data + '}';
        }
    }

    public static class BinaryMessage extends WebSocketEvent {
        private final byte[] data;

        public BinaryMessage(byte[] data) {
            this.data = data;
        }

        public byte[] getData() {
            return data;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onBinary(this);
        }

        @Override
        public String toString() {
            return "BinaryMessage{size=" + data.length + '}';
        }
    }

    public static class CloseConnection extends WebSocketEvent {
        public static final int NORMAL_CLOSURE = 1000;
        public static final int PROTOCOL_ERROR = 1002;
        public static final int NO_STATUS_RCVD = 1005;
        public static final int ABNORMAL_CLOSURE = 1006;
        public static final int INVALID_FRAME_PAYLOAD_DATA = 1007;
        public static final int MESSAGE_TOO_BIG = 1009;

        private final int code;
        private final String reason;

        public CloseConnection(int code, String reason) {
            this.code = code;
            this.reason = reason == null ? "" : reason;
        }

        public CloseConnection(int code) {
            this(code, "");
        }

        public int getCode() {
            return code;
        }

        public String getReason() {
            return reason;
        }

        byte[] getReasonBytes() {
            return reason.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onClose(this);
        }

        @Override
        public String toString() {
            return "CloseConnection{code=" + code + ", reason='" + reason + "'}";
        }
    }

    public static class Ping extends WebSocketEvent {
        private final byte[] payload;

        public Ping(byte[] payload) {
            this.payload = payload;
        }

        public byte[] getPayload() {
            return payload;
        }

        public Pong response() {
            return new Pong(payload);
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onPing(this);
        }
    }

    public static class Pong extends WebSocketEvent {
        private final byte[] payload;

        public Pong(byte[] payload) {
            this.payload = payload;
        }

        public byte[] getPayload() {
            return payload;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onPong(this);
        }
    }
}
