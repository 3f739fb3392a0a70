package com.jetlang.h3.transport;

public abstract class TransportEvent {

    public abstract void accept(Visitor visitor);

    public interface Visitor {

        void onProtocolNegotiated(ProtocolNegotiated event);

        void onStreamDataReceived(StreamDataReceived event);

        void onStreamReset(StreamReset event);
    }

    public static class ProtocolNegotiated extends TransportEvent {
        private final String alpnProtocol;

        public ProtocolNegotiated(String alpnProtocol) {
            this.alpnProtocol = alpnProtocol;
        }

        public String getAlpnProtocol() {
            return alpnProtocol;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onProtocolNegotiated(this);
        }

        @Override
        public String toString() {
            return "ProtocolNegotiated{" + alpnProtocol + '}';
        }
    }

    public static class StreamDataReceived extends TransportEvent {
        private final long streamId;
        private final byte[] data;
        private final boolean endStream;

        public StreamDataReceived(long streamId, byte[] data, boolean endStream) {
            this.streamId = streamId;
            this.data = data;
            this.endStream = endStream;
        }

        public long getStreamId() {
            return streamId;
        }

        public byte[] getData() {
            return data;
        }

        public boolean isEndStream() {
            return endStream;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onStreamDataReceived(this);
        }

        @Override
        public String toString() {
            return "StreamDataReceived{streamId=" + streamId + ", size=" + data.length + ", endStream=" + endStream + '}';
        }
    }

    public static class StreamReset extends TransportEvent {
        private final long streamId;
        private final long errorCode;

        public StreamReset(long streamId, long errorCode) {
            this.streamId = streamId;
            this.errorCode = errorCode;
        }

        public long getStreamId() {
            return streamId;
        }

        public long getErrorCode() {
            return errorCode;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onStreamReset(this);
        }

        @Override
        public String toString() {
            return "StreamReset{streamId=" + streamId + ", errorCode=" + errorCode + '}';
        }
    }
}
