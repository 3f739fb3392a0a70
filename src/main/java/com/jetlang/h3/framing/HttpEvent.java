package com.jetlang.h3.framing;

/**
 * Typed event produced by an {@link HttpFraming} from raw transport events.
 */
public abstract class HttpEvent {

    private final long streamId;

    HttpEvent(long streamId) {
        this.streamId = streamId;
    }

    public long getStreamId() {
        return streamId;
    }

    public abstract void accept(Visitor visitor);

    public interface Visitor {

        void onRequestReceived(RequestReceived event);

        void onDataReceived(DataReceived event);
    }

    /**
     * Request headers that open a stream.
     */
    public static class RequestReceived extends HttpEvent {
        private final HeaderList headers;
        private final boolean streamEnded;

        public RequestReceived(long streamId, HeaderList headers, boolean streamEnded) {
            super(streamId);
            this.headers = headers;
            this.streamEnded = streamEnded;
        }

        public HeaderList getHeaders() {
            return headers;
        }

        public boolean isStreamEnded() {
            return streamEnded;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onRequestReceived(this);
        }

        @Override
        public String toString() {
            return "RequestReceived{streamId=" + getStreamId() + ", headers=" + headers + ", streamEnded=" + streamEnded + '}';
        }
    }

    public static class DataReceived extends HttpEvent {
        private final byte[] data;
        private final boolean streamEnded;

        public DataReceived(long streamId, byte[] data, boolean streamEnded) {
            super(streamId);
            this.data = data;
            this.streamEnded = streamEnded;
        }

        public byte[] getData() {
            return data;
        }

        public boolean isStreamEnded() {
            return streamEnded;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.onDataReceived(this);
        }

        @Override
        public String toString() {
            return "DataReceived{streamId=" + getStreamId() + ", size=" + data.length + ", streamEnded=" + streamEnded + '}';
        }
    }
}
