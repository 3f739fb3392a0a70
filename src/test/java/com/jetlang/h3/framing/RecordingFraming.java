package com.jetlang.h3.framing;

import com.jetlang.h3.transport.TransportEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records what handlers write and hands back no events of its own; tests feed framed events to the dispatcher.
 */
public class RecordingFraming implements HttpFraming {

    private final FramingProtocol protocol;
    private final List<Frame> frames = new ArrayList<>();
    private final List<TransportEvent> transportEvents = new ArrayList<>();

    public RecordingFraming(FramingProtocol protocol) {
        this.protocol = protocol;
    }

    public RecordingFraming() {
        this(FramingProtocol.HTTP_3);
    }

    @Override
    public FramingProtocol getProtocol() {
        return protocol;
    }

    @Override
    public List<HttpEvent> handleEvent(TransportEvent event) {
        transportEvents.add(event);
        return Collections.emptyList();
    }

    @Override
    public void sendHeaders(long streamId, HeaderList headers) {
        frames.add(new Frame(streamId, headers, null, false));
    }

    @Override
    public void sendData(long streamId, byte[] data, boolean endStream) {
        frames.add(new Frame(streamId, null, data, endStream));
    }

    public List<Frame> getFrames() {
        return frames;
    }

    public List<Frame> framesFor(long streamId) {
        List<Frame> result = new ArrayList<>();
        for (Frame frame : frames) {
            if (frame.streamId == streamId) {
                result.add(frame);
            }
        }
        return result;
    }

    public List<TransportEvent> getTransportEvents() {
        return transportEvents;
    }

    public static class Frame {
        public final long streamId;
        public final HeaderList headers;
        public final byte[] data;
        public final boolean endStream;

        Frame(long streamId, HeaderList headers, byte[] data, boolean endStream) {
            this.streamId = streamId;
            this.headers = headers;
            this.data = data;
            this.endStream = endStream;
        }

        public boolean isHeaders() {
            return headers != null;
        }

        @Override
        public String toString() {
            return isHeaders() ? "headers" + headers : "data{size=" + data.length + ", end=" + endStream + '}';
        }
    }
}
