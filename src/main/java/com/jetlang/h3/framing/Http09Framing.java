package com.jetlang.h3.framing;

import com.jetlang.h3.transport.QuicTransport;
import com.jetlang.h3.transport.TransportEvent;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * HTTP/0.9 over QUIC streams. The request is a single "METHOD PATH" line, the response is the raw stream data.
 */
public class Http09Framing implements HttpFraming {

    public static final Charset ascii = StandardCharsets.US_ASCII;
    private static final byte[] empty = new byte[0];

    private final QuicTransport transport;
    private final Map<Long, byte[]> partialRequestLines = new HashMap<>();
    private final Set<Long> requestsReceived = new HashSet<>();

    public Http09Framing(QuicTransport transport) {
        this.transport = transport;
    }

    @Override
    public FramingProtocol getProtocol() {
        return FramingProtocol.HTTP_0_9;
    }

    @Override
    public List<HttpEvent> handleEvent(TransportEvent event) {
        final List<HttpEvent> result = new ArrayList<>(2);
        event.accept(new TransportEvent.Visitor() {
            @Override
            public void onProtocolNegotiated(TransportEvent.ProtocolNegotiated event) {
            }

            @Override
            public void onStreamDataReceived(TransportEvent.StreamDataReceived event) {
                onStreamData(event, result);
            }

            @Override
            public void onStreamReset(TransportEvent.StreamReset event) {
                partialRequestLines.remove(event.getStreamId());
                requestsReceived.remove(event.getStreamId());
            }
        });
        return result;
    }

    private void onStreamData(TransportEvent.StreamDataReceived event, List<HttpEvent> result) {
        final long streamId = event.getStreamId();
        if (!isClientBidirectional(streamId)) {
            return;
        }
        if (requestsReceived.contains(streamId)) {
            if (event.isEndStream()) {
                requestsReceived.remove(streamId);
            }
            result.add(new HttpEvent.DataReceived(streamId, event.getData(), event.isEndStream()));
            return;
        }
        byte[] buffered = concat(partialRequestLines.remove(streamId), event.getData());
        int eol = find(buffered, (byte) '\n');
        if (eol < 0 && !event.isEndStream()) {
            partialRequestLines.put(streamId, buffered);
            return;
        }
        int lineEnd = eol < 0 ? buffered.length : eol;
        String line = new String(buffered, 0, lineEnd, ascii).trim();
        int space = line.indexOf(' ');
        String method = space < 0 ? line : line.substring(0, space);
        String path = space < 0 ? "" : line.substring(space + 1).trim();
        if (!event.isEndStream()) {
            requestsReceived.add(streamId);
        }
        result.add(new HttpEvent.RequestReceived(streamId, HeaderList.of(":method", method, ":path", path), false));
        byte[] remainder = eol < 0 ? empty : Arrays.copyOfRange(buffered, eol + 1, buffered.length);
        result.add(new HttpEvent.DataReceived(streamId, remainder, event.isEndStream()));
    }

    /**
     * @return streams with a partial request line or a request still receiving data.
     */
    int openStreams() {
        return partialRequestLines.size() + requestsReceived.size();
    }

    @Override
    public void sendHeaders(long streamId, HeaderList headers) {
        // responses carry no headers
    }

    @Override
    public void sendData(long streamId, byte[] data, boolean endStream) {
        transport.sendStreamData(streamId, data, endStream);
    }

    private static boolean isClientBidirectional(long streamId) {
        return streamId % 4 == 0;
    }

    private static byte[] concat(byte[] first, byte[] second) {
        if (first == null) {
            return second;
        }
        byte[] result = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, result, first.length, second.length);
        return result;
    }

    private static int find(byte[] array, byte c) {
        for (int i = 0; i < array.length; i++) {
            if (array[i] == c) {
                return i;
            }
        }
        return -1;
    }
}
