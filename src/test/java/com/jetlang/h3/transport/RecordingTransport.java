package com.jetlang.h3.transport;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

public class RecordingTransport implements QuicTransport {

    private final List<StreamData> sent = new ArrayList<>();
    private int transmits;

    @Override
    public synchronized void sendStreamData(long streamId, byte[] data, boolean endStream) {
        sent.add(new StreamData(streamId, data, endStream));
    }

    @Override
    public synchronized void transmit() {
        transmits++;
    }

    public synchronized List<StreamData> getSent() {
        return new ArrayList<>(sent);
    }

    public synchronized int getTransmits() {
        return transmits;
    }

    public synchronized byte[] bytesFor(long streamId) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (StreamData data : sent) {
            if (data.streamId == streamId) {
                out.write(data.data, 0, data.data.length);
            }
        }
        return out.toByteArray();
    }

    public static class StreamData {
        public final long streamId;
        public final byte[] data;
        public final boolean endStream;

        StreamData(long streamId, byte[] data, boolean endStream) {
            this.streamId = streamId;
            this.data = data;
            this.endStream = endStream;
        }
    }
}
