package com.jetlang.h3.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Collects per-connection protocol events so they can be dumped as json when the server stops.
 */
public class ProtocolEventLog {

    public static final ProtocolEventLog NONE = new ProtocolEventLog() {
        @Override
        public Trace startTrace(String connectionId) {
            return Trace.NONE;
        }
    };

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Object lock = new Object();
    private final List<Trace> traces = new ArrayList<>();

    public Trace startTrace(String connectionId) {
        Trace trace = new Trace(connectionId, System.nanoTime());
        synchronized (lock) {
            traces.add(trace);
        }
        return trace;
    }

    public List<Map<String, Object>> snapshot() {
        List<Trace> copy;
        synchronized (lock) {
            copy = new ArrayList<>(traces);
        }
        List<Map<String, Object>> result = new ArrayList<>(copy.size());
        for (Trace trace : copy) {
            result.add(trace.toMap());
        }
        return result;
    }

    public void writeTo(OutputStream out) throws IOException {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("traces", snapshot());
        MAPPER.writeValue(out, root);
    }

    public void writeTo(Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            writeTo(out);
        }
    }

    public static class Trace {

        public static final Trace NONE = new Trace("none", 0) {
            @Override
            public void record(String category, String event, Map<String, Object> data) {
            }
        };

        private final String connectionId;
        private final long startNanos;
        private final List<Map<String, Object>> events = new ArrayList<>();

        Trace(String connectionId, long startNanos) {
            this.connectionId = connectionId;
            this.startNanos = startNanos;
        }

        public void record(String category, String event, Map<String, Object> data) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("time", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            entry.put("category", category);
            entry.put("event", event);
            entry.put("data", data);
            synchronized (events) {
                events.add(entry);
            }
        }

        public String getConnectionId() {
            return connectionId;
        }

        public int size() {
            synchronized (events) {
                return events.size();
            }
        }

        Map<String, Object> toMap() {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("connection_id", connectionId);
            synchronized (events) {
                result.put("events", new ArrayList<>(events));
            }
            return result;
        }
    }
}
