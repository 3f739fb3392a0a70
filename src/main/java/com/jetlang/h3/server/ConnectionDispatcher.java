package com.jetlang.h3.server;

import com.jetlang.h3.app.Application;
import com.jetlang.h3.app.Scope;
import com.jetlang.h3.app.ScopeType;
import com.jetlang.h3.framing.FramingFactory;
import com.jetlang.h3.framing.FramingProtocol;
import com.jetlang.h3.framing.HttpEvent;
import com.jetlang.h3.framing.HttpFraming;
import com.jetlang.h3.transport.ProtocolEventLog;
import com.jetlang.h3.transport.QuicTransport;
import com.jetlang.h3.transport.TransportEvent;
import com.jetlang.h3.ws.WebSocketCodec;
import org.jetlang.core.DisposingExecutor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for every event on one QUIC connection. Selects the framing on protocol negotiation, creates a
 * handler the first time a stream carries request headers and routes later stream data to it.
 *
 * <p>Not thread safe. Every method must be called on the connection's executor, which is also the executor the
 * handlers and the application run on.
 */
public class ConnectionDispatcher implements TransportEvent.Visitor, HttpEvent.Visitor {

    private static final Logger LOGGER = Logger.getLogger(ConnectionDispatcher.class.getName());

    private final QuicTransport transport;
    private final DisposingExecutor executor;
    private final Application application;
    private final FramingFactory framingFactory;
    private final WebSocketCodec.Factory codecFactory;
    private final ResponseHeaders responseHeaders;
    private final ExceptionHandler exceptionHandler;
    private final ProtocolEventLog.Trace trace;
    private final Map<Long, StreamHandler> handlers = new HashMap<>();
    private final RetiredStreams retired = new RetiredStreams();
    private boolean negotiated;
    private HttpFraming framing;

    public ConnectionDispatcher(QuicTransport transport, DisposingExecutor executor, Application application,
                                Http3ServerConfig config, ProtocolEventLog.Trace trace) {
        this.transport = transport;
        this.executor = executor;
        this.application = application;
        this.framingFactory = config.getFramingFactory();
        this.codecFactory = config.getWebSocketCodecFactory();
        this.responseHeaders = new ResponseHeaders(config.getServerName(), config.getClock());
        this.exceptionHandler = config.getExceptionHandler();
        this.trace = trace;
    }

    /**
     * Handles one transport event: negotiation and resets directly, stream data through the framing. Flushes once
     * at the end.
     */
    public void onTransportEvent(TransportEvent event) {
        event.accept(this);
        if (framing != null) {
            for (HttpEvent httpEvent : framing.handleEvent(event)) {
                httpEvent.accept(this);
            }
        }
        transport.transmit();
    }

    /**
     * The first negotiation decides the framing for the lifetime of the connection, later ones are ignored.
     */
    public void onTransportNegotiated(String alpnProtocol) {
        if (negotiated) {
            LOGGER.fine("Ignoring renegotiation to " + alpnProtocol);
            trace.record("transport", "negotiation_ignored", fields("alpn", alpnProtocol));
            return;
        }
        negotiated = true;
        trace.record("transport", "protocol_negotiated", fields("alpn", alpnProtocol));
        FramingProtocol protocol = FramingProtocol.forAlpn(alpnProtocol);
        if (protocol == null) {
            LOGGER.warning("Unrecognized application protocol " + alpnProtocol + ", stream events will be dropped");
            return;
        }
        framing = framingFactory.create(protocol, transport);
        if (framing == null) {
            LOGGER.warning("No framing registered for " + protocol + ", stream events will be dropped");
        }
    }

    /**
     * Dispatches an already framed event and flushes.
     */
    public void onFramingEvent(HttpEvent event) {
        event.accept(this);
        transport.transmit();
    }

    @Override
    public void onProtocolNegotiated(TransportEvent.ProtocolNegotiated event) {
        onTransportNegotiated(event.getAlpnProtocol());
    }

    @Override
    public void onStreamDataReceived(TransportEvent.StreamDataReceived event) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(event.toString());
        }
        trace.record("transport", "stream_data_received",
                fields("stream_id", event.getStreamId(), "length", event.getData().length, "fin", event.isEndStream()));
    }

    @Override
    public void onStreamReset(TransportEvent.StreamReset event) {
        final long streamId = event.getStreamId();
        trace.record("transport", "stream_reset", fields("stream_id", streamId, "error_code", event.getErrorCode()));
        retired.retire(streamId);
        StreamHandler handler = handlers.remove(streamId);
        if (handler != null) {
            handler.onReset();
        }
    }

    @Override
    public void onRequestReceived(HttpEvent.RequestReceived event) {
        final long streamId = event.getStreamId();
        if (handlers.containsKey(streamId) || retired.isRetired(streamId)) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Ignoring duplicate request on stream " + streamId);
            }
            return;
        }
        if (framing == null) {
            throw new IllegalStateException("Request on stream " + streamId + " before protocol negotiation");
        }
        Scope scope = ScopeParser.parse(event.getHeaders(), framing.getProtocol());
        final StreamHandler handler;
        if (scope.getType() == ScopeType.WEBSOCKET) {
            handler = new WebSocketHandler(streamId, scope, framing, transport, responseHeaders, executor, codecFactory);
        } else {
            handler = new HttpRequestHandler(streamId, scope, framing, transport, responseHeaders, executor);
        }
        handlers.put(streamId, handler);
        trace.record("http", "request_received", fields("stream_id", streamId, "type", scope.getType().getName(),
                "method", scope.getMethod(), "path", scope.getRawPath()));
        if (event.isStreamEnded()) {
            handler.onRequestEnded();
        }
        executor.execute(() -> start(handler));
    }

    @Override
    public void onDataReceived(HttpEvent.DataReceived event) {
        StreamHandler handler = handlers.get(event.getStreamId());
        if (handler == null) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Dropping " + event + " for unknown stream");
            }
            return;
        }
        handler.onFramingEvent(event);
    }

    private void start(StreamHandler handler) {
        CompletableFuture<Void> done = handler.runApplication(application);
        done.whenComplete((ignored, failed) -> executor.execute(() -> onStreamComplete(handler, failed)));
    }

    private void onStreamComplete(StreamHandler handler, Throwable failed) {
        final long streamId = handler.getStreamId();
        handlers.remove(streamId, handler);
        retired.retire(streamId);
        trace.record("http", "stream_closed", fields("stream_id", streamId, "failed", failed != null));
        if (failed != null) {
            exceptionHandler.onException(streamId, unwrap(failed));
        }
    }

    /**
     * The connection is gone. Every live stream is treated as reset.
     */
    public void close() {
        List<StreamHandler> live = new ArrayList<>(handlers.values());
        handlers.clear();
        for (StreamHandler handler : live) {
            retired.retire(handler.getStreamId());
            handler.onReset();
        }
        trace.record("transport", "connection_closed", fields("streams", live.size()));
    }

    public boolean isNegotiated() {
        return negotiated;
    }

    /**
     * @return the framing chosen on negotiation or null if none is in effect.
     */
    public HttpFraming getFraming() {
        return framing;
    }

    public int getActiveStreamCount() {
        return handlers.size();
    }

    StreamHandler getHandler(long streamId) {
        return handlers.get(streamId);
    }

    private static Throwable unwrap(Throwable failed) {
        if (failed instanceof CompletionException && failed.getCause() != null) {
            return failed.getCause();
        }
        return failed;
    }

    private static Map<String, Object> fields(Object... namesAndValues) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            result.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return result;
    }
}
