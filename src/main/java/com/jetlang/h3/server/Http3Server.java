package com.jetlang.h3.server;

import com.jetlang.h3.app.Application;
import com.jetlang.h3.transport.ProtocolEventLog;
import com.jetlang.h3.transport.QuicTransport;
import com.jetlang.h3.transport.SessionTicketFetcher;
import com.jetlang.h3.transport.SessionTicketHandler;
import com.jetlang.h3.transport.SessionTicketStore;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.PoolFiberFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Serves one application over every connection the transport accepts. Each connection gets its own pool fiber
 * which serializes its streams, connections run in parallel.
 */
public class Http3Server {

    private static final Logger LOGGER = Logger.getLogger(Http3Server.class.getName());

    private final Application application;
    private final Http3ServerConfig config;
    private final ExecutorService executorService;
    private final PoolFiberFactory fiberFactory;
    private final SessionTicketStore ticketStore = new SessionTicketStore();
    private final ProtocolEventLog eventLog;
    private final AtomicLong connectionIds = new AtomicLong();

    public Http3Server(Application application, Http3ServerConfig config, ExecutorService executorService) {
        this.application = application;
        this.config = config;
        this.executorService = executorService;
        this.fiberFactory = new PoolFiberFactory(executorService);
        this.eventLog = config.getProtocolEventLogPath() != null ? new ProtocolEventLog() : ProtocolEventLog.NONE;
    }

    public Http3Server(Application application, Http3ServerConfig config) {
        this(application, config, Executors.newFixedThreadPool(Math.max(Runtime.getRuntime().availableProcessors(), 1)));
    }

    /**
     * Called by the transport for every accepted connection.
     */
    public QuicFiberConnection onNewConnection(QuicTransport transport) {
        final String connectionId = Long.toString(connectionIds.incrementAndGet());
        Fiber fiber = fiberFactory.create();
        ConnectionDispatcher dispatcher =
                new ConnectionDispatcher(transport, fiber, application, config, eventLog.startTrace(connectionId));
        fiber.start();
        LOGGER.fine("New connection " + connectionId);
        return new QuicFiberConnection(fiber, dispatcher);
    }

    public SessionTicketFetcher getSessionTicketFetcher() {
        return ticketStore;
    }

    public SessionTicketHandler getSessionTicketHandler() {
        return ticketStore;
    }

    public ProtocolEventLog getProtocolEventLog() {
        return eventLog;
    }

    /**
     * Stops every connection fiber and writes the protocol events when a path is configured.
     */
    public void close() throws IOException {
        fiberFactory.dispose();
        executorService.shutdown();
        Path path = config.getProtocolEventLogPath();
        if (path != null) {
            eventLog.writeTo(path);
            LOGGER.info("Protocol events written to " + path);
        }
    }
}
