package com.jetlang.h3.server;

import com.jetlang.h3.transport.TransportEvent;
import org.jetlang.fibers.Fiber;

/**
 * Thread safe face of a {@link ConnectionDispatcher}. Transport callbacks are queued onto the connection's fiber.
 */
public class QuicFiberConnection {

    private final Fiber fiber;
    private final ConnectionDispatcher dispatcher;

    public QuicFiberConnection(Fiber fiber, ConnectionDispatcher dispatcher) {
        this.fiber = fiber;
        this.dispatcher = dispatcher;
    }

    public void onTransportEvent(TransportEvent event) {
        fiber.execute(() -> dispatcher.onTransportEvent(event));
    }

    /**
     * Resets every live stream. The fiber is disposed after the disconnects queued by the resets are delivered.
     */
    public void onConnectionLost() {
        fiber.execute(() -> {
            dispatcher.close();
            fiber.execute(fiber::dispose);
        });
    }
}
