package com.jetlang.h3.app;

import java.util.concurrent.CompletableFuture;

public interface Receive {

    /**
     * @return the next inbound message for the stream. Completes on the connection's fiber, in arrival order.
     */
    CompletableFuture<InboundMessage> receive();
}
