package com.jetlang.h3.server;

import com.jetlang.h3.app.Application;
import com.jetlang.h3.app.InboundMessage;
import com.jetlang.h3.app.Receive;
import com.jetlang.h3.app.Scope;
import com.jetlang.h3.app.Send;
import com.jetlang.h3.framing.HttpEvent;
import com.jetlang.h3.framing.HttpFraming;
import com.jetlang.h3.transport.QuicTransport;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Bridges one stream to an application. All methods run on the connection's executor.
 */
public abstract class StreamHandler implements Receive, Send {

    protected static final byte[] empty = new byte[0];

    protected final long streamId;
    protected final Scope scope;
    protected final HttpFraming framing;
    protected final QuicTransport transport;
    protected final ResponseHeaders responseHeaders;
    protected final Mailbox<InboundMessage> mailbox;
    private boolean reset;

    StreamHandler(long streamId, Scope scope, HttpFraming framing, QuicTransport transport,
                  ResponseHeaders responseHeaders, Executor executor) {
        this.streamId = streamId;
        this.scope = scope;
        this.framing = framing;
        this.transport = transport;
        this.responseHeaders = responseHeaders;
        this.mailbox = new Mailbox<>(executor);
    }

    public long getStreamId() {
        return streamId;
    }

    public Scope getScope() {
        return scope;
    }

    public boolean isReset() {
        return reset;
    }

    /**
     * Data that arrived on the stream after the request headers.
     */
    public abstract void onFramingEvent(HttpEvent.DataReceived event);

    /**
     * The request headers also ended the stream.
     */
    public abstract void onRequestEnded();

    /**
     * Runs the application for this stream. The future fails with whatever the application failed with.
     */
    public abstract CompletableFuture<Void> runApplication(Application application);

    /**
     * The peer abandoned the stream. Output is dropped from now on and a pending receive is resolved.
     */
    public void onReset() {
        if (!reset) {
            reset = true;
            onStreamReset();
        }
    }

    protected abstract void onStreamReset();

    @Override
    public CompletableFuture<InboundMessage> receive() {
        return mailbox.take();
    }

    protected CompletableFuture<Void> call(Application application) {
        try {
            CompletionStage<Void> result = application.call(scope, this, this);
            if (result == null) {
                return CompletableFuture.completedFuture(null);
            }
            return result.toCompletableFuture();
        } catch (Exception failed) {
            return CompletableFuture.failedFuture(failed);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{streamId=" + streamId + ", scope=" + scope + '}';
    }
}
