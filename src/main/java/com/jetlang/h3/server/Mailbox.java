package com.jetlang.h3.server;

import java.util.ArrayDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Unbounded FIFO of inbound messages for one stream. Confined to the connection's executor; takers waiting on an
 * empty mailbox are completed through that executor.
 */
public class Mailbox<T> {

    private final Executor executor;
    private final ArrayDeque<T> messages = new ArrayDeque<>();
    private final ArrayDeque<CompletableFuture<T>> takers = new ArrayDeque<>();
    private Throwable failure;

    public Mailbox(Executor executor) {
        this.executor = executor;
    }

    public void put(T message) {
        CompletableFuture<T> taker = takers.poll();
        if (taker != null) {
            executor.execute(() -> taker.complete(message));
        } else {
            messages.add(message);
        }
    }

    public CompletableFuture<T> take() {
        T next = messages.poll();
        if (next != null) {
            return CompletableFuture.completedFuture(next);
        }
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        CompletableFuture<T> taker = new CompletableFuture<>();
        takers.add(taker);
        return taker;
    }

    /**
     * Queued messages are still delivered; every take after them fails with the cause.
     */
    public void fail(Throwable cause) {
        if (failure != null) {
            return;
        }
        failure = cause;
        CompletableFuture<T> taker;
        while ((taker = takers.poll()) != null) {
            final CompletableFuture<T> waiting = taker;
            executor.execute(() -> waiting.completeExceptionally(cause));
        }
    }

    public int size() {
        return messages.size();
    }

    public int waiting() {
        return takers.size();
    }
}
