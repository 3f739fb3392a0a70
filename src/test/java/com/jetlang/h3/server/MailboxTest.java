package com.jetlang.h3.server;

import org.jetlang.core.SynchronousDisposingExecutor;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MailboxTest {

    private final List<Runnable> queued = new ArrayList<>();
    private final Mailbox<String> mailbox = new Mailbox<>(queued::add);

    @Test
    public void deliversInPutOrder() throws Exception {
        mailbox.put("a");
        mailbox.put("b");
        assertEquals(2, mailbox.size());
        assertEquals("a", mailbox.take().get());
        assertEquals("b", mailbox.take().get());
        assertTrue(queued.isEmpty());
    }

    @Test
    public void waitingTakerIsCompletedThroughExecutor() throws Exception {
        CompletableFuture<String> first = mailbox.take();
        CompletableFuture<String> second = mailbox.take();
        assertEquals(2, mailbox.waiting());
        mailbox.put("x");
        mailbox.put("y");
        assertFalse(first.isDone());
        assertEquals(2, queued.size());
        queued.forEach(Runnable::run);
        assertEquals("x", first.get());
        assertEquals("y", second.get());
        assertEquals(0, mailbox.size());
    }

    @Test
    public void failureAfterQueuedMessages() throws Exception {
        IllegalStateException cause = new IllegalStateException("violation");
        mailbox.put("last");
        mailbox.fail(cause);
        assertEquals("last", mailbox.take().get());
        try {
            mailbox.take().get();
            fail();
        } catch (ExecutionException e) {
            assertSame(cause, e.getCause());
        }
    }

    @Test
    public void failureCompletesWaitingTakers() {
        Mailbox<String> direct = new Mailbox<>(new SynchronousDisposingExecutor());
        CompletableFuture<String> waiting = direct.take();
        direct.fail(new IllegalStateException("gone"));
        assertTrue(waiting.isCompletedExceptionally());
        assertEquals(0, direct.waiting());
    }
}
