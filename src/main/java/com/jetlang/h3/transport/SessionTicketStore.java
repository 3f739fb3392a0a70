package com.jetlang.h3.transport;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory resumption cache shared by every connection of a server. A ticket can be resumed once.
 */
public class SessionTicketStore implements SessionTicketFetcher, SessionTicketHandler {

    private final Object lock = new Object();
    private final Map<ByteBuffer, SessionTicket> tickets = new HashMap<>();

    public void add(SessionTicket ticket) {
        ByteBuffer label = ByteBuffer.wrap(ticket.getTicket());
        synchronized (lock) {
            tickets.put(label, ticket);
        }
    }

    public SessionTicket pop(byte[] label) {
        ByteBuffer key = ByteBuffer.wrap(label.clone());
        synchronized (lock) {
            return tickets.remove(key);
        }
    }

    public int size() {
        synchronized (lock) {
            return tickets.size();
        }
    }

    @Override
    public SessionTicket fetch(byte[] label) {
        return pop(label);
    }

    @Override
    public void onTicketIssued(SessionTicket ticket) {
        add(ticket);
    }
}
