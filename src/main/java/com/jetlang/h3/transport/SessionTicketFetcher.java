package com.jetlang.h3.transport;

public interface SessionTicketFetcher {

    /**
     * @return the ticket issued under the label or null if there is none to resume.
     */
    SessionTicket fetch(byte[] label);
}
