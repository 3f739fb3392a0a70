package com.jetlang.h3.transport;

public interface SessionTicketHandler {

    void onTicketIssued(SessionTicket ticket);
}
