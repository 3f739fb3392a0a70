package com.jetlang.h3.transport;

import java.time.Instant;
import java.util.Arrays;

/**
 * Resumption state issued to a client. The ticket bytes double as the label the client presents when it
 * reconnects.
 */
public class SessionTicket {

    private final byte[] ticket;
    private final int cipherSuite;
    private final String serverName;
    private final byte[] resumptionSecret;
    private final Instant notValidBefore;
    private final Instant notValidAfter;
    private final long ageAdd;

    public SessionTicket(byte[] ticket, int cipherSuite, String serverName, byte[] resumptionSecret,
                         Instant notValidBefore, Instant notValidAfter, long ageAdd) {
        this.ticket = ticket.clone();
        this.cipherSuite = cipherSuite;
        this.serverName = serverName;
        this.resumptionSecret = resumptionSecret.clone();
        this.notValidBefore = notValidBefore;
        this.notValidAfter = notValidAfter;
        this.ageAdd = ageAdd;
    }

    public byte[] getTicket() {
        return ticket.clone();
    }

    public int getCipherSuite() {
        return cipherSuite;
    }

    public String getServerName() {
        return serverName;
    }

    public byte[] getResumptionSecret() {
        return resumptionSecret.clone();
    }

    public Instant getNotValidBefore() {
        return notValidBefore;
    }

    public Instant getNotValidAfter() {
        return notValidAfter;
    }

    public long getAgeAdd() {
        return ageAdd;
    }

    @Override
    public String toString() {
        return "SessionTicket{" +
                "ticket=" + Arrays.toString(ticket) +
                ", cipherSuite=" + cipherSuite +
                ", serverName='" + serverName + '\'' +
                ", notValidAfter=" + notValidAfter +
                '}';
    }
}
