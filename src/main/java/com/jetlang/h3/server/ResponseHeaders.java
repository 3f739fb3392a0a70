package com.jetlang.h3.server;

import com.jetlang.h3.framing.HeaderList;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

class ResponseHeaders {

    // RFC 1123 with a two digit day, as HTTP dates are written
    static final DateTimeFormatter HTTP_DATE =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);

    private final String serverName;
    private final Clock clock;

    ResponseHeaders(String serverName, Clock clock) {
        this.serverName = serverName;
        this.clock = clock;
    }

    HeaderList create(int status) {
        return new HeaderList()
                .add(":status", Integer.toString(status))
                .add("server", serverName)
                .add("date", HTTP_DATE.format(clock.instant()));
    }
}
