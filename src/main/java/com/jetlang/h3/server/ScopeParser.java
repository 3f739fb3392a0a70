package com.jetlang.h3.server;

import com.jetlang.h3.app.Scope;
import com.jetlang.h3.app.ScopeType;
import com.jetlang.h3.framing.FramingProtocol;
import com.jetlang.h3.framing.HeaderList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Builds the {@link Scope} of a stream from the headers that opened it.
 */
public final class ScopeParser {

    private ScopeParser() {
    }

    public static Scope parse(HeaderList requestHeaders, FramingProtocol protocol) {
        HeaderList headers = new HeaderList();
        String method = "";
        String rawPath = "";
        String upgrade = null;
        for (HeaderList.Header header : requestHeaders) {
            final String name = header.getName();
            switch (name) {
                case ":authority":
                    headers.add("host", header.getValue());
                    break;
                case ":method":
                    method = header.getValue();
                    break;
                case ":path":
                    rawPath = header.getValue();
                    break;
                case ":protocol":
                    upgrade = header.getValue();
                    break;
                default:
                    if (!name.isEmpty() && !header.isPseudoHeader()) {
                        headers.add(name.toLowerCase(Locale.ROOT), header.getValue());
                    }
            }
        }
        final int query = rawPath.indexOf('?');
        final String path = query < 0 ? rawPath : rawPath.substring(0, query);
        final String queryString = query < 0 ? "" : rawPath.substring(query + 1);
        if (isWebSocketUpgrade(method, upgrade)) {
            return new Scope(ScopeType.WEBSOCKET, protocol.getHttpVersion(), method, path, queryString, rawPath,
                    headers, subprotocols(requestHeaders));
        }
        return new Scope(ScopeType.HTTP, protocol.getHttpVersion(), method, path, queryString, rawPath,
                headers, Collections.emptyList());
    }

    static boolean isWebSocketUpgrade(String method, String upgrade) {
        return "CONNECT".equals(method) && "websocket".equals(upgrade);
    }

    private static List<String> subprotocols(HeaderList requestHeaders) {
        List<String> result = new ArrayList<>();
        String offered = null;
        for (HeaderList.Header header : requestHeaders) {
            if (header.getName().equalsIgnoreCase("sec-websocket-protocol")) {
                offered = header.getValue();
            }
        }
        if (offered != null) {
            for (String candidate : offered.split(",")) {
                String trimmed = candidate.trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return result;
    }
}
