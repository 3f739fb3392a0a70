package com.jetlang.h3.app;

import com.jetlang.h3.framing.HeaderList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable description of the request that opened a stream.
 */
public class Scope {

    private final ScopeType type;
    private final String httpVersion;
    private final String method;
    private final String path;
    private final String queryString;
    private final String rawPath;
    private final HeaderList headers;
    private final List<String> subprotocols;

    public Scope(ScopeType type, String httpVersion, String method, String path, String queryString, String rawPath,
                 HeaderList headers, List<String> subprotocols) {
        this.type = type;
        this.httpVersion = httpVersion;
        this.method = method;
        this.path = path;
        this.queryString = queryString;
        this.rawPath = rawPath;
        this.headers = headers.unmodifiable();
        this.subprotocols = Collections.unmodifiableList(new ArrayList<>(subprotocols));
    }

    public ScopeType getType() {
        return type;
    }

    public String getHttpVersion() {
        return httpVersion;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    /**
     * @return the query without the leading '?', empty when the path has none.
     */
    public String getQueryString() {
        return queryString;
    }

    public String getRawPath() {
        return rawPath;
    }

    public String getRootPath() {
        return "";
    }

    public String getScheme() {
        return type.getScheme();
    }

    /**
     * @return request headers in arrival order, lower-cased names, no pseudo-headers.
     */
    public HeaderList getHeaders() {
        return headers;
    }

    /**
     * @return subprotocols offered by a websocket client, empty for http.
     */
    public List<String> getSubprotocols() {
        return subprotocols;
    }

    @Override
    public String toString() {
        return "Scope{" +
                "type=" + type.getName() +
                ", httpVersion='" + httpVersion + '\'' +
                ", method='" + method + '\'' +
                ", rawPath='" + rawPath + '\'' +
                ", headers=" + headers +
                '}';
    }
}
