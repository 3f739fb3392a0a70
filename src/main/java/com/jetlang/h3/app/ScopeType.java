package com.jetlang.h3.app;

public enum ScopeType {
    HTTP("http", "https"),
    WEBSOCKET("websocket", "wss");

    private final String name;
    private final String scheme;

    ScopeType(String name, String scheme) {
        this.name = name;
        this.scheme = scheme;
    }

    public String getName() {
        return name;
    }

    public String getScheme() {
        return scheme;
    }
}
