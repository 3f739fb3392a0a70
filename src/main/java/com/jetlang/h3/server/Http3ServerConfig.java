package com.jetlang.h3.server;

import com.jetlang.h3.framing.FramingFactory;
import com.jetlang.h3.ws.ServerWebSocketCodec;
import com.jetlang.h3.ws.WebSocketCodec;

import java.nio.file.Path;
import java.time.Clock;

public class Http3ServerConfig {

    private String serverName = "jetlang-h3";
    private Clock clock = Clock.systemUTC();
    private FramingFactory framingFactory = FramingFactory.defaults();
    private WebSocketCodec.Factory webSocketCodecFactory = ServerWebSocketCodec::new;
    private ExceptionHandler exceptionHandler = new ExceptionHandler.Logging();
    private Path protocolEventLogPath;

    public String getServerName() {
        return serverName;
    }

    /**
     * Value of the server header on every response.
     */
    public Http3ServerConfig setServerName(String serverName) {
        this.serverName = serverName;
        return this;
    }

    public Clock getClock() {
        return clock;
    }

    public Http3ServerConfig setClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public FramingFactory getFramingFactory() {
        return framingFactory;
    }

    public Http3ServerConfig setFramingFactory(FramingFactory framingFactory) {
        this.framingFactory = framingFactory;
        return this;
    }

    public WebSocketCodec.Factory getWebSocketCodecFactory() {
        return webSocketCodecFactory;
    }

    public Http3ServerConfig setWebSocketCodecFactory(WebSocketCodec.Factory webSocketCodecFactory) {
        this.webSocketCodecFactory = webSocketCodecFactory;
        return this;
    }

    public ExceptionHandler getExceptionHandler() {
        return exceptionHandler;
    }

    public Http3ServerConfig setExceptionHandler(ExceptionHandler exceptionHandler) {
        this.exceptionHandler = exceptionHandler;
        return this;
    }

    /**
     * @return where protocol events are written as json on close, null when they aren't collected.
     */
    public Path getProtocolEventLogPath() {
        return protocolEventLogPath;
    }

    public Http3ServerConfig setProtocolEventLogPath(Path protocolEventLogPath) {
        this.protocolEventLogPath = protocolEventLogPath;
        return this;
    }
}
