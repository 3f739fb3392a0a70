package com.jetlang.h3.framing;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public enum FramingProtocol {
    HTTP_3("3", "h3-22", "h3"),
    HTTP_0_9("0.9", "hq-22", "hq-interop");

    private final String httpVersion;
    private final List<String> alpnProtocols;

    FramingProtocol(String httpVersion, String... alpnProtocols) {
        this.httpVersion = httpVersion;
        this.alpnProtocols = Collections.unmodifiableList(Arrays.asList(alpnProtocols));
    }

    public String getHttpVersion() {
        return httpVersion;
    }

    public List<String> getAlpnProtocols() {
        return alpnProtocols;
    }

    /**
     * @return the protocol negotiated by the alpn name or null if the name isn't recognized.
     */
    public static FramingProtocol forAlpn(String alpnProtocol) {
        for (FramingProtocol protocol : values()) {
            if (protocol.alpnProtocols.contains(alpnProtocol)) {
                return protocol;
            }
        }
        return null;
    }
}
