package com.jetlang.h3.framing;

import com.jetlang.h3.transport.QuicTransport;

import java.util.EnumMap;
import java.util.Map;

public interface FramingFactory {

    /**
     * @return framing for the negotiated protocol or null if the protocol isn't supported.
     */
    HttpFraming create(FramingProtocol protocol, QuicTransport transport);

    /**
     * Only the legacy variant is available by default. The full HTTP/3 framing is registered by the
     * embedding transport.
     */
    static Registry defaults() {
        return new Registry().register(FramingProtocol.HTTP_0_9, Http09Framing::new);
    }

    interface Creator {
        HttpFraming create(QuicTransport transport);
    }

    class Registry implements FramingFactory {
        private final Map<FramingProtocol, Creator> creators = new EnumMap<>(FramingProtocol.class);

        public Registry register(FramingProtocol protocol, Creator creator) {
            creators.put(protocol, creator);
            return this;
        }

        public boolean supports(FramingProtocol protocol) {
            return creators.containsKey(protocol);
        }

        @Override
        public HttpFraming create(FramingProtocol protocol, QuicTransport transport) {
            Creator creator = creators.get(protocol);
            if (creator == null) {
                return null;
            }
            return creator.create(transport);
        }
    }
}
