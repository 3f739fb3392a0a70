package com.jetlang.h3.app;

import com.jetlang.h3.framing.HeaderList;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

public class OutboundMessageTest {

    @Test(expected = IllegalArgumentException.class)
    public void sendNeedsTextOrBytes() {
        new OutboundMessage.WebSocketSend(null, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void sendCannotCarryBoth() {
        new OutboundMessage.WebSocketSend("a", new byte[0]);
    }

    @Test
    public void typeNames() {
        assertEquals("http.response.start", OutboundMessage.responseStart(200).getType());
        assertEquals("http.response.body", OutboundMessage.responseBody(new byte[0]).getType());
        assertEquals("websocket.accept", OutboundMessage.websocketAccept().getType());
        assertEquals("websocket.send", OutboundMessage.sendText("x").getType());
        assertEquals("websocket.close", OutboundMessage.close(1000).getType());
        assertNull(OutboundMessage.websocketAccept().getSubprotocol());
        assertEquals("", OutboundMessage.close(1000).getReason());
    }

    @Test
    public void closeReasonMustFitAControlFrame() {
        String longest = repeat("r", OutboundMessage.WebSocketClose.MAX_REASON_BYTES);
        assertEquals(longest, new OutboundMessage.WebSocketClose(1000, longest).getReason());
        assertRejected(longest + "r");
        // two utf-8 bytes each
        assertRejected(repeat("\u00e9", 62));
    }

    private static void assertRejected(String reason) {
        try {
            new OutboundMessage.WebSocketClose(1000, reason);
            fail("accepted reason of " + reason.length() + " chars");
        } catch (IllegalArgumentException expected) {
        }
    }

    private static String repeat(String s, int times) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < times; i++) {
            result.append(s);
        }
        return result.toString();
    }

    @Test(expected = UnsupportedOperationException.class)
    public void scopeIsImmutable() {
        List<String> subprotocols = new ArrayList<>(Arrays.asList("chat"));
        Scope scope = new Scope(ScopeType.WEBSOCKET, "3", "CONNECT", "/", "", "/", HeaderList.of("host", "h"),
                subprotocols);
        subprotocols.add("other");
        assertEquals(Arrays.asList("chat"), scope.getSubprotocols());
        scope.getHeaders().add("x", "y");
    }
}
