package com.jetlang.h3.ws;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ServerWebSocketCodecTest {

    private final ServerWebSocketCodec codec = new ServerWebSocketCodec();

    @Test
    public void textAndBinaryInOneChunk() throws Exception {
        codec.receiveData(ClientFrames.concat(ClientFrames.text("hello"), ClientFrames.binary(new byte[]{1, 2, 3})));
        List<WebSocketEvent> events = codec.events();
        assertEquals(2, events.size());
        assertEquals("hello", ((WebSocketEvent.TextMessage) events.get(0)).getData());
        assertArrayEquals(new byte[]{1, 2, 3}, ((WebSocketEvent.BinaryMessage) events.get(1)).getData());
        assertTrue(codec.events().isEmpty());
    }

    @Test
    public void frameSplitAcrossReads() throws Exception {
        byte[] frame = ClientFrames.text("split across reads");
        for (byte b : frame) {
            codec.receiveData(new byte[]{b});
        }
        List<WebSocketEvent> events = codec.events();
        assertEquals(1, events.size());
        assertEquals("split across reads", ((WebSocketEvent.TextMessage) events.get(0)).getData());
    }

    @Test
    public void mediumAndLargeLengths() throws Exception {
        byte[] medium = new byte[300];
        Arrays.fill(medium, (byte) 7);
        byte[] large = new byte[70000];
        Arrays.fill(large, (byte) 9);
        codec.receiveData(ClientFrames.binary(medium));
        codec.receiveData(ClientFrames.binary(large));
        List<WebSocketEvent> events = codec.events();
        assertArrayEquals(medium, ((WebSocketEvent.BinaryMessage) events.get(0)).getData());
        assertArrayEquals(large, ((WebSocketEvent.BinaryMessage) events.get(1)).getData());
    }

    @Test
    public void fragmentsAreReassembled() throws Exception {
        codec.receiveData(ClientFrames.frame(ServerWebSocketCodec.OPCODE_TEXT, false, "frag".getBytes(StandardCharsets.UTF_8)));
        codec.receiveData(ClientFrames.ping(new byte[]{5}));
        codec.receiveData(ClientFrames.frame(ServerWebSocketCodec.OPCODE_CONT, true, "mented".getBytes(StandardCharsets.UTF_8)));
        List<WebSocketEvent> events = codec.events();
        assertEquals(2, events.size());
        assertArrayEquals(new byte[]{5}, ((WebSocketEvent.Ping) events.get(0)).getPayload());
        assertEquals("fragmented", ((WebSocketEvent.TextMessage) events.get(1)).getData());
    }

    @Test
    public void closeWithCodeAndEmptyClose() throws Exception {
        codec.receiveData(ClientFrames.close(1001));
        WebSocketEvent.CloseConnection close = (WebSocketEvent.CloseConnection) codec.events().get(0);
        assertEquals(1001, close.getCode());

        ServerWebSocketCodec other = new ServerWebSocketCodec();
        other.receiveData(ClientFrames.frame(ServerWebSocketCodec.OPCODE_CLOSE, true, new byte[0]));
        close = (WebSocketEvent.CloseConnection) other.events().get(0);
        assertEquals(WebSocketEvent.CloseConnection.NO_STATUS_RCVD, close.getCode());
    }

    @Test
    public void dataAfterCloseIsDiscarded() throws Exception {
        codec.receiveData(ClientFrames.concat(ClientFrames.close(1000), ClientFrames.text("late")));
        assertEquals(1, codec.events().size());
        codec.receiveData(ClientFrames.text("later"));
        assertTrue(codec.events().isEmpty());
    }

    @Test
    public void unmaskedFrameIsAProtocolError() throws Exception {
        assertViolation(new byte[]{(byte) 0x81, 0x01, 'a'}, WebSocketEvent.CloseConnection.PROTOCOL_ERROR);
    }

    @Test
    public void reservedBitsAreAProtocolError() throws Exception {
        byte[] frame = ClientFrames.text("x");
        frame[0] |= 0x40;
        assertViolation(frame, WebSocketEvent.CloseConnection.PROTOCOL_ERROR);
    }

    @Test
    public void continuationWithoutMessage() throws Exception {
        assertViolation(ClientFrames.frame(ServerWebSocketCodec.OPCODE_CONT, true, new byte[]{1}),
                WebSocketEvent.CloseConnection.PROTOCOL_ERROR);
    }

    @Test
    public void fragmentedControlFrame() throws Exception {
        assertViolation(ClientFrames.frame(ServerWebSocketCodec.OPCODE_PING, false, new byte[0]),
                WebSocketEvent.CloseConnection.PROTOCOL_ERROR);
    }

    @Test
    public void unknownOpcode() throws Exception {
        assertViolation(ClientFrames.frame((byte) 0x3, true, new byte[0]), WebSocketEvent.CloseConnection.PROTOCOL_ERROR);
    }

    @Test
    public void invalidUtf8() throws Exception {
        assertViolation(ClientFrames.frame(ServerWebSocketCodec.OPCODE_TEXT, true, new byte[]{(byte) 0xC3, 0x28}),
                WebSocketEvent.CloseConnection.INVALID_FRAME_PAYLOAD_DATA);
    }

    @Test
    public void failureIsSticky() throws Exception {
        assertViolation(new byte[]{(byte) 0x81, 0x01, 'a'}, WebSocketEvent.CloseConnection.PROTOCOL_ERROR);
        try {
            codec.receiveData(ClientFrames.text("ok"));
            fail();
        } catch (WebSocketProtocolException expected) {
            assertTrue(codec.events().isEmpty());
        }
    }

    @Test
    public void serverFramesAreUnmasked() {
        byte[] text = codec.send(new WebSocketEvent.TextMessage("hi"));
        assertArrayEquals(new byte[]{(byte) 0x81, 2, 'h', 'i'}, text);

        byte[] pong = codec.send(new WebSocketEvent.Ping(new byte[]{4}).response());
        assertEquals(ServerWebSocketCodec.OPCODE_PONG, ClientFrames.opcode(pong));
        assertArrayEquals(new byte[]{4}, ClientFrames.payload(pong));

        byte[] medium = codec.send(new WebSocketEvent.BinaryMessage(new byte[200]));
        assertEquals(126, medium[1]);
        assertEquals(4 + 200, medium.length);
    }

    @Test
    public void nothingIsSentAfterClose() {
        byte[] close = codec.send(new WebSocketEvent.CloseConnection(1000, "bye"));
        assertEquals(ServerWebSocketCodec.OPCODE_CLOSE, ClientFrames.opcode(close));
        assertEquals(1000, ClientFrames.closeCode(close));
        assertEquals("bye", new String(ClientFrames.payload(close), 2, 3, StandardCharsets.UTF_8));
        try {
            codec.send(new WebSocketEvent.TextMessage("late"));
            fail();
        } catch (IllegalStateException expected) {
        }
    }

    @Test
    public void oversizedMessageIsRejected() throws Exception {
        ServerWebSocketCodec small = new ServerWebSocketCodec(8);
        small.receiveData(ClientFrames.binary(new byte[8]));
        assertEquals(1, small.events().size());
        try {
            small.receiveData(ClientFrames.binary(new byte[9]));
            fail();
        } catch (WebSocketProtocolException e) {
            assertEquals(WebSocketEvent.CloseConnection.MESSAGE_TOO_BIG, e.getCloseCode());
        }
    }

    @Test
    public void oversizedFragmentedMessageIsRejected() throws Exception {
        ServerWebSocketCodec small = new ServerWebSocketCodec(8);
        small.receiveData(ClientFrames.frame(ServerWebSocketCodec.OPCODE_BINARY, false, new byte[5]));
        try {
            small.receiveData(ClientFrames.frame(ServerWebSocketCodec.OPCODE_CONT, true, new byte[4]));
            fail();
        } catch (WebSocketProtocolException e) {
            assertEquals(WebSocketEvent.CloseConnection.MESSAGE_TOO_BIG, e.getCloseCode());
        }
        assertTrue(small.events().isEmpty());
    }

    @Test
    public void controlFramesAreNotCountedAgainstMessageSize() throws Exception {
        ServerWebSocketCodec small = new ServerWebSocketCodec(4);
        small.receiveData(ClientFrames.ping(new byte[100]));
        assertEquals(1, small.events().size());
    }

    @Test
    public void closeReasonTooLongForControlFrame() {
        StringBuilder reason = new StringBuilder();
        for (int i = 0; i < 124; i++) {
            reason.append('x');
        }
        try {
            codec.send(new WebSocketEvent.CloseConnection(1000, reason.toString()));
            fail();
        } catch (IllegalArgumentException expected) {
        }
        byte[] close = codec.send(new WebSocketEvent.CloseConnection(1000, reason.substring(1)));
        assertEquals(125, ClientFrames.payload(close).length);
    }

    private void assertViolation(byte[] data, int closeCode) {
        try {
            codec.receiveData(data);
            fail("expected violation");
        } catch (WebSocketProtocolException e) {
            assertEquals(closeCode, e.getCloseCode());
        }
    }
}
