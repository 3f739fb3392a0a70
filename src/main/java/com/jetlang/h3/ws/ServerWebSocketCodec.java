package com.jetlang.h3.ws;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * RFC 6455 framing for the server end of a session. Inbound frames must be masked, outbound frames are not.
 * Fragmented messages are reassembled before they are reported.
 */
public class ServerWebSocketCodec implements WebSocketCodec {

    static final byte OPCODE_CONT = 0x0;
    static final byte OPCODE_TEXT = 0x1;
    static final byte OPCODE_BINARY = 0x2;
    static final byte OPCODE_CLOSE = 0x8;
    static final byte OPCODE_PING = 0x9;
    static final byte OPCODE_PONG = 0xA;

    public static final int DEFAULT_MAX_MESSAGE_SIZE = 16 * 1024 * 1024;

    private static final byte[] empty = new byte[0];
    private static final SizeType[] sizes = SizeType.values();

    private final int maxMessageSize;
    private final List<WebSocketEvent> events = new ArrayList<>();
    private final BodyReader bodyReader = new BodyReader();
    private ByteBuffer bb = bufferAllocate(1024);
    private ContentType fragmentType;
    private byte[] message = empty;
    private int messageSize;
    private boolean closeSent;
    private WebSocketProtocolException failure;

    private final State closed = new State() {
        @Override
        public State processBytes(ByteBuffer bb) {
            bb.position(bb.limit());
            return null;
        }
    };

    private final State frameStart = new State() {
        @Override
        public int minRequiredBytes() {
            return 2;
        }

        @Override
        public State processBytes(ByteBuffer bb) throws WebSocketProtocolException {
            byte b = bb.get();
            boolean fin = (b & 0x80) != 0;
            if ((b & 0x70) != 0) {
                throw new WebSocketProtocolException("Reserve bits are not supported.");
            }
            byte opcode = (byte) (b & 0x0F);
            byte lengthByte = bb.get();
            if ((lengthByte & 0x80) == 0) {
                throw new WebSocketProtocolException("Client frames must be masked.");
            }
            ContentType type = toContentType(opcode);
            if (type.control) {
                if (!fin) {
                    throw new WebSocketProtocolException(type + " cannot be fragmented.");
                }
            } else if (opcode == OPCODE_CONT) {
                if (fragmentType == null) {
                    throw new WebSocketProtocolException("Continuation frame without a message in progress.");
                }
            } else if (fragmentType != null) {
                throw new WebSocketProtocolException(type + " received when expecting a continuation frame.");
            }
            final int size = 0x7F & lengthByte;
            if (size <= 125) {
                return bodyReader.init(type, fin, size);
            }
            if (type.control) {
                throw new WebSocketProtocolException(type + " max size of 125.");
            }
            if (size == 126) {
                return new State() {
                    @Override
                    public int minRequiredBytes() {
                        return 2;
                    }

                    @Override
                    public State processBytes(ByteBuffer bb) throws WebSocketProtocolException {
                        int size = ((bb.get() & 0xFF) << 8) + (bb.get() & 0xFF);
                        return bodyReader.init(type, fin, size);
                    }
                };
            }
            return new State() {
                @Override
                public int minRequiredBytes() {
                    return 8;
                }

                @Override
                public State processBytes(ByteBuffer bb) throws WebSocketProtocolException {
                    long size = bb.getLong();
                    if (size < 0 || size > Integer.MAX_VALUE - 4) {
                        throw new WebSocketProtocolException("Unsupported size: " + size);
                    }
                    return bodyReader.init(type, fin, (int) size);
                }
            };
        }
    };

    private State current = frameStart;

    public ServerWebSocketCodec() {
        this(DEFAULT_MAX_MESSAGE_SIZE);
    }

    /**
     * @param maxMessageSize largest text or binary message accepted after reassembly. Larger messages fail with
     *                       close code 1009.
     */
    public ServerWebSocketCodec(int maxMessageSize) {
        this.maxMessageSize = maxMessageSize;
    }

    @Override
    public void receiveData(byte[] data) throws WebSocketProtocolException {
        if (failure != null) {
            throw failure;
        }
        if (bb.remaining() < data.length) {
            ByteBuffer resize = bufferAllocate(bb.position() + Math.max(1024, data.length));
            bb.flip();
            bb = resize.put(bb);
        }
        bb.put(data);
        bb.flip();
        try {
            State result = current;
            while (result != null) {
                result = current.process(bb);
                if (result != null) {
                    current = result;
                }
            }
        } catch (WebSocketProtocolException e) {
            failure = e;
            current = closed;
            throw e;
        } finally {
            bb.compact();
        }
    }

    @Override
    public List<WebSocketEvent> events() {
        if (events.isEmpty()) {
            return new ArrayList<>(0);
        }
        List<WebSocketEvent> result = new ArrayList<>(events);
        events.clear();
        return result;
    }

    @Override
    public byte[] send(WebSocketEvent event) {
        if (closeSent) {
            throw new IllegalStateException("Close frame already sent, cannot send " + event);
        }
        final byte[][] frame = new byte[1][];
        event.accept(new WebSocketEvent.Visitor() {
            @Override
            public void onText(WebSocketEvent.TextMessage event) {
                frame[0] = frame(OPCODE_TEXT, event.getData().getBytes(StandardCharsets.UTF_8));
            }

            @Override
            public void onBinary(WebSocketEvent.BinaryMessage event) {
                frame[0] = frame(OPCODE_BINARY, event.getData());
            }

            @Override
            public void onClose(WebSocketEvent.CloseConnection event) {
                byte[] reason = event.getReasonBytes();
                if (reason.length > 123) {
                    throw new IllegalArgumentException("Close reason of " + reason.length + " bytes exceeds 123.");
                }
                closeSent = true;
                if (event.getCode() == WebSocketEvent.CloseConnection.NO_STATUS_RCVD) {
                    frame[0] = frame(OPCODE_CLOSE, empty);
                    return;
                }
                ByteBuffer payload = bufferAllocate(2 + reason.length);
                payload.putShort((short) event.getCode());
                payload.put(reason);
                frame[0] = frame(OPCODE_CLOSE, payload.array());
            }

            @Override
            public void onPing(WebSocketEvent.Ping event) {
                frame[0] = frame(OPCODE_PING, event.getPayload());
            }

            @Override
            public void onPong(WebSocketEvent.Pong event) {
                frame[0] = frame(OPCODE_PONG, event.getPayload());
            }
        });
        return frame[0];
    }

    private static byte[] frame(byte opCode, byte[] bytes) {
        final int length = bytes.length;
        byte header = 0;
        header |= 1 << 7;
        header |= opCode % 128;
        SizeType sz = findSize(length);
        ByteBuffer bb = bufferAllocate(1 + length + sz.bytes);
        bb.put(header);
        sz.write(bb, length);
        bb.put(bytes);
        return bb.array();
    }

    static ByteBuffer bufferAllocate(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.BIG_ENDIAN);
    }

    private static ContentType toContentType(byte opcode) throws WebSocketProtocolException {
        switch (opcode) {
            case OPCODE_TEXT:
                return ContentType.Text;
            case OPCODE_BINARY:
                return ContentType.Binary;
            case OPCODE_CONT:
                return ContentType.Continuation;
            case OPCODE_CLOSE:
                return ContentType.Close;
            case OPCODE_PING:
                return ContentType.Ping;
            case OPCODE_PONG:
                return ContentType.Pong;
        }
        throw new WebSocketProtocolException(opcode + " op code isn't supported.");
    }

    private static SizeType findSize(int length) {
        for (SizeType size : sizes) {
            if (length <= size.max) {
                return size;
            }
        }
        throw new IllegalArgumentException(length + " invalid ");
    }

    private static String decodeText(byte[] bytes, int size) throws WebSocketProtocolException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes, 0, size)).toString();
        } catch (CharacterCodingException e) {
            throw new WebSocketProtocolException("Invalid UTF-8 in text message.",
                    WebSocketEvent.CloseConnection.INVALID_FRAME_PAYLOAD_DATA);
        }
    }

    interface State {

        default int minRequiredBytes() {
            return 1;
        }

        default State process(ByteBuffer bb) throws WebSocketProtocolException {
            if (bb.remaining() < minRequiredBytes()) {
                return null;
            }
            return processBytes(bb);
        }

        State processBytes(ByteBuffer bb) throws WebSocketProtocolException;
    }

    enum ContentType {
        Text(false) {
            @Override
            WebSocketEvent toEvent(byte[] payload, int size) throws WebSocketProtocolException {
                return new WebSocketEvent.TextMessage(decodeText(payload, size));
            }
        }, Binary(false) {
            @Override
            WebSocketEvent toEvent(byte[] payload, int size) {
                return new WebSocketEvent.BinaryMessage(Arrays.copyOf(payload, size));
            }
        }, Continuation(false) {
            @Override
            WebSocketEvent toEvent(byte[] payload, int size) {
                throw new IllegalStateException("continuation completes the message it continues");
            }
        }, Close(true) {
            @Override
            WebSocketEvent toEvent(byte[] payload, int size) throws WebSocketProtocolException {
                if (size == 0) {
                    return new WebSocketEvent.CloseConnection(WebSocketEvent.CloseConnection.NO_STATUS_RCVD);
                }
                if (size == 1) {
                    throw new WebSocketProtocolException("Close payload of 1 byte.");
                }
                int code = ((payload[0] & 0xFF) << 8) + (payload[1] & 0xFF);
                byte[] reason = Arrays.copyOfRange(payload, 2, size);
                return new WebSocketEvent.CloseConnection(code, decodeText(reason, reason.length));
            }
        }, Ping(true) {
            @Override
            WebSocketEvent toEvent(byte[] payload, int size) {
                return new WebSocketEvent.Ping(Arrays.copyOf(payload, size));
            }
        }, Pong(true) {
            @Override
            WebSocketEvent toEvent(byte[] payload, int size) {
                return new WebSocketEvent.Pong(Arrays.copyOf(payload, size));
            }
        };

        final boolean control;

        ContentType(boolean control) {
            this.control = control;
        }

        abstract WebSocketEvent toEvent(byte[] payload, int size) throws WebSocketProtocolException;
    }

    enum SizeType {
        Small(125, 1) {
            @Override
            void write(ByteBuffer bb, int length) {
                bb.put((byte) length);
            }
        },
        Medium(65535, 3) {
            @Override
            void write(ByteBuffer bb, int length) {
                bb.put((byte) 126);
                bb.put((byte) (length >>> 8));
                bb.put((byte) length);
            }
        },
        Large(Integer.MAX_VALUE, 9) {
            @Override
            void write(ByteBuffer bb, int length) {
                bb.put((byte) 127);
                bb.putLong(length);
            }
        };

        final int max;
        final int bytes;

        SizeType(int max, int bytes) {
            this.max = max;
            this.bytes = bytes;
        }

        abstract void write(ByteBuffer bb, int length);
    }

    private class BodyReader implements State {
        private ContentType type;
        private boolean fin;
        private int size;
        private byte[] control = empty;

        State init(ContentType type, boolean fin, int size) throws WebSocketProtocolException {
            long total = type == ContentType.Continuation ? (long) messageSize + size : size;
            if (!type.control && total > maxMessageSize) {
                throw new WebSocketProtocolException("Message of " + total + " bytes exceeds " + maxMessageSize + ".",
                        WebSocketEvent.CloseConnection.MESSAGE_TOO_BIG);
            }
            this.type = type;
            this.fin = fin;
            this.size = size;
            return this;
        }

        @Override
        public int minRequiredBytes() {
            return size + 4;
        }

        @Override
        public State processBytes(ByteBuffer bb) throws WebSocketProtocolException {
            final int maskPos = bb.position();
            bb.position(maskPos + 4);
            if (type.control) {
                if (control.length < size) {
                    control = new byte[size];
                }
                unmask(bb, maskPos, control, 0);
                events.add(type.toEvent(control, size));
                return type == ContentType.Close ? closed : frameStart;
            }
            if (type != ContentType.Continuation) {
                fragmentType = type;
                messageSize = 0;
            }
            if (message.length < messageSize + size) {
                message = Arrays.copyOf(message, messageSize + size);
            }
            unmask(bb, maskPos, message, messageSize);
            messageSize += size;
            if (fin) {
                WebSocketEvent complete = fragmentType.toEvent(message, messageSize);
                fragmentType = null;
                messageSize = 0;
                events.add(complete);
            }
            return frameStart;
        }

        private void unmask(ByteBuffer bb, int maskPos, byte[] target, int offset) {
            for (int i = 0; i < size; i++) {
                target[i + offset] = (byte) (bb.get() ^ bb.get((i % 4) + maskPos));
            }
        }
    }
}
