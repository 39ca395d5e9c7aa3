package com.trackerrelay.collectors.probe;

import java.nio.ByteBuffer;

// BEP 15 connect request: protocol id, action, transaction id, all big-endian.
public final class UdpConnectRequest {
    public static final long PROTOCOL_ID = 0x41727101980L;
    public static final int ACTION_CONNECT = 0;
    public static final int LENGTH = 16;
    public static final int MIN_RESPONSE_LENGTH = 8;

    private UdpConnectRequest() {
    }

    public static byte[] encode(int transactionId) {
        return ByteBuffer.allocate(LENGTH)
                .putLong(PROTOCOL_ID)
                .putInt(ACTION_CONNECT)
                .putInt(transactionId)
                .array();
    }

    public static boolean isAcceptableResponse(int length) {
        return length >= MIN_RESPONSE_LENGTH;
    }
}
