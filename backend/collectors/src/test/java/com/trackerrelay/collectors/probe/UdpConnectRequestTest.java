package com.trackerrelay.collectors.probe;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UdpConnectRequestTest {
    @Test
    void encodesSixteenBigEndianBytes() {
        byte[] request = UdpConnectRequest.encode(0x12345678);

        assertArrayEquals(new byte[]{
                0x00, 0x00, 0x04, 0x17, 0x27, 0x10, 0x19, (byte) 0x80,
                0x00, 0x00, 0x00, 0x00,
                0x12, 0x34, 0x56, 0x78
        }, request);
    }

    @Test
    void carriesTransactionIdVerbatim() {
        ByteBuffer buffer = ByteBuffer.wrap(UdpConnectRequest.encode(-2));

        assertEquals(UdpConnectRequest.LENGTH, buffer.remaining());
        assertEquals(0x41727101980L, buffer.getLong());
        assertEquals(0, buffer.getInt());
        assertEquals(-2, buffer.getInt());
    }

    @Test
    void responsesShorterThanEightBytesAreRejected() {
        assertFalse(UdpConnectRequest.isAcceptableResponse(0));
        assertFalse(UdpConnectRequest.isAcceptableResponse(7));
        assertTrue(UdpConnectRequest.isAcceptableResponse(8));
        assertTrue(UdpConnectRequest.isAcceptableResponse(16));
    }
}
