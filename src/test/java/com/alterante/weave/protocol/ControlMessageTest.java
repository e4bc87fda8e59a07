package com.alterante.weave.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ControlMessageTest {

    @Test
    void connectionRequestLayout() throws PacketException {
        ControlMessage request = ControlMessage.connectionRequest(1, 2, 185, new byte[]{7, 8});
        byte[] encoded = request.encode();
        assertArrayEquals(new byte[]{0x00, 0x00, 0x01, 0x00, 0x02, 0x00, (byte) 185, 7, 8}, encoded);

        ControlMessage decoded = ControlMessage.decode(encoded);
        assertEquals(ControlCommand.CONNECTION_REQUEST, decoded.command());
        assertEquals(1, decoded.minVersion());
        assertEquals(2, decoded.maxVersion());
        assertEquals(185, decoded.packetSize());
        assertArrayEquals(new byte[]{7, 8}, decoded.data());
        assertEquals(request, decoded);
    }

    @Test
    void connectionConfirmLayout() throws PacketException {
        ControlMessage confirm = ControlMessage.connectionConfirm(1, 512, null);
        byte[] encoded = confirm.encode();
        assertArrayEquals(new byte[]{0x01, 0x00, 0x01, 0x02, 0x00}, encoded);

        ControlMessage decoded = ControlMessage.decode(encoded);
        assertEquals(ControlCommand.CONNECTION_CONFIRM, decoded.command());
        assertEquals(1, decoded.selectedVersion());
        assertEquals(512, decoded.packetSize());
        assertEquals(0, decoded.data().length);
    }

    @Test
    void errorIsSingleByte() throws PacketException {
        assertArrayEquals(new byte[]{0x02}, ControlMessage.error().encode());
        assertEquals(ControlCommand.ERROR, ControlMessage.decode(new byte[]{0x02}).command());
    }

    @Test
    void defaultPacketSizeRequestFitsOnePacket() {
        // 20-byte packet, 1-byte header: 19 bytes of payload, 7 fixed
        byte[] encoded = ControlMessage.connectionRequest(1, 1, 20, new byte[12]).encode();
        assertEquals(19, encoded.length);
    }

    @Test
    void unknownCommandRejected() {
        assertThrows(PacketException.class, () -> ControlMessage.decode(new byte[]{0x09}));
        assertThrows(PacketException.class, () -> ControlMessage.decode(new byte[0]));
    }

    @Test
    void truncatedPayloadRejected() {
        assertThrows(PacketException.class, () -> ControlMessage.decode(new byte[]{0x00, 0x00, 0x01}));
        assertThrows(PacketException.class, () -> ControlMessage.decode(new byte[]{0x01, 0x00}));
    }

    @Test
    void invalidFieldsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ControlMessage.connectionRequest(3, 2, 20, null));
        assertThrows(IllegalArgumentException.class, () -> ControlMessage.connectionConfirm(1, 70_000, null));
    }
}
