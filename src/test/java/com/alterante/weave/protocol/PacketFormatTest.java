package com.alterante.weave.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PacketFormatTest {

    @Test
    void defaultFormatIsOneByteHeader() {
        assertEquals(3, PacketFormat.DEFAULT.counterBits());
        assertEquals(1, PacketFormat.DEFAULT.headerSize());
        assertEquals(8, PacketFormat.DEFAULT.counterSpace());
        assertEquals(7, PacketFormat.DEFAULT.maxCounter());
        assertEquals(19, PacketFormat.DEFAULT.maxPayload(20));
    }

    @Test
    void headerGrowsWithCounterWidth() {
        assertEquals(1, new PacketFormat(5).headerSize());
        assertEquals(2, new PacketFormat(6).headerSize());
        assertEquals(2, new PacketFormat(13).headerSize());
        assertEquals(3, new PacketFormat(14).headerSize());
        assertEquals(3, new PacketFormat(16).headerSize());
    }

    @Test
    void counterWidthBounds() {
        assertThrows(IllegalArgumentException.class, () -> new PacketFormat(0));
        assertThrows(IllegalArgumentException.class, () -> new PacketFormat(17));
    }
}
