package org.arena.stream;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArenaLineDecoderTest {

    @Test
    void partialLineKeptUntilNewline() {
        ArenaLineDecoder decoder = new ArenaLineDecoder();

        assertTrue(decoder.feed("a0:\"Hel").isEmpty());
        assertTrue(decoder.hasPartial());
        assertEquals(List.of("a0:\"Hello\""), decoder.feed("lo\"\nad:"));
        assertEquals("ad:", decoder.flush());
        assertFalse(decoder.hasPartial());
    }

    @Test
    void stripsCarriageReturn() {
        ArenaLineDecoder decoder = new ArenaLineDecoder();
        assertEquals(List.of("a0:\"x\"", ""), decoder.feed("a0:\"x\"\r\n\r\n"));
    }

    @Test
    void flushOnEmptyBufferReturnsNull() {
        ArenaLineDecoder decoder = new ArenaLineDecoder();
        decoder.feed("line\n");
        assertNull(decoder.flush());
    }
}
