package com.questrail.remotedisplay.protocol.frame;

import com.questrail.remotedisplay.protocol.codec.FrameFormatException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PacketAssemblerTest
{
    @Test
    void chunksAreAttachedToTheNextMainPacket()
    {
        PacketAssembler assembler = new PacketAssembler(1024);

        assertTrue(assembler.accept(2, new byte[] { 2 }).isEmpty());
        assertTrue(assembler.accept(1, new byte[] { 1, 1 }).isEmpty());
        assertEquals(2, assembler.pendingChunks());

        Packet packet = assembler.accept(0, new byte[] { 0 }).orElseThrow();

        assertArrayEquals(new byte[] { 0 }, packet.main());
        assertEquals(2, packet.chunkCount());
        assertArrayEquals(new byte[] { 1, 1 }, packet.chunk(1).orElseThrow());
        assertArrayEquals(new byte[] { 2 }, packet.chunk(2).orElseThrow());
        assertEquals(0, assembler.pendingChunks());
    }

    @Test
    void mainPacketWithoutChunks()
    {
        Packet packet = new PacketAssembler(16).accept(0, new byte[] { 7 }).orElseThrow();

        assertEquals(0, packet.chunkCount());
        assertTrue(packet.chunk(1).isEmpty());
    }

    @Test
    void duplicateChunkIndexIsAProtocolError()
    {
        PacketAssembler assembler = new PacketAssembler(1024);
        assembler.accept(1, new byte[] { 1 });

        assertThrows(FrameFormatException.class, () -> assembler.accept(1, new byte[] { 1 }));
    }

    @Test
    void bufferedChunksAreBounded()
    {
        PacketAssembler assembler = new PacketAssembler(4);
        assembler.accept(1, new byte[3]);

        assertThrows(FrameFormatException.class, () -> assembler.accept(2, new byte[2]));
    }
}
