package com.mini.fts.archive;

import com.mini.fts.exception.ArchiveException;
import com.mini.fts.exception.ArchiveFileNotFoundException;
import com.mini.fts.exception.CorruptArchiveException;
import com.mini.fts.exception.TruncatedArchiveException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * VirtualDirectory测试
 */
public class VirtualDirectoryTest {
    
    private static byte[] sampleArchive() {
        return new ArchiveWriter()
            .add("a", "xyz".getBytes(StandardCharsets.UTF_8))
            .add("b", new byte[0])
            .add("segments_1", "some longer content".getBytes(StandardCharsets.UTF_8))
            .toByteArray();
    }
    
    @Test
    public void testScenarioA() {
        byte[] archive = new ArchiveWriter()
            .add("a", "xyz".getBytes(StandardCharsets.UTF_8))
            .add("b", new byte[0])
            .toByteArray();
        VirtualDirectory directory = VirtualDirectory.open(archive);
        
        assertArrayEquals("xyz".getBytes(StandardCharsets.UTF_8), directory.readBytes("a"));
        assertArrayEquals(new byte[0], directory.readBytes("b"));
        assertTrue(directory.exists("a"));
        assertFalse(directory.exists("c"));
        ArchiveFileNotFoundException e = assertThrows(ArchiveFileNotFoundException.class, 
            () -> directory.read("c"));
        assertEquals("c", e.getName());
    }
    
    @Test
    public void testRoundTripRandomPayloads() {
        Random random = new Random(42);
        for (int round = 0; round < 20; round++) {
            Map<String, byte[]> expected = new LinkedHashMap<>();
            int fileCount = 1 + random.nextInt(12);
            for (int i = 0; i < fileCount; i++) {
                // 约四分之一的文件为空
                byte[] content = new byte[random.nextInt(4) == 0 ? 0 : random.nextInt(2000)];
                random.nextBytes(content);
                expected.put("_" + round + "_" + i + (i % 2 == 0 ? ".cfs" : ".si"), content);
            }
            
            ArchiveWriter writer = new ArchiveWriter();
            expected.forEach(writer::add);
            VirtualDirectory directory = VirtualDirectory.open(writer.toByteArray());
            
            assertEquals(fileCount, directory.getFileCount());
            for (Map.Entry<String, byte[]> entry : expected.entrySet()) {
                assertArrayEquals(entry.getValue(), directory.readBytes(entry.getKey()), entry.getKey());
            }
        }
    }
    
    @Test
    public void testReadIsZeroCopyView() {
        byte[] archive = sampleArchive();
        VirtualDirectory directory = VirtualDirectory.open(archive);
        
        ByteBuffer view = directory.read("a");
        assertTrue(view.isReadOnly());
        assertEquals(3, view.remaining());
        
        // 视图与原始数组共享内容
        int contentStart = archive.length - 4 - (3 + 0 + "some longer content".length());
        archive[contentStart] = 'q';
        assertEquals('q', directory.read("a").get(0));
    }
    
    @Test
    public void testOpenFromSliceOfLargerBuffer() {
        byte[] archive = sampleArchive();
        byte[] host = new byte[archive.length + 100];
        System.arraycopy(archive, 0, host, 37, archive.length);
        
        ByteBuffer buffer = ByteBuffer.wrap(host, 37, archive.length);
        VirtualDirectory directory = VirtualDirectory.open(buffer);
        assertArrayEquals("xyz".getBytes(StandardCharsets.UTF_8), directory.readBytes("a"));
        assertEquals(37, buffer.position());
    }
    
    @Test
    public void testLeadingMagicBitFlips() {
        byte[] archive = sampleArchive();
        for (int bit = 0; bit < 32; bit++) {
            byte[] corrupted = archive.clone();
            corrupted[bit / 8] ^= (byte) (1 << (bit % 8));
            assertThrows(CorruptArchiveException.class, () -> VirtualDirectory.open(corrupted), "bit " + bit);
        }
    }
    
    @Test
    public void testTrailingMagicBitFlips() {
        byte[] archive = sampleArchive();
        int trailer = archive.length - 4;
        for (int bit = 0; bit < 32; bit++) {
            byte[] corrupted = archive.clone();
            corrupted[trailer + bit / 8] ^= (byte) (1 << (bit % 8));
            assertThrows(TruncatedArchiveException.class, () -> VirtualDirectory.open(corrupted), "bit " + bit);
        }
    }
    
    @Test
    public void testTruncationAtEveryLength() {
        byte[] archive = sampleArchive();
        for (int length = 0; length < archive.length; length++) {
            byte[] truncated = Arrays.copyOf(archive, length);
            ArchiveException e = assertThrows(ArchiveException.class, () -> VirtualDirectory.open(truncated));
            if (length < 4) {
                assertInstanceOf(CorruptArchiveException.class, e, "length " + length);
            } else {
                assertInstanceOf(TruncatedArchiveException.class, e, "length " + length);
            }
        }
    }
    
    @Test
    public void testTrailingGarbage() {
        byte[] archive = sampleArchive();
        byte[] extended = Arrays.copyOf(archive, archive.length + 3);
        assertThrows(CorruptArchiveException.class, () -> VirtualDirectory.open(extended));
    }
    
    @Test
    public void testNotAnArchive() {
        assertThrows(CorruptArchiveException.class, 
            () -> VirtualDirectory.open("hello world".getBytes(StandardCharsets.UTF_8)));
        assertThrows(CorruptArchiveException.class, () -> VirtualDirectory.open(new byte[0]));
    }
    
    @Test
    public void testForgedEntryCount() {
        byte[] archive = ArchiveWriter.pack(Arrays.asList(ArchiveFile.of("a", new byte[]{1, 2})));
        // 把条目数改成一个很大的值
        ByteBuffer.wrap(archive).order(ArchiveFormat.BYTE_ORDER).putInt(4, 1_000_000);
        assertThrows(TruncatedArchiveException.class, () -> VirtualDirectory.open(archive));
    }
    
    @Test
    public void testForgedLengthsDoNotOverflow() {
        // 两个条目的长度之和正好是 Long.MAX_VALUE，没有内容也没有结尾魔数
        long first = Long.MAX_VALUE - (0x46L << 56);
        long second = 0x46L << 56;
        ByteBuffer buffer = ByteBuffer.allocate(54).order(ArchiveFormat.BYTE_ORDER);
        buffer.put(ArchiveFormat.MAGIC).putInt(2);
        buffer.putInt(1).put((byte) 'a').putLong(0).putLong(first);
        buffer.putInt(1).put((byte) 'b').putLong(first).putLong(second);

        assertThrows(TruncatedArchiveException.class, () -> VirtualDirectory.open(buffer.array()));
    }

    @Test
    public void testSizes() {
        VirtualDirectory directory = VirtualDirectory.open(sampleArchive());
        assertEquals(3 + "some longer content".length(), directory.getContentSize());
        assertEquals(sampleArchive().length, directory.getArchiveSize());
    }
}
