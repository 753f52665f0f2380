package com.mini.fts.store;

import com.mini.fts.archive.ArchiveFile;
import com.mini.fts.archive.ArchiveWriter;
import com.mini.fts.archive.VirtualDirectory;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexInput;
import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ArchiveDirectory测试
 */
public class ArchiveDirectoryTest {
    
    private static ArchiveDirectory directoryOf(ArchiveFile... files) {
        return new ArchiveDirectory(VirtualDirectory.open(ArchiveWriter.pack(Arrays.asList(files))));
    }
    
    @Test
    public void testListAllSorted() throws IOException {
        try (ArchiveDirectory directory = directoryOf(
                ArchiveFile.of("segments_1", new byte[3]),
                ArchiveFile.of("_0.si", new byte[5]),
                ArchiveFile.of("_0.cfs", new byte[0]))) {
            assertArrayEquals(new String[]{"_0.cfs", "_0.si", "segments_1"}, directory.listAll());
            assertEquals(5, directory.fileLength("_0.si"));
            assertEquals(0, directory.fileLength("_0.cfs"));
            assertThrows(NoSuchFileException.class, () -> directory.fileLength("missing"));
            assertThrows(NoSuchFileException.class, () -> directory.openInput("missing", IOContext.DEFAULT));
        }
    }
    
    @Test
    public void testReadOnly() throws IOException {
        try (ArchiveDirectory directory = directoryOf(ArchiveFile.of("a", new byte[]{1}))) {
            assertThrows(UnsupportedOperationException.class, () -> directory.createOutput("b", IOContext.DEFAULT));
            assertThrows(UnsupportedOperationException.class, 
                () -> directory.createTempOutput("b", "tmp", IOContext.DEFAULT));
            assertThrows(UnsupportedOperationException.class, () -> directory.deleteFile("a"));
            assertThrows(UnsupportedOperationException.class, () -> directory.rename("a", "b"));
            assertThrows(UnsupportedOperationException.class, () -> directory.sync(Collections.singleton("a")));
            assertThrows(UnsupportedOperationException.class, directory::syncMetaData);
            assertTrue(directory.getPendingDeletions().isEmpty());
        }
    }
    
    @Test
    public void testIndexInputCloneAndSlice() throws IOException {
        byte[] content = "0123456789".getBytes(StandardCharsets.US_ASCII);
        try (ArchiveDirectory directory = directoryOf(ArchiveFile.of("x", new byte[]{9}), 
                                                      ArchiveFile.of("digits", content));
             IndexInput input = directory.openInput("digits", IOContext.DEFAULT)) {
            assertEquals(10, input.length());
            assertEquals('0', input.readByte());
            
            IndexInput clone = input.clone();
            assertEquals(1, clone.getFilePointer());
            assertEquals('1', clone.readByte());
            assertEquals('2', clone.readByte());
            // 原实例位置不受影响
            assertEquals(1, input.getFilePointer());
            
            IndexInput slice = input.slice("middle", 3, 4);
            assertEquals(4, slice.length());
            byte[] bytes = new byte[4];
            slice.readBytes(bytes, 0, 4);
            assertEquals("3456", new String(bytes, StandardCharsets.US_ASCII));
            assertThrows(EOFException.class, slice::readByte);
            
            input.seek(9);
            assertEquals('9', input.readByte());
            assertThrows(EOFException.class, () -> input.seek(11));
            assertThrows(EOFException.class, () -> input.readBytes(new byte[2], 0, 2));
            
            input.seek(0);
            input.skipBytes(5);
            assertEquals('5', input.readByte());
            assertThrows(IllegalArgumentException.class, () -> input.slice("bad", 8, 5));
        }
    }
    
    @Test
    public void testLuceneOpensArchivedIndex() throws IOException {
        List<ArchiveFile> files;
        try (FullTextIndexBuilder builder = new FullTextIndexBuilder("title", "id", 16)) {
            builder.add(1, "a dairy cow");
            builder.add(2, "milk farm");
            builder.add(3, null);
            files = builder.finish();
        }
        
        assertFalse(files.isEmpty());
        assertTrue(files.stream().noneMatch(f -> f.getName().equals(IndexWriter.WRITE_LOCK_NAME)));
        assertTrue(files.stream().anyMatch(f -> f.getName().startsWith("segments_")));
        
        try (ArchiveDirectory directory = directoryOf(files.toArray(new ArchiveFile[0]));
             DirectoryReader reader = DirectoryReader.open(directory)) {
            assertEquals(3, reader.numDocs());
            assertEquals(1, reader.leaves().size());
        }
    }
}
