package com.mini.fts.store;

import com.mini.fts.format.ColumnarFile;
import com.mini.fts.format.ColumnarFileReader;
import com.mini.fts.format.ColumnarFileWriter;
import com.mini.fts.schema.Row;
import com.mini.fts.testutils.TitleFiles;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.TermQuery;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EmbeddedIndexStore测试
 */
public class EmbeddedIndexStoreTest {
    
    @TempDir
    Path tempDir;
    
    private static final List<String> TITLES = Arrays.asList(
        "a dairy cow", "Milk farm", "cow dairy", null, "Dairy Cow!");
    
    private Path writeIndexed(String name) throws IOException {
        Path path = tempDir.resolve(name);
        TitleFiles.write(path, TITLES, TitleFiles.options(2));
        return path;
    }
    
    @Test
    public void testEmbedAndExtract() throws IOException {
        Path path = writeIndexed("indexed.mcf");
        
        try (ColumnarFileReader reader = ColumnarFileReader.open(path)) {
            IndexMetadata metadata = EmbeddedIndexStore.readMetadata(reader, "title").orElseThrow();
            assertEquals("title", metadata.getColumn());
            assertEquals("id", metadata.getKeyField());
            assertEquals(FullTextAnalyzer.ANALYZER_ID, metadata.getAnalyzer());
            assertTrue(metadata.getLength() > 0);
            
            Optional<SearchIndexSession> session = EmbeddedIndexStore.extract(reader, "title");
            assertTrue(session.isPresent());
            try (SearchIndexSession s = session.get()) {
                assertEquals(5, s.getDocumentCount());
                assertEquals(3, s.count(new TermQuery(new Term("title", "dairy"))));
                assertEquals(List.of(1L, 3L, 5L), 
                    List.copyOf(s.resolveKeys(new TermQuery(new Term("title", "cow")))));
            }
            
            assertEquals(metadata.getLength(), reader.getReadStatistics().getAuxiliaryBytesRead());
            assertEquals(0, reader.getReadStatistics().getDataBytesRead());
        }
    }
    
    @Test
    public void testMissingIndex() throws IOException {
        Path path = writeIndexed("missing.mcf");
        try (ColumnarFileReader reader = ColumnarFileReader.open(path)) {
            assertFalse(EmbeddedIndexStore.extract(reader, "category").isPresent());
            assertFalse(EmbeddedIndexStore.extract(reader, "nope").isPresent());
        }
    }
    
    @Test
    public void testCorruptArchiveReportsNoIndex() throws IOException {
        Path path = writeIndexed("corrupt.mcf");
        long offset;
        try (ColumnarFileReader reader = ColumnarFileReader.open(path)) {
            offset = EmbeddedIndexStore.readMetadata(reader, "title").orElseThrow().getOffset();
        }
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "rw")) {
            file.seek(offset);
            file.write('X');
        }
        
        try (ColumnarFileReader reader = ColumnarFileReader.open(path)) {
            assertFalse(EmbeddedIndexStore.extract(reader, "title").isPresent());
            // 数据本身仍然可读
            assertEquals(5, reader.readAll().size());
        }
    }
    
    @Test
    public void testTruncatedArchiveReportsNoIndex() throws IOException {
        Path path = writeIndexed("truncated.mcf");
        IndexMetadata original;
        try (ColumnarFileReader reader = ColumnarFileReader.open(path)) {
            original = EmbeddedIndexStore.readMetadata(reader, "title").orElseThrow();
        }
        
        // 元数据声明的区间比归档短
        Path rewritten = tempDir.resolve("truncated-copy.mcf");
        copyWithMetadata(path, rewritten, region -> new IndexMetadata(region.getOffset(), region.getLength() - 10, 
            "title", "id", FullTextAnalyzer.ANALYZER_ID, original.getFileCount()));
        try (ColumnarFileReader reader = ColumnarFileReader.open(rewritten)) {
            assertFalse(EmbeddedIndexStore.extract(reader, "title").isPresent());
        }
    }
    
    @Test
    public void testAnalyzerMismatch() throws IOException {
        Path path = writeIndexed("analyzer.mcf");
        IndexMetadata original;
        try (ColumnarFileReader reader = ColumnarFileReader.open(path)) {
            original = EmbeddedIndexStore.readMetadata(reader, "title").orElseThrow();
        }
        
        Path rewritten = tempDir.resolve("analyzer-copy.mcf");
        copyWithMetadata(path, rewritten, region -> new IndexMetadata(region.getOffset(), region.getLength(), 
            "title", "id", "standard-v9", original.getFileCount()));
        try (ColumnarFileReader reader = ColumnarFileReader.open(rewritten)) {
            assertFalse(EmbeddedIndexStore.extract(reader, "title").isPresent());
        }
    }
    
    @Test
    public void testMalformedMetadata() throws IOException {
        Path path = tempDir.resolve("malformed.mcf");
        try (ColumnarFileWriter writer = new ColumnarFileWriter(path, TitleFiles.schema())) {
            writer.write(new Row(1L, "cow", null));
            writer.putMetadata(IndexMetadata.metadataKey("title"), "{not json");
        }
        try (ColumnarFileReader reader = ColumnarFileReader.open(path)) {
            assertFalse(EmbeddedIndexStore.readMetadata(reader, "title").isPresent());
            assertFalse(EmbeddedIndexStore.extract(reader, "title").isPresent());
        }
    }
    
    @Test
    public void testForgedEntryLengthsReportNoIndex() throws IOException {
        long first = Long.MAX_VALUE - (0x46L << 56);
        long second = 0x46L << 56;
        ByteBuffer forged = ByteBuffer.allocate(54).order(ByteOrder.LITTLE_ENDIAN);
        forged.put("FTEP".getBytes(StandardCharsets.US_ASCII)).putInt(2);
        forged.putInt(1).put((byte) 'a').putLong(0).putLong(first);
        forged.putInt(1).put((byte) 'b').putLong(first).putLong(second);

        Path path = tempDir.resolve("forged.mcf");
        try (ColumnarFileWriter writer = new ColumnarFileWriter(path, TitleFiles.schema())) {
            writer.write(new Row(1L, "cow", null));
            ColumnarFile.Region region = writer.appendAuxiliaryRegion(forged.array());
            writer.putMetadata(IndexMetadata.metadataKey("title"), new IndexMetadata(region.getOffset(),
                region.getLength(), "title", "id", FullTextAnalyzer.ANALYZER_ID, 2).toJson());
        }
        try (ColumnarFileReader reader = ColumnarFileReader.open(path)) {
            assertFalse(EmbeddedIndexStore.extract(reader, "title").isPresent());
            assertEquals(1, reader.readAll().size());
        }
    }

    @Test
    public void testEmptyArchiveHasNoMatches() throws IOException {
        Path path = tempDir.resolve("empty-archive.mcf");
        try (ColumnarFileWriter writer = new ColumnarFileWriter(path, TitleFiles.schema())) {
            writer.write(new Row(1L, "cow", null));
            EmbeddedIndexStore.embed(writer, "title", "id", Collections.emptyList());
        }
        try (ColumnarFileReader reader = ColumnarFileReader.open(path)) {
            Optional<SearchIndexSession> session = EmbeddedIndexStore.extract(reader, "title");
            assertTrue(session.isPresent());
            try (SearchIndexSession s = session.get()) {
                assertEquals(0, s.getDocumentCount());
                assertEquals(0, s.count(new TermQuery(new Term("title", "cow"))));
                assertTrue(s.resolveKeys(new TermQuery(new Term("title", "cow"))).isEmpty());
                assertFalse(s.hasTerm("cow"));
            }
        }
    }
    
    /**
     * 复制数据行和原归档字节，用给定的元数据值替换索引元数据
     */
    private static void copyWithMetadata(Path source, Path target, 
                                         Function<ColumnarFile.Region, IndexMetadata> metadata) throws IOException {
        try (ColumnarFileReader reader = ColumnarFileReader.open(source);
             ColumnarFileWriter writer = new ColumnarFileWriter(target, reader.getSchema())) {
            for (Row row : reader.readAll()) {
                writer.write(row);
            }
            IndexMetadata original = EmbeddedIndexStore.readMetadata(reader, "title").orElseThrow();
            byte[] archive = new byte[(int) original.getLength()];
            reader.readRange(original.getOffset(), original.getLength()).get(archive);
            
            ColumnarFile.Region region = writer.appendAuxiliaryRegion(archive);
            writer.putMetadata(IndexMetadata.metadataKey("title"), metadata.apply(region).toJson());
        }
    }
}
