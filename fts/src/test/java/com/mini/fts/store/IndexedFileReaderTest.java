package com.mini.fts.store;

import com.mini.fts.config.FullTextIndexOptions;
import com.mini.fts.testutils.TitleFiles;
import com.mini.fts.testutils.TitleGenerator;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.TermQuery;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IndexedFileReader测试
 */
public class IndexedFileReaderTest {
    
    @TempDir
    Path tempDir;
    
    @Test
    public void testSessionExtractedOnce() throws IOException {
        Path path = tempDir.resolve("once.mcf");
        TitleFiles.write(path, new TitleGenerator(1).next(200), TitleFiles.options(50));
        
        try (IndexedFileReader reader = IndexedFileReader.open(path)) {
            assertEquals(Set.of("title"), reader.getIndexedColumns());
            assertEquals(0, reader.getExtractionCount());
            
            Optional<SearchIndexSession> first = reader.session("title");
            Optional<SearchIndexSession> second = reader.session("title");
            assertTrue(first.isPresent());
            assertSame(first.get(), second.get());
            assertEquals(1, reader.getExtractionCount());
            
            // 没有索引的列也只尝试一次
            assertFalse(reader.session("category").isPresent());
            assertFalse(reader.session("category").isPresent());
            assertEquals(2, reader.getExtractionCount());
        }
    }
    
    @Test
    public void testConcurrentQueries() throws Exception {
        Path path = tempDir.resolve("concurrent.mcf");
        List<String> titles = new TitleGenerator(2).next(500);
        TitleFiles.write(path, titles, TitleFiles.options(100));
        
        long expected = titles.stream()
            .filter(t -> new FullTextAnalyzer().tokenize("title", t).stream().anyMatch(tok -> tok.getTerm().equals("cow")))
            .count();
        
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try (IndexedFileReader reader = IndexedFileReader.open(path)) {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                tasks.add(() -> reader.session("title").orElseThrow()
                    .resolveKeys(new TermQuery(new Term("title", "cow"))).size());
            }
            for (Future<Integer> future : executor.invokeAll(tasks)) {
                assertEquals(expected, future.get().longValue());
            }
            assertEquals(1, reader.getExtractionCount());
        } finally {
            executor.shutdownNow();
        }
    }
    
    @Test
    public void testClosedReaderRejectsSessions() throws IOException {
        Path path = tempDir.resolve("closed.mcf");
        TitleFiles.write(path, new TitleGenerator(3).next(10), TitleFiles.options(5));
        
        IndexedFileReader reader = IndexedFileReader.open(path);
        reader.session("title");
        reader.close();
        assertThrows(IllegalStateException.class, () -> reader.session("title"));
    }
    
    @Test
    public void testWriterValidatesColumns() {
        Path path = tempDir.resolve("invalid.mcf");
        assertThrows(IllegalArgumentException.class, () -> new IndexedFileWriter(path, TitleFiles.schema(),
            FullTextIndexOptions.builder().indexColumn("id").build()));
        assertThrows(IllegalArgumentException.class, () -> new IndexedFileWriter(path, TitleFiles.schema(),
            FullTextIndexOptions.builder().indexColumn("missing").build()));
        assertThrows(IllegalArgumentException.class, () -> new IndexedFileWriter(path, TitleFiles.schema(),
            FullTextIndexOptions.builder().indexColumn("title").keyField("other").build()));
    }
}
