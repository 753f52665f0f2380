package com.mini.fts.store;

import com.mini.fts.testutils.TitleFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SearchIndexSession测试
 */
public class SearchIndexSessionTest {

    @TempDir
    Path tempDir;

    private IndexedFileReader open() throws IOException {
        Path path = tempDir.resolve("terms.mcf");
        TitleFiles.write(path, Arrays.asList(
            "dairy cow", "daisy field", "dai", "cowboy dairyman", "milk"), TitleFiles.options(2));
        return IndexedFileReader.open(path);
    }

    @Test
    public void testFindTermsWithPrefix() throws IOException {
        try (IndexedFileReader reader = open()) {
            SearchIndexSession session = reader.session("title").orElseThrow();

            assertEquals(List.of("dai", "dairy", "dairyman", "daisy"), session.findTermsWithPrefix("dai", 10));
            assertEquals(List.of("cow", "cowboy"), session.findTermsWithPrefix("cow", 10));
            assertEquals(List.of("milk"), session.findTermsWithPrefix("milk", 10));
            // 前缀之后的词项不会被带进来
            assertEquals(List.of("field"), session.findTermsWithPrefix("fi", 10));
            assertTrue(session.findTermsWithPrefix("zebra", 10).isEmpty());
            assertTrue(session.findTermsWithPrefix("dairyx", 10).isEmpty());
        }
    }

    @Test
    public void testFindTermsWithPrefixLimit() throws IOException {
        try (IndexedFileReader reader = open()) {
            SearchIndexSession session = reader.session("title").orElseThrow();
            assertEquals(List.of("dai", "dairy"), session.findTermsWithPrefix("dai", 2));
        }
    }

    @Test
    public void testPrefixLookupAgreesWithFullScan() throws IOException {
        try (IndexedFileReader reader = open()) {
            SearchIndexSession session = reader.session("title").orElseThrow();
            for (String prefix : Arrays.asList("d", "da", "dairy", "c", "m", "x")) {
                assertEquals(session.findTerms(term -> term.startsWith(prefix), 100),
                    session.findTermsWithPrefix(prefix, 100), prefix);
            }
        }
    }
}
