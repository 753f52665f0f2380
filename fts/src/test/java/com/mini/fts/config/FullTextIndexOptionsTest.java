package com.mini.fts.config;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FullTextIndexOptions测试
 */
public class FullTextIndexOptionsTest {
    
    @Test
    public void testDefaults() {
        FullTextIndexOptions options = FullTextIndexOptions.defaults();
        assertTrue(options.getIndexColumns().isEmpty());
        assertEquals("id", options.getKeyField());
        assertEquals(16.0, options.getWriterRamBufferMb());
        assertEquals(0.0004, options.getSelectivityCutoff());
        assertEquals(100_000, options.getMaxPushdownKeys());
        assertEquals(256, options.getMaxTermExpansions());
        assertEquals(1024, options.getRowGroupSize());
        assertEquals(0.01, options.getBloomFilterFpp());
    }
    
    @Test
    public void testFromMap() {
        Map<String, String> properties = new HashMap<>();
        properties.put(FullTextIndexOptions.INDEX_COLUMNS, "title, body ,,title");
        properties.put(FullTextIndexOptions.KEY_FIELD, "doc_id");
        properties.put(FullTextIndexOptions.SELECTIVITY_CUTOFF, "0.5");
        properties.put(FullTextIndexOptions.MAX_PUSHDOWN_KEYS, "10");
        properties.put(FullTextIndexOptions.MAX_TERM_EXPANSIONS, " 8 ");
        properties.put(FullTextIndexOptions.ROW_GROUP_SIZE, "64");
        properties.put(FullTextIndexOptions.BLOOM_FILTER_FPP, "0.05");
        properties.put(FullTextIndexOptions.WRITER_RAM_BUFFER_MB, "4");
        properties.put("unrelated.key", "ignored");
        
        FullTextIndexOptions options = FullTextIndexOptions.fromMap(properties);
        assertEquals(Arrays.asList("title", "body"), options.getIndexColumns());
        assertEquals("doc_id", options.getKeyField());
        assertEquals(0.5, options.getSelectivityCutoff());
        assertEquals(10, options.getMaxPushdownKeys());
        assertEquals(8, options.getMaxTermExpansions());
        assertEquals(64, options.getRowGroupSize());
        assertEquals(0.05, options.getBloomFilterFpp());
        assertEquals(4.0, options.getWriterRamBufferMb());
    }
    
    @Test
    public void testInvalidValues() {
        Map<String, String> properties = new HashMap<>();
        properties.put(FullTextIndexOptions.MAX_PUSHDOWN_KEYS, "many");
        assertThrows(IllegalArgumentException.class, () -> FullTextIndexOptions.fromMap(properties));
        
        assertThrows(IllegalArgumentException.class, 
            () -> FullTextIndexOptions.builder().rowGroupSize(0).build());
        assertThrows(IllegalArgumentException.class, 
            () -> FullTextIndexOptions.builder().bloomFilterFpp(1.0).build());
        assertThrows(IllegalArgumentException.class, 
            () -> FullTextIndexOptions.builder().keyField("").build());
        assertThrows(IllegalArgumentException.class, 
            () -> FullTextIndexOptions.builder().selectivityCutoff(-1).build());
    }
}
