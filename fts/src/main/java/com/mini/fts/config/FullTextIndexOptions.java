package com.mini.fts.config;

import com.mini.fts.format.ColumnarFileWriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 全文索引配置选项
 * 
 * 既可以通过 Builder 构造，也可以从表属性风格的键值对解析（{@link #fromMap(Map)}）。
 */
public class FullTextIndexOptions {
    
    public static final String INDEX_COLUMNS = "fts.index.columns";
    public static final String KEY_FIELD = "fts.index.key-field";
    public static final String WRITER_RAM_BUFFER_MB = "fts.index.writer-ram-buffer-mb";
    public static final String SELECTIVITY_CUTOFF = "fts.rewrite.selectivity-cutoff";
    public static final String MAX_PUSHDOWN_KEYS = "fts.rewrite.max-pushdown-keys";
    public static final String MAX_TERM_EXPANSIONS = "fts.rewrite.max-term-expansions";
    public static final String ROW_GROUP_SIZE = "fts.file.row-group-size";
    public static final String BLOOM_FILTER_FPP = "fts.file.bloom-filter-fpp";
    
    /** 建立全文索引的文本列 */
    private final List<String> indexColumns;
    
    /** 索引中保存的主键列，默认 id */
    private final String keyField;
    
    /** Lucene IndexWriter 内存缓冲大小（MB），默认 16 */
    private final double writerRamBufferMb;
    
    /** 命中行数占比超过该值时放弃改写，默认 0.04% */
    private final double selectivityCutoff;
    
    /** 单次改写最多解析的主键数 */
    private final int maxPushdownKeys;
    
    /** 部分词在词典中最多扩展出的词项数 */
    private final int maxTermExpansions;
    
    private final int rowGroupSize;
    
    private final double bloomFilterFpp;
    
    private FullTextIndexOptions(Builder builder) {
        this.indexColumns = Collections.unmodifiableList(new ArrayList<>(builder.indexColumns));
        this.keyField = builder.keyField;
        this.writerRamBufferMb = builder.writerRamBufferMb;
        this.selectivityCutoff = builder.selectivityCutoff;
        this.maxPushdownKeys = builder.maxPushdownKeys;
        this.maxTermExpansions = builder.maxTermExpansions;
        this.rowGroupSize = builder.rowGroupSize;
        this.bloomFilterFpp = builder.bloomFilterFpp;
    }
    
    public static FullTextIndexOptions defaults() {
        return builder().build();
    }
    
    /**
     * 从键值对解析，未出现的键取默认值
     */
    public static FullTextIndexOptions fromMap(Map<String, String> options) {
        Builder builder = builder();
        String columns = options.get(INDEX_COLUMNS);
        if (columns != null) {
            for (String column : columns.split(",")) {
                if (!column.trim().isEmpty()) {
                    builder.indexColumn(column.trim());
                }
            }
        }
        if (options.containsKey(KEY_FIELD)) {
            builder.keyField(options.get(KEY_FIELD).trim());
        }
        if (options.containsKey(WRITER_RAM_BUFFER_MB)) {
            builder.writerRamBufferMb(parseDouble(options, WRITER_RAM_BUFFER_MB));
        }
        if (options.containsKey(SELECTIVITY_CUTOFF)) {
            builder.selectivityCutoff(parseDouble(options, SELECTIVITY_CUTOFF));
        }
        if (options.containsKey(MAX_PUSHDOWN_KEYS)) {
            builder.maxPushdownKeys(parseInt(options, MAX_PUSHDOWN_KEYS));
        }
        if (options.containsKey(MAX_TERM_EXPANSIONS)) {
            builder.maxTermExpansions(parseInt(options, MAX_TERM_EXPANSIONS));
        }
        if (options.containsKey(ROW_GROUP_SIZE)) {
            builder.rowGroupSize(parseInt(options, ROW_GROUP_SIZE));
        }
        if (options.containsKey(BLOOM_FILTER_FPP)) {
            builder.bloomFilterFpp(parseDouble(options, BLOOM_FILTER_FPP));
        }
        return builder.build();
    }
    
    private static int parseInt(Map<String, String> options, String key) {
        try {
            return Integer.parseInt(options.get(key).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + options.get(key), e);
        }
    }
    
    private static double parseDouble(Map<String, String> options, String key) {
        try {
            return Double.parseDouble(options.get(key).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + options.get(key), e);
        }
    }
    
    public List<String> getIndexColumns() {
        return indexColumns;
    }
    
    public String getKeyField() {
        return keyField;
    }
    
    public double getWriterRamBufferMb() {
        return writerRamBufferMb;
    }
    
    public double getSelectivityCutoff() {
        return selectivityCutoff;
    }
    
    public int getMaxPushdownKeys() {
        return maxPushdownKeys;
    }
    
    public int getMaxTermExpansions() {
        return maxTermExpansions;
    }
    
    public int getRowGroupSize() {
        return rowGroupSize;
    }
    
    public double getBloomFilterFpp() {
        return bloomFilterFpp;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private final List<String> indexColumns = new ArrayList<>();
        private String keyField = "id";
        private double writerRamBufferMb = 16.0;
        private double selectivityCutoff = 0.0004;
        private int maxPushdownKeys = 100_000;
        private int maxTermExpansions = 256;
        private int rowGroupSize = ColumnarFileWriter.DEFAULT_ROW_GROUP_SIZE;
        private double bloomFilterFpp = ColumnarFileWriter.DEFAULT_BLOOM_FILTER_FPP;
        
        public Builder indexColumn(String column) {
            if (!indexColumns.contains(column)) {
                indexColumns.add(column);
            }
            return this;
        }
        
        public Builder indexColumns(List<String> columns) {
            for (String column : columns) {
                indexColumn(column);
            }
            return this;
        }
        
        public Builder keyField(String keyField) {
            this.keyField = keyField;
            return this;
        }
        
        public Builder writerRamBufferMb(double writerRamBufferMb) {
            this.writerRamBufferMb = writerRamBufferMb;
            return this;
        }
        
        public Builder selectivityCutoff(double selectivityCutoff) {
            this.selectivityCutoff = selectivityCutoff;
            return this;
        }
        
        public Builder maxPushdownKeys(int maxPushdownKeys) {
            this.maxPushdownKeys = maxPushdownKeys;
            return this;
        }
        
        public Builder maxTermExpansions(int maxTermExpansions) {
            this.maxTermExpansions = maxTermExpansions;
            return this;
        }
        
        public Builder rowGroupSize(int rowGroupSize) {
            this.rowGroupSize = rowGroupSize;
            return this;
        }
        
        public Builder bloomFilterFpp(double bloomFilterFpp) {
            this.bloomFilterFpp = bloomFilterFpp;
            return this;
        }
        
        public FullTextIndexOptions build() {
            if (keyField == null || keyField.isEmpty()) {
                throw new IllegalArgumentException("Key field must be specified");
            }
            if (selectivityCutoff < 0) {
                throw new IllegalArgumentException("Selectivity cutoff must not be negative: " + selectivityCutoff);
            }
            if (maxPushdownKeys <= 0 || maxTermExpansions <= 0 || rowGroupSize <= 0) {
                throw new IllegalArgumentException("Limits must be positive: maxPushdownKeys=" + maxPushdownKeys
                    + ", maxTermExpansions=" + maxTermExpansions + ", rowGroupSize=" + rowGroupSize);
            }
            if (bloomFilterFpp <= 0 || bloomFilterFpp >= 1) {
                throw new IllegalArgumentException("Bloom filter fpp must be in (0, 1): " + bloomFilterFpp);
            }
            return new FullTextIndexOptions(this);
        }
    }
    
    @Override
    public String toString() {
        return "FullTextIndexOptions{" +
                "indexColumns=" + indexColumns +
                ", keyField='" + keyField + '\'' +
                ", selectivityCutoff=" + selectivityCutoff +
                ", maxPushdownKeys=" + maxPushdownKeys +
                ", maxTermExpansions=" + maxTermExpansions +
                ", rowGroupSize=" + rowGroupSize +
                '}';
    }
}
