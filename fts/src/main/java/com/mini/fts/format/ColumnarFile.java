package com.mini.fts.format;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mini.fts.schema.Schema;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 列式宿主文件结构定义
 * 
 * 文件布局：
 * <pre>
 * [MAGIC 4B]
 * [RowGroup0: ColumnChunk0][ColumnChunk1]...[KeyBloomFilter]
 * [RowGroup1: ...]
 * [辅助区域（可选，不属于任何数据页）]
 * [Footer JSON][footer_length u32][MAGIC 4B]
 * </pre>
 * 
 * 不认识辅助区域的读取器只按 Footer 中记录的列块偏移读取数据，因此可以完全忽略它。
 */
public final class ColumnarFile {
    
    static final byte[] MAGIC = "MCF1".getBytes(StandardCharsets.US_ASCII);
    
    static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;
    
    /** footer_length(4) + MAGIC(4) */
    static final int TAIL_SIZE = 8;
    
    private ColumnarFile() {
    }
    
    /** 文件尾部元信息 */
    public static class Footer {
        /** 列定义 */
        private final Schema schema;
        
        /** 总行数 */
        private final long rowCount;
        
        /** 行组元信息 */
        private final List<RowGroupMeta> rowGroups;
        
        /** 可选的键值元数据，未知的键会被读取器忽略 */
        private final Map<String, String> keyValueMetadata;

        @JsonCreator
        public Footer(@JsonProperty("schema") Schema schema,
                      @JsonProperty("rowCount") long rowCount,
                      @JsonProperty("rowGroups") List<RowGroupMeta> rowGroups,
                      @JsonProperty("keyValueMetadata") Map<String, String> keyValueMetadata) {
            this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
            this.rowCount = rowCount;
            this.rowGroups = rowGroups == null ? new ArrayList<>() : new ArrayList<>(rowGroups);
            this.keyValueMetadata = keyValueMetadata == null 
                ? new LinkedHashMap<>() : new LinkedHashMap<>(keyValueMetadata);
        }

        public Schema getSchema() { return schema; }
        public long getRowCount() { return rowCount; }
        public List<RowGroupMeta> getRowGroups() { return Collections.unmodifiableList(rowGroups); }
        public Map<String, String> getKeyValueMetadata() { return Collections.unmodifiableMap(keyValueMetadata); }

        @Override
        public String toString() {
            return "Footer{" +
                    "rowCount=" + rowCount +
                    ", rowGroups=" + rowGroups.size() +
                    ", metadataKeys=" + keyValueMetadata.keySet() +
                    '}';
        }
    }

    /**
     * 行组：剪枝的最小粒度
     */
    public static class RowGroupMeta {
        private final int ordinal;
        private final long rowCount;
        private final List<ColumnChunkMeta> columns;
        
        /** 主键列布隆过滤器的位置，长度为 0 表示没有 */
        private final long keyBloomFilterOffset;
        private final int keyBloomFilterLength;

        @JsonCreator
        public RowGroupMeta(@JsonProperty("ordinal") int ordinal,
                            @JsonProperty("rowCount") long rowCount,
                            @JsonProperty("columns") List<ColumnChunkMeta> columns,
                            @JsonProperty("keyBloomFilterOffset") long keyBloomFilterOffset,
                            @JsonProperty("keyBloomFilterLength") int keyBloomFilterLength) {
            this.ordinal = ordinal;
            this.rowCount = rowCount;
            this.columns = new ArrayList<>(columns);
            this.keyBloomFilterOffset = keyBloomFilterOffset;
            this.keyBloomFilterLength = keyBloomFilterLength;
        }

        public int getOrdinal() { return ordinal; }
        public long getRowCount() { return rowCount; }
        public List<ColumnChunkMeta> getColumns() { return Collections.unmodifiableList(columns); }
        public long getKeyBloomFilterOffset() { return keyBloomFilterOffset; }
        public int getKeyBloomFilterLength() { return keyBloomFilterLength; }
        
        public ColumnChunkMeta getColumn(String name) {
            for (ColumnChunkMeta column : columns) {
                if (column.getColumnName().equals(name)) {
                    return column;
                }
            }
            return null;
        }
        
        @JsonIgnore
        public long getDataLength() {
            long total = 0;
            for (ColumnChunkMeta column : columns) {
                total += column.getLength();
            }
            return total;
        }

        @Override
        public String toString() {
            return "RowGroupMeta{" +
                    "ordinal=" + ordinal +
                    ", rowCount=" + rowCount +
                    ", columns=" + columns +
                    '}';
        }
    }

    /**
     * 列块：一个行组中某一列的连续编码数据
     */
    public static class ColumnChunkMeta {
        private final String columnName;
        private final long offset;
        private final long length;
        private final ColumnStatistics statistics;

        @JsonCreator
        public ColumnChunkMeta(@JsonProperty("columnName") String columnName,
                               @JsonProperty("offset") long offset,
                               @JsonProperty("length") long length,
                               @JsonProperty("statistics") ColumnStatistics statistics) {
            this.columnName = columnName;
            this.offset = offset;
            this.length = length;
            this.statistics = statistics;
        }

        public String getColumnName() { return columnName; }
        public long getOffset() { return offset; }
        public long getLength() { return length; }
        public ColumnStatistics getStatistics() { return statistics; }

        @Override
        public String toString() {
            return "ColumnChunkMeta{" +
                    "column='" + columnName + '\'' +
                    ", offset=" + offset +
                    ", length=" + length +
                    ", statistics=" + statistics +
                    '}';
        }
    }
    
    /**
     * 文件中的一段绝对字节区间
     */
    public static class Region {
        private final long offset;
        private final long length;

        @JsonCreator
        public Region(@JsonProperty("offset") long offset,
                      @JsonProperty("length") long length) {
            if (offset < 0 || length < 0) {
                throw new IllegalArgumentException("Invalid region: offset=" + offset + ", length=" + length);
            }
            this.offset = offset;
            this.length = length;
        }

        public long getOffset() { return offset; }
        public long getLength() { return length; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Region region = (Region) o;
            return offset == region.offset && length == region.length;
        }

        @Override
        public int hashCode() {
            return Objects.hash(offset, length);
        }

        @Override
        public String toString() {
            return "Region{offset=" + offset + ", length=" + length + '}';
        }
    }
}
