package com.mini.fts.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * 宿主文件 Footer 中的索引元数据项
 * 键为 fts.index.&lt;column&gt;，值为本类的 JSON
 */
public class IndexMetadata {
    
    public static final String KEY_PREFIX = "fts.index.";
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    /** 归档在宿主文件中的绝对偏移 */
    private final long offset;
    
    /** 归档长度 */
    private final long length;
    
    private final String column;
    private final String keyField;
    private final String analyzer;
    private final int fileCount;

    @JsonCreator
    public IndexMetadata(@JsonProperty("offset") long offset,
                         @JsonProperty("length") long length,
                         @JsonProperty("column") String column,
                         @JsonProperty("keyField") String keyField,
                         @JsonProperty("analyzer") String analyzer,
                         @JsonProperty("fileCount") int fileCount) {
        this.offset = offset;
        this.length = length;
        this.column = column;
        this.keyField = keyField;
        this.analyzer = analyzer;
        this.fileCount = fileCount;
    }
    
    public static String metadataKey(String column) {
        return KEY_PREFIX + column;
    }
    
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize index metadata", e);
        }
    }
    
    public static IndexMetadata fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, IndexMetadata.class);
    }

    public long getOffset() { return offset; }
    public long getLength() { return length; }
    public String getColumn() { return column; }
    public String getKeyField() { return keyField; }
    public String getAnalyzer() { return analyzer; }
    public int getFileCount() { return fileCount; }

    @Override
    public String toString() {
        return "IndexMetadata{" +
                "offset=" + offset +
                ", length=" + length +
                ", column='" + column + '\'' +
                ", keyField='" + keyField + '\'' +
                ", analyzer='" + analyzer + '\'' +
                ", fileCount=" + fileCount +
                '}';
    }
}
