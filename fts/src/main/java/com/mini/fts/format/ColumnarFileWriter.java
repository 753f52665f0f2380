package com.mini.fts.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import com.mini.fts.schema.Field;
import com.mini.fts.schema.Row;
import com.mini.fts.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 列式文件写入器
 * 按行缓冲，满 rowGroupSize 行后按列写出一个行组
 * 
 * 写入顺序：数据行组 -> 辅助区域 -> Footer。
 * 一旦写入辅助区域，就不能再追加数据行。
 */
public class ColumnarFileWriter implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(ColumnarFileWriter.class);
    
    /** 默认行组大小 */
    public static final int DEFAULT_ROW_GROUP_SIZE = 1024;
    
    /** 布隆过滤器误判率 */
    public static final double DEFAULT_BLOOM_FILTER_FPP = 0.01;
    
    private final Path path;
    private final Schema schema;
    private final int rowGroupSize;
    private final double bloomFilterFpp;
    private final ObjectMapper objectMapper;
    private final FileChannel fileChannel;
    
    private final List<Row> pendingRows = new ArrayList<>();
    private final List<ColumnarFile.RowGroupMeta> rowGroups = new ArrayList<>();
    private final Map<String, String> keyValueMetadata = new LinkedHashMap<>();
    
    private long rowCount;
    private boolean dataSealed;
    private boolean closed;
    
    public ColumnarFileWriter(Path path, Schema schema) throws IOException {
        this(path, schema, DEFAULT_ROW_GROUP_SIZE, DEFAULT_BLOOM_FILTER_FPP);
    }
    
    public ColumnarFileWriter(Path path, Schema schema, int rowGroupSize, double bloomFilterFpp) 
            throws IOException {
        if (rowGroupSize <= 0) {
            throw new IllegalArgumentException("Row group size must be positive: " + rowGroupSize);
        }
        this.path = path;
        this.schema = schema;
        this.rowGroupSize = rowGroupSize;
        this.bloomFilterFpp = bloomFilterFpp;
        this.objectMapper = new ObjectMapper();
        
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        this.fileChannel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        writeFully(ByteBuffer.wrap(ColumnarFile.MAGIC));
    }
    
    /**
     * 写入一行
     */
    public void write(Row row) throws IOException {
        ensureOpen();
        if (dataSealed) {
            throw new IllegalStateException("Cannot write rows after an auxiliary region was appended");
        }
        pendingRows.add(row.validate(schema));
        rowCount++;
        if (pendingRows.size() >= rowGroupSize) {
            flushRowGroup();
        }
    }
    
    /**
     * 在所有数据页之后写入一段不透明字节，返回其绝对位置
     */
    public ColumnarFile.Region appendAuxiliaryRegion(byte[] bytes) throws IOException {
        ensureOpen();
        finishData();
        long offset = fileChannel.position();
        writeFully(ByteBuffer.wrap(bytes));
        logger.debug("Appended auxiliary region to {}: offset={}, length={}", path, offset, bytes.length);
        return new ColumnarFile.Region(offset, bytes.length);
    }
    
    /**
     * 记录一条 Footer 键值元数据
     */
    public void putMetadata(String key, String value) {
        ensureOpen();
        keyValueMetadata.put(key, value);
    }
    
    public long getRowCount() {
        return rowCount;
    }
    
    public Schema getSchema() {
        return schema;
    }
    
    public Path getPath() {
        return path;
    }
    
    /**
     * 刷出剩余行并写入 Footer
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            finishData();
            
            ColumnarFile.Footer footer = new ColumnarFile.Footer(schema, rowCount, rowGroups, keyValueMetadata);
            byte[] footerBytes = objectMapper.writeValueAsBytes(footer);
            writeFully(ByteBuffer.wrap(footerBytes));
            
            ByteBuffer tail = ByteBuffer.allocate(ColumnarFile.TAIL_SIZE).order(ColumnarFile.BYTE_ORDER);
            tail.putInt(footerBytes.length);
            tail.put(ColumnarFile.MAGIC);
            tail.flip();
            writeFully(tail);
            
            fileChannel.force(true);
            logger.info("Wrote columnar file: file={}, rows={}, rowGroups={}, size={} bytes",
                       path, rowCount, rowGroups.size(), fileChannel.size());
        } finally {
            closed = true;
            fileChannel.close();
        }
    }
    
    /**
     * 刷出缓冲中的行，此后只允许追加辅助区域
     */
    public void finishData() throws IOException {
        if (!dataSealed) {
            if (!pendingRows.isEmpty()) {
                flushRowGroup();
            }
            dataSealed = true;
        }
    }
    
    private void flushRowGroup() throws IOException {
        List<Field> fields = schema.getFields();
        List<ColumnarFile.ColumnChunkMeta> chunks = new ArrayList<>(fields.size());
        
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            List<Object> values = new ArrayList<>(pendingRows.size());
            ColumnStatistics.Collector stats = new ColumnStatistics.Collector(field.getName(), field.getType());
            for (Row row : pendingRows) {
                Object value = row.get(i);
                values.add(value);
                stats.update(value);
            }
            
            byte[] encoded = ColumnCodec.encode(field.getType(), values);
            long offset = fileChannel.position();
            writeFully(ByteBuffer.wrap(encoded));
            chunks.add(new ColumnarFile.ColumnChunkMeta(field.getName(), offset, encoded.length, stats.finish()));
        }
        
        // 主键列布隆过滤器
        BloomFilter<Long> bloomFilter = BloomFilter.create(
            Funnels.longFunnel(), pendingRows.size(), bloomFilterFpp);
        int keyIndex = schema.getKeyIndex();
        for (Row row : pendingRows) {
            bloomFilter.put((Long) row.get(keyIndex));
        }
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        bloomFilter.writeTo(baos);
        byte[] bloomBytes = baos.toByteArray();
        long bloomOffset = fileChannel.position();
        writeFully(ByteBuffer.wrap(bloomBytes));
        
        ColumnarFile.RowGroupMeta meta = new ColumnarFile.RowGroupMeta(
            rowGroups.size(), pendingRows.size(), chunks, bloomOffset, bloomBytes.length);
        rowGroups.add(meta);
        
        logger.debug("Flushed row group {}: rows={}, dataBytes={}", 
                    meta.getOrdinal(), meta.getRowCount(), meta.getDataLength());
        pendingRows.clear();
    }
    
    private void writeFully(ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            fileChannel.write(buffer);
        }
    }
    
    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Writer is closed: " + path);
        }
    }
}
