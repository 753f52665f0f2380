package com.mini.fts.store;

import com.mini.fts.archive.ArchiveFile;
import com.mini.fts.archive.ArchiveWriter;
import com.mini.fts.config.FullTextIndexOptions;
import com.mini.fts.exception.SearchBackendException;
import com.mini.fts.format.ColumnarFileWriter;
import com.mini.fts.schema.Field;
import com.mini.fts.schema.Row;
import com.mini.fts.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 带全文索引的宿主文件写入器
 * 行数据写入列式文件，同时把配置的文本列写入各自的索引构建器
 * 
 * 关闭时索引的提交和打包与最后一个行组的刷写并行进行，两者没有共享的可变状态，
 * 都完成后再把归档依次写入辅助区域并写出 Footer。
 */
public class IndexedFileWriter implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(IndexedFileWriter.class);
    
    private final Schema schema;
    private final ColumnarFileWriter fileWriter;
    private final int keyIndex;
    
    /** 列名 -> 索引构建器 */
    private final Map<String, FullTextIndexBuilder> builders = new LinkedHashMap<>();
    private final Map<String, Integer> columnIndexes = new LinkedHashMap<>();
    
    private boolean closed;
    
    public IndexedFileWriter(Path path, Schema schema, FullTextIndexOptions options) throws IOException {
        this.schema = schema;
        if (!schema.getKeyField().equals(options.getKeyField())) {
            throw new IllegalArgumentException("Index key field " + options.getKeyField() 
                + " does not match schema key field " + schema.getKeyField());
        }
        for (String column : options.getIndexColumns()) {
            Field field = schema.getField(column);
            if (field == null || !field.isFullTextIndexable()) {
                throw new IllegalArgumentException("Indexed column must be an existing STRING field: " + column);
            }
            columnIndexes.put(column, schema.getFieldIndex(column));
        }
        this.keyIndex = schema.getKeyIndex();
        this.fileWriter = new ColumnarFileWriter(path, schema, options.getRowGroupSize(), options.getBloomFilterFpp());
        for (String column : columnIndexes.keySet()) {
            builders.put(column, new FullTextIndexBuilder(column, schema.getKeyField(), 
                                                          options.getWriterRamBufferMb()));
        }
    }
    
    public void write(Row row) throws IOException {
        Row normalized = row.validate(schema);
        fileWriter.write(normalized);
        long key = (Long) normalized.get(keyIndex);
        for (Map.Entry<String, FullTextIndexBuilder> entry : builders.entrySet()) {
            entry.getValue().add(key, (String) normalized.get(columnIndexes.get(entry.getKey())));
        }
    }
    
    public long getRowCount() {
        return fileWriter.getRowCount();
    }
    
    public Path getPath() {
        return fileWriter.getPath();
    }
    
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        
        CompletableFuture<List<PackedIndex>> packing = CompletableFuture.supplyAsync(this::packIndexes);
        try {
            fileWriter.finishData();
            
            List<PackedIndex> packed = joinPacking(packing);
            for (PackedIndex index : packed) {
                EmbeddedIndexStore.embedArchive(fileWriter, index.column, schema.getKeyField(), 
                                                index.archive, index.fileCount);
            }
            logger.info("Closing indexed file {}: rows={}, indexedColumns={}", 
                       fileWriter.getPath(), fileWriter.getRowCount(), builders.keySet());
        } finally {
            // 构建器只能在打包线程结束后释放
            packing.exceptionally(e -> null).join();
            try {
                for (FullTextIndexBuilder builder : builders.values()) {
                    builder.close();
                }
            } finally {
                fileWriter.close();
            }
        }
    }
    
    private List<PackedIndex> packIndexes() {
        List<PackedIndex> packed = new ArrayList<>(builders.size());
        for (FullTextIndexBuilder builder : builders.values()) {
            try {
                List<ArchiveFile> files = builder.finish();
                packed.add(new PackedIndex(builder.getColumn(), ArchiveWriter.pack(files), files.size()));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return packed;
    }
    
    private static List<PackedIndex> joinPacking(CompletableFuture<List<PackedIndex>> packing) throws IOException {
        try {
            return packing.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new SearchBackendException("Failed to build full-text index", cause);
        }
    }
    
    private static final class PackedIndex {
        private final String column;
        private final byte[] archive;
        private final int fileCount;
        
        private PackedIndex(String column, byte[] archive, int fileCount) {
            this.column = column;
            this.archive = archive;
            this.fileCount = fileCount;
        }
    }
}
