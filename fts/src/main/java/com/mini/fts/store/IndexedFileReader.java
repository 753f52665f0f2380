package com.mini.fts.store;

import com.mini.fts.format.ColumnarFileReader;
import com.mini.fts.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 带全文索引的宿主文件读取器
 * 持有打开的列式文件，并按列懒加载、缓存索引会话
 * 
 * 每个打开的文件句柄对每列至多提取一次，提取失败的结果同样被缓存。
 * 关闭时关闭所有会话。
 */
public class IndexedFileReader implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(IndexedFileReader.class);
    
    private final ColumnarFileReader fileReader;
    private final Map<String, Optional<SearchIndexSession>> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger extractionCount = new AtomicInteger();
    private volatile boolean closed;
    
    public IndexedFileReader(ColumnarFileReader fileReader) {
        this.fileReader = fileReader;
    }
    
    public static IndexedFileReader open(Path path) throws IOException {
        return new IndexedFileReader(ColumnarFileReader.open(path));
    }
    
    public ColumnarFileReader getFileReader() {
        return fileReader;
    }
    
    public Schema getSchema() {
        return fileReader.getSchema();
    }
    
    public long getRowCount() {
        return fileReader.getRowCount();
    }
    
    /**
     * 元数据中声明了索引的列（不代表索引一定可用）
     */
    public Set<String> getIndexedColumns() {
        Set<String> columns = new TreeSet<>();
        for (String key : fileReader.getFooter().getKeyValueMetadata().keySet()) {
            if (key.startsWith(IndexMetadata.KEY_PREFIX)) {
                columns.add(key.substring(IndexMetadata.KEY_PREFIX.length()));
            }
        }
        return columns;
    }
    
    /**
     * 获取某列的索引会话，首次访问时提取
     */
    public Optional<SearchIndexSession> session(String column) {
        if (closed) {
            throw new IllegalStateException("Reader is closed: " + fileReader.getPath());
        }
        return sessions.computeIfAbsent(column, c -> {
            extractionCount.incrementAndGet();
            return EmbeddedIndexStore.extract(fileReader, c);
        });
    }
    
    /**
     * 实际执行过的提取次数
     */
    public int getExtractionCount() {
        return extractionCount.get();
    }
    
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        IOException failure = null;
        for (Optional<SearchIndexSession> session : sessions.values()) {
            if (session.isPresent()) {
                try {
                    session.get().close();
                } catch (IOException e) {
                    logger.warn("Failed to close {}", session.get(), e);
                    failure = e;
                }
            }
        }
        sessions.clear();
        fileReader.close();
        if (failure != null) {
            throw failure;
        }
    }
}
