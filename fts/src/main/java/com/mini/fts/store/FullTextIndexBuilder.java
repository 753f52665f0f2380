package com.mini.fts.store;

import com.mini.fts.archive.ArchiveFile;
import com.mini.fts.exception.SearchBackendException;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 单列全文索引构建器
 * 在内存目录中建立 Lucene 索引，完成后导出为按文件名排序的 (name, bytes) 列表
 * 
 * 每个文档包含主键（数值 DocValues + 存储字段）和一个不存储的文本字段。
 */
public class FullTextIndexBuilder implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(FullTextIndexBuilder.class);
    
    private final String column;
    private final String keyField;
    private final ByteBuffersDirectory directory;
    private final IndexWriter indexWriter;
    
    private long documentCount;
    private boolean finished;
    
    public FullTextIndexBuilder(String column, String keyField, double ramBufferMb) {
        if (column.equals(keyField)) {
            throw new IllegalArgumentException("Text column cannot be the key field: " + column);
        }
        this.column = column;
        this.keyField = keyField;
        this.directory = new ByteBuffersDirectory();
        
        IndexWriterConfig config = new IndexWriterConfig(new FullTextAnalyzer());
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
        config.setRAMBufferSizeMB(ramBufferMb);
        try {
            this.indexWriter = new IndexWriter(directory, config);
        } catch (IOException e) {
            throw new SearchBackendException("Failed to create index writer for column " + column, e);
        }
    }
    
    /**
     * 添加一个文档，text 为 null 时只记录主键
     */
    public void add(long key, String text) {
        if (finished) {
            throw new IllegalStateException("Index builder for column " + column + " is already finished");
        }
        Document document = new Document();
        document.add(new NumericDocValuesField(keyField, key));
        document.add(new StoredField(keyField, key));
        if (text != null) {
            document.add(new TextField(column, text, Field.Store.NO));
        }
        try {
            indexWriter.addDocument(document);
        } catch (IOException e) {
            throw new SearchBackendException("Failed to index key " + key + " of column " + column, e);
        }
        documentCount++;
    }
    
    /**
     * 提交并合并为单个段，然后导出全部索引文件
     */
    public List<ArchiveFile> finish() throws IOException {
        if (finished) {
            throw new IllegalStateException("Index builder for column " + column + " is already finished");
        }
        finished = true;
        
        indexWriter.forceMerge(1);
        indexWriter.commit();
        indexWriter.close();
        
        String[] names = directory.listAll();
        Arrays.sort(names);
        List<ArchiveFile> files = new ArrayList<>(names.length);
        long totalBytes = 0;
        for (String name : names) {
            if (IndexWriter.WRITE_LOCK_NAME.equals(name)) {
                continue;
            }
            try (IndexInput input = directory.openInput(name, IOContext.READONCE)) {
                byte[] bytes = new byte[Math.toIntExact(input.length())];
                input.readBytes(bytes, 0, bytes.length);
                files.add(ArchiveFile.of(name, bytes));
                totalBytes += bytes.length;
            }
        }
        directory.close();
        
        logger.info("Built full-text index: column={}, documents={}, files={}, bytes={}", 
                   column, documentCount, files.size(), totalBytes);
        return files;
    }
    
    public String getColumn() {
        return column;
    }
    
    public String getKeyField() {
        return keyField;
    }
    
    public long getDocumentCount() {
        return documentCount;
    }
    
    /**
     * 放弃未完成的索引
     */
    @Override
    public void close() throws IOException {
        if (!finished) {
            finished = true;
            indexWriter.rollback();
            directory.close();
        }
    }
}
