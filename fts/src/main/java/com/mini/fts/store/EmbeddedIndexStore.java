package com.mini.fts.store;

import com.mini.fts.archive.ArchiveFile;
import com.mini.fts.archive.ArchiveWriter;
import com.mini.fts.archive.VirtualDirectory;
import com.mini.fts.exception.MiniFtsException;
import com.mini.fts.format.ColumnarFile;
import com.mini.fts.format.ColumnarFileReader;
import com.mini.fts.format.ColumnarFileWriter;
import com.mini.fts.schema.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;

/**
 * 嵌入式索引存储
 * 
 * 写入时：把索引文件打包为归档，写入宿主文件数据页之后的辅助区域，
 * 并在 Footer 元数据中记录 fts.index.&lt;column&gt; -&gt; {offset, length, ...}。
 * 
 * 读取时：按元数据读出归档区间，解析为虚拟目录，再在其上打开 Lucene 索引。
 * 任何导致索引不可用的问题都只返回空结果，查询退回全表扫描。
 */
public final class EmbeddedIndexStore {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddedIndexStore.class);
    
    private EmbeddedIndexStore() {
    }
    
    /**
     * 打包并嵌入一个列的索引文件
     */
    public static IndexMetadata embed(ColumnarFileWriter writer, String column, String keyField,
                                      List<ArchiveFile> files) throws IOException {
        return embedArchive(writer, column, keyField, ArchiveWriter.pack(files), files.size());
    }
    
    /**
     * 嵌入已经打包好的归档
     */
    public static IndexMetadata embedArchive(ColumnarFileWriter writer, String column, String keyField,
                                             byte[] archive, int fileCount) throws IOException {
        ColumnarFile.Region region = writer.appendAuxiliaryRegion(archive);
        IndexMetadata metadata = new IndexMetadata(region.getOffset(), region.getLength(), column, keyField,
                                                   FullTextAnalyzer.ANALYZER_ID, fileCount);
        writer.putMetadata(IndexMetadata.metadataKey(column), metadata.toJson());
        logger.info("Embedded full-text index into {}: {}", writer.getPath(), metadata);
        return metadata;
    }
    
    /**
     * 读取元数据项，不存在或无法解析时返回空
     */
    public static Optional<IndexMetadata> readMetadata(ColumnarFileReader reader, String column) {
        Optional<String> value = reader.getMetadata(IndexMetadata.metadataKey(column));
        if (!value.isPresent()) {
            return Optional.empty();
        }
        try {
            return Optional.of(IndexMetadata.fromJson(value.get()));
        } catch (IOException e) {
            logger.warn("Malformed index metadata for column {} in {}: {}", column, reader.getPath(), e.getMessage());
            return Optional.empty();
        }
    }
    
    /**
     * 从宿主文件重建某一列的索引会话
     */
    public static Optional<SearchIndexSession> extract(ColumnarFileReader reader, String column) {
        Optional<IndexMetadata> found = readMetadata(reader, column);
        if (!found.isPresent()) {
            logger.debug("No embedded index for column {} in {}", column, reader.getPath());
            return Optional.empty();
        }
        IndexMetadata metadata = found.get();
        
        if (!column.equals(metadata.getColumn())) {
            logger.warn("Index metadata of column {} in {} describes column {}, ignoring it", 
                       column, reader.getPath(), metadata.getColumn());
            return Optional.empty();
        }
        if (!FullTextAnalyzer.ANALYZER_ID.equals(metadata.getAnalyzer())) {
            logger.warn("Index of column {} in {} was built with analyzer {}, expected {}, ignoring it",
                       column, reader.getPath(), metadata.getAnalyzer(), FullTextAnalyzer.ANALYZER_ID);
            return Optional.empty();
        }
        Field keyField = reader.getSchema().getField(metadata.getKeyField());
        if (keyField == null || !keyField.isKeyCandidate()) {
            logger.warn("Index of column {} in {} refers to unknown key field {}, ignoring it",
                       column, reader.getPath(), metadata.getKeyField());
            return Optional.empty();
        }
        
        try {
            ByteBuffer bytes = reader.readRange(metadata.getOffset(), metadata.getLength());
            VirtualDirectory directory = VirtualDirectory.open(bytes);
            if (directory.getFileCount() != metadata.getFileCount()) {
                logger.warn("Index archive of column {} in {} has {} files, metadata records {}, ignoring it",
                           column, reader.getPath(), directory.getFileCount(), metadata.getFileCount());
                return Optional.empty();
            }
            SearchIndexSession session = SearchIndexSession.open(directory, column, metadata.getKeyField());
            logger.info("Extracted full-text index of column {} from {}: {} files, {} bytes",
                       column, reader.getPath(), directory.getFileCount(), metadata.getLength());
            return Optional.of(session);
        } catch (IOException | MiniFtsException | IllegalArgumentException e) {
            logger.warn("No usable index for column {} in {}: {}", column, reader.getPath(), e.toString());
            return Optional.empty();
        }
    }
}
