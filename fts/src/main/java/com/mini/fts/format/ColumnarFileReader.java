package com.mini.fts.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import com.mini.fts.exception.HostFileException;
import com.mini.fts.predicate.Predicate;
import com.mini.fts.schema.Field;
import com.mini.fts.schema.Row;
import com.mini.fts.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 列式文件读取器
 * 打开时只读取 Footer；扫描时按行组读取，并利用统计信息跳过不可能命中的行组
 * 
 * 所有读取都使用定位读（positional read），同一个读取器可以被多个线程并发扫描。
 */
public class ColumnarFileReader implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(ColumnarFileReader.class);
    
    private final Path path;
    private final FileChannel fileChannel;
    private final long fileSize;
    private final ColumnarFile.Footer footer;
    private final RowGroupFilter rowGroupFilter;
    private final ReadStatistics readStatistics = new ReadStatistics();
    
    /** 行组序号 -> 主键布隆过滤器 */
    private final Map<Integer, BloomFilter<Long>> bloomFilterCache = new ConcurrentHashMap<>();
    
    private ColumnarFileReader(Path path, FileChannel fileChannel, long fileSize, ColumnarFile.Footer footer) {
        this.path = path;
        this.fileChannel = fileChannel;
        this.fileSize = fileSize;
        this.footer = footer;
        this.rowGroupFilter = new RowGroupFilter(footer.getSchema().getKeyField(), this::loadBloomFilter);
    }
    
    public static ColumnarFileReader open(Path path) throws IOException {
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            long size = channel.size();
            ColumnarFile.Footer footer = readFooter(path, channel, size);
            logger.debug("Opened columnar file: file={}, rows={}, rowGroups={}", 
                        path, footer.getRowCount(), footer.getRowGroups().size());
            return new ColumnarFileReader(path, channel, size, footer);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }
    
    private static ColumnarFile.Footer readFooter(Path path, FileChannel channel, long size) throws IOException {
        int minimumSize = ColumnarFile.MAGIC.length + ColumnarFile.TAIL_SIZE;
        if (size < minimumSize) {
            throw new HostFileException("File too small to be a columnar file: " + path);
        }
        
        ByteBuffer head = readAt(channel, 0, ColumnarFile.MAGIC.length);
        if (!Arrays.equals(head.array(), ColumnarFile.MAGIC)) {
            throw new HostFileException("Invalid leading magic in " + path);
        }
        
        ByteBuffer tail = readAt(channel, size - ColumnarFile.TAIL_SIZE, ColumnarFile.TAIL_SIZE)
            .order(ColumnarFile.BYTE_ORDER);
        int footerLength = tail.getInt();
        byte[] magic = new byte[ColumnarFile.MAGIC.length];
        tail.get(magic);
        if (!Arrays.equals(magic, ColumnarFile.MAGIC)) {
            throw new HostFileException("Invalid trailing magic in " + path);
        }
        if (footerLength < 0 || footerLength > size - minimumSize) {
            throw new HostFileException("Invalid footer length " + footerLength + " in " + path);
        }
        
        ByteBuffer footerBytes = readAt(channel, size - ColumnarFile.TAIL_SIZE - footerLength, footerLength);
        return new ObjectMapper().readValue(footerBytes.array(), ColumnarFile.Footer.class);
    }
    
    private static ByteBuffer readAt(FileChannel channel, long position, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, position + buffer.position());
            if (n < 0) {
                throw new EOFException("Unexpected end of file at " + (position + buffer.position()));
            }
        }
        buffer.flip();
        return buffer;
    }
    
    public ColumnarFile.Footer getFooter() {
        return footer;
    }
    
    public Schema getSchema() {
        return footer.getSchema();
    }
    
    public long getRowCount() {
        return footer.getRowCount();
    }
    
    public Path getPath() {
        return path;
    }
    
    public long getFileSize() {
        return fileSize;
    }
    
    public ReadStatistics getReadStatistics() {
        return readStatistics;
    }
    
    /**
     * 读取 Footer 键值元数据
     */
    public Optional<String> getMetadata(String key) {
        return Optional.ofNullable(footer.getKeyValueMetadata().get(key));
    }
    
    /**
     * 读取全部行
     */
    public List<Row> readAll() throws IOException {
        return read(null);
    }
    
    /**
     * 按下推谓词扫描
     * 先用统计信息跳过整个行组，再对读出的行逐行求值
     * 
     * @param pushdown 下推谓词，为 null 时读取全部行
     */
    public List<Row> read(Predicate pushdown) throws IOException {
        Schema schema = footer.getSchema();
        List<Row> result = new ArrayList<>();
        
        for (ColumnarFile.RowGroupMeta rowGroup : footer.getRowGroups()) {
            if (!rowGroupFilter.mightMatch(pushdown, rowGroup)) {
                readStatistics.recordRowGroupSkipped();
                logger.trace("Skipped row group {} of {}", rowGroup.getOrdinal(), path);
                continue;
            }
            
            for (Row row : readRowGroup(schema, rowGroup)) {
                if (pushdown == null || pushdown.test(row, schema)) {
                    result.add(row);
                }
            }
        }
        
        logger.debug("Scanned {} with pushdown [{}]: {} rows, {}", path, pushdown, result.size(), readStatistics);
        return result;
    }
    
    private List<Row> readRowGroup(Schema schema, ColumnarFile.RowGroupMeta rowGroup) throws IOException {
        List<Field> fields = schema.getFields();
        int rowCount = (int) rowGroup.getRowCount();
        List<List<Object>> columns = new ArrayList<>(fields.size());
        
        for (Field field : fields) {
            ColumnarFile.ColumnChunkMeta chunk = rowGroup.getColumn(field.getName());
            if (chunk == null) {
                throw new HostFileException("Row group " + rowGroup.getOrdinal() 
                    + " has no chunk for column " + field.getName());
            }
            ByteBuffer data = readAt(fileChannel, chunk.getOffset(), (int) chunk.getLength());
            columns.add(ColumnCodec.decode(field.getType(), data.array(), rowCount));
        }
        readStatistics.recordRowGroupRead(rowGroup.getDataLength());
        
        List<Row> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            Object[] values = new Object[fields.size()];
            for (int c = 0; c < fields.size(); c++) {
                values[c] = columns.get(c).get(r);
            }
            rows.add(new Row(values));
        }
        return rows;
    }
    
    /**
     * 读取一段绝对字节区间（例如辅助区域）
     */
    public ByteBuffer readRange(long offset, long length) throws IOException {
        return readRegion(new ColumnarFile.Region(offset, length));
    }
    
    public ByteBuffer readRegion(ColumnarFile.Region region) throws IOException {
        if (region.getOffset() + region.getLength() > fileSize || region.getLength() > Integer.MAX_VALUE) {
            throw new HostFileException("Region " + region + " is outside of file " + path 
                + " (size=" + fileSize + ")");
        }
        ByteBuffer buffer = readAt(fileChannel, region.getOffset(), (int) region.getLength());
        readStatistics.recordAuxiliaryRead(region.getLength());
        return buffer;
    }
    
    private BloomFilter<Long> loadBloomFilter(ColumnarFile.RowGroupMeta rowGroup) {
        return bloomFilterCache.computeIfAbsent(rowGroup.getOrdinal(), ordinal -> {
            try {
                ByteBuffer bytes = readAt(fileChannel, rowGroup.getKeyBloomFilterOffset(), 
                                          rowGroup.getKeyBloomFilterLength());
                return BloomFilter.readFrom(new ByteArrayInputStream(bytes.array()), Funnels.longFunnel());
            } catch (IOException e) {
                throw new HostFileException("Failed to load bloom filter of row group " + ordinal, e);
            }
        });
    }
    
    @Override
    public void close() throws IOException {
        fileChannel.close();
    }
}
