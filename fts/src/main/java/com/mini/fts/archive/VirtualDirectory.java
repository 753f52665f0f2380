package com.mini.fts.archive;

import com.mini.fts.exception.ArchiveFileNotFoundException;
import com.mini.fts.exception.CorruptArchiveException;
import com.mini.fts.exception.TruncatedArchiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 虚拟目录（归档读取器）
 * 解析归档字节并提供零拷贝的按名查找
 * 
 * 打开时按顺序校验：
 * 1. 起始魔数，不匹配则 {@link CorruptArchiveException}
 * 2. 顺序读取头部条目，条目必须首尾相接、名称唯一
 * 3. 在 header_end + sum(length) 处读取结尾魔数，缺失或不匹配则 {@link TruncatedArchiveException}
 * 
 * 构造完成后完全只读，可被任意多个线程并发访问。
 */
public class VirtualDirectory implements NamedFileSource {
    private static final Logger logger = LoggerFactory.getLogger(VirtualDirectory.class);
    
    /** 整个归档的只读视图 */
    private final ByteBuffer archive;
    
    /** 内容区的只读视图 */
    private final ByteBuffer content;
    
    /** 文件名 -> 条目，保持写入顺序 */
    private final Map<String, FileEntry> entries;
    
    private VirtualDirectory(ByteBuffer archive, ByteBuffer content, Map<String, FileEntry> entries) {
        this.archive = archive;
        this.content = content;
        this.entries = entries;
    }
    
    public static VirtualDirectory open(byte[] bytes) {
        return open(ByteBuffer.wrap(bytes));
    }
    
    /**
     * 解析归档
     * 从 buffer 的当前 position 到 limit 视为完整归档，buffer 本身不会被修改
     */
    public static VirtualDirectory open(ByteBuffer buffer) {
        ByteBuffer archive = buffer.slice().asReadOnlyBuffer().order(ArchiveFormat.BYTE_ORDER);
        int totalSize = archive.remaining();
        
        // 1. 起始魔数
        if (totalSize < ArchiveFormat.MAGIC_SIZE || !magicAt(archive, 0)) {
            throw new CorruptArchiveException("Leading magic mismatch, not an archive");
        }
        archive.position(ArchiveFormat.MAGIC_SIZE);
        
        // 2. 头部
        Map<String, FileEntry> entries;
        try {
            entries = readHeader(archive);
        } catch (BufferUnderflowException e) {
            throw new TruncatedArchiveException("Archive ends inside its header", e);
        }
        int headerEnd = archive.position();
        
        // 3. 结尾魔数
        long contentSize = 0;
        for (FileEntry entry : entries.values()) {
            contentSize = entry.getEnd();
        }
        // 先与剩余字节比较，伪造的长度不能让 headerEnd + contentSize 溢出
        long available = (long) totalSize - headerEnd - ArchiveFormat.MAGIC_SIZE;
        if (contentSize > available) {
            throw new TruncatedArchiveException("Archive truncated: header declares " + contentSize
                + " content bytes, only " + Math.max(available, 0) + " available");
        }
        long footerPosition = headerEnd + contentSize;
        if (!magicAt(archive, (int) footerPosition)) {
            throw new TruncatedArchiveException("Trailing magic mismatch at position " + footerPosition);
        }
        if (footerPosition + ArchiveFormat.MAGIC_SIZE != totalSize) {
            throw new CorruptArchiveException("Unexpected " 
                + (totalSize - footerPosition - ArchiveFormat.MAGIC_SIZE) + " bytes after trailing magic");
        }
        
        ByteBuffer content = archive.duplicate();
        content.position(headerEnd).limit((int) footerPosition);
        content = content.slice().asReadOnlyBuffer();
        archive.rewind();
        
        logger.debug("Opened archive: files={}, headerSize={}, contentSize={}", 
                    entries.size(), headerEnd, contentSize);
        
        return new VirtualDirectory(archive, content, Collections.unmodifiableMap(entries));
    }
    
    private static Map<String, FileEntry> readHeader(ByteBuffer archive) {
        int entryCount = archive.getInt();
        if (entryCount < 0) {
            throw new CorruptArchiveException("Invalid entry count: " + Integer.toUnsignedString(entryCount));
        }
        // 每个条目至少占 ENTRY_FIXED_SIZE 字节，提前判断避免按伪造的数量分配内存
        if ((long) entryCount * ArchiveFormat.ENTRY_FIXED_SIZE > archive.remaining()) {
            throw new TruncatedArchiveException("Header declares " + entryCount 
                + " entries but only " + archive.remaining() + " bytes remain");
        }
        
        Map<String, FileEntry> entries = new LinkedHashMap<>();
        long expectedOffset = 0;
        for (int i = 0; i < entryCount; i++) {
            int nameLength = archive.getInt();
            if (nameLength < 0) {
                throw new CorruptArchiveException("Invalid name length in entry " + i);
            }
            if (nameLength > archive.remaining()) {
                throw new TruncatedArchiveException("Archive ends inside the name of entry " + i);
            }
            byte[] nameBytes = new byte[nameLength];
            archive.get(nameBytes);
            String name = new String(nameBytes, StandardCharsets.UTF_8);
            long offset = archive.getLong();
            long length = archive.getLong();
            
            if (offset != expectedOffset || length < 0) {
                throw new CorruptArchiveException("Entry '" + name + "' is not contiguous: offset=" 
                    + offset + ", length=" + length + ", expected offset=" + expectedOffset);
            }
            if (entries.containsKey(name)) {
                throw new CorruptArchiveException("Duplicate entry name: " + name);
            }
            try {
                expectedOffset = Math.addExact(offset, length);
            } catch (ArithmeticException e) {
                throw new CorruptArchiveException("Entry '" + name + "' length overflows: " + length);
            }
            entries.put(name, new FileEntry(name, offset, length));
        }
        return entries;
    }
    
    private static boolean magicAt(ByteBuffer buffer, int position) {
        for (int i = 0; i < ArchiveFormat.MAGIC_SIZE; i++) {
            if (buffer.get(position + i) != ArchiveFormat.MAGIC[i]) {
                return false;
            }
        }
        return true;
    }
    
    @Override
    public ByteBuffer read(String name) {
        FileEntry entry = entries.get(name);
        if (entry == null) {
            throw new ArchiveFileNotFoundException(name);
        }
        ByteBuffer view = content.duplicate();
        view.position((int) entry.getOffset()).limit((int) entry.getEnd());
        return view.slice().order(ArchiveFormat.BYTE_ORDER);
    }
    
    /**
     * 读取文件内容并复制为字节数组
     */
    public byte[] readBytes(String name) {
        ByteBuffer view = read(name);
        byte[] bytes = new byte[view.remaining()];
        view.get(bytes);
        return bytes;
    }
    
    @Override
    public boolean exists(String name) {
        return entries.containsKey(name);
    }
    
    @Override
    public List<String> listNames() {
        return new ArrayList<>(entries.keySet());
    }
    
    public FileEntry getEntry(String name) {
        FileEntry entry = entries.get(name);
        if (entry == null) {
            throw new ArchiveFileNotFoundException(name);
        }
        return entry;
    }
    
    public int getFileCount() {
        return entries.size();
    }
    
    /**
     * 归档总长度（含两端魔数）
     */
    public int getArchiveSize() {
        return archive.capacity();
    }
    
    public long getContentSize() {
        return content.capacity();
    }
    
    @Override
    public String toString() {
        return "VirtualDirectory{" +
                "files=" + entries.size() +
                ", archiveSize=" + archive.capacity() +
                '}';
    }
}
