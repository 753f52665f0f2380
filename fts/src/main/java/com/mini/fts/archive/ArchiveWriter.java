package com.mini.fts.archive;

import com.mini.fts.exception.DuplicateNameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 归档写入器
 * 将一组命名字节缓冲区打包成一个自描述、可校验损坏的字节序列
 * 
 * 单次遍历完成，要求所有文件内容都在内存中；不支持流式写入。
 * 相同的有序输入总是产生字节完全一致的输出。
 */
public class ArchiveWriter {
    private static final Logger logger = LoggerFactory.getLogger(ArchiveWriter.class);
    
    private final List<ArchiveFile> files = new ArrayList<>();
    
    private final Set<String> names = new HashSet<>();
    
    /**
     * 追加一个文件，顺序即为归档中的顺序
     * @throws DuplicateNameException 名称已存在
     */
    public ArchiveWriter add(ArchiveFile file) {
        if (!names.add(file.getName())) {
            throw new DuplicateNameException(file.getName());
        }
        files.add(file);
        return this;
    }
    
    public ArchiveWriter add(String name, byte[] content) {
        return add(ArchiveFile.of(name, content));
    }
    
    public ArchiveWriter addAll(List<ArchiveFile> toAdd) {
        for (ArchiveFile file : toAdd) {
            add(file);
        }
        return this;
    }
    
    public List<ArchiveFile> getFiles() {
        return Collections.unmodifiableList(files);
    }
    
    /**
     * 一次性打包给定的文件列表
     */
    public static byte[] pack(List<ArchiveFile> files) {
        return new ArchiveWriter().addAll(files).toByteArray();
    }
    
    /**
     * 生成归档字节
     * 
     * 1. 写入起始魔数
     * 2. 写入头部：条目数，以及按输入顺序累加得到的 offset/length
     * 3. 按同样顺序写入文件内容
     * 4. 写入结尾魔数
     */
    public byte[] toByteArray() {
        List<byte[]> encodedNames = new ArrayList<>(files.size());
        long headerSize = ArchiveFormat.ENTRY_COUNT_SIZE;
        long contentSize = 0;
        for (ArchiveFile file : files) {
            byte[] encoded = file.getName().getBytes(StandardCharsets.UTF_8);
            encodedNames.add(encoded);
            headerSize += ArchiveFormat.entrySize(encoded);
            contentSize += file.length();
        }
        
        long totalSize = ArchiveFormat.MAGIC_SIZE + headerSize + contentSize + ArchiveFormat.MAGIC_SIZE;
        if (totalSize > Integer.MAX_VALUE) {
            throw new IllegalStateException("Archive too large to build in memory: " + totalSize + " bytes");
        }
        
        ByteBuffer buffer = ByteBuffer.allocate((int) totalSize).order(ArchiveFormat.BYTE_ORDER);
        buffer.put(ArchiveFormat.MAGIC);
        buffer.putInt(files.size());
        
        long offset = 0;
        for (int i = 0; i < files.size(); i++) {
            byte[] encoded = encodedNames.get(i);
            long length = files.get(i).length();
            buffer.putInt(encoded.length);
            buffer.put(encoded);
            buffer.putLong(offset);
            buffer.putLong(length);
            offset += length;
        }
        
        for (ArchiveFile file : files) {
            buffer.put(file.getContent());
        }
        buffer.put(ArchiveFormat.MAGIC);
        
        logger.debug("Packed archive: files={}, headerSize={}, contentSize={}, total={} bytes",
                    files.size(), headerSize, contentSize, totalSize);
        
        return buffer.array();
    }
}
