package com.mini.fts.archive;

import java.util.Objects;

/**
 * 归档头部中的单个文件条目
 * offset 相对于内容区起点
 */
public final class FileEntry {
    
    private final String name;
    
    private final long offset;
    
    private final long length;
    
    public FileEntry(String name, long offset, long length) {
        this.name = Objects.requireNonNull(name, "File name cannot be null");
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException(
                "Offset and length must be non-negative: offset=" + offset + ", length=" + length);
        }
        this.offset = offset;
        this.length = length;
    }
    
    public String getName() {
        return name;
    }
    
    public long getOffset() {
        return offset;
    }
    
    public long getLength() {
        return length;
    }
    
    /**
     * 文件在内容区中的结束位置（不含）
     */
    public long getEnd() {
        return offset + length;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileEntry that = (FileEntry) o;
        return offset == that.offset &&
                length == that.length &&
                name.equals(that.name);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, offset, length);
    }
    
    @Override
    public String toString() {
        return "FileEntry{" +
                "name='" + name + '\'' +
                ", offset=" + offset +
                ", length=" + length +
                '}';
    }
}
