package com.mini.fts.archive;

import java.util.Arrays;
import java.util.Objects;

/**
 * 待打包的命名字节缓冲区
 */
public final class ArchiveFile {
    
    private final String name;
    
    private final byte[] content;
    
    private ArchiveFile(String name, byte[] content) {
        this.name = Objects.requireNonNull(name, "File name cannot be null");
        this.content = Objects.requireNonNull(content, "File content cannot be null");
    }
    
    public static ArchiveFile of(String name, byte[] content) {
        return new ArchiveFile(name, content);
    }
    
    public String getName() {
        return name;
    }
    
    public byte[] getContent() {
        return content;
    }
    
    public int length() {
        return content.length;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArchiveFile that = (ArchiveFile) o;
        return name.equals(that.name) && Arrays.equals(content, that.content);
    }
    
    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(content);
    }
    
    @Override
    public String toString() {
        return "ArchiveFile{name='" + name + "', length=" + content.length + '}';
    }
}
