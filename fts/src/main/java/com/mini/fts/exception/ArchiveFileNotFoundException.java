package com.mini.fts.exception;

/**
 * 在合法归档中查找不到指定名称的文件
 */
public class ArchiveFileNotFoundException extends ArchiveException {
    
    private final String name;
    
    public ArchiveFileNotFoundException(String name) {
        super("File not found in archive: " + name);
        this.name = name;
    }
    
    public String getName() {
        return name;
    }
}
