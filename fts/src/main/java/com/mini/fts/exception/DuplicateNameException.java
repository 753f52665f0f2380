package com.mini.fts.exception;

/**
 * 打包时出现重名文件
 */
public class DuplicateNameException extends ArchiveException {
    
    private final String name;
    
    public DuplicateNameException(String name) {
        super("Duplicate file name in archive: " + name);
        this.name = name;
    }
    
    public String getName() {
        return name;
    }
}
