package com.mini.fts.exception;

/**
 * 归档文件相关异常的基类
 */
public class ArchiveException extends MiniFtsException {
    
    public ArchiveException(String message) {
        super(message);
    }
    
    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
