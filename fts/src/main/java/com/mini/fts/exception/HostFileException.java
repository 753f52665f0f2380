package com.mini.fts.exception;

/**
 * 列式宿主文件格式错误
 */
public class HostFileException extends MiniFtsException {
    
    public HostFileException(String message) {
        super(message);
    }
    
    public HostFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
