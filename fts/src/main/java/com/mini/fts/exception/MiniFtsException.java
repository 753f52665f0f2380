package com.mini.fts.exception;

/**
 * Mini FTS 基础异常类
 * 所有模块抛出的非受检异常都继承自该类
 */
public class MiniFtsException extends RuntimeException {
    
    public MiniFtsException(String message) {
        super(message);
    }
    
    public MiniFtsException(String message, Throwable cause) {
        super(message, cause);
    }
}
