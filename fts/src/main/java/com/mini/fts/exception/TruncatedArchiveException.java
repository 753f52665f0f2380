package com.mini.fts.exception;

/**
 * 归档不完整：在头部声明的结束位置找不到结尾魔数
 * 通常意味着写入过程被中断
 */
public class TruncatedArchiveException extends ArchiveException {
    
    public TruncatedArchiveException(String message) {
        super(message);
    }
    
    public TruncatedArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
