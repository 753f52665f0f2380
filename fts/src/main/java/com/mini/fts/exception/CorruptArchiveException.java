package com.mini.fts.exception;

/**
 * 字节序列根本不是一个合法的归档：起始魔数不匹配，或者头部自相矛盾
 */
public class CorruptArchiveException extends ArchiveException {
    
    public CorruptArchiveException(String message) {
        super(message);
    }
}
