package com.mini.fts.exception;

/**
 * 全文检索引擎（Lucene）内部错误
 * 查询路径上会被降级为 NoRewrite，而不是让整个查询失败
 */
public class SearchBackendException extends MiniFtsException {
    
    public SearchBackendException(String message, Throwable cause) {
        super(message, cause);
    }
    
    public SearchBackendException(String message) {
        super(message);
    }
}
