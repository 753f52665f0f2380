package com.mini.fts.schema;

/**
 * 列类型
 * 宿主文件只需要整型主键列和文本列
 */
public enum DataType {
    /** 64 位有符号整数 */
    LONG,
    
    /** UTF-8 字符串 */
    STRING;
    
    public boolean isCompatible(Object value) {
        if (value == null) {
            return true;
        }
        switch (this) {
            case LONG:
                return value instanceof Long || value instanceof Integer;
            case STRING:
                return value instanceof String;
            default:
                return false;
        }
    }
    
    /**
     * 将值规范化为该类型的 Java 表示（Integer 提升为 Long）
     */
    public Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (this == LONG && value instanceof Integer) {
            return ((Integer) value).longValue();
        }
        return value;
    }
}
