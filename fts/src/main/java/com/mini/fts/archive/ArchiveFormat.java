package com.mini.fts.archive;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * 归档文件格式常量
 * 
 * 文件结构：
 * <pre>
 * [MAGIC 4B]
 * [entry_count u32]
 * [entry_count x {name_len u32, name bytes, offset u64, length u64}]
 * [文件内容，按写入顺序连续存放]
 * [MAGIC 4B]
 * </pre>
 * 
 * offset 相对于内容区起点（紧跟在头部之后），所有整数均为小端序。
 */
public final class ArchiveFormat {
    
    /** Full-Text index Embedded in a columnar file */
    static final byte[] MAGIC = "FTEP".getBytes(StandardCharsets.US_ASCII);
    
    static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;
    
    static final int MAGIC_SIZE = 4;
    
    static final int ENTRY_COUNT_SIZE = 4;
    
    /** name_len(4) + offset(8) + length(8)，不含名称本身 */
    static final int ENTRY_FIXED_SIZE = 4 + 8 + 8;
    
    private ArchiveFormat() {
    }
    
    /**
     * 单个头部条目占用的字节数
     */
    static int entrySize(byte[] encodedName) {
        return ENTRY_FIXED_SIZE + encodedName.length;
    }
    
    /**
     * 空归档（entry_count = 0）的总长度
     */
    public static int minimumArchiveSize() {
        return MAGIC_SIZE + ENTRY_COUNT_SIZE + MAGIC_SIZE;
    }
}
