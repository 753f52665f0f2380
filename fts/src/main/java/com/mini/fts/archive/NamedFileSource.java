package com.mini.fts.archive;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * 只读的扁平命名文件查找能力
 * 检索引擎通过该接口访问归档中的文件，不需要目录、权限等文件系统语义
 */
public interface NamedFileSource {
    
    /**
     * 读取文件内容
     * @return 只读视图，不复制底层字节
     * @throws com.mini.fts.exception.ArchiveFileNotFoundException 文件不存在
     */
    ByteBuffer read(String name);
    
    boolean exists(String name);
    
    /**
     * 按写入顺序列出所有文件名
     */
    List<String> listNames();
}
