package com.mini.fts.format;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 读取统计
 * 记录行组的读取与跳过情况，以及实际读取的数据页字节数
 */
public class ReadStatistics {
    
    private final AtomicLong rowGroupsRead = new AtomicLong(0);
    private final AtomicLong rowGroupsSkipped = new AtomicLong(0);
    private final AtomicLong dataBytesRead = new AtomicLong(0);
    private final AtomicLong auxiliaryBytesRead = new AtomicLong(0);
    
    void recordRowGroupRead(long bytes) {
        rowGroupsRead.incrementAndGet();
        dataBytesRead.addAndGet(bytes);
    }
    
    void recordRowGroupSkipped() {
        rowGroupsSkipped.incrementAndGet();
    }
    
    void recordAuxiliaryRead(long bytes) {
        auxiliaryBytesRead.addAndGet(bytes);
    }
    
    public long getRowGroupsRead() {
        return rowGroupsRead.get();
    }
    
    public long getRowGroupsSkipped() {
        return rowGroupsSkipped.get();
    }
    
    public long getDataBytesRead() {
        return dataBytesRead.get();
    }
    
    public long getAuxiliaryBytesRead() {
        return auxiliaryBytesRead.get();
    }
    
    public void reset() {
        rowGroupsRead.set(0);
        rowGroupsSkipped.set(0);
        dataBytesRead.set(0);
        auxiliaryBytesRead.set(0);
    }
    
    @Override
    public String toString() {
        return "ReadStatistics{" +
                "rowGroupsRead=" + rowGroupsRead.get() +
                ", rowGroupsSkipped=" + rowGroupsSkipped.get() +
                ", dataBytesRead=" + dataBytesRead.get() +
                ", auxiliaryBytesRead=" + auxiliaryBytesRead.get() +
                '}';
    }
}
