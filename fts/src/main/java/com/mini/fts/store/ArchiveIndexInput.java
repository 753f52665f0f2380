package com.mini.fts.store;

import org.apache.lucene.store.IndexInput;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * 基于归档内文件切片的 IndexInput
 * 直接读取 ByteBuffer 视图，不复制数据
 * 
 * clone 和 slice 得到的实例共享底层字节，但各自维护读取位置。
 */
final class ArchiveIndexInput extends IndexInput {
    
    private final ByteBuffer buffer;
    
    /**
     * @param buffer 文件内容，读取位置从 0 开始，limit 即文件长度
     */
    ArchiveIndexInput(String resourceDescription, ByteBuffer buffer) {
        super(resourceDescription);
        this.buffer = buffer;
    }
    
    @Override
    public long getFilePointer() {
        return buffer.position();
    }
    
    @Override
    public void seek(long pos) throws IOException {
        if (pos < 0 || pos > buffer.limit()) {
            throw new EOFException("Seek position " + pos + " is out of bounds [0, " + buffer.limit() + "]: " + this);
        }
        buffer.position((int) pos);
    }
    
    @Override
    public long length() {
        return buffer.limit();
    }
    
    @Override
    public byte readByte() throws IOException {
        if (!buffer.hasRemaining()) {
            throw new EOFException("Read past end of file: " + this);
        }
        return buffer.get();
    }
    
    @Override
    public void readBytes(byte[] b, int offset, int len) throws IOException {
        if (len > buffer.remaining()) {
            throw new EOFException("Read past end of file: " + this 
                + " (requested " + len + ", remaining " + buffer.remaining() + ")");
        }
        buffer.get(b, offset, len);
    }
    
    @Override
    public void skipBytes(long numBytes) throws IOException {
        if (numBytes < 0) {
            throw new IllegalArgumentException("numBytes must be >= 0, got " + numBytes);
        }
        seek(getFilePointer() + numBytes);
    }
    
    @Override
    public IndexInput slice(String sliceDescription, long offset, long length) {
        if (offset < 0 || length < 0 || offset + length > buffer.limit()) {
            throw new IllegalArgumentException("Slice [" + offset + ", " + (offset + length) 
                + ") is out of bounds: " + this);
        }
        ByteBuffer view = buffer.duplicate();
        view.position((int) offset);
        view.limit((int) (offset + length));
        return new ArchiveIndexInput(getFullSliceDescription(sliceDescription), view.slice());
    }
    
    @Override
    public ArchiveIndexInput clone() {
        return new ArchiveIndexInput(toString(), buffer.duplicate());
    }
    
    @Override
    public void close() {
        // 字节归宿主文件读取器所有
    }
}
