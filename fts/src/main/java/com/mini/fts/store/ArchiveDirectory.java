package com.mini.fts.store;

import com.mini.fts.archive.NamedFileSource;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexInput;
import org.apache.lucene.store.IndexOutput;
import org.apache.lucene.store.Lock;
import org.apache.lucene.store.NoLockFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 只读 Lucene Directory
 * 只依赖按名读取和存在判断两个能力，文件列表取自归档的文件表
 * 
 * 所有写操作都抛出 {@link UnsupportedOperationException}。
 */
public class ArchiveDirectory extends Directory {
    
    private final NamedFileSource source;
    private final String[] names;
    private volatile boolean closed;
    
    public ArchiveDirectory(NamedFileSource source) {
        this.source = source;
        List<String> listed = source.listNames();
        this.names = listed.toArray(new String[0]);
        Arrays.sort(this.names);
    }
    
    @Override
    public String[] listAll() {
        ensureOpen();
        return names.clone();
    }
    
    @Override
    public long fileLength(String name) throws IOException {
        ensureOpen();
        requireExists(name);
        return source.read(name).remaining();
    }
    
    @Override
    public IndexInput openInput(String name, IOContext context) throws IOException {
        ensureOpen();
        requireExists(name);
        return new ArchiveIndexInput("ArchiveIndexInput(" + name + ")", source.read(name).slice());
    }
    
    private void requireExists(String name) throws NoSuchFileException {
        if (!source.exists(name)) {
            throw new NoSuchFileException(name);
        }
    }
    
    @Override
    public Lock obtainLock(String name) throws IOException {
        return NoLockFactory.INSTANCE.obtainLock(this, name);
    }
    
    @Override
    public void deleteFile(String name) {
        throw readOnly("deleteFile");
    }
    
    @Override
    public IndexOutput createOutput(String name, IOContext context) {
        throw readOnly("createOutput");
    }
    
    @Override
    public IndexOutput createTempOutput(String prefix, String suffix, IOContext context) {
        throw readOnly("createTempOutput");
    }
    
    @Override
    public void sync(Collection<String> names) {
        throw readOnly("sync");
    }
    
    @Override
    public void syncMetaData() {
        throw readOnly("syncMetaData");
    }
    
    @Override
    public void rename(String source, String dest) {
        throw readOnly("rename");
    }
    
    private UnsupportedOperationException readOnly(String operation) {
        return new UnsupportedOperationException(operation + " is not supported by a read-only archive directory");
    }
    
    @Override
    public Set<String> getPendingDeletions() {
        return Collections.emptySet();
    }
    
    @Override
    protected void ensureOpen() {
        if (closed) {
            throw new AlreadyClosedException("Archive directory is closed");
        }
    }
    
    @Override
    public void close() {
        closed = true;
    }
    
    @Override
    public String toString() {
        return "ArchiveDirectory{files=" + names.length + '}';
    }
}
