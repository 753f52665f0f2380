package com.mini.fts.store;

import com.mini.fts.archive.VirtualDirectory;
import com.mini.fts.exception.SearchBackendException;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.DocValues;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.MultiTerms;
import org.apache.lucene.index.NumericDocValues;
import org.apache.lucene.index.Terms;
import org.apache.lucene.index.TermsEnum;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreMode;
import org.apache.lucene.search.SimpleCollector;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.StringHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * 可查询的索引会话
 * 绑定一个归档目录和在其上打开的 Lucene 读取器，构建完成后只读，可被多个查询并发使用
 * 
 * 没有任何提交点的空归档也能打开，此时任何查询都没有命中。
 */
public class SearchIndexSession implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(SearchIndexSession.class);
    
    private final String column;
    private final String keyField;
    private final VirtualDirectory virtualDirectory;
    private final ArchiveDirectory directory;
    
    /** 空归档时为 null */
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private volatile boolean closed;
    
    private SearchIndexSession(String column, String keyField, VirtualDirectory virtualDirectory,
                               ArchiveDirectory directory, DirectoryReader reader) {
        this.column = column;
        this.keyField = keyField;
        this.virtualDirectory = virtualDirectory;
        this.directory = directory;
        this.reader = reader;
        this.searcher = reader == null ? null : new IndexSearcher(reader);
    }
    
    /**
     * 在归档上打开 Lucene 索引
     */
    public static SearchIndexSession open(VirtualDirectory virtualDirectory, String column, String keyField) {
        ArchiveDirectory directory = new ArchiveDirectory(virtualDirectory);
        try {
            DirectoryReader reader = DirectoryReader.indexExists(directory) 
                ? DirectoryReader.open(directory) : null;
            SearchIndexSession session = new SearchIndexSession(column, keyField, virtualDirectory, directory, reader);
            logger.debug("Opened search index session: column={}, files={}, documents={}", 
                        column, virtualDirectory.getFileCount(), session.getDocumentCount());
            return session;
        } catch (IOException | RuntimeException e) {
            directory.close();
            throw new SearchBackendException("Failed to open index of column " + column + " on " + virtualDirectory, e);
        }
    }
    
    public String getColumn() {
        return column;
    }
    
    public String getKeyField() {
        return keyField;
    }
    
    public VirtualDirectory getVirtualDirectory() {
        return virtualDirectory;
    }
    
    public int getDocumentCount() {
        return reader == null ? 0 : reader.numDocs();
    }
    
    /**
     * 词典中是否存在该词项
     */
    public boolean hasTerm(String term) {
        ensureOpen();
        try {
            Terms terms = terms();
            return terms != null && terms.iterator().seekExact(new BytesRef(term));
        } catch (IOException | RuntimeException e) {
            throw new SearchBackendException("Failed to look up term '" + term + "' in column " + column, e);
        }
    }
    
    /**
     * 按词典顺序枚举满足条件的词项，最多返回 limit 个
     */
    public List<String> findTerms(Predicate<String> condition, int limit) {
        ensureOpen();
        List<String> result = new ArrayList<>();
        try {
            Terms terms = terms();
            if (terms == null) {
                return result;
            }
            TermsEnum termsEnum = terms.iterator();
            BytesRef term;
            while ((term = termsEnum.next()) != null && result.size() < limit) {
                String text = term.utf8ToString();
                if (condition.test(text)) {
                    result.add(text);
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new SearchBackendException("Failed to enumerate terms of column " + column, e);
        }
        return result;
    }
    
    /**
     * 按词典顺序返回以 prefix 开头的词项，最多 limit 个
     * 先定位到第一个不小于 prefix 的词项，离开前缀范围即停止
     */
    public List<String> findTermsWithPrefix(String prefix, int limit) {
        ensureOpen();
        List<String> result = new ArrayList<>();
        try {
            Terms terms = terms();
            if (terms == null) {
                return result;
            }
            BytesRef prefixBytes = new BytesRef(prefix);
            TermsEnum termsEnum = terms.iterator();
            if (termsEnum.seekCeil(prefixBytes) == TermsEnum.SeekStatus.END) {
                return result;
            }
            BytesRef term = termsEnum.term();
            while (term != null && result.size() < limit && StringHelper.startsWith(term, prefixBytes)) {
                result.add(term.utf8ToString());
                term = termsEnum.next();
            }
        } catch (IOException | RuntimeException e) {
            throw new SearchBackendException("Failed to enumerate terms with prefix '" + prefix 
                + "' in column " + column, e);
        }
        return result;
    }
    
    private Terms terms() throws IOException {
        return reader == null ? null : MultiTerms.getTerms(reader, column);
    }
    
    /**
     * 统计命中文档数
     */
    public int count(Query query) {
        ensureOpen();
        if (searcher == null) {
            return 0;
        }
        try {
            return searcher.count(query);
        } catch (IOException | RuntimeException e) {
            throw new SearchBackendException("Failed to count " + query + " in column " + column, e);
        }
    }
    
    /**
     * 执行查询并把命中文档解析为主键
     */
    public SortedSet<Long> resolveKeys(Query query) {
        ensureOpen();
        if (searcher == null) {
            return Collections.emptySortedSet();
        }
        KeyCollector collector = new KeyCollector();
        try {
            searcher.search(query, collector);
        } catch (IOException | RuntimeException e) {
            throw new SearchBackendException("Failed to search " + query + " in column " + column, e);
        }
        return collector.keys;
    }
    
    private void ensureOpen() {
        if (closed) {
            throw new SearchBackendException("Search index session of column " + column + " is closed");
        }
    }
    
    @Override
    public void close() throws IOException {
        closed = true;
        try {
            if (reader != null) {
                reader.close();
            }
        } finally {
            directory.close();
        }
    }
    
    @Override
    public String toString() {
        return "SearchIndexSession{column='" + column + "', keyField='" + keyField + "', documents=" 
            + getDocumentCount() + '}';
    }
    
    /**
     * 从主键 DocValues 读取命中文档的主键
     */
    private class KeyCollector extends SimpleCollector {
        private final SortedSet<Long> keys = new TreeSet<>();
        private NumericDocValues keyValues;
        
        @Override
        protected void doSetNextReader(LeafReaderContext context) throws IOException {
            keyValues = DocValues.getNumeric(context.reader(), keyField);
        }
        
        @Override
        public void collect(int doc) throws IOException {
            if (!keyValues.advanceExact(doc)) {
                throw new SearchBackendException("Document " + doc + " has no " + keyField + " value");
            }
            keys.add(keyValues.longValue());
        }
        
        @Override
        public ScoreMode scoreMode() {
            return ScoreMode.COMPLETE_NO_SCORES;
        }
    }
}
