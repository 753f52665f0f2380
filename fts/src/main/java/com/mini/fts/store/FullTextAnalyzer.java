package com.mini.fts.store;

import com.mini.fts.exception.SearchBackendException;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 全文索引分析器
 * 建索引和解析查询字面量必须使用同一个分析器，否则基于索引的剪枝会漏掉匹配行
 * 
 * 分析器标识会写入宿主文件的索引元数据，读取时标识不一致的索引被视为不可用。
 */
public class FullTextAnalyzer extends Analyzer {
    
    public static final String ANALYZER_ID = "alnum-lower-v1";
    
    @Override
    protected TokenStreamComponents createComponents(String fieldName) {
        return new TokenStreamComponents(new AlnumLowerTokenizer());
    }
    
    public static boolean isTokenChar(int codePoint) {
        return AlnumLowerTokenizer.isTokenChar(codePoint);
    }
    
    /**
     * 对一段文本分词，返回词项及其在原文中的位置
     */
    public List<Token> tokenize(String fieldName, String text) {
        List<Token> tokens = new ArrayList<>();
        try (TokenStream stream = tokenStream(fieldName, text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            OffsetAttribute offset = stream.addAttribute(OffsetAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(new Token(term.toString(), offset.startOffset(), offset.endOffset()));
            }
            stream.end();
        } catch (IOException e) {
            throw new SearchBackendException("Failed to tokenize: " + text, e);
        }
        return tokens;
    }
    
    /**
     * 分词结果
     */
    public static final class Token {
        private final String term;
        private final int startOffset;
        private final int endOffset;
        
        public Token(String term, int startOffset, int endOffset) {
            this.term = term;
            this.startOffset = startOffset;
            this.endOffset = endOffset;
        }
        
        public String getTerm() {
            return term;
        }
        
        public int getStartOffset() {
            return startOffset;
        }
        
        public int getEndOffset() {
            return endOffset;
        }
        
        @Override
        public String toString() {
            return term + "[" + startOffset + "," + endOffset + ")";
        }
    }
}
