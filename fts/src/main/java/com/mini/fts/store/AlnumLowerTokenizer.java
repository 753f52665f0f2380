package com.mini.fts.store;

import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;

import java.io.IOException;

/**
 * 字母数字分词器
 * 以非字母、非数字的码点为分隔，每个码点单独转小写
 * 
 * 转小写按码点一一对应，因此词项长度与原文片段长度相同，偏移量可以直接对应回原文。
 */
final class AlnumLowerTokenizer extends Tokenizer {
    
    private final CharTermAttribute termAttribute = addAttribute(CharTermAttribute.class);
    private final OffsetAttribute offsetAttribute = addAttribute(OffsetAttribute.class);
    
    /** 当前输入的全部文本 */
    private final StringBuilder text = new StringBuilder();
    private int position;
    private int finalOffset;
    
    static boolean isTokenChar(int codePoint) {
        return Character.isLetterOrDigit(codePoint);
    }
    
    @Override
    public boolean incrementToken() throws IOException {
        clearAttributes();
        int length = text.length();
        
        while (position < length) {
            int cp = Character.codePointAt(text, position);
            if (isTokenChar(cp)) {
                break;
            }
            position += Character.charCount(cp);
        }
        if (position >= length) {
            return false;
        }
        
        int start = position;
        while (position < length) {
            int cp = Character.codePointAt(text, position);
            if (!isTokenChar(cp)) {
                break;
            }
            appendLower(cp);
            position += Character.charCount(cp);
        }
        offsetAttribute.setOffset(correctOffset(start), correctOffset(position));
        return true;
    }
    
    private void appendLower(int codePoint) {
        int lower = Character.toLowerCase(codePoint);
        if (Character.isBmpCodePoint(lower)) {
            termAttribute.append((char) lower);
        } else {
            termAttribute.append(Character.highSurrogate(lower));
            termAttribute.append(Character.lowSurrogate(lower));
        }
    }
    
    @Override
    public void reset() throws IOException {
        super.reset();
        text.setLength(0);
        position = 0;
        char[] buffer = new char[1024];
        int n;
        while ((n = input.read(buffer)) != -1) {
            text.append(buffer, 0, n);
        }
        finalOffset = correctOffset(text.length());
    }
    
    @Override
    public void end() throws IOException {
        super.end();
        offsetAttribute.setOffset(finalOffset, finalOffset);
    }
}
