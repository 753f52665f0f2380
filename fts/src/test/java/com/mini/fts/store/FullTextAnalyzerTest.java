package com.mini.fts.store;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FullTextAnalyzer测试
 */
public class FullTextAnalyzerTest {
    
    private final FullTextAnalyzer analyzer = new FullTextAnalyzer();
    
    private List<String> terms(String text) {
        return analyzer.tokenize("title", text).stream()
            .map(FullTextAnalyzer.Token::getTerm)
            .collect(Collectors.toList());
    }
    
    @Test
    public void testSplitsOnNonAlphanumeric() {
        assertEquals(List.of("dairy", "cow", "s", "2024"), terms("Dairy-COW's 2024!"));
        assertEquals(List.of("a", "b", "c"), terms("  a__b..c  "));
        assertTrue(terms("--- ... !!!").isEmpty());
        assertTrue(terms("").isEmpty());
    }
    
    @Test
    public void testOffsets() {
        List<FullTextAnalyzer.Token> tokens = analyzer.tokenize("title", "Dairy-COW's");
        assertEquals(3, tokens.size());
        assertEquals(0, tokens.get(0).getStartOffset());
        assertEquals(5, tokens.get(0).getEndOffset());
        assertEquals(6, tokens.get(1).getStartOffset());
        assertEquals(9, tokens.get(1).getEndOffset());
        assertEquals(10, tokens.get(2).getStartOffset());
        assertEquals(11, tokens.get(2).getEndOffset());
    }
    
    @Test
    public void testUnicodeLetters() {
        assertEquals(List.of("straße", "café", "東京"), terms("STRAßE Café/東京"));
        assertTrue(FullTextAnalyzer.isTokenChar('é'));
        assertFalse(FullTextAnalyzer.isTokenChar('_'));
    }
    
    @Test
    public void testReusableAcrossCalls() {
        for (int i = 0; i < 3; i++) {
            assertEquals(List.of("cow", String.valueOf(i)), terms("cow " + i));
        }
    }
}
