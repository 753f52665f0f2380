package com.mini.fts.rewrite;

import com.mini.fts.store.FullTextAnalyzer;
import com.mini.fts.store.SearchIndexSession;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.MultiPhraseQuery;
import org.apache.lucene.search.PhraseQuery;
import org.apache.lucene.search.Query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * 把子串字面量转换为有序短语查询
 * 
 * 字面量按索引分析器切分为若干词段后：
 * <ul>
 *   <li>中间的词段必须与索引中的词项完全相同</li>
 *   <li>字面量以词字符开头时，第一个词段可以是某个词项的后缀</li>
 *   <li>字面量以词字符结尾时，最后一个词段可以是某个词项的前缀</li>
 *   <li>同时触及两端的唯一词段可以是某个词项的任意子串</li>
 * </ul>
 * 边缘词段通过枚举词典展开，所有位置都只有一个词项时使用 PhraseQuery，否则使用 MultiPhraseQuery。
 * 这样得到的命中集合包含所有子串匹配的行，多出来的行由残留过滤去掉。
 */
class LiteralQueryBuilder {
    
    enum Status {
        /** 得到可执行的查询 */
        QUERY,
        /** 字面量中没有词字符 */
        NO_TOKENS,
        /** 某个位置展开的词项过多 */
        TOO_MANY_EXPANSIONS,
        /** 某个位置在词典中没有任何候选，不可能有命中 */
        NO_MATCH
    }
    
    private final FullTextAnalyzer analyzer;
    private final int maxTermExpansions;
    
    LiteralQueryBuilder(FullTextAnalyzer analyzer, int maxTermExpansions) {
        this.analyzer = analyzer;
        this.maxTermExpansions = maxTermExpansions;
    }
    
    Result build(String literal, SearchIndexSession session) {
        String column = session.getColumn();
        List<FullTextAnalyzer.Token> tokens = analyzer.tokenize(column, literal);
        if (tokens.isEmpty()) {
            return new Result(Status.NO_TOKENS, null);
        }
        
        List<List<String>> positions = new ArrayList<>(tokens.size());
        boolean allSingle = true;
        for (int i = 0; i < tokens.size(); i++) {
            FullTextAnalyzer.Token token = tokens.get(i);
            boolean openLeft = i == 0 && token.getStartOffset() == 0;
            boolean openRight = i == tokens.size() - 1 && token.getEndOffset() == literal.length();
            
            List<String> candidates = expand(session, token.getTerm(), openLeft, openRight);
            if (candidates.isEmpty()) {
                return new Result(Status.NO_MATCH, null);
            }
            if (candidates.size() > maxTermExpansions) {
                return new Result(Status.TOO_MANY_EXPANSIONS, null);
            }
            allSingle &= candidates.size() == 1;
            positions.add(candidates);
        }
        
        Query query;
        if (allSingle) {
            PhraseQuery.Builder builder = new PhraseQuery.Builder();
            for (int i = 0; i < positions.size(); i++) {
                builder.add(new Term(column, positions.get(i).get(0)), i);
            }
            query = builder.build();
        } else {
            MultiPhraseQuery.Builder builder = new MultiPhraseQuery.Builder();
            for (int i = 0; i < positions.size(); i++) {
                List<String> candidates = positions.get(i);
                Term[] terms = new Term[candidates.size()];
                for (int j = 0; j < terms.length; j++) {
                    terms[j] = new Term(column, candidates.get(j));
                }
                builder.add(terms, i);
            }
            query = builder.build();
        }
        return new Result(Status.QUERY, query);
    }
    
    private List<String> expand(SearchIndexSession session, String token, boolean openLeft, boolean openRight) {
        if (!openLeft && !openRight) {
            return session.hasTerm(token) ? Collections.singletonList(token) : Collections.emptyList();
        }
        // 多取一个用于判断是否超限
        int limit = maxTermExpansions + 1;
        if (!openLeft) {
            return session.findTermsWithPrefix(token, limit);
        }
        Predicate<String> condition = openRight ? term -> term.contains(token) : term -> term.endsWith(token);
        return session.findTerms(condition, limit);
    }
    
    static final class Result {
        private final Status status;
        private final Query query;
        
        Result(Status status, Query query) {
            this.status = status;
            this.query = query;
        }
        
        Status getStatus() {
            return status;
        }
        
        Query getQuery() {
            return query;
        }
    }
}
