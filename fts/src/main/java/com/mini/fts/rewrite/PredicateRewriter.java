package com.mini.fts.rewrite;

import com.mini.fts.config.FullTextIndexOptions;
import com.mini.fts.exception.SearchBackendException;
import com.mini.fts.predicate.Predicate;
import com.mini.fts.store.FullTextAnalyzer;
import com.mini.fts.store.SearchIndexSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.SortedSet;

/**
 * 谓词改写器
 * 把无法利用统计信息剪枝的 LIKE '%literal%' 谓词改写为主键集合
 * 
 * 流程：提取字面量 -> 按索引分析器分词并构造有序短语查询 -> 统计命中数并检查选择率阈值
 * -> 把命中文档解析为主键。阈值只影响是否改写，不影响结果正确性。
 */
public class PredicateRewriter {
    private static final Logger logger = LoggerFactory.getLogger(PredicateRewriter.class);
    
    private final FullTextIndexOptions options;
    private final LiteralQueryBuilder queryBuilder;
    
    public PredicateRewriter(FullTextIndexOptions options) {
        this.options = options;
        this.queryBuilder = new LiteralQueryBuilder(new FullTextAnalyzer(), options.getMaxTermExpansions());
    }
    
    /**
     * 提取可改写谓词的字面量：未取反的 LIKE/ILIKE，且模式为 %literal%
     */
    public static Optional<String> extractLiteral(Predicate predicate) {
        if (!(predicate instanceof Predicate.LikePredicate)) {
            return Optional.empty();
        }
        Predicate.LikePredicate like = (Predicate.LikePredicate) predicate;
        if (like.isNegated()) {
            return Optional.empty();
        }
        return like.getPattern().unanchoredLiteral();
    }
    
    /**
     * 改写单个谓词
     * 
     * @param predicate 文本匹配谓词
     * @param session 该列的索引会话
     * @param rowCount 宿主文件总行数，用于计算选择率
     */
    public RewriteOutcome rewrite(Predicate predicate, SearchIndexSession session, long rowCount) {
        Optional<String> literal = extractLiteral(predicate);
        if (!literal.isPresent()) {
            logger.debug("Predicate {} is not an unanchored substring match", predicate);
            return RewriteOutcome.noRewrite(RewriteOutcome.Reason.UNSUPPORTED_PREDICATE_SHAPE);
        }
        
        try {
            LiteralQueryBuilder.Result built = queryBuilder.build(literal.get(), session);
            switch (built.getStatus()) {
                case NO_TOKENS:
                    return RewriteOutcome.noRewrite(RewriteOutcome.Reason.NO_TOKENS);
                case TOO_MANY_EXPANSIONS:
                    logger.debug("Literal '{}' expands to more than {} terms at some position", 
                                literal.get(), options.getMaxTermExpansions());
                    return RewriteOutcome.noRewrite(RewriteOutcome.Reason.TOO_MANY_TERM_EXPANSIONS);
                case NO_MATCH:
                    logger.debug("Literal '{}' has a token with no candidate term in column {}", 
                                literal.get(), session.getColumn());
                    return RewriteOutcome.empty();
                default:
                    break;
            }
            
            int count = session.count(built.getQuery());
            if (count == 0) {
                logger.debug("Query {} has no match in column {}", built.getQuery(), session.getColumn());
                return RewriteOutcome.empty();
            }
            if (rowCount > 0 && (double) count / rowCount > options.getSelectivityCutoff()) {
                logger.debug("Query {} matches {} of {} rows, above cutoff {}", 
                            built.getQuery(), count, rowCount, options.getSelectivityCutoff());
                return RewriteOutcome.noRewrite(RewriteOutcome.Reason.ABOVE_SELECTIVITY_CUTOFF);
            }
            if (count > options.getMaxPushdownKeys()) {
                return RewriteOutcome.noRewrite(RewriteOutcome.Reason.TOO_MANY_KEYS);
            }
            
            SortedSet<Long> keys = session.resolveKeys(built.getQuery());
            logger.debug("Rewrote {} to {} keys via {}", predicate, keys.size(), built.getQuery());
            return keys.isEmpty() ? RewriteOutcome.empty() : RewriteOutcome.pushdown(keys);
        } catch (SearchBackendException e) {
            logger.warn("Search failed for {}, falling back to full scan", predicate, e);
            return RewriteOutcome.noRewrite(RewriteOutcome.Reason.SEARCH_FAILED);
        }
    }
}
