package com.mini.fts.plan;

import com.mini.fts.config.FullTextIndexOptions;
import com.mini.fts.predicate.Predicate;
import com.mini.fts.rewrite.PredicateRewriter;
import com.mini.fts.rewrite.RewriteOutcome;
import com.mini.fts.rewrite.RewriteState;
import com.mini.fts.schema.Field;
import com.mini.fts.store.IndexedFileReader;
import com.mini.fts.store.SearchIndexSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 计划选择器
 * 在原谓词、主键下推和空结果短路之间做选择
 * 
 * 只有整个谓词或顶层 AND 中的 LIKE/ILIKE 子句才是候选，OR 之下的子句不做改写。
 * 多个候选都得到 Pushdown 时对主键集合取交集；任一候选为 Empty 则整个扫描为空。
 * 搜索失败等情况一律退回原谓词。
 */
public class PlanSelector {
    private static final Logger logger = LoggerFactory.getLogger(PlanSelector.class);
    
    private final PredicateRewriter rewriter;
    
    public PlanSelector(FullTextIndexOptions options) {
        this(new PredicateRewriter(options));
    }
    
    public PlanSelector(PredicateRewriter rewriter) {
        this.rewriter = rewriter;
    }
    
    public ScanPlan select(IndexedFileReader file, Predicate predicate) {
        List<RewriteDecision> decisions = new ArrayList<>();
        if (predicate == null) {
            return ScanPlan.original(null, decisions);
        }
        
        SortedSet<Long> keys = null;
        String keyField = null;
        for (Predicate conjunct : predicate.conjuncts()) {
            if (!(conjunct instanceof Predicate.LikePredicate)) {
                continue;
            }
            Predicate.LikePredicate like = (Predicate.LikePredicate) conjunct;
            RewriteDecision decision = analyze(file, like);
            decisions.add(decision);
            logger.debug("Rewrite decision: {}", decision);
            
            RewriteOutcome outcome = decision.getOutcome();
            if (outcome.isEmpty()) {
                ScanPlan plan = ScanPlan.empty(predicate, decisions);
                logger.debug("Selected plan for {}: {}", file.getFileReader().getPath(), plan);
                return plan;
            }
            if (outcome.isPushdown()) {
                keyField = file.session(like.getFieldName())
                    .map(SearchIndexSession::getKeyField)
                    .orElse(file.getSchema().getKeyField());
                if (keys == null) {
                    keys = new TreeSet<>(outcome.getKeys());
                } else {
                    keys.retainAll(outcome.getKeys());
                }
            }
        }
        
        ScanPlan plan;
        if (keys == null) {
            plan = ScanPlan.original(predicate, decisions);
        } else if (keys.isEmpty()) {
            plan = ScanPlan.empty(predicate, decisions);
        } else {
            plan = ScanPlan.pushdown(predicate, Predicate.in(keyField, keys), decisions);
        }
        logger.debug("Selected plan for {}: {}", file.getFileReader().getPath(), plan);
        return plan;
    }
    
    private RewriteDecision analyze(IndexedFileReader file, Predicate.LikePredicate like) {
        String column = like.getFieldName();
        List<RewriteState> path = new ArrayList<>();
        path.add(RewriteState.UNANALYZED);
        
        Field field = file.getSchema().getField(column);
        if (field == null || !field.isFullTextIndexable() 
                || !PredicateRewriter.extractLiteral(like).isPresent()) {
            path.add(RewriteState.UNSUPPORTED);
            return new RewriteDecision(like, column, path,
                RewriteOutcome.noRewrite(RewriteOutcome.Reason.UNSUPPORTED_PREDICATE_SHAPE));
        }
        path.add(RewriteState.PATTERN_EXTRACTED);
        
        Optional<SearchIndexSession> session = file.session(column);
        if (!session.isPresent()) {
            path.add(RewriteState.UNSUPPORTED);
            return new RewriteDecision(like, column, path,
                RewriteOutcome.noRewrite(RewriteOutcome.Reason.NO_USABLE_INDEX));
        }
        RewriteOutcome outcome = rewriter.rewrite(like, session.get(), file.getRowCount());
        path.add(outcome.getState());
        return new RewriteDecision(like, column, path, outcome);
    }
}
