package com.mini.fts.plan;

import com.mini.fts.predicate.Predicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 交给宿主扫描算子的计划
 * 
 * <ul>
 *   <li>shortCircuitEmpty 为 true 时不读取任何数据，直接返回空结果</li>
 *   <li>pushdownPredicate 存在时用于统计信息剪枝，否则使用原谓词</li>
 *   <li>residualPredicate 对每一行重新求值</li>
 * </ul>
 */
public class ScanPlan {
    
    /** 原始扫描谓词，null 表示全表扫描 */
    private final Predicate originalPredicate;
    
    /** 改写得到的主键谓词 */
    private final Predicate pushdownPredicate;
    
    private final boolean shortCircuitEmpty;
    
    private final Predicate residualPredicate;
    
    private final List<RewriteDecision> decisions;
    
    private ScanPlan(Predicate originalPredicate, Predicate pushdownPredicate, boolean shortCircuitEmpty,
                     Predicate residualPredicate, List<RewriteDecision> decisions) {
        this.originalPredicate = originalPredicate;
        this.pushdownPredicate = pushdownPredicate;
        this.shortCircuitEmpty = shortCircuitEmpty;
        this.residualPredicate = residualPredicate;
        this.decisions = Collections.unmodifiableList(new ArrayList<>(decisions));
    }
    
    /**
     * 不改写：原谓词交给扫描，并逐行复核
     */
    public static ScanPlan original(Predicate predicate, List<RewriteDecision> decisions) {
        return new ScanPlan(predicate, null, false, predicate, decisions);
    }
    
    /**
     * 主键下推，原谓词作为残留过滤保留
     */
    public static ScanPlan pushdown(Predicate predicate, Predicate pushdown, List<RewriteDecision> decisions) {
        return new ScanPlan(predicate, pushdown, false, predicate, decisions);
    }
    
    public static ScanPlan empty(Predicate predicate, List<RewriteDecision> decisions) {
        return new ScanPlan(predicate, null, true, null, decisions);
    }
    
    public Predicate getOriginalPredicate() {
        return originalPredicate;
    }
    
    public Predicate getPushdownPredicate() {
        return pushdownPredicate;
    }
    
    public boolean isShortCircuitEmpty() {
        return shortCircuitEmpty;
    }
    
    public Predicate getResidualPredicate() {
        return residualPredicate;
    }
    
    public List<RewriteDecision> getDecisions() {
        return decisions;
    }
    
    /**
     * 实际交给宿主文件的扫描谓词
     */
    public Predicate getScanPredicate() {
        return pushdownPredicate != null ? pushdownPredicate : originalPredicate;
    }
    
    @Override
    public String toString() {
        if (shortCircuitEmpty) {
            return "ScanPlan{EMPTY, original=" + originalPredicate + '}';
        }
        return "ScanPlan{" +
                "original=" + originalPredicate +
                ", pushdown=" + pushdownPredicate +
                ", residual=" + residualPredicate +
                ", decisions=" + decisions.size() +
                '}';
    }
}
