package com.mini.fts.rewrite;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 改写结果：NoRewrite、Pushdown(主键集合) 或 Empty
 * 每次查询新生成，不做持久化
 */
public final class RewriteOutcome {
    
    public enum Kind {
        NO_REWRITE,
        PUSHDOWN,
        EMPTY
    }
    
    /** 放弃改写的原因 */
    public enum Reason {
        UNSUPPORTED_PREDICATE_SHAPE(RewriteState.UNSUPPORTED),
        NO_USABLE_INDEX(RewriteState.UNSUPPORTED),
        NO_TOKENS(RewriteState.UNSUPPORTED),
        TOO_MANY_TERM_EXPANSIONS(RewriteState.DECLINED),
        ABOVE_SELECTIVITY_CUTOFF(RewriteState.DECLINED),
        TOO_MANY_KEYS(RewriteState.DECLINED),
        SEARCH_FAILED(RewriteState.SEARCH_FAILED);
        
        private final RewriteState state;
        
        Reason(RewriteState state) {
            this.state = state;
        }
        
        public RewriteState getState() {
            return state;
        }
    }
    
    private static final RewriteOutcome EMPTY = new RewriteOutcome(Kind.EMPTY, Collections.emptySortedSet(), null);
    
    private final Kind kind;
    private final SortedSet<Long> keys;
    private final Reason reason;
    
    private RewriteOutcome(Kind kind, SortedSet<Long> keys, Reason reason) {
        this.kind = kind;
        this.keys = keys;
        this.reason = reason;
    }
    
    public static RewriteOutcome noRewrite(Reason reason) {
        return new RewriteOutcome(Kind.NO_REWRITE, Collections.emptySortedSet(), reason);
    }
    
    public static RewriteOutcome pushdown(SortedSet<Long> keys) {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Pushdown requires at least one key, use empty() instead");
        }
        return new RewriteOutcome(Kind.PUSHDOWN, Collections.unmodifiableSortedSet(new TreeSet<>(keys)), null);
    }
    
    public static RewriteOutcome empty() {
        return EMPTY;
    }
    
    public Kind getKind() {
        return kind;
    }
    
    /**
     * Pushdown 时为命中的主键，其它情况为空集合
     */
    public SortedSet<Long> getKeys() {
        return keys;
    }
    
    /**
     * NoRewrite 的原因，其它情况为 null
     */
    public Reason getReason() {
        return reason;
    }
    
    public RewriteState getState() {
        switch (kind) {
            case PUSHDOWN:
                return RewriteState.PUSHDOWN;
            case EMPTY:
                return RewriteState.EMPTY;
            default:
                return reason.getState();
        }
    }
    
    public boolean isNoRewrite() {
        return kind == Kind.NO_REWRITE;
    }
    
    public boolean isPushdown() {
        return kind == Kind.PUSHDOWN;
    }
    
    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }
    
    @Override
    public String toString() {
        switch (kind) {
            case PUSHDOWN:
                return "Pushdown(" + keys.size() + " keys)";
            case EMPTY:
                return "Empty";
            default:
                return "NoRewrite(" + reason + ")";
        }
    }
}
