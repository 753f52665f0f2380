package com.mini.fts.rewrite;

/**
 * 单个候选谓词的改写状态
 * 
 * <pre>
 * UNANALYZED -> PATTERN_EXTRACTED | UNSUPPORTED
 * PATTERN_EXTRACTED -> PUSHDOWN | EMPTY | SEARCH_FAILED | DECLINED | UNSUPPORTED
 * </pre>
 * PATTERN_EXTRACTED 之后的 UNSUPPORTED 表示列上没有可用的索引，或字面量切不出词。
 * UNSUPPORTED、SEARCH_FAILED 和 DECLINED 最终都按原谓词扫描。
 */
public enum RewriteState {
    UNANALYZED(false),
    PATTERN_EXTRACTED(false),
    UNSUPPORTED(true),
    PUSHDOWN(true),
    EMPTY(true),
    SEARCH_FAILED(true),
    /** 索引可用，但命中太多，按性能阈值放弃改写 */
    DECLINED(true);
    
    private final boolean terminal;
    
    RewriteState(boolean terminal) {
        this.terminal = terminal;
    }
    
    public boolean isTerminal() {
        return terminal;
    }
}
