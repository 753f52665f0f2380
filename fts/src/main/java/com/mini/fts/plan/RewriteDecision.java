package com.mini.fts.plan;

import com.mini.fts.predicate.Predicate;
import com.mini.fts.rewrite.RewriteOutcome;
import com.mini.fts.rewrite.RewriteState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个候选谓词的改写决策记录
 * 保存从 UNANALYZED 开始经过的全部状态，最后一个状态必须是终态
 */
public class RewriteDecision {
    private final Predicate predicate;
    private final String column;
    private final List<RewriteState> path;
    private final RewriteOutcome outcome;

    public RewriteDecision(Predicate predicate, String column, List<RewriteState> path, RewriteOutcome outcome) {
        if (path.isEmpty() || path.get(0) != RewriteState.UNANALYZED) {
            throw new IllegalArgumentException("Rewrite path must start at UNANALYZED: " + path);
        }
        RewriteState last = path.get(path.size() - 1);
        if (!last.isTerminal()) {
            throw new IllegalArgumentException("Rewrite path must end in a terminal state: " + path);
        }
        this.predicate = predicate;
        this.column = column;
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
        this.outcome = outcome;
    }

    public Predicate getPredicate() {
        return predicate;
    }

    public String getColumn() {
        return column;
    }

    /** 终态 */
    public RewriteState getState() {
        return path.get(path.size() - 1);
    }

    public List<RewriteState> getPath() {
        return path;
    }

    public RewriteOutcome getOutcome() {
        return outcome;
    }

    @Override
    public String toString() {
        return "RewriteDecision{" +
                "predicate=" + predicate +
                ", path=" + path +
                ", outcome=" + outcome +
                '}';
    }
}
