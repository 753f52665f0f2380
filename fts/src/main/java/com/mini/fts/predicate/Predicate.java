package com.mini.fts.predicate;

import com.mini.fts.schema.Row;
import com.mini.fts.schema.Schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Predicate
 * 谓词过滤条件，用于扫描时的行级过滤和行组级剪枝
 */
public abstract class Predicate {
    
    /**
     * 测试行是否满足条件
     */
    public abstract boolean test(Row row, Schema schema);
    
    /**
     * AND 组合
     */
    public Predicate and(Predicate other) {
        return new AndPredicate(this, other);
    }
    
    /**
     * OR 组合
     */
    public Predicate or(Predicate other) {
        return new OrPredicate(this, other);
    }
    
    /**
     * 展开顶层 AND，返回所有合取项；非 AND 谓词返回自身
     */
    public List<Predicate> conjuncts() {
        return Collections.singletonList(this);
    }
    
    /**
     * 将合取项重新组合为左深 AND 树
     */
    public static Predicate conjunction(List<Predicate> predicates) {
        if (predicates.isEmpty()) {
            throw new IllegalArgumentException("Conjunction requires at least one predicate");
        }
        Predicate result = predicates.get(0);
        for (int i = 1; i < predicates.size(); i++) {
            result = new AndPredicate(result, predicates.get(i));
        }
        return result;
    }
    
    static int requireField(Schema schema, String fieldName) {
        int fieldIndex = schema.getFieldIndex(fieldName);
        if (fieldIndex == -1) {
            throw new IllegalArgumentException("Field not found: " + fieldName);
        }
        return fieldIndex;
    }
    
    /**
     * 比较操作符
     */
    public enum CompareOp {
        EQ("="),
        NE("!="),
        GT(">"),
        GE(">="),
        LT("<"),
        LE("<=");
        
        private final String symbol;
        
        CompareOp(String symbol) {
            this.symbol = symbol;
        }
        
        public String getSymbol() {
            return symbol;
        }
    }
    
    /**
     * 字段比较谓词
     */
    public static class FieldPredicate extends Predicate {
        private final String fieldName;
        private final CompareOp op;
        private final Object value;
        
        public FieldPredicate(String fieldName, CompareOp op, Object value) {
            this.fieldName = fieldName;
            this.op = op;
            this.value = value instanceof Integer ? Long.valueOf((Integer) value) : value;
        }
        
        public String getFieldName() {
            return fieldName;
        }
        
        public CompareOp getOp() {
            return op;
        }
        
        public Object getValue() {
            return value;
        }
        
        @Override
        public boolean test(Row row, Schema schema) {
            Object fieldValue = row.get(requireField(schema, fieldName));
            
            if (fieldValue == null || value == null) {
                return false;
            }
            
            return compare(fieldValue, value, op);
        }
        
        @SuppressWarnings({"unchecked", "rawtypes"})
        private boolean compare(Object left, Object right, CompareOp op) {
            if (!(left instanceof Comparable)) {
                return op == CompareOp.EQ ? left.equals(right) : !left.equals(right);
            }
            
            int cmp = ((Comparable) left).compareTo(right);
            
            switch (op) {
                case EQ: return cmp == 0;
                case NE: return cmp != 0;
                case GT: return cmp > 0;
                case GE: return cmp >= 0;
                case LT: return cmp < 0;
                case LE: return cmp <= 0;
                default: throw new IllegalArgumentException("Unsupported operator: " + op);
            }
        }
        
        @Override
        public String toString() {
            return fieldName + " " + op.getSymbol() + " " + value;
        }
    }
    
    /**
     * 集合成员谓词：field IN (v1, v2, ...)
     */
    public static class InPredicate extends Predicate {
        private final String fieldName;
        private final Set<Object> values;
        
        public InPredicate(String fieldName, Collection<?> values) {
            this.fieldName = fieldName;
            Set<Object> normalized = new LinkedHashSet<>();
            for (Object v : values) {
                normalized.add(v instanceof Integer ? Long.valueOf((Integer) v) : v);
            }
            this.values = Collections.unmodifiableSet(normalized);
        }
        
        public String getFieldName() {
            return fieldName;
        }
        
        public Set<Object> getValues() {
            return values;
        }
        
        @Override
        public boolean test(Row row, Schema schema) {
            Object fieldValue = row.get(requireField(schema, fieldName));
            return fieldValue != null && values.contains(fieldValue);
        }
        
        @Override
        public String toString() {
            return fieldName + " IN " + values;
        }
    }
    
    /**
     * 模式匹配谓词：field [NOT] LIKE / ILIKE pattern
     * 
     * ILIKE 的语义是先对两边逐码点做 {@link Character#toLowerCase(int)} 再按 LIKE 匹配，
     * 与全文索引的大小写折叠规则一致。
     */
    public static class LikePredicate extends Predicate {
        private final String fieldName;
        private final LikePattern pattern;
        private final LikePattern foldedPattern;
        private final boolean caseInsensitive;
        private final boolean negated;
        
        public LikePredicate(String fieldName, String pattern, boolean caseInsensitive, boolean negated) {
            this.fieldName = fieldName;
            this.pattern = LikePattern.compile(pattern);
            this.foldedPattern = caseInsensitive ? LikePattern.compile(foldCase(pattern)) : this.pattern;
            this.caseInsensitive = caseInsensitive;
            this.negated = negated;
        }
        
        public String getFieldName() {
            return fieldName;
        }
        
        public LikePattern getPattern() {
            return pattern;
        }
        
        public boolean isCaseInsensitive() {
            return caseInsensitive;
        }
        
        public boolean isNegated() {
            return negated;
        }
        
        @Override
        public boolean test(Row row, Schema schema) {
            Object fieldValue = row.get(requireField(schema, fieldName));
            if (fieldValue == null) {
                return false;
            }
            String text = fieldValue.toString();
            boolean matched = caseInsensitive 
                ? foldedPattern.matches(foldCase(text)) 
                : pattern.matches(text);
            return matched != negated;
        }
        
        /**
         * 逐码点转小写
         */
        public static String foldCase(String text) {
            StringBuilder sb = new StringBuilder(text.length());
            text.codePoints().forEach(cp -> sb.appendCodePoint(Character.toLowerCase(cp)));
            return sb.toString();
        }
        
        @Override
        public String toString() {
            return fieldName + (negated ? " NOT" : "") + (caseInsensitive ? " ILIKE '" : " LIKE '") 
                + pattern + "'";
        }
    }
    
    /**
     * AND 谓词
     */
    public static class AndPredicate extends Predicate {
        private final Predicate left;
        private final Predicate right;
        
        public AndPredicate(Predicate left, Predicate right) {
            this.left = left;
            this.right = right;
        }
        
        public Predicate getLeft() {
            return left;
        }
        
        public Predicate getRight() {
            return right;
        }
        
        @Override
        public boolean test(Row row, Schema schema) {
            return left.test(row, schema) && right.test(row, schema);
        }
        
        @Override
        public List<Predicate> conjuncts() {
            List<Predicate> result = new ArrayList<>(left.conjuncts());
            result.addAll(right.conjuncts());
            return result;
        }
        
        @Override
        public String toString() {
            return "(" + left + " AND " + right + ")";
        }
    }
    
    /**
     * OR 谓词
     */
    public static class OrPredicate extends Predicate {
        private final Predicate left;
        private final Predicate right;
        
        public OrPredicate(Predicate left, Predicate right) {
            this.left = left;
            this.right = right;
        }
        
        public Predicate getLeft() {
            return left;
        }
        
        public Predicate getRight() {
            return right;
        }
        
        @Override
        public boolean test(Row row, Schema schema) {
            return left.test(row, schema) || right.test(row, schema);
        }
        
        @Override
        public String toString() {
            return "(" + left + " OR " + right + ")";
        }
    }
    
    /**
     * 创建相等谓词
     */
    public static Predicate equal(String field, Object value) {
        return new FieldPredicate(field, CompareOp.EQ, value);
    }
    
    /**
     * 创建不等谓词
     */
    public static Predicate notEqual(String field, Object value) {
        return new FieldPredicate(field, CompareOp.NE, value);
    }
    
    public static Predicate greaterThan(String field, Object value) {
        return new FieldPredicate(field, CompareOp.GT, value);
    }
    
    public static Predicate greaterOrEqual(String field, Object value) {
        return new FieldPredicate(field, CompareOp.GE, value);
    }
    
    public static Predicate lessThan(String field, Object value) {
        return new FieldPredicate(field, CompareOp.LT, value);
    }
    
    public static Predicate lessOrEqual(String field, Object value) {
        return new FieldPredicate(field, CompareOp.LE, value);
    }
    
    /**
     * 创建 IN 谓词
     */
    public static Predicate in(String field, Collection<?> values) {
        return new InPredicate(field, values);
    }
    
    public static Predicate in(String field, Object... values) {
        return new InPredicate(field, Arrays.asList(values));
    }
    
    /**
     * 创建 LIKE 谓词（区分大小写）
     */
    public static Predicate like(String field, String pattern) {
        return new LikePredicate(field, pattern, false, false);
    }
    
    /**
     * 创建 ILIKE 谓词（不区分大小写）
     */
    public static Predicate ilike(String field, String pattern) {
        return new LikePredicate(field, pattern, true, false);
    }
    
    public static Predicate notLike(String field, String pattern) {
        return new LikePredicate(field, pattern, false, true);
    }
}
