package com.mini.fts.format;

import com.google.common.hash.BloomFilter;
import com.mini.fts.predicate.Predicate;

import java.util.function.Function;

/**
 * 行组过滤器
 * 根据列统计信息和主键布隆过滤器判断一个行组是否可能包含满足谓词的行
 * 
 * 返回 false 表示一定不包含，可以跳过；无法判断的谓词一律保守返回 true。
 */
class RowGroupFilter {
    
    private final String keyField;
    
    /** 按需加载行组的主键布隆过滤器 */
    private final Function<ColumnarFile.RowGroupMeta, BloomFilter<Long>> bloomFilterLoader;
    
    RowGroupFilter(String keyField, Function<ColumnarFile.RowGroupMeta, BloomFilter<Long>> bloomFilterLoader) {
        this.keyField = keyField;
        this.bloomFilterLoader = bloomFilterLoader;
    }
    
    boolean mightMatch(Predicate predicate, ColumnarFile.RowGroupMeta rowGroup) {
        if (predicate == null) {
            return true;
        }
        
        if (predicate instanceof Predicate.AndPredicate) {
            Predicate.AndPredicate and = (Predicate.AndPredicate) predicate;
            return mightMatch(and.getLeft(), rowGroup) && mightMatch(and.getRight(), rowGroup);
        }
        if (predicate instanceof Predicate.OrPredicate) {
            Predicate.OrPredicate or = (Predicate.OrPredicate) predicate;
            return mightMatch(or.getLeft(), rowGroup) || mightMatch(or.getRight(), rowGroup);
        }
        if (predicate instanceof Predicate.InPredicate) {
            return evaluateIn((Predicate.InPredicate) predicate, rowGroup);
        }
        if (predicate instanceof Predicate.FieldPredicate) {
            return evaluateCompare((Predicate.FieldPredicate) predicate, rowGroup);
        }
        
        return true;
    }
    
    private boolean evaluateIn(Predicate.InPredicate predicate, ColumnarFile.RowGroupMeta rowGroup) {
        ColumnarFile.ColumnChunkMeta chunk = rowGroup.getColumn(predicate.getFieldName());
        if (chunk == null || chunk.getStatistics() == null) {
            return true;
        }
        ColumnStatistics stats = chunk.getStatistics();
        boolean useBloom = keyField.equals(predicate.getFieldName()) && rowGroup.getKeyBloomFilterLength() > 0;
        BloomFilter<Long> bloomFilter = null;
        
        for (Object value : predicate.getValues()) {
            if (value == null || !stats.mightContainValue(value)) {
                continue;
            }
            if (!useBloom || !(value instanceof Long)) {
                return true;
            }
            if (bloomFilter == null) {
                bloomFilter = bloomFilterLoader.apply(rowGroup);
            }
            if (bloomFilter.mightContain((Long) value)) {
                return true;
            }
        }
        return false;
    }
    
    private boolean evaluateCompare(Predicate.FieldPredicate predicate, ColumnarFile.RowGroupMeta rowGroup) {
        ColumnarFile.ColumnChunkMeta chunk = rowGroup.getColumn(predicate.getFieldName());
        if (chunk == null || chunk.getStatistics() == null || predicate.getValue() == null) {
            return true;
        }
        ColumnStatistics stats = chunk.getStatistics();
        Object value = predicate.getValue();
        
        switch (predicate.getOp()) {
            case EQ:
                if (!stats.mightContainValue(value)) {
                    return false;
                }
                if (keyField.equals(predicate.getFieldName()) && value instanceof Long
                        && rowGroup.getKeyBloomFilterLength() > 0) {
                    return bloomFilterLoader.apply(rowGroup).mightContain((Long) value);
                }
                return true;
            case GT:
            case GE:
                return stats.mightOverlapRange(value, null);
            case LT:
            case LE:
                return stats.mightOverlapRange(null, value);
            default:
                return true;
        }
    }
}
