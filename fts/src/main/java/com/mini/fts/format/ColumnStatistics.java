package com.mini.fts.format;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mini.fts.schema.DataType;

import java.util.Objects;

/**
 * Column Statistics
 * 单个列块的统计信息，用于行组级谓词下推
 * 
 * 统计信息包括:
 * 1. 最小值/最大值 (用于范围和 IN 过滤)
 * 2. 空值数量
 * 3. 总行数
 */
public class ColumnStatistics {
    
    private final String columnName;
    private final DataType dataType;
    
    /** 最小值 */
    private final Object minValue;
    
    /** 最大值 */
    private final Object maxValue;
    
    /** 空值数量 */
    private final long nullCount;
    
    /** 总行数 */
    private final long rowCount;
    
    @JsonCreator
    public ColumnStatistics(
            @JsonProperty("columnName") String columnName,
            @JsonProperty("dataType") DataType dataType,
            @JsonProperty("minValue") Object minValue,
            @JsonProperty("maxValue") Object maxValue,
            @JsonProperty("nullCount") long nullCount,
            @JsonProperty("rowCount") long rowCount) {
        this.columnName = columnName;
        this.dataType = dataType;
        // JSON 反序列化后小整数会变成 Integer，这里统一回 Long
        this.minValue = dataType.normalize(minValue);
        this.maxValue = dataType.normalize(maxValue);
        this.nullCount = nullCount;
        this.rowCount = rowCount;
    }
    
    public String getColumnName() {
        return columnName;
    }
    
    public DataType getDataType() {
        return dataType;
    }
    
    public Object getMinValue() {
        return minValue;
    }
    
    public Object getMaxValue() {
        return maxValue;
    }
    
    public long getNullCount() {
        return nullCount;
    }
    
    public long getRowCount() {
        return rowCount;
    }
    
    /**
     * 检查值是否可能在范围内
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public boolean mightContainValue(Object value) {
        if (value == null) {
            return nullCount > 0;
        }
        
        if (minValue == null || maxValue == null) {
            // 全为空的列块不可能包含非空值
            return nullCount < rowCount;
        }
        
        if (!(value instanceof Comparable)) {
            return true;
        }
        
        try {
            Comparable comparableValue = (Comparable) value;
            return comparableValue.compareTo(minValue) >= 0 &&
                   comparableValue.compareTo(maxValue) <= 0;
        } catch (ClassCastException e) {
            return true; // 类型不匹配,保守返回 true
        }
    }
    
    /**
     * 检查范围是否可能重叠，边界为 null 表示无穷
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public boolean mightOverlapRange(Object rangeMin, Object rangeMax) {
        if (minValue == null || maxValue == null) {
            return nullCount < rowCount;
        }
        
        try {
            if (rangeMin != null && ((Comparable) rangeMin).compareTo(maxValue) > 0) {
                return false; // rangeMin > maxValue
            }
            if (rangeMax != null && ((Comparable) rangeMax).compareTo(minValue) < 0) {
                return false; // rangeMax < minValue
            }
            return true;
        } catch (ClassCastException e) {
            return true;
        }
    }
    
    /**
     * 统计信息累加器，写入列块时逐值更新
     */
    public static class Collector {
        private final String columnName;
        private final DataType dataType;
        private Comparable<Object> min;
        private Comparable<Object> max;
        private long nullCount;
        private long rowCount;
        
        public Collector(String columnName, DataType dataType) {
            this.columnName = columnName;
            this.dataType = dataType;
        }
        
        @SuppressWarnings("unchecked")
        public void update(Object value) {
            rowCount++;
            if (value == null) {
                nullCount++;
                return;
            }
            Comparable<Object> comparable = (Comparable<Object>) value;
            if (min == null || comparable.compareTo(min) < 0) {
                min = comparable;
            }
            if (max == null || comparable.compareTo(max) > 0) {
                max = comparable;
            }
        }
        
        public ColumnStatistics finish() {
            return new ColumnStatistics(columnName, dataType, min, max, nullCount, rowCount);
        }
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnStatistics)) return false;
        ColumnStatistics that = (ColumnStatistics) o;
        return nullCount == that.nullCount &&
               rowCount == that.rowCount &&
               columnName.equals(that.columnName) &&
               dataType == that.dataType &&
               Objects.equals(minValue, that.minValue) &&
               Objects.equals(maxValue, that.maxValue);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(columnName, dataType, minValue, maxValue, nullCount, rowCount);
    }
    
    @Override
    public String toString() {
        return "ColumnStatistics{" +
                "column='" + columnName + '\'' +
                ", min=" + minValue +
                ", max=" + maxValue +
                ", nullCount=" + nullCount +
                ", rowCount=" + rowCount +
                '}';
    }
}
