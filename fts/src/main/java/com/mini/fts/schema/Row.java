package com.mini.fts.schema;

import java.util.Arrays;
import java.util.Objects;

/**
 * 行数据
 * 值的顺序与 {@link Schema#getFields()} 一致
 */
public class Row {
    private final Object[] values;

    public Row(Object... values) {
        this.values = Objects.requireNonNull(values, "Values cannot be null").clone();
    }

    /**
     * 获取字段值数组
     * 
     * @return 字段值数组的副本
     */
    public Object[] getValues() {
        return values.clone();
    }

    public Object get(int index) {
        return values[index];
    }

    public int size() {
        return values.length;
    }

    /**
     * 校验行数据与 Schema 是否匹配，并返回规范化后的行
     */
    public Row validate(Schema schema) {
        if (values.length != schema.getFieldCount()) {
            throw new IllegalArgumentException("Row has " + values.length 
                + " values but schema has " + schema.getFieldCount() + " fields");
        }
        Object[] normalized = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            normalized[i] = schema.getFields().get(i).accept(values[i]);
        }
        return new Row(normalized);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Row row = (Row) o;
        return Arrays.equals(values, row.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Row" + Arrays.toString(values);
    }
}
