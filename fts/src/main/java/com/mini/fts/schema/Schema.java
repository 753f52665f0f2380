package com.mini.fts.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Schema 类
 * 宿主文件的列定义，以及用于把全文索引命中结果映射回行的主键列
 */
public class Schema {
    /** 字段列表 */
    private final List<Field> fields;
    
    /** 主键列名，必须是非空 LONG 列 */
    private final String keyField;

    @JsonCreator
    public Schema(
            @JsonProperty("fields") List<Field> fields,
            @JsonProperty("keyField") String keyField) {
        this.fields = new ArrayList<>(Objects.requireNonNull(fields, "Fields cannot be null"));
        this.keyField = Objects.requireNonNull(keyField, "Key field cannot be null");
        validate();
    }

    /**
     * 验证Schema的有效性
     */
    private void validate() {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Schema must have at least one field");
        }
        Set<String> names = new HashSet<>();
        for (Field field : fields) {
            if (!names.add(field.getName())) {
                throw new IllegalArgumentException("Duplicate field: " + field.getName());
            }
        }
        Field key = getField(keyField);
        if (key == null) {
            throw new IllegalArgumentException("Key field not found: " + keyField);
        }
        if (!key.isKeyCandidate()) {
            throw new IllegalArgumentException("Key field must be a non-null LONG column: " + keyField);
        }
    }

    public List<Field> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public String getKeyField() {
        return keyField;
    }

    /**
     * 根据字段名获取字段
     */
    public Field getField(String name) {
        return fields.stream()
                .filter(f -> f.getName().equals(name))
                .findFirst()
                .orElse(null);
    }

    /**
     * 获取字段索引
     */
    public int getFieldIndex(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @JsonIgnore
    public int getKeyIndex() {
        return getFieldIndex(keyField);
    }

    @JsonIgnore
    public int getFieldCount() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schema schema = (Schema) o;
        return fields.equals(schema.fields) && keyField.equals(schema.keyField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, keyField);
    }

    @Override
    public String toString() {
        return "Schema{" +
                "fields=" + fields +
                ", keyField='" + keyField + '\'' +
                '}';
    }
}
