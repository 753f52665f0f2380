package com.mini.fts.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 宿主文件中的一列
 *
 * 除了名称和类型，还负责两类判断：
 * 能否作为全文索引命中回查用的主键列（非空 LONG），
 * 能否建立全文索引（STRING）。
 */
public class Field {
    private final String name;
    private final DataType type;
    private final boolean nullable;

    @JsonCreator
    public Field(
            @JsonProperty("name") String name,
            @JsonProperty("type") DataType type,
            @JsonProperty("nullable") boolean nullable) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Field name cannot be empty");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "Field type cannot be null");
        this.nullable = nullable;
    }

    /** 非空 LONG 主键列 */
    public static Field key(String name) {
        return new Field(name, DataType.LONG, false);
    }

    /** 可为空的文本列 */
    public static Field text(String name) {
        return new Field(name, DataType.STRING, true);
    }

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    /**
     * 索引文档里存的主键值要能无损回到这一列，并且每行都有值
     */
    @JsonIgnore
    public boolean isKeyCandidate() {
        return type == DataType.LONG && !nullable;
    }

    @JsonIgnore
    public boolean isFullTextIndexable() {
        return type == DataType.STRING;
    }

    /**
     * 校验写入这一列的值，返回按列类型规范化后的值
     *
     * @throws IllegalArgumentException 空值写入非空列，或类型不兼容
     */
    public Object accept(Object value) {
        if (value == null) {
            if (!nullable) {
                throw new IllegalArgumentException("Field " + name + " cannot be null");
            }
            return null;
        }
        if (!type.isCompatible(value)) {
            throw new IllegalArgumentException("Value " + value + " is not compatible with "
                + type + " for field " + name);
        }
        return type.normalize(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Field)) return false;
        Field other = (Field) o;
        return nullable == other.nullable && type == other.type && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, nullable);
    }

    @Override
    public String toString() {
        return name + " " + type + (nullable ? "" : " NOT NULL");
    }
}
