package org.csu.reldb.common.model;

import lombok.Getter;
import org.csu.reldb.common.exception.ConstraintException;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * 列定义：名称、声明类型及约束。
 * 负责把任意 Value 转换为本列的类型，并做 NOT NULL / 长度校验。
 */
@Getter
public class Column {

    private static final Set<String> TRUE_TEXTS = Set.of("true", "1", "yes", "t");

    private final String name;
    private final DataType dataType;
    private final Integer length;       // 仅 VARCHAR 使用，可为 null
    private final boolean nullable;
    private final boolean primaryKey;
    private final boolean unique;
    private final Value defaultValue;   // 无默认值时为 Value.NULL

    public Column(String name, DataType dataType) {
        this(name, dataType, null, true, false, false, Value.NULL);
    }

    public Column(String name, DataType dataType, Integer length, boolean nullable,
                  boolean primaryKey, boolean unique, Value defaultValue) {
        this.name = name;
        this.dataType = dataType;
        this.length = dataType == DataType.VARCHAR ? length : null;
        this.nullable = nullable;
        this.primaryKey = primaryKey;
        this.unique = unique;
        this.defaultValue = defaultValue == null ? Value.NULL : defaultValue;
    }

    /**
     * 是否需要唯一性约束（主键或 UNIQUE）。
     */
    public boolean requiresUniqueness() {
        return primaryKey || unique;
    }

    /**
     * 把值转换为本列的声明类型。Null 保持为 Null。
     * @throws ConstraintException 无法转换时
     */
    public Value convert(Value value) {
        if (value.isNull()) {
            return Value.NULL;
        }
        return switch (dataType) {
            case INT -> toInt(value);
            case FLOAT -> toFloat(value);
            case VARCHAR -> value.getType() == ValueType.TEXT ? value : new Value(value.render());
            case BOOLEAN -> toBoolean(value);
            case DATETIME -> toDateTime(value);
        };
    }

    /**
     * 校验并转换一个待写入本列的值。
     * 主键列隐含 NOT NULL。
     * @return 转换后的值
     */
    public Value validate(Value value) {
        if (value.isNull()) {
            if (!nullable || primaryKey) {
                throw new ConstraintException("Column '" + name + "' cannot be NULL");
            }
            return Value.NULL;
        }
        Value converted = convert(value);
        if (dataType == DataType.VARCHAR && length != null && converted.asText().length() > length) {
            throw new ConstraintException(String.format(
                    "Value too long for column '%s': %d characters, maximum is %d",
                    name, converted.asText().length(), length));
        }
        return converted;
    }

    /**
     * 转为 INT。FLOAT 截断小数部分；文本先按整数解析，失败再按小数解析并截断，
     * 因此 {@code '3.5'} 得到 3 而不是转换错误。
     */
    private Value toInt(Value value) {
        return switch (value.getType()) {
            case INT -> value;
            case FLOAT, BOOL -> new Value(value.asLong());
            case TEXT -> {
                String text = value.asText().trim();
                try {
                    yield new Value(Long.parseLong(text));
                } catch (NumberFormatException e) {
                    yield new Value((long) parseFiniteDouble(value));
                }
            }
            case TIMESTAMP, NULL -> throw conversionError(value);
        };
    }

    private Value toFloat(Value value) {
        return switch (value.getType()) {
            case FLOAT -> value;
            case INT, BOOL -> new Value(value.asDouble());
            case TEXT -> new Value(parseFiniteDouble(value));
            case TIMESTAMP, NULL -> throw conversionError(value);
        };
    }

    private Value toBoolean(Value value) {
        return switch (value.getType()) {
            case BOOL -> value;
            case TEXT -> new Value(TRUE_TEXTS.contains(value.asText().toLowerCase()));
            case INT, FLOAT -> new Value(value.asDouble() != 0.0);
            case TIMESTAMP -> new Value(true);
            case NULL -> throw conversionError(value);
        };
    }

    private Value toDateTime(Value value) {
        return switch (value.getType()) {
            case TIMESTAMP -> value;
            case TEXT -> {
                LocalDateTime parsed = Value.parseTimestamp(value.asText().trim());
                if (parsed == null) {
                    throw conversionError(value);
                }
                yield new Value(parsed);
            }
            case INT, FLOAT, BOOL, NULL -> throw conversionError(value);
        };
    }

    private double parseFiniteDouble(Value value) {
        try {
            double parsed = Double.parseDouble(value.asText().trim());
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                throw conversionError(value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw conversionError(value);
        }
    }

    private ConstraintException conversionError(Value value) {
        return new ConstraintException(String.format("Cannot convert '%s' to %s for column '%s'",
                value.render(), dataType, name));
    }

    /**
     * 列的文本描述，例如 {@code name VARCHAR(100) NOT NULL}。
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(name).append(' ').append(dataType);
        if (length != null) {
            sb.append('(').append(length).append(')');
        }
        if (primaryKey) {
            sb.append(" PRIMARY KEY");
        }
        if (unique) {
            sb.append(" UNIQUE");
        }
        if (!nullable) {
            sb.append(" NOT NULL");
        }
        if (!defaultValue.isNull()) {
            sb.append(" DEFAULT ");
            sb.append(defaultValue.getType() == ValueType.TEXT ? "'" + defaultValue.render() + "'" : defaultValue.render());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
