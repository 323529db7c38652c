package org.csu.reldb.common.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Objects;

/**
 * 表示一个具体的值，可以是不同数据类型。
 * 所有存储与比较的数据都使用这一种标量表示：Int / Float / Text / Bool / Timestamp / Null。
 */
public final class Value implements Comparable<Value> {

    public static final Value NULL = new Value(ValueType.NULL, null);

    /** 时间戳的规范文本格式，同时也是第一个被接受的解析格式 */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter DATE_ONLY_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    // 按顺序尝试，第一个匹配的格式生效
    private static final List<DateTimeFormatter> ACCEPTED_TIMESTAMP_FORMATS = List.of(
            TIMESTAMP_FORMAT,
            DATE_ONLY_FORMAT,
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss").withResolverStyle(ResolverStyle.STRICT)
    );

    private final ValueType type;
    private final Object value;

    public Value(long value) {
        this(ValueType.INT, value);
    }

    public Value(double value) {
        this(ValueType.FLOAT, value);
    }

    public Value(String value) {
        this(ValueType.TEXT, Objects.requireNonNull(value, "text value"));
    }

    public Value(boolean value) {
        this(ValueType.BOOL, value);
    }

    public Value(LocalDateTime value) {
        this(ValueType.TIMESTAMP, Objects.requireNonNull(value, "timestamp value"));
    }

    private Value(ValueType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public ValueType getType() {
        return type;
    }

    /**
     * 原始的 Java 对象 (Long / Double / String / Boolean / LocalDateTime)，Null 时返回 null。
     */
    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    public long asLong() {
        return switch (type) {
            case INT -> (Long) value;
            case FLOAT -> (long) (double) (Double) value;
            case BOOL -> (Boolean) value ? 1L : 0L;
            case NULL, TEXT, TIMESTAMP -> throw new IllegalStateException("Not a numeric value: " + render());
        };
    }

    public double asDouble() {
        return switch (type) {
            case INT -> (double) (Long) value;
            case FLOAT -> (Double) value;
            case BOOL -> (Boolean) value ? 1.0 : 0.0;
            case NULL, TEXT, TIMESTAMP -> throw new IllegalStateException("Not a numeric value: " + render());
        };
    }

    public boolean asBoolean() {
        if (type != ValueType.BOOL) {
            throw new IllegalStateException("Not a boolean value: " + render());
        }
        return (Boolean) value;
    }

    public String asText() {
        if (type != ValueType.TEXT) {
            throw new IllegalStateException("Not a text value: " + render());
        }
        return (String) value;
    }

    public LocalDateTime asTimestamp() {
        if (type != ValueType.TIMESTAMP) {
            throw new IllegalStateException("Not a timestamp value: " + render());
        }
        return (LocalDateTime) value;
    }

    /**
     * 值的规范文本形式，也是写入 VARCHAR 列时的转换结果。
     * 数值与布尔沿用 Java 的 {@code String.valueOf}：布尔为 {@code true}/{@code false}，
     * 很大或很小的 FLOAT 为科学计数法，例如 {@code 1.0E10}。
     */
    public String render() {
        return switch (type) {
            case NULL -> "NULL";
            case INT, FLOAT, BOOL -> String.valueOf(value);
            case TEXT -> (String) value;
            case TIMESTAMP -> ((LocalDateTime) value).format(TIMESTAMP_FORMAT);
        };
    }

    /**
     * 依次尝试接受的时间格式解析文本。
     * @param text 待解析文本
     * @return 解析结果，所有格式都不匹配时返回 null
     */
    public static LocalDateTime parseTimestamp(String text) {
        for (DateTimeFormatter format : ACCEPTED_TIMESTAMP_FORMATS) {
            try {
                if (format == DATE_ONLY_FORMAT) {
                    return LocalDate.parse(text, format).atStartOfDay();
                }
                return LocalDateTime.parse(text, format);
            } catch (DateTimeParseException e) {
                // 尝试下一个格式
            }
        }
        return null;
    }

    /**
     * 全序比较：Null 最小；INT 与 FLOAT 按数值比较；TIMESTAMP 与可解析的 TEXT 按时间比较；
     * 其余不同类型按类型等级比较。
     */
    @Override
    public int compareTo(Value other) {
        if (type.isNumeric() && other.type.isNumeric()) {
            if (type == ValueType.INT && other.type == ValueType.INT) {
                return Long.compare((Long) value, (Long) other.value);
            }
            return Double.compare(asDouble(), other.asDouble());
        }
        if (type == other.type) {
            return switch (type) {
                case NULL -> 0;
                case BOOL -> Boolean.compare((Boolean) value, (Boolean) other.value);
                case TEXT -> ((String) value).compareTo((String) other.value);
                case TIMESTAMP -> ((LocalDateTime) value).compareTo((LocalDateTime) other.value);
                case INT, FLOAT -> throw new IllegalStateException("unreachable");
            };
        }
        if (type == ValueType.TIMESTAMP && other.type == ValueType.TEXT) {
            LocalDateTime parsed = parseTimestamp((String) other.value);
            if (parsed != null) {
                return ((LocalDateTime) value).compareTo(parsed);
            }
        }
        if (type == ValueType.TEXT && other.type == ValueType.TIMESTAMP) {
            return -other.compareTo(this);
        }
        return Integer.compare(type.rank(), other.type.rank());
    }

    /**
     * 两个值是否可以有意义地比较大小（同类、数值之间、时间与可解析文本之间）。
     */
    public boolean isComparableWith(Value other) {
        if (type == other.type || (type.isNumeric() && other.type.isNumeric())) {
            return true;
        }
        if (type == ValueType.TIMESTAMP && other.type == ValueType.TEXT) {
            return parseTimestamp((String) other.value) != null;
        }
        if (type == ValueType.TEXT && other.type == ValueType.TIMESTAMP) {
            return parseTimestamp((String) value) != null;
        }
        return false;
    }

    @Override
    public String toString() {
        return render();
    }

    // 数值之间按数值相等，保证 1 与 1.0 在哈希索引中落在同一个桶
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value other)) return false;
        if (type.isNumeric() && other.type.isNumeric()) {
            return compareTo(other) == 0;
        }
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (type.isNumeric()) {
            return Double.hashCode(asDouble());
        }
        return Objects.hash(type, value);
    }
}
