package org.lupenghan.docdb.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.lupenghan.docdb.exception.SchemaException;
import org.lupenghan.docdb.exception.ValidationException;
import org.lupenghan.docdb.operation.models.ColumnBlueprint;
import org.lupenghan.docdb.schema.models.ColumnDefinition;
import org.lupenghan.docdb.schema.models.DataType;
import org.lupenghan.docdb.utils.Json;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 列定义校验、列顺序计算以及按列类型转换值
 */
public final class ColumnRules {

    private ColumnRules() {
    }

    /**
     * 校验单个列蓝图并生成列定义
     * @param blueprint 列蓝图
     * @param existingNames 目标表中已有的列名
     * @return 列定义（默认值已按类型转换）
     * @throws SchemaException 列名为空、重名、类型缺失或无法识别、默认值与类型不符
     */
    public static ColumnDefinition validateColumnBlueprint(ColumnBlueprint blueprint, Collection<String> existingNames)
            throws SchemaException {
        if (blueprint == null) {
            throw new SchemaException("Column definition cannot be empty.");
        }
        String name = blueprint.getName() == null ? "" : blueprint.getName().trim();
        if (name.isEmpty()) {
            throw new SchemaException("Column name cannot be empty.");
        }
        if (existingNames.contains(name)) {
            throw new SchemaException("Duplicate column name \"" + name + "\".");
        }
        String dataType = blueprint.getDataType() == null ? "" : blueprint.getDataType().trim();
        if (dataType.isEmpty()) {
            throw new SchemaException("Column \"" + name + "\" must declare a data type.");
        }
        if (DataType.fromTag(dataType).isEmpty()) {
            throw new SchemaException("Column \"" + name + "\" uses unsupported data type \"" + dataType + "\".");
        }

        ColumnDefinition column = ColumnDefinition.builder()
                .name(name)
                .dataType(dataType)
                .nullable(blueprint.allowsNull() && !blueprint.isPrimaryKey())   // 主键总是非空
                .primaryKey(blueprint.isPrimaryKey())
                .build();

        if (blueprint.getDefaultValue() != null) {
            try {
                column.setDefaultValue(coerceValue(column, blueprint.getDefaultValue()));
            } catch (ValidationException e) {
                throw new SchemaException("Invalid default value: " + e.getMessage());
            }
        }
        return column;
    }

    /**
     * 校验 create_table 的整组列蓝图，最多允许一个主键
     * @param blueprints 列蓝图（按声明顺序）
     * @return 列定义，顺序与输入一致
     */
    public static List<ColumnDefinition> buildColumns(List<ColumnBlueprint> blueprints) throws SchemaException {
        if (blueprints == null || blueprints.isEmpty()) {
            throw new SchemaException("Cannot create a table without columns.");
        }
        List<ColumnDefinition> columns = new ArrayList<>();
        Set<String> names = new HashSet<>();
        String primaryKey = null;
        for (ColumnBlueprint blueprint : blueprints) {
            ColumnDefinition column = validateColumnBlueprint(blueprint, names);
            if (column.isPrimaryKey()) {
                if (primaryKey != null) {
                    throw new SchemaException("Multiple primary keys are not supported (\""
                            + primaryKey + "\" and \"" + column.getName() + "\").");
                }
                primaryKey = column.getName();
            }
            names.add(column.getName());
            columns.add(column);
        }
        return columns;
    }

    /**
     * 计算新增列之后的列顺序
     * @param order 当前顺序
     * @param columnName 新列名
     * @param position 插入位置，为空时追加；超出末尾时也追加
     * @return 新的列顺序（不修改入参）
     */
    public static List<String> nextColumnOrder(List<String> order, String columnName, Integer position)
            throws SchemaException {
        List<String> next = new ArrayList<>(order);
        if (position == null) {
            next.add(columnName);
            return next;
        }
        if (position < 0) {
            throw new SchemaException("Column position must be non-negative, got " + position + ".");
        }
        next.add(Math.min(position, next.size()), columnName);
        return next;
    }

    public static Optional<DataType> typeOf(ColumnDefinition column) {
        return DataType.fromTag(column.getDataType());
    }

    /**
     * 按列类型转换值
     * @param column 列定义
     * @param value 输入值
     * @return 转换后的值；null 只允许出现在可空列
     * @throws ValidationException 值与列类型或可空约束不符
     */
    public static Object coerceValue(ColumnDefinition column, Object value) throws ValidationException {
        if (value == null) {
            if (!column.isNullable()) {
                throw new ValidationException("Column \"" + column.getName() + "\" does not allow null values.");
            }
            return null;
        }

        Optional<DataType> type = typeOf(column);
        if (type.isEmpty()) {
            // 旧文档里可能存在无法识别的类型标签，原样保存
            return value;
        }
        switch (type.get()) {
            case TEXT:
                return String.valueOf(value);
            case INTEGER:
                return coerceInteger(column, value);
            case NUMBER:
                return coerceNumber(column, value);
            case BOOLEAN:
                return coerceBoolean(column, value);
            case DATE:
            case DATETIME:
                return coerceTemporal(column, value);
            case JSON:
                return coerceJson(column, value);
            default:
                return value;
        }
    }

    private static BigDecimal parseDecimal(ColumnDefinition column, Object value) throws ValidationException {
        if (value instanceof Number) {
            if (value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new ValidationException("Value for column \"" + column.getName() + "\" must be numeric.");
                }
                return BigDecimal.valueOf(d);
            }
            return new BigDecimal(value.toString());
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return new BigDecimal(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Value for column \"" + column.getName() + "\" must be numeric.");
            }
        }
        throw new ValidationException("Value for column \"" + column.getName() + "\" must be numeric.");
    }

    private static Long coerceInteger(ColumnDefinition column, Object value) throws ValidationException {
        BigDecimal decimal = stripTrailingZeros(column, parseDecimal(column, value));
        if (decimal.scale() > 0) {
            throw new ValidationException("Value for column \"" + column.getName() + "\" must be an integer.");
        }
        Long exact = exactLong(decimal);
        if (exact == null) {
            throw new ValidationException("Value for column \"" + column.getName() + "\" is out of range.");
        }
        return exact;
    }

    private static Number coerceNumber(ColumnDefinition column, Object value) throws ValidationException {
        BigDecimal decimal = parseDecimal(column, value);
        BigDecimal stripped = stripTrailingZeros(column, decimal);
        if (stripped.scale() <= 0) {
            Long exact = exactLong(stripped);
            if (exact != null) {
                return exact;
            }
        }
        double d = decimal.doubleValue();
        if (Double.isInfinite(d)) {
            throw new ValidationException("Value for column \"" + column.getName() + "\" is out of range.");
        }
        return d;
    }

    private static BigDecimal stripTrailingZeros(ColumnDefinition column, BigDecimal decimal) throws ValidationException {
        try {
            return decimal.stripTrailingZeros();
        } catch (ArithmeticException e) {
            // 指数超出 int 范围
            throw new ValidationException("Value for column \"" + column.getName() + "\" is out of range.");
        }
    }

    /**
     * 整数部分超过 19 位时不展开，直接视为超出 long 范围
     */
    private static Long exactLong(BigDecimal integral) {
        if ((long) integral.precision() - integral.scale() > 19) {
            return null;
        }
        try {
            return integral.longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static Boolean coerceBoolean(ColumnDefinition column, Object value) throws ValidationException {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String normalized = ((String) value).trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) {
                return Boolean.TRUE;
            }
            if ("false".equals(normalized)) {
                return Boolean.FALSE;
            }
        }
        throw new ValidationException("Value for column \"" + column.getName() + "\" must be boolean.");
    }

    private static String coerceTemporal(ColumnDefinition column, Object value) throws ValidationException {
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue()).toString();
        }
        String text = String.valueOf(value).trim();
        Instant instant = parseInstant(text);
        if (instant == null) {
            throw new ValidationException("Value for column \"" + column.getName() + "\" must be a valid date.");
        }
        return instant.toString();
    }

    private static Instant parseInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            // 不是 UTC 瞬时格式，继续尝试带偏移的格式
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            // 继续尝试本地日期时间，按 UTC 解释
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            // 继续尝试纯日期
        }
        try {
            return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Object coerceJson(ColumnDefinition column, Object value) throws ValidationException {
        if (!(value instanceof String)) {
            try {
                return Json.deepCopy(value);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid JSON for column \"" + column.getName() + "\": " + e.getMessage());
            }
        }
        try {
            return Json.mapper().readValue((String) value, Object.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid JSON for column \"" + column.getName() + "\": "
                    + e.getOriginalMessage());
        }
    }
}
