package org.lupenghan.docdb.criteria;

import org.lupenghan.docdb.criteria.models.ComparisonOperator;
import org.lupenghan.docdb.criteria.models.CriteriaCondition;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

/**
 * 行过滤条件求值器
 * 多个条件之间是 AND 关系；空条件列表匹配所有行。求值不抛异常，无法比较时视为不匹配
 */
public final class CriteriaEvaluator {

    private CriteriaEvaluator() {
    }

    /**
     * 构造行谓词
     * @param criteria 条件列表，可以为 null
     * @return 行谓词
     */
    public static Predicate<Map<String, Object>> predicate(List<CriteriaCondition> criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return row -> true;
        }
        List<CriteriaCondition> conditions = List.copyOf(criteria);
        return row -> matches(row, conditions);
    }

    public static boolean matches(Map<String, Object> row, List<CriteriaCondition> criteria) {
        if (criteria == null) {
            return true;
        }
        for (CriteriaCondition condition : criteria) {
            if (!evaluate(row, condition)) {
                return false;
            }
        }
        return true;
    }

    public static boolean evaluate(Map<String, Object> row, CriteriaCondition condition) {
        Object candidate = row.get(condition.getColumn());
        Object value = condition.getValue();
        ComparisonOperator operator = condition.getOperator() == null ? ComparisonOperator.EQ : condition.getOperator();

        switch (operator) {
            case EQ:
                return looseEquals(candidate, value);
            case NEQ:
                return !looseEquals(candidate, value);
            case GT:
                return compareNumbers(candidate, value, c -> c > 0);
            case GTE:
                return compareNumbers(candidate, value, c -> c >= 0);
            case LT:
                return compareNumbers(candidate, value, c -> c < 0);
            case LTE:
                return compareNumbers(candidate, value, c -> c <= 0);
            case CONTAINS:
                return contains(candidate, value);
            case IN:
                return in(candidate, value);
            default:
                return false;
        }
    }

    /**
     * 宽松相等：数字与数字字符串按数值比较（1 与 "1" 相等），布尔值按 1/0 参与数值比较，
     * null 只与 null 相等，其余按值相等
     */
    public static boolean looseEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == null && right == null;
        }
        if (left instanceof String && right instanceof String) {
            return left.equals(right);
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return left.equals(right);
        }
        if (isNumericLike(left) || isNumericLike(right)) {
            if (!isScalar(left) || !isScalar(right)) {
                return false;
            }
            BigDecimal l = toNumber(left);
            BigDecimal r = toNumber(right);
            return l != null && r != null && l.compareTo(r) == 0;
        }
        return Objects.equals(left, right);
    }

    /**
     * 转成数值，失败返回 null
     */
    public static BigDecimal toNumber(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        if (value instanceof String) {
            String trimmed = ((String) value).trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean compareNumbers(Object candidate, Object value, IntPredicate test) {
        BigDecimal left = toNumber(candidate);
        BigDecimal right = toNumber(value);
        if (left == null || right == null) {
            return false;
        }
        return test.test(left.compareTo(right));
    }

    private static boolean contains(Object candidate, Object value) {
        if (candidate == null || value == null) {
            return false;
        }
        String haystack = String.valueOf(candidate).toLowerCase(Locale.ROOT);
        String needle = String.valueOf(value).toLowerCase(Locale.ROOT);
        return haystack.contains(needle);
    }

    private static boolean in(Object candidate, Object value) {
        if (value instanceof Collection) {
            for (Object entry : (Collection<?>) value) {
                if (looseEquals(candidate, entry)) {
                    return true;
                }
            }
            return false;
        }
        if (value instanceof Object[]) {
            for (Object entry : (Object[]) value) {
                if (looseEquals(candidate, entry)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isNumericLike(Object value) {
        return value instanceof Number || value instanceof Boolean;
    }

    private static boolean isScalar(Object value) {
        return value instanceof Number || value instanceof Boolean || value instanceof String;
    }
}
