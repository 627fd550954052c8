package org.lupenghan.docdb.criteria;

import org.junit.Test;
import org.lupenghan.docdb.criteria.models.ComparisonOperator;
import org.lupenghan.docdb.criteria.models.CriteriaCondition;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CriteriaEvaluatorTest {

    private static Map<String, Object> row(Object... pairs) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            row.put((String) pairs[i], pairs[i + 1]);
        }
        return row;
    }

    @Test
    public void testLooseEquality() {
        assertTrue(CriteriaEvaluator.looseEquals(1L, "1"));
        assertTrue(CriteriaEvaluator.looseEquals("2.50", 2.5));
        assertTrue(CriteriaEvaluator.looseEquals(true, 1));
        assertTrue(CriteriaEvaluator.looseEquals(0L, false));
        assertTrue(CriteriaEvaluator.looseEquals(null, null));
        assertTrue(CriteriaEvaluator.looseEquals("abc", "abc"));

        assertFalse(CriteriaEvaluator.looseEquals(null, 0));
        assertFalse(CriteriaEvaluator.looseEquals("", null));
        assertFalse(CriteriaEvaluator.looseEquals("1", "1.0"));     // 两个字符串按原文比较
        assertFalse(CriteriaEvaluator.looseEquals(1, "abc"));
        assertFalse(CriteriaEvaluator.looseEquals(true, "true"));
    }

    @Test
    public void testEqAndNeq() {
        Map<String, Object> r = row("age", 30L, "name", "Ada");
        assertTrue(CriteriaEvaluator.evaluate(r, CriteriaCondition.eq("age", "30")));
        assertFalse(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("age", ComparisonOperator.NEQ, 30)));
        assertTrue(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("name", ComparisonOperator.NEQ, "ada")));
        // 缺失的列等于 null
        assertTrue(CriteriaEvaluator.evaluate(r, CriteriaCondition.eq("email", null)));
        assertTrue(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("email", ComparisonOperator.NEQ, "x")));
    }

    @Test
    public void testNullOperatorDefaultsToEq() {
        CriteriaCondition condition = CriteriaCondition.builder().column("age").operator(null).value(5).build();
        assertTrue(CriteriaEvaluator.evaluate(row("age", 5L), condition));
    }

    @Test
    public void testNumericComparisons() {
        Map<String, Object> r = row("age", 18L, "score", "7.5", "name", "bob");
        assertTrue(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("age", ComparisonOperator.GTE, 18)));
        assertFalse(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("age", ComparisonOperator.GT, 18)));
        assertTrue(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("age", ComparisonOperator.LT, "19")));
        assertTrue(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("score", ComparisonOperator.LTE, 7.5)));
        // 无法转成数字时不匹配，也不抛异常
        assertFalse(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("name", ComparisonOperator.GT, 1)));
        assertFalse(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("missing", ComparisonOperator.LT, 1)));
        assertFalse(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("age", ComparisonOperator.GT, null)));
    }

    @Test
    public void testContainsIsCaseInsensitive() {
        Map<String, Object> r = row("name", "Grace Hopper", "id", 12345L);
        assertTrue(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("name", ComparisonOperator.CONTAINS, "HOP")));
        assertTrue(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("id", ComparisonOperator.CONTAINS, "234")));
        assertFalse(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("name", ComparisonOperator.CONTAINS, "ada")));
        assertFalse(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("missing", ComparisonOperator.CONTAINS, "a")));
    }

    @Test
    public void testIn() {
        Map<String, Object> r = row("status", "active", "level", 2L);
        assertTrue(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("status", ComparisonOperator.IN,
                Arrays.asList("active", "pending"))));
        assertTrue(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("level", ComparisonOperator.IN,
                Arrays.asList("1", "2"))));
        assertFalse(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("status", ComparisonOperator.IN,
                List.of("closed"))));
        // 非列表的值永远不匹配
        assertFalse(CriteriaEvaluator.evaluate(r, CriteriaCondition.of("status", ComparisonOperator.IN, "active")));
    }

    @Test
    public void testConjunctionAndEmptyCriteria() {
        Map<String, Object> r = row("age", 20L, "city", "Paris");
        assertTrue(CriteriaEvaluator.matches(r, List.of()));
        assertTrue(CriteriaEvaluator.predicate(null).test(r));
        assertTrue(CriteriaEvaluator.matches(r, List.of(
                CriteriaCondition.of("age", ComparisonOperator.GTE, 18),
                CriteriaCondition.eq("city", "Paris"))));
        assertFalse(CriteriaEvaluator.matches(r, List.of(
                CriteriaCondition.of("age", ComparisonOperator.GTE, 18),
                CriteriaCondition.eq("city", "Rome"))));
    }
}
