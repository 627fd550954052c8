package org.lupenghan.parser;

import org.junit.Test;
import org.lupenghan.docdb.criteria.models.ComparisonOperator;
import org.lupenghan.docdb.exception.PlanParseException;
import org.lupenghan.docdb.operation.models.AddColumnOperation;
import org.lupenghan.docdb.operation.models.ColumnBlueprint;
import org.lupenghan.docdb.operation.models.CreateTableOperation;
import org.lupenghan.docdb.operation.models.DropTableOperation;
import org.lupenghan.docdb.operation.models.IfExistsPolicy;
import org.lupenghan.docdb.operation.models.Operation;
import org.lupenghan.docdb.operation.models.OperationType;
import org.lupenghan.docdb.operation.models.SelectOperation;
import org.lupenghan.docdb.operation.models.SortDirection;
import org.lupenghan.docdb.operation.models.UpdateOperation;
import org.lupenghan.docdb.plan.models.Plan;

import java.util.List;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PlanParserTest {

    @Test
    public void testParseFencedPlan() throws PlanParseException {
        String raw = "Sure! Here is the plan:\n"
                + "```json\n"
                + "{\n"
                + "  \"thought\": \"create a table\",\n"
                + "  \"warnings\": [\"careful\", 42],\n"
                + "  \"expectedRevision\": 3,\n"
                + "  \"operations\": [\n"
                + "    {\"type\": \"createTable\", \"table\": \"users\", \"ifExists\": \"skip\",\n"
                + "     \"columns\": [{\"name\": \"id\", \"dataType\": \"integer\", \"isPrimaryKey\": true},\n"
                + "                 {\"name\": \"bio\"}]},\n"
                + "    {\"type\": \"drop-table\", \"table\": \"old\", \"ifExists\": true}\n"
                + "  ]\n"
                + "}\n"
                + "```\n"
                + "Let me know if you need anything else.";

        Plan plan = PlanParser.parse(raw);
        assertEquals("create a table", plan.getThought());
        assertNull(plan.getFinalResponse());
        assertEquals(List.of("careful"), plan.getWarnings());
        assertEquals(Long.valueOf(3), plan.getExpectedRevision());
        assertEquals(2, plan.getOperations().size());

        CreateTableOperation create = (CreateTableOperation) plan.getOperations().get(0);
        assertEquals("users", create.getTable());
        assertEquals(IfExistsPolicy.SKIP, create.getIfExists());
        ColumnBlueprint id = create.getColumns().get(0);
        assertTrue(id.isPrimaryKey());
        assertEquals("integer", id.getDataType());

        // 缺省的列类型为 text，默认可空
        ColumnBlueprint bio = create.getColumns().get(1);
        assertEquals("text", bio.getDataType());
        assertTrue(bio.allowsNull());
        assertFalse(bio.isPrimaryKey());

        DropTableOperation drop = (DropTableOperation) plan.getOperations().get(1);
        assertTrue(drop.isIfExists());
    }

    @Test
    public void testParseWithoutOperations() throws PlanParseException {
        Plan plan = PlanParser.parse("{\"thought\": \"nothing to do\", \"finalResponse\": \"All set.\"}");
        assertTrue(plan.getOperations().isEmpty());
        assertEquals("All set.", plan.getFinalResponse());
        assertNull(plan.getExpectedRevision());
    }

    @Test
    public void testNormalizeType() {
        assertEquals(Optional.of(OperationType.CREATE_TABLE), PlanParser.normalizeType("createTable"));
        assertEquals(Optional.of(OperationType.CREATE_TABLE), PlanParser.normalizeType("create-table"));
        assertEquals(Optional.of(OperationType.CREATE_TABLE), PlanParser.normalizeType("CREATE_TABLE"));
        assertEquals(Optional.of(OperationType.CREATE_TABLE), PlanParser.normalizeType("ddl.create_table"));
        assertEquals(Optional.of(OperationType.INSERT), PlanParser.normalizeType("DML.Insert"));
        assertEquals(Optional.of(OperationType.ALTER_TABLE_ADD_COLUMN), PlanParser.normalizeType("alterTableAddColumn"));
        assertEquals(Optional.of(OperationType.SELECT), PlanParser.normalizeType(" select "));
        assertFalse(PlanParser.normalizeType("truncate").isPresent());
        assertFalse(PlanParser.normalizeType("").isPresent());
        assertFalse(PlanParser.normalizeType(null).isPresent());
    }

    @Test
    public void testSanitize() {
        assertEquals("{\"a\":1}", PlanParser.sanitize("```\n{\"a\":1}\n```"));
        assertEquals("{\"a\":{\"b\":2}}", PlanParser.sanitize("noise {\"a\":{\"b\":2}} trailing"));
        assertEquals("", PlanParser.sanitize(null));
    }

    @Test
    public void testParseSingleOperations() throws PlanParseException {
        Operation operation = PlanParser.parseOperation("{\"type\": \"select\", \"table\": \"users\","
                + " \"columns\": [\"name\"],"
                + " \"criteria\": [{\"column\": \"age\", \"operator\": \"GTE\", \"value\": 18}],"
                + " \"orderBy\": [{\"column\": \"name\", \"direction\": \"desc\"}],"
                + " \"limit\": 5}");
        SelectOperation select = (SelectOperation) operation;
        assertEquals(List.of("name"), select.getColumns());
        assertEquals(ComparisonOperator.GTE, select.getCriteria().get(0).getOperator());
        assertEquals(18L, select.getCriteria().get(0).getValue());
        assertEquals(SortDirection.DESC, select.getOrderBy().get(0).getDirection());
        assertEquals(Integer.valueOf(5), select.getLimit());

        UpdateOperation update = (UpdateOperation) PlanParser.parseOperation(
                "{\"type\": \"update\", \"table\": \"users\", \"allRows\": true, \"changes\": {\"active\": false}}");
        assertTrue(update.isAllRows());
        assertEquals(Boolean.FALSE, update.getChanges().get("active"));

        AddColumnOperation add = (AddColumnOperation) PlanParser.parseOperation(
                "{\"type\": \"alter_table_add_column\", \"table\": \"users\", \"column\": {\"name\": \"email\", \"nullable\": \"no\"}}");
        assertEquals("text", add.getColumn().getDataType());
        assertTrue(add.getColumn().allowsNull());
    }

    @Test
    public void testRejectsInvalidPlans() {
        assertParseFails("", "Plan is empty.");
        assertParseFails("{\"operations\": [", "Plan is not valid JSON");
        assertParseFails("[1, 2]", "Plan must be a JSON object.");
        assertParseFails("{\"operations\": {}}", "operations must be an array.");
        assertParseFails("{\"expectedRevision\": \"latest\"}", "expectedRevision must be an integer.");
        assertParseFails("{\"operations\": [{\"type\": \"truncate\", \"table\": \"users\"}]}",
                "Operation 1: Unsupported operation type: truncate");
        assertParseFails("{\"operations\": [{\"type\": \"select\", \"table\": \"t\"}, 7]}",
                "Operation 2: Operation must be a JSON object.");
        assertParseFails("{\"operations\": [{\"type\": \"select\", \"table\": \"t\","
                        + " \"criteria\": [{\"column\": \"a\", \"operator\": \"like\", \"value\": 1}]}]}",
                "Operation 1: Invalid dql.select operation");
    }

    private static void assertParseFails(String raw, String expectedPrefix) {
        try {
            PlanParser.parse(raw);
            fail("应该解析失败: " + raw);
        } catch (PlanParseException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith(expectedPrefix));
        }
    }
}
