package org.lupenghan.docdb.history.Impl;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lupenghan.docdb.exception.NotFoundException;
import org.lupenghan.docdb.executor.models.ExecutionResult;
import org.lupenghan.docdb.executor.models.ExecutionStatus;
import org.lupenghan.docdb.history.models.QueryHistoryEntry;
import org.lupenghan.docdb.history.models.QueryHistoryFilter;
import org.lupenghan.docdb.history.models.QueryHistoryStats;
import org.lupenghan.docdb.operation.models.DropTableOperation;
import org.lupenghan.docdb.operation.models.InsertOperation;
import org.lupenghan.docdb.operation.models.OperationCategory;
import org.lupenghan.docdb.operation.models.OperationType;
import org.lupenghan.docdb.operation.models.SelectOperation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class QueryHistoryImplTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static SelectOperation select(String table) {
        return SelectOperation.builder().table(table).build();
    }

    private static ExecutionResult ok(OperationType type) {
        return ExecutionResult.success(type, "ok");
    }

    @Test
    public void testNewestFirstAndBounded() {
        QueryHistoryImpl history = new QueryHistoryImpl(3);
        for (String table : List.of("a", "b", "c", "d")) {
            history.record(select(table), ok(OperationType.SELECT), 1);
        }
        assertEquals(3, history.size());

        List<QueryHistoryEntry> entries = history.list(null);
        assertEquals(List.of("d"), entries.get(0).getTables());
        assertEquals(List.of("b"), entries.get(2).getTables());
    }

    @Test
    public void testRecordsOutcome() {
        QueryHistoryImpl history = new QueryHistoryImpl(10);
        QueryHistoryEntry entry = history.record(DropTableOperation.builder().table("ghost").build(),
                ExecutionResult.error(OperationType.DROP_TABLE, new NotFoundException("Table \"ghost\" does not exist.")),
                4);
        assertEquals("DROP TABLE ghost", entry.getQuery());
        assertEquals(OperationCategory.DDL, entry.getCategory());
        assertEquals(ExecutionStatus.ERROR, entry.getStatus());
        assertEquals("Table \"ghost\" does not exist.", entry.getErrorMessage());
        assertNull(entry.getAffectedRows());
        assertEquals(4, entry.getExecutionTimeMs());

        QueryHistoryEntry inserted = history.record(InsertOperation.builder().table("users")
                        .rows(List.of(Map.of("id", 1), Map.of("id", 2))).build(),
                ExecutionResult.builder().type(OperationType.INSERT).status(ExecutionStatus.SUCCESS)
                        .detail("Inserted 2 row(s) into \"users\".").affectedRows(2).build(), 1);
        assertEquals(Integer.valueOf(2), inserted.getAffectedRows());
        assertNull(inserted.getErrorMessage());
    }

    @Test
    public void testFilterAndStats() {
        QueryHistoryImpl history = new QueryHistoryImpl(10);
        history.record(select("Users"), ok(OperationType.SELECT), 2);
        history.record(select("orders"), ok(OperationType.SELECT), 4);
        history.record(DropTableOperation.builder().table("ghost").ifExists(true).build(),
                ExecutionResult.skipped(OperationType.DROP_TABLE, "skipped"), 0);
        history.record(DropTableOperation.builder().table("ghost").build(),
                ExecutionResult.error(OperationType.DROP_TABLE, new NotFoundException("missing")), 6);

        assertEquals(1, history.list(QueryHistoryFilter.builder().searchTerm("USERS").build()).size());
        assertEquals(1, history.list(QueryHistoryFilter.builder().searchTerm("if exists").build()).size());
        assertEquals(2, history.list(QueryHistoryFilter.builder().category(OperationCategory.DDL).build()).size());
        assertEquals(1, history.list(QueryHistoryFilter.builder().status(ExecutionStatus.ERROR).build()).size());
        assertTrue(history.list(QueryHistoryFilter.builder().since(CLOCK.instant().plusSeconds(3600 * 24 * 365 * 100L))
                .build()).isEmpty());

        QueryHistoryStats stats = history.stats();
        assertEquals(4, stats.getTotal());
        assertEquals(2, stats.getSucceeded());
        assertEquals(1, stats.getSkipped());
        assertEquals(1, stats.getFailed());
        assertEquals(3.0, stats.getAverageExecutionTimeMs(), 0.0001);

        history.clear();
        assertEquals(0, history.size());
        assertEquals(0.0, history.stats().getAverageExecutionTimeMs(), 0.0001);
    }

    @Test
    public void testPersistsAndReloads() throws IOException {
        Path path = folder.getRoot().toPath().resolve("history").resolve("query-history.json");
        QueryHistoryImpl history = new QueryHistoryImpl(path, 2, CLOCK);
        history.record(select("a"), ok(OperationType.SELECT), 1);
        history.record(select("b"), ok(OperationType.SELECT), 1);
        assertTrue(Files.exists(path));

        QueryHistoryImpl reloaded = new QueryHistoryImpl(path, 1, CLOCK);
        assertEquals(1, reloaded.size());
        QueryHistoryEntry entry = reloaded.list(QueryHistoryFilter.all()).get(0);
        assertEquals("SELECT * FROM b", entry.getQuery());
        assertEquals(CLOCK.instant(), entry.getExecutedAt());
        assertEquals(ExecutionStatus.SUCCESS, entry.getStatus());
        assertEquals(OperationCategory.DQL, entry.getCategory());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveLimit() {
        new QueryHistoryImpl(0);
    }

    @Test
    public void testMissingFileStartsEmpty() throws IOException {
        QueryHistoryImpl history = new QueryHistoryImpl(folder.getRoot().toPath().resolve("none.json"), 5, CLOCK);
        assertEquals(0, history.size());
        assertFalse(Files.exists(folder.getRoot().toPath().resolve("none.json")));
    }
}
