package org.lupenghan.docdb.history.Impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.docdb.executor.models.ExecutionResult;
import org.lupenghan.docdb.history.OperationQueryRenderer;
import org.lupenghan.docdb.history.interfaces.QueryHistory;
import org.lupenghan.docdb.history.models.QueryHistoryEntry;
import org.lupenghan.docdb.history.models.QueryHistoryFilter;
import org.lupenghan.docdb.history.models.QueryHistoryStats;
import org.lupenghan.docdb.operation.models.Operation;
import org.lupenghan.docdb.utils.Json;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * 查询历史：最新的记录在最前面，超过上限时丢弃最旧的记录。
 * 配置了文件路径时每次记录后都会写回磁盘
 */
@Slf4j
public class QueryHistoryImpl implements QueryHistory {
    private final Path path;
    private final int limit;
    private final Clock clock;
    private final ObjectMapper mapper = Json.mapper();
    private final LinkedList<QueryHistoryEntry> entries = new LinkedList<>();

    /**
     * @param path 历史文件路径，为 null 时只保存在内存中
     * @param limit 最多保留的记录数
     * @param clock 时钟
     */
    public QueryHistoryImpl(Path path, int limit, Clock clock) throws IOException {
        if (limit <= 0) {
            throw new IllegalArgumentException("History limit must be positive: " + limit);
        }
        this.path = path;
        this.limit = limit;
        this.clock = clock;
        load();
    }

    public QueryHistoryImpl(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("History limit must be positive: " + limit);
        }
        this.path = null;
        this.limit = limit;
        this.clock = Clock.systemUTC();
    }

    private void load() throws IOException {
        if (path == null || !Files.exists(path)) {
            return;
        }
        List<QueryHistoryEntry> loaded = mapper.readValue(path.toFile(), new TypeReference<List<QueryHistoryEntry>>() {
        });
        entries.addAll(loaded);
        trim();
        log.info("加载查询历史 {} 条: {}", entries.size(), path);
    }

    @Override
    public synchronized QueryHistoryEntry record(Operation operation, ExecutionResult result, long executionTimeMs) {
        Integer affected = result.getAffectedRows();
        if (affected == null && result.getResultSet() != null) {
            affected = result.getResultSet().getRowCount();
        }
        QueryHistoryEntry entry = QueryHistoryEntry.builder()
                .id(UUID.randomUUID().toString())
                .query(OperationQueryRenderer.render(operation))
                .category(operation.getType().getCategory())
                .status(result.getStatus())
                .executionTimeMs(executionTimeMs)
                .affectedRows(affected)
                .errorMessage(result.isError() ? result.getDetail() : null)
                .tables(operation.getTable() == null ? List.of() : List.of(operation.getTable()))
                .executedAt(clock.instant())
                .build();
        entries.addFirst(entry);
        trim();
        save();
        return entry;
    }

    @Override
    public synchronized List<QueryHistoryEntry> list(QueryHistoryFilter filter) {
        QueryHistoryFilter f = filter == null ? QueryHistoryFilter.all() : filter;
        String term = f.getSearchTerm() == null || f.getSearchTerm().isBlank()
                ? null : f.getSearchTerm().trim().toLowerCase(Locale.ROOT);
        List<QueryHistoryEntry> result = new ArrayList<>();
        for (QueryHistoryEntry entry : entries) {
            if (f.getCategory() != null && f.getCategory() != entry.getCategory()) continue;
            if (f.getStatus() != null && f.getStatus() != entry.getStatus()) continue;
            if (f.getSince() != null && entry.getExecutedAt().isBefore(f.getSince())) continue;
            if (f.getUntil() != null && entry.getExecutedAt().isAfter(f.getUntil())) continue;
            if (term != null && !matchesTerm(entry, term)) continue;
            result.add(entry);
        }
        return result;
    }

    private static boolean matchesTerm(QueryHistoryEntry entry, String term) {
        if (entry.getQuery() != null && entry.getQuery().toLowerCase(Locale.ROOT).contains(term)) {
            return true;
        }
        if (entry.getTables() != null) {
            for (String table : entry.getTables()) {
                if (table.toLowerCase(Locale.ROOT).contains(term)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public synchronized QueryHistoryStats stats() {
        int succeeded = 0;
        int skipped = 0;
        int failed = 0;
        long totalTime = 0;
        for (QueryHistoryEntry entry : entries) {
            switch (entry.getStatus()) {
                case SUCCESS -> succeeded++;
                case SKIPPED -> skipped++;
                case ERROR -> failed++;
            }
            totalTime += entry.getExecutionTimeMs();
        }
        return QueryHistoryStats.builder()
                .total(entries.size())
                .succeeded(succeeded)
                .skipped(skipped)
                .failed(failed)
                .averageExecutionTimeMs(entries.isEmpty() ? 0 : (double) totalTime / entries.size())
                .build();
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        save();
    }

    private void trim() {
        while (entries.size() > limit) {
            entries.removeLast();
        }
    }

    private void save() {
        if (path == null) {
            return;
        }
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), entries);
        } catch (IOException e) {
            log.error("查询历史写入失败: {}", path, e);
            throw new UncheckedIOException(e);
        }
    }
}
