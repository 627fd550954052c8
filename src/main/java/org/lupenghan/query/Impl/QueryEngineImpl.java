package org.lupenghan.query.Impl;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.docdb.config.DocDbConfig;
import org.lupenghan.docdb.exception.StaleRevisionException;
import org.lupenghan.docdb.executor.Impl.OperationExecutorImpl;
import org.lupenghan.docdb.executor.interfaces.OperationExecutor;
import org.lupenghan.docdb.executor.models.ExecutionResult;
import org.lupenghan.docdb.history.Impl.QueryHistoryImpl;
import org.lupenghan.docdb.history.interfaces.QueryHistory;
import org.lupenghan.docdb.operation.models.Operation;
import org.lupenghan.docdb.plan.Impl.PlanRunnerImpl;
import org.lupenghan.docdb.plan.interfaces.PlanRunner;
import org.lupenghan.docdb.plan.models.Plan;
import org.lupenghan.docdb.plan.models.PlanResponse;
import org.lupenghan.docdb.store.Impl.JsonDocumentStore;
import org.lupenghan.docdb.store.interfaces.DocumentStore;
import org.lupenghan.docdb.store.models.DocumentSummary;
import org.lupenghan.query.interfaces.QueryEngine;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.locks.Lock;

@Slf4j
public class QueryEngineImpl implements QueryEngine {
    @Getter
    private final DocumentStore store;
    private final OperationExecutor executor;
    private final PlanRunner planRunner;
    private final QueryHistory history;
    private final int digestSampleRows;

    public QueryEngineImpl(DocumentStore store, OperationExecutor executor, PlanRunner planRunner,
                           QueryHistory history, int digestSampleRows) {
        this.store = store;
        this.executor = executor;
        this.planRunner = planRunner;
        this.history = history;
        this.digestSampleRows = digestSampleRows;
    }

    /**
     * 按配置组装并加载引擎
     */
    public static QueryEngineImpl open(DocDbConfig config, Clock clock) throws IOException {
        QueryHistory history = new QueryHistoryImpl(config.getHistoryPath(), config.getHistoryLimit(), clock);
        DocumentStore store = new JsonDocumentStore(config.getDatabasePath(), clock, config.getSuperuserRole(),
                config.isLockFileEnabled());
        store.load();
        OperationExecutor executor = new OperationExecutorImpl(clock, config.getSuperuserRole(), history);
        PlanRunner planRunner = new PlanRunnerImpl(store, executor, config.getPersistenceMode());
        log.info("✅ DocDB 已启动: {} (持久化模式 {})", config.getDatabasePath(), config.getPersistenceMode());
        return new QueryEngineImpl(store, executor, planRunner, history, config.getDigestSampleRows());
    }

    public static QueryEngineImpl open(DocDbConfig config) throws IOException {
        return open(config, Clock.systemUTC());
    }

    @Override
    public ExecutionResult execute(Operation operation) throws IOException {
        return execute(operation, null);
    }

    @Override
    public ExecutionResult execute(Operation operation, String role) throws IOException {
        if (operation == null) {
            throw new IllegalArgumentException("Operation must not be null");
        }
        boolean mutating = operation.getType().isMutating();
        Lock lock = mutating ? store.writeLock() : store.readLock();
        lock.lock();
        try {
            ExecutionResult result = executor.execute(store.getDocument(), operation, role);
            if (mutating) {
                store.persistIfDirty();
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PlanResponse executePlan(Plan plan) throws StaleRevisionException, IOException {
        return planRunner.run(plan);
    }

    @Override
    public DocumentSummary getSummary() {
        return store.getSummary();
    }

    @Override
    public String getDigest() {
        return store.getDigest(digestSampleRows);
    }

    @Override
    public QueryHistory getHistory() {
        return history;
    }

    @Override
    public void close() throws IOException {
        log.info("关闭 DocDB: {}", store.getPath());
        store.close();
    }
}
