package org.lupenghan.docdb.plan.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.docdb.exception.StaleRevisionException;
import org.lupenghan.docdb.executor.interfaces.OperationExecutor;
import org.lupenghan.docdb.executor.models.ExecutionResult;
import org.lupenghan.docdb.operation.models.Operation;
import org.lupenghan.docdb.plan.interfaces.PlanRunner;
import org.lupenghan.docdb.plan.models.PersistenceMode;
import org.lupenghan.docdb.plan.models.Plan;
import org.lupenghan.docdb.plan.models.PlanResponse;
import org.lupenghan.docdb.schema.models.Document;
import org.lupenghan.docdb.store.interfaces.DocumentStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.Lock;

/**
 * 计划执行器：整个计划期间持有存储的写锁，逐个执行操作，失败的操作不影响后续操作
 */
@Slf4j
public class PlanRunnerImpl implements PlanRunner {
    static final String NO_CHANGES_RESPONSE = "No changes were required for your request.";

    private final DocumentStore store;
    private final OperationExecutor executor;
    private final PersistenceMode persistenceMode;

    public PlanRunnerImpl(DocumentStore store, OperationExecutor executor, PersistenceMode persistenceMode) {
        this.store = store;
        this.executor = executor;
        this.persistenceMode = persistenceMode;
    }

    @Override
    public PlanResponse run(Plan plan) throws StaleRevisionException, IOException {
        if (plan == null) {
            throw new IllegalArgumentException("Plan must not be null");
        }
        Lock lock = store.writeLock();
        lock.lock();
        try {
            Document document = store.getDocument();
            if (plan.getExpectedRevision() != null && plan.getExpectedRevision() != document.revision()) {
                log.warn("计划被拒绝：期望 revision={}，当前 revision={}", plan.getExpectedRevision(), document.revision());
                throw new StaleRevisionException(plan.getExpectedRevision(), document.revision());
            }

            log.info("开始执行计划，共 {} 个操作 (role={})", plan.getOperations().size(), plan.getRole());
            List<ExecutionResult> results = new ArrayList<>();
            Set<String> warnings = new LinkedHashSet<>();
            for (String warning : plan.getWarnings()) {
                if (warning != null && !warning.isBlank()) {
                    warnings.add(warning.trim());
                }
            }

            for (Operation operation : plan.getOperations()) {
                ExecutionResult result = executor.execute(document, operation, plan.getRole());
                results.add(result);
                if (result.isError()) {
                    warnings.add(result.getDetail());
                } else if (persistenceMode == PersistenceMode.PER_OPERATION) {
                    store.persistIfDirty();
                }
            }
            if (store.persistIfDirty()) {
                log.debug("计划执行完毕，已写盘 (revision={})", document.revision());
            }

            long failed = results.stream().filter(ExecutionResult::isError).count();
            log.info("计划执行完毕：成功/跳过 {} 个，失败 {} 个", results.size() - failed, failed);
            return PlanResponse.builder()
                    .content(buildContent(plan, results))
                    .thought(plan.getThought())
                    .results(List.copyOf(results))
                    .warnings(List.copyOf(warnings))
                    .summary(store.getSummary())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    static String buildContent(Plan plan, List<ExecutionResult> results) {
        if (plan.getFinalResponse() != null && !plan.getFinalResponse().isBlank()) {
            return plan.getFinalResponse().trim();
        }
        if (results.isEmpty()) {
            return NO_CHANGES_RESPONSE;
        }
        StringBuilder sb = new StringBuilder("Here is what I executed:");
        for (int i = 0; i < results.size(); i++) {
            sb.append('\n').append(i + 1).append(". ").append(results.get(i).getDetail());
        }
        return sb.toString();
    }
}
