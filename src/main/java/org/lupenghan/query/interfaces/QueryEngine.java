package org.lupenghan.query.interfaces;

import org.lupenghan.docdb.exception.StaleRevisionException;
import org.lupenghan.docdb.executor.models.ExecutionResult;
import org.lupenghan.docdb.history.interfaces.QueryHistory;
import org.lupenghan.docdb.operation.models.Operation;
import org.lupenghan.docdb.plan.models.Plan;
import org.lupenghan.docdb.plan.models.PlanResponse;
import org.lupenghan.docdb.store.models.DocumentSummary;

import java.io.Closeable;
import java.io.IOException;

/**
 * 对外的入口：执行单个操作或整个计划，并提供文档概要与查询历史
 */
public interface QueryEngine extends Closeable {

    ExecutionResult execute(Operation operation) throws IOException;

    /**
     * 以指定角色执行单个操作，写操作成功后立即写盘
     * @param operation 操作
     * @param role 执行角色，为 null 时不做权限检查
     */
    ExecutionResult execute(Operation operation, String role) throws IOException;

    PlanResponse executePlan(Plan plan) throws StaleRevisionException, IOException;

    DocumentSummary getSummary();

    /**
     * 给规划器使用的纯文本摘要
     */
    String getDigest();

    QueryHistory getHistory();
}
