package org.lupenghan.docdb.plan.interfaces;

import org.lupenghan.docdb.exception.StaleRevisionException;
import org.lupenghan.docdb.plan.models.Plan;
import org.lupenghan.docdb.plan.models.PlanResponse;

import java.io.IOException;

public interface PlanRunner {
    /**
     * 按顺序执行计划中的全部操作，单个操作失败不会中断计划
     * @param plan 计划
     * @return 执行结果汇总
     * @throws StaleRevisionException 计划声明的 revision 与当前文档不一致
     * @throws IOException 写盘失败
     */
    PlanResponse run(Plan plan) throws StaleRevisionException, IOException;
}
