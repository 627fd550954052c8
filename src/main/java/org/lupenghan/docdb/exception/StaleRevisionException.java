package org.lupenghan.docdb.exception;

/**
 * 乐观并发检查失败：计划基于的修订号已经过期
 */
public class StaleRevisionException extends Exception {
    private final long expectedRevision;
    private final long actualRevision;

    /**
     * @param expectedRevision 调用方期望的修订号
     * @param actualRevision 文档当前的修订号
     */
    public StaleRevisionException(long expectedRevision, long actualRevision) {
        super("Document revision is " + actualRevision + " but the plan expected " + expectedRevision + ".");
        this.expectedRevision = expectedRevision;
        this.actualRevision = actualRevision;
    }

    public long getExpectedRevision() {
        return expectedRevision;
    }

    public long getActualRevision() {
        return actualRevision;
    }
}
