package org.lupenghan.docdb.plan.models;

import java.util.Locale;

/**
 * 计划执行时的写盘时机
 */
public enum PersistenceMode {
    PER_OPERATION,  // 每个写操作之后写盘
    PER_PLAN;       // 计划结束后写盘一次

    public static PersistenceMode fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Persistence mode must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return PersistenceMode.valueOf(normalized);
    }
}
