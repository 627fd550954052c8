package org.lupenghan.docdb.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lupenghan.docdb.plan.models.PersistenceMode;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 运行配置，默认值与 docdb.properties 中的一致
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DocDbConfig {
    @Builder.Default
    private Path databasePath = Paths.get("data", "database.json");
    @Builder.Default
    private PersistenceMode persistenceMode = PersistenceMode.PER_PLAN;
    @Builder.Default
    private String superuserRole = "admin";
    @Builder.Default
    private Path historyPath = Paths.get("data", "query-history.json");     // 为 null 时历史只保存在内存
    @Builder.Default
    private int historyLimit = 500;
    @Builder.Default
    private int digestSampleRows = 2;
    @Builder.Default
    private boolean lockFileEnabled = true;

    public static DocDbConfig defaults() {
        return DocDbConfig.builder().build();
    }
}
