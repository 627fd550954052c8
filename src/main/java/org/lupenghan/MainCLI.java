package org.lupenghan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.lupenghan.docdb.config.DocDbConfig;
import org.lupenghan.docdb.config.DocDbConfigLoader;
import org.lupenghan.docdb.exception.PlanParseException;
import org.lupenghan.docdb.exception.StaleRevisionException;
import org.lupenghan.docdb.executor.models.ExecutionResult;
import org.lupenghan.docdb.history.models.QueryHistoryEntry;
import org.lupenghan.docdb.history.models.QueryHistoryFilter;
import org.lupenghan.docdb.operation.models.Operation;
import org.lupenghan.docdb.plan.models.Plan;
import org.lupenghan.docdb.plan.models.PlanResponse;
import org.lupenghan.docdb.utils.Json;
import org.lupenghan.parser.PlanParser;
import org.lupenghan.query.Impl.QueryEngineImpl;
import org.lupenghan.query.interfaces.QueryEngine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Scanner;

/**
 * 交互式命令行：直接输入 JSON 操作或计划文件，结果以 JSON 输出
 */
public class MainCLI {
    private static final String HELP = String.join("\n",
            "可用命令:",
            "  summary               显示数据库概要",
            "  digest                显示给规划器使用的文本摘要",
            "  history [关键字]       显示查询历史",
            "  role <角色名>|none     设置执行角色",
            "  run <操作JSON>         执行单个操作",
            "  plan <文件>            执行计划文件",
            "  exit | quit           退出");

    private final QueryEngine queryEngine;
    private final ObjectWriter writer = Json.mapper().writerWithDefaultPrettyPrinter();
    private String role;

    public MainCLI(QueryEngine queryEngine) {
        this.queryEngine = queryEngine;
    }

    public void run(InputStream in, PrintStream out) {
        Scanner scanner = new Scanner(in, StandardCharsets.UTF_8);
        out.println("欢迎使用 DocDB 🌱 文档数据库。输入 help 查看命令，exit 退出。");

        while (true) {
            out.print("\n> ");
            if (!scanner.hasNextLine()) break;
            String line = scanner.nextLine().trim();
            if (line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit")) break;
            if (line.isEmpty()) continue;

            String[] parts = line.split("\\s+", 2);
            String command = parts[0].toLowerCase();
            String argument = parts.length > 1 ? parts[1].trim() : "";
            try {
                switch (command) {
                    case "help" -> out.println(HELP);
                    case "summary" -> out.println(writer.writeValueAsString(queryEngine.getSummary()));
                    case "digest" -> out.println(queryEngine.getDigest());
                    case "history" -> {
                        List<QueryHistoryEntry> entries = queryEngine.getHistory()
                                .list(QueryHistoryFilter.builder().searchTerm(argument).build());
                        out.println("📜 共 " + entries.size() + " 条记录");
                        for (QueryHistoryEntry entry : entries) {
                            out.println(" - [" + entry.getStatus().getValue() + "] " + entry.getQuery()
                                    + " (" + entry.getExecutionTimeMs() + " ms)");
                        }
                    }
                    case "role" -> {
                        role = argument.isEmpty() || argument.equalsIgnoreCase("none") ? null : argument;
                        out.println("当前角色: " + (role == null ? "<不检查权限>" : role));
                    }
                    case "run" -> {
                        Operation operation = PlanParser.parseOperation(argument);
                        ExecutionResult result = queryEngine.execute(operation, role);
                        out.println(writer.writeValueAsString(result));
                    }
                    case "plan" -> {
                        String raw = Files.readString(Paths.get(argument), StandardCharsets.UTF_8);
                        Plan plan = PlanParser.parse(raw);
                        if (plan.getRole() == null && role != null) {
                            plan = plan.toBuilder().role(role).build();
                        }
                        PlanResponse response = queryEngine.executePlan(plan);
                        out.println(response.getContent());
                        out.println(writer.writeValueAsString(response.getResults()));
                        for (String warning : response.getWarnings()) {
                            out.println("⚠️ " + warning);
                        }
                    }
                    default -> out.println("❌ 无法识别的命令: " + command + "，输入 help 查看命令");
                }
            } catch (PlanParseException e) {
                out.println("❌ 无法解析: " + e.getMessage());
            } catch (StaleRevisionException e) {
                out.println("⚠️ 计划已过期: " + e.getMessage());
            } catch (JsonProcessingException e) {
                out.println("⚠️ 输出序列化失败: " + e.getOriginalMessage());
            } catch (IOException | IllegalArgumentException e) {
                out.println("⚠️ 执行出错：" + e.getMessage());
            }
        }

        out.println("👋 再见！");
    }

    public static void main(String[] args) throws IOException {
        DocDbConfig config = DocDbConfigLoader.load();
        try (QueryEngine queryEngine = QueryEngineImpl.open(config)) {
            new MainCLI(queryEngine).run(System.in, System.out);
        }
    }
}
