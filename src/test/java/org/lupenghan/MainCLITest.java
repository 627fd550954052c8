package org.lupenghan;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lupenghan.docdb.config.DocDbConfig;
import org.lupenghan.query.Impl.QueryEngineImpl;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertTrue;

public class MainCLITest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private QueryEngineImpl engine;

    @Before
    public void setUp() throws IOException {
        Path root = folder.getRoot().toPath();
        engine = QueryEngineImpl.open(DocDbConfig.builder()
                .databasePath(root.resolve("database.json"))
                .historyPath(null)
                .lockFileEnabled(false)
                .build());
    }

    @After
    public void tearDown() throws IOException {
        engine.close();
    }

    private String run(String input) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        new MainCLI(engine).run(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testRunOperations() {
        String output = run(String.join("\n",
                "run {\"type\": \"createTable\", \"table\": \"notes\", \"columns\": [{\"name\": \"id\", \"dataType\": \"integer\", \"isPrimaryKey\": true}]}",
                "run {\"type\": \"insert\", \"table\": \"notes\", \"rows\": [{\"id\": 1}]}",
                "digest",
                "history notes",
                "exit",
                "run {\"type\": \"drop_table\", \"table\": \"notes\"}"));

        assertTrue(output.contains("Created table \\\"notes\\\" with 1 column(s)."));
        assertTrue(output.contains("Table \"notes\" (1 row(s), 1 column(s))"));
        assertTrue(output.contains("📜 共 2 条记录"));
        assertTrue(output.contains("👋 再见！"));
        assertTrue(engine.getSummary().table("notes") != null);
    }

    @Test
    public void testPlanFileAndErrors() throws IOException {
        Path plan = folder.newFile("plan.json").toPath();
        Files.writeString(plan, "```json\n{\"finalResponse\": \"Nothing to drop.\","
                + " \"operations\": [{\"type\": \"drop_table\", \"table\": \"ghost\"}]}\n```", StandardCharsets.UTF_8);

        String output = run(String.join("\n",
                "plan " + plan,
                "run {\"type\": \"truncate\"}",
                "frobnicate",
                "role none"));

        assertTrue(output.contains("Nothing to drop."));
        assertTrue(output.contains("⚠️ Table \"ghost\" does not exist."));
        assertTrue(output.contains("❌ 无法解析: Unsupported operation type: truncate"));
        assertTrue(output.contains("❌ 无法识别的命令: frobnicate"));
        assertTrue(output.contains("当前角色: <不检查权限>"));
    }
}
