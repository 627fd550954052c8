package org.lupenghan.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.docdb.exception.PlanParseException;
import org.lupenghan.docdb.operation.models.Operation;
import org.lupenghan.docdb.operation.models.OperationType;
import org.lupenghan.docdb.plan.models.Plan;
import org.lupenghan.docdb.utils.Json;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析外部规划器返回的 JSON 计划。
 * 容忍 Markdown 代码块、JSON 外的多余文字以及各种写法的操作类型（createTable、create-table、CREATE_TABLE）
 */
@Slf4j
public class PlanParser {
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern DELIMITERS = Pattern.compile("[\\s\\-]+");

    private static final ObjectMapper MAPPER = Json.mapper();

    private PlanParser() {
    }

    /**
     * 解析完整的计划
     * @param raw 规划器的原始输出
     * @return 计划
     * @throws PlanParseException JSON 非法、操作类型未知或字段无法绑定
     */
    public static Plan parse(String raw) throws PlanParseException {
        JsonNode root = readTree(sanitize(raw));
        if (!root.isObject()) {
            throw new PlanParseException("Plan must be a JSON object.");
        }

        Plan.PlanBuilder builder = Plan.builder()
                .thought(text(root, "thought"))
                .finalResponse(text(root, "finalResponse"))
                .role(text(root, "role"));

        JsonNode warnings = root.get("warnings");
        if (warnings != null && warnings.isArray()) {
            for (JsonNode warning : warnings) {
                if (warning.isTextual()) {
                    builder.warning(warning.asText());
                }
            }
        }

        JsonNode revision = root.get("expectedRevision");
        if (revision != null && !revision.isNull()) {
            if (!revision.canConvertToLong()) {
                throw new PlanParseException("expectedRevision must be an integer.");
            }
            builder.expectedRevision(revision.asLong());
        }

        JsonNode operations = root.get("operations");
        if (operations != null && !operations.isNull()) {
            if (!operations.isArray()) {
                throw new PlanParseException("operations must be an array.");
            }
            int index = 0;
            for (JsonNode operation : operations) {
                index++;
                try {
                    builder.operation(bindOperation(operation));
                } catch (PlanParseException e) {
                    throw new PlanParseException("Operation " + index + ": " + e.getMessage(), e);
                }
            }
        }
        Plan plan = builder.build();
        log.debug("解析计划完成，共 {} 个操作", plan.getOperations().size());
        return plan;
    }

    /**
     * 解析单个操作
     */
    public static Operation parseOperation(String json) throws PlanParseException {
        return bindOperation(readTree(sanitize(json)));
    }

    /**
     * 去掉代码块标记以及最外层花括号之外的内容
     */
    static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String candidate = raw.trim();
        Matcher fence = CODE_FENCE.matcher(candidate);
        if (fence.find()) {
            candidate = fence.group(1).trim();
        }
        int first = candidate.indexOf('{');
        int last = candidate.lastIndexOf('}');
        if (first != -1 && last >= first) {
            candidate = candidate.substring(first, last + 1);
        }
        return candidate;
    }

    /**
     * 规范化操作类型，例如 createTable、create-table、CREATE_TABLE 都对应 ddl.create_table
     */
    static Optional<OperationType> normalizeType(String type) {
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        String normalized = CAMEL_BOUNDARY.matcher(type.trim()).replaceAll("$1_$2");
        normalized = DELIMITERS.matcher(normalized).replaceAll("_").toLowerCase(Locale.ROOT);

        Optional<OperationType> exact = OperationType.lookup(normalized);
        if (exact.isPresent()) {
            return exact;
        }
        String action = normalized.substring(normalized.indexOf('.') + 1);
        for (OperationType candidate : OperationType.values()) {
            if (candidate.getAction().equals(action)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static Operation bindOperation(JsonNode node) throws PlanParseException {
        if (node == null || !node.isObject()) {
            throw new PlanParseException("Operation must be a JSON object.");
        }
        ObjectNode entry = ((ObjectNode) node).deepCopy();
        String rawType = text(entry, "type");
        OperationType type = normalizeType(rawType)
                .orElseThrow(() -> new PlanParseException("Unsupported operation type: " + rawType));
        entry.remove("type");

        if (type == OperationType.CREATE_TABLE && entry.get("columns") != null && entry.get("columns").isArray()) {
            for (JsonNode column : entry.get("columns")) {
                normalizeColumn(column);
            }
        }
        if (type == OperationType.ALTER_TABLE_ADD_COLUMN) {
            normalizeColumn(entry.get("column"));
        }

        try {
            return MAPPER.treeToValue(entry, type.getOperationClass());
        } catch (JsonProcessingException e) {
            throw new PlanParseException("Invalid " + type.getWireName() + " operation: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 列蓝图：dataType 缺失时为 text，nullable 缺失时为 true
     */
    private static void normalizeColumn(JsonNode column) {
        if (column == null || !column.isObject()) {
            return;
        }
        ObjectNode blueprint = (ObjectNode) column;
        String dataType = text(blueprint, "dataType");
        blueprint.put("dataType", dataType == null || dataType.isBlank() ? "text" : dataType.trim());
        JsonNode nullable = blueprint.get("nullable");
        if (nullable == null || !nullable.isBoolean()) {
            blueprint.put("nullable", true);
        }
    }

    private static JsonNode readTree(String json) throws PlanParseException {
        if (json.isEmpty()) {
            throw new PlanParseException("Plan is empty.");
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PlanParseException("Plan is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
