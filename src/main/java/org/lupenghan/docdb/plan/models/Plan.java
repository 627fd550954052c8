package org.lupenghan.docdb.plan.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.lupenghan.docdb.operation.models.Operation;

import java.util.List;

/**
 * 外部规划器生成的一批操作
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Plan {
    String thought;                 // 规划器的思考过程（可选）
    String finalResponse;           // 规划器给用户的回复（可选）
    @Singular
    List<String> warnings;
    @Singular
    List<Operation> operations;     // 按顺序执行
    String role;                    // 执行角色，为空时不做权限检查
    Long expectedRevision;          // 乐观并发：与当前 revision 不一致时拒绝整个计划
}
