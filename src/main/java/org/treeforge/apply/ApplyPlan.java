package org.treeforge.apply;

import java.util.List;

/**
 * 预览结果：通过闸门校验并完成调度、但尚未执行的变更计划。
 *
 * @param operations 按执行顺序排列的变更
 * @param warnings   非致命告警（基线漂移、扫描时跳过的条目等）
 * @param summary    面向用户的分组文本（新建 / 重命名 / 删除）
 */
public record ApplyPlan(List<OperationRecord> operations, List<String> warnings, String summary) {

    public ApplyPlan {
        operations = List.copyOf(operations);
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
