package org.treeforge.filesystem.dto;

import java.time.Instant;
import java.util.List;

/**
 * {@code tree_apply} 的返回结果。
 *
 * @param sessionId      会话标识
 * @param confirmed      是否确认执行（confirm=true）
 * @param applied        是否全部执行成功
 * @param partialSuccess 是否部分成功（执行中途失败，之前的变更已生效）
 * @param completed      已执行的变更
 * @param failed         失败的变更（无失败时为 null）
 * @param remaining      未尝试的变更
 * @param error          失败原因（无失败时为 null）
 * @param baselineText   刷新后的基线文本（未执行时为当前基线）
 * @param problems       解析/校验/路径安全问题（逐条；为空表示没有此类问题）
 * @param appliedAt      执行完成时间（未执行时为 null）
 * @param warnings       非致命告警/提示
 */
public record TreeApplyResult(
        String sessionId,
        boolean confirmed,
        boolean applied,
        boolean partialSuccess,
        List<OperationView> completed,
        OperationView failed,
        List<OperationView> remaining,
        String error,
        String baselineText,
        List<String> problems,
        Instant appliedAt,
        List<String> warnings
) {
}
