package org.treeforge.filesystem.dto;

import java.util.List;

/**
 * {@code tree_preview} 的返回结果（未修改磁盘）。
 *
 * @param sessionId  会话标识
 * @param valid      是否通过解析与结构校验
 * @param operations 按执行顺序排列的变更（未通过校验时为空）
 * @param summary    分组文本，或校验失败时的错误报告
 * @param problems   解析/校验问题（逐条，带行号）
 * @param warnings   非致命告警/提示
 */
public record TreePreviewResult(
        String sessionId,
        boolean valid,
        List<OperationView> operations,
        String summary,
        List<String> problems,
        List<String> warnings
) {
}
