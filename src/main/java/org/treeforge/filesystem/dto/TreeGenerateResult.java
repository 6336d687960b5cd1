package org.treeforge.filesystem.dto;

import java.util.List;

/**
 * {@code tree_generate} / {@code tree_accept_live_baseline} 的返回结果。
 *
 * @param sessionId 会话标识（后续预览/应用都需要）
 * @param rootId    根目录标识
 * @param path      声明根目录（相对 rootId，统一使用 / 分隔）
 * @param text      可编辑的树形文本
 * @param nodeCount 节点数（不含根）
 * @param warnings  非致命告警/提示
 */
public record TreeGenerateResult(
        String sessionId,
        String rootId,
        String path,
        String text,
        int nodeCount,
        List<String> warnings
) {
}
