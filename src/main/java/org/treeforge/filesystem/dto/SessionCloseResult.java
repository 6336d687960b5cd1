package org.treeforge.filesystem.dto;

/**
 * {@code tree_close_session} 的返回结果。
 *
 * @param sessionId 会话标识
 * @param closed    是否关闭了一个存在的会话
 */
public record SessionCloseResult(String sessionId, boolean closed) {
}
