package org.treeforge.session;

import org.treeforge.tree.Tree;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 一个编辑会话的基线快照（不可变，整体替换）。
 *
 * @param sessionId    会话标识
 * @param rootId       白名单根目录标识
 * @param displayPath  声明根目录相对 rootId 的显示路径
 * @param rootPath     声明根目录的绝对路径
 * @param baseline     上次扫描/应用后的未标记树
 * @param baselineText 基线的树形文本（即最近一次交给用户编辑的文本）
 * @param updatedAt    基线更新时间
 * @param expiresAt    过期时间（每次访问后顺延）
 */
public record SessionState(
        String sessionId,
        String rootId,
        String displayPath,
        Path rootPath,
        Tree baseline,
        String baselineText,
        Instant updatedAt,
        Instant expiresAt
) {

    public boolean isExpired() {
        return Instant.now().isAfter(expiresAt);
    }

    SessionState withBaseline(Tree newBaseline, String newText, Instant now, Instant newExpiresAt) {
        return new SessionState(sessionId, rootId, displayPath, rootPath, newBaseline, newText, now, newExpiresAt);
    }

    SessionState touch(Instant newExpiresAt) {
        return new SessionState(sessionId, rootId, displayPath, rootPath, baseline, baselineText, updatedAt, newExpiresAt);
    }
}
