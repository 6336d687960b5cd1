package org.treeforge.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treeforge.exception.SessionBusyException;
import org.treeforge.tree.Tree;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 会话基线存储（内存版）。
 * <p>
 * 工作流：
 * <ol>
 *   <li>{@code tree_generate}：扫描目录，{@link #open} 新会话并保存基线。</li>
 *   <li>{@code tree_preview} / {@code tree_apply}：{@link #get} 读取基线；应用成功后 {@link #replace} 整体替换。</li>
 *   <li>{@code tree_close_session}：{@link #close} 丢弃会话。</li>
 * </ol>
 * <p>
 * 约束：
 * <ul>
 *   <li>每个会话有 TTL（每次访问顺延），超时自动失效。</li>
 *   <li>会话总数有上限，满了先清理过期会话，仍满则拒绝。</li>
 *   <li>同一会话同一时刻只允许一个预览/应用在执行（{@link #beginOperation}/{@link #endOperation}）。</li>
 *   <li>仅用于单实例/单进程场景。</li>
 * </ul>
 */
public class TreeSessionStore {

    private static final Logger logger = LoggerFactory.getLogger(TreeSessionStore.class);

    private final Duration ttl;
    private final int maxSessions;
    private final ConcurrentHashMap<String, SessionState> store = new ConcurrentHashMap<>();
    private final Set<String> busy = ConcurrentHashMap.newKeySet();

    public TreeSessionStore(Duration ttl, int maxSessions) {
        this.ttl = ttl;
        this.maxSessions = maxSessions;
    }

    public SessionState open(String rootId, String displayPath, Path rootPath, Tree baseline, String baselineText) {
        cleanupExpired();
        if (store.size() >= maxSessions) {
            throw new IllegalStateException("会话数已达上限 " + maxSessions + "（tree-forge.max-sessions）；请先关闭不再使用的会话");
        }
        String sessionId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        SessionState state = new SessionState(
                sessionId,
                rootId,
                displayPath,
                rootPath,
                baseline,
                baselineText,
                now,
                now.plus(ttl)
        );
        store.put(sessionId, state);
        logger.info("打开会话 {}：{}（{}）", sessionId, rootPath, rootId);
        return state;
    }

    /**
     * 读取会话（顺延 TTL）；不存在或已过期时抛出 {@link IllegalArgumentException}。
     */
    public SessionState get(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId 不能为空");
        }
        SessionState state = store.get(sessionId);
        if (state == null) {
            throw new IllegalArgumentException("会话不存在或已关闭：" + sessionId);
        }
        if (state.isExpired()) {
            store.remove(sessionId);
            throw new IllegalArgumentException("会话已过期：" + sessionId + "；请重新调用 tree_generate");
        }
        SessionState touched = state.touch(Instant.now().plus(ttl));
        store.replace(sessionId, state, touched);
        return touched;
    }

    /**
     * 用新的基线整体替换会话状态。
     */
    public SessionState replace(String sessionId, Tree baseline, String baselineText) {
        SessionState current = get(sessionId);
        Instant now = Instant.now();
        SessionState updated = current.withBaseline(baseline, baselineText, now, now.plus(ttl));
        store.put(sessionId, updated);
        return updated;
    }

    /**
     * 丢弃会话。执行中的标记不在这里清除，仍由正在执行的操作通过 {@link #endOperation} 释放。
     */
    public boolean close(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        SessionState removed = store.remove(sessionId);
        if (removed != null) {
            logger.info("关闭会话 {}", sessionId);
        }
        return removed != null;
    }

    /**
     * 标记会话进入执行中；同一会话已有操作在执行时抛出 {@link SessionBusyException}。
     */
    public SessionState beginOperation(String sessionId) {
        SessionState state = get(sessionId);
        if (!busy.add(sessionId)) {
            throw new SessionBusyException(sessionId);
        }
        return state;
    }

    public void endOperation(String sessionId) {
        busy.remove(sessionId);
    }

    public boolean isBusy(String sessionId) {
        return sessionId != null && busy.contains(sessionId);
    }

    public int size() {
        return store.size();
    }

    private void cleanupExpired() {
        Instant now = Instant.now();
        for (Map.Entry<String, SessionState> entry : store.entrySet()) {
            if (entry.getValue().expiresAt().isBefore(now) && !busy.contains(entry.getKey())) {
                store.remove(entry.getKey());
            }
        }
    }
}
