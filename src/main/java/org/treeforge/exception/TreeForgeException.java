package org.treeforge.exception;

/**
 * 所有 TreeForge 业务异常的基类（运行时异常）。
 * <p>
 * 子类划分：
 * <ul>
 *   <li>{@link TreeParseException}：文本解析失败，带行号，可修改文本后重试。</li>
 *   <li>{@link TreeValidationException}：结构不一致或操作规则冲突，可重新生成基线或修正标记后重试。</li>
 *   <li>{@link PathSafetyException}：路径越界或名称非法，始终拒绝。</li>
 *   <li>{@link SessionBusyException}：同一会话已有操作在执行，稍后重试。</li>
 *   <li>{@link OperationExecutionException}：某一步磁盘变更失败，之前已执行的步骤不回滚。</li>
 * </ul>
 */
public abstract class TreeForgeException extends RuntimeException {

    protected TreeForgeException(String message) {
        super(message);
    }

    protected TreeForgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
