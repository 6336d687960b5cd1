package org.treeforge.exception;

import org.treeforge.apply.OperationRecord;

import java.util.List;

/**
 * 执行阶段某一条变更失败。
 * <p>
 * 执行是 fail-fast 的：失败记录之前的变更已经落盘且不会回滚（部分成功），之后的记录不再尝试。
 */
public class OperationExecutionException extends TreeForgeException {

    private final List<OperationRecord> completed;
    private final OperationRecord failed;
    private final List<OperationRecord> remaining;

    public OperationExecutionException(
            String message,
            List<OperationRecord> completed,
            OperationRecord failed,
            List<OperationRecord> remaining,
            Throwable cause
    ) {
        super(message, cause);
        this.completed = List.copyOf(completed);
        this.failed = failed;
        this.remaining = List.copyOf(remaining);
    }

    public List<OperationRecord> getCompleted() {
        return completed;
    }

    public OperationRecord getFailed() {
        return failed;
    }

    public List<OperationRecord> getRemaining() {
        return remaining;
    }
}
