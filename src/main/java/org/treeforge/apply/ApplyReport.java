package org.treeforge.apply;

import java.util.List;

/**
 * 执行结果（全部成功时返回；失败时改为抛出 {@link org.treeforge.exception.OperationExecutionException}）。
 *
 * @param executed 按执行顺序排列的记录；预演时即调度结果本身
 * @param dryRun   是否为预演（未调用文件系统）
 */
public record ApplyReport(List<OperationRecord> executed, boolean dryRun) {

    public ApplyReport {
        executed = List.copyOf(executed);
    }

    public int count() {
        return executed.size();
    }
}
