package org.treeforge.apply;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treeforge.exception.OperationExecutionException;
import org.treeforge.filesystem.FilesystemProvider;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 按调度顺序逐条执行变更。
 * <p>
 * 顺序执行、遇错即停：第一条失败的记录会连同已完成/未尝试的记录一起包装为
 * {@link OperationExecutionException} 抛出。已完成的变更不会回滚。
 */
public class ApplyExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ApplyExecutor.class);

    public ApplyReport execute(List<OperationRecord> ordered, FilesystemProvider provider, boolean dryRun) {
        if (dryRun) {
            return new ApplyReport(ordered, true);
        }
        List<OperationRecord> completed = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            OperationRecord record = ordered.get(i);
            try {
                apply(record, provider);
            } catch (IOException | RuntimeException e) {
                List<OperationRecord> remaining = ordered.subList(i + 1, ordered.size());
                logger.warn("变更执行失败，已完成 {} 条，未尝试 {} 条：{}（{}）",
                        completed.size(), remaining.size(), record.describe(), e.toString());
                throw new OperationExecutionException(
                        "执行失败：" + record.describe() + "（" + describeCause(e) + "）；之前的 "
                                + completed.size() + " 条变更已生效且不会回滚",
                        completed,
                        record,
                        remaining,
                        e
                );
            }
            logger.debug("已执行：{}", record.describe());
            completed.add(record);
        }
        return new ApplyReport(completed, false);
    }

    private static void apply(OperationRecord record, FilesystemProvider provider) throws IOException {
        switch (record.operation()) {
            case CREATE -> {
                if (record.nodeKind().isFolder()) {
                    provider.createFolder(record.path());
                } else {
                    provider.createFile(record.path());
                }
            }
            case RENAME -> provider.rename(record.path(), record.newPath());
            case DELETE -> provider.deleteRecursive(record.path());
        }
    }

    private static String describeCause(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return e.getClass().getSimpleName() + ": " + message;
    }
}
