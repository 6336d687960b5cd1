package org.treeforge.apply;

import org.treeforge.exception.PathSafetyException;
import org.treeforge.tree.NodeKind;
import org.treeforge.tree.Operation;
import org.treeforge.tree.PathSafety;
import org.treeforge.tree.TreePath;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 把操作记录排成安全的执行顺序。
 * <p>
 * 调度前逐条复核路径安全（原路径与重命名新路径都要通过 {@link PathSafety}），任意一条失败立即中止。
 * <p>
 * 五个分组按固定顺序拼接，组内顺序确定（同级再按路径字典序）：
 * <ol>
 *   <li>新建目录：浅的在前，保证父目录先于子目录存在。</li>
 *   <li>新建文件。</li>
 *   <li>重命名：深的在前，保证外层目录改名前内部的重命名仍使用旧路径。</li>
 *   <li>删除文件。</li>
 *   <li>删除目录：深的在前，子目录先于父目录删除。</li>
 * </ol>
 * 删除排在重命名之后，因此位于被重命名目录之下的删除记录会改写为执行时的实际路径。
 */
public final class ApplyScheduler {

    private static final Comparator<OperationRecord> SHALLOW_FIRST =
            Comparator.<OperationRecord>comparingInt(r -> r.path().depth()).thenComparing(OperationRecord::path);

    private static final Comparator<OperationRecord> DEEP_FIRST =
            Comparator.<OperationRecord>comparingInt(r -> -r.path().depth()).thenComparing(OperationRecord::path);

    private static final Comparator<OperationRecord> LEXICAL = Comparator.comparing(OperationRecord::path);

    private ApplyScheduler() {
    }

    public static List<OperationRecord> schedule(List<OperationRecord> records, Path root) {
        for (OperationRecord record : records) {
            requireSafe(record, root);
        }

        List<OperationRecord> createFolders = new ArrayList<>();
        List<OperationRecord> createFiles = new ArrayList<>();
        List<OperationRecord> renames = new ArrayList<>();
        List<OperationRecord> deleteFiles = new ArrayList<>();
        List<OperationRecord> deleteFolders = new ArrayList<>();
        for (OperationRecord record : records) {
            boolean folder = record.nodeKind() == NodeKind.FOLDER;
            switch (record.operation()) {
                case CREATE -> (folder ? createFolders : createFiles).add(record);
                case RENAME -> renames.add(record);
                case DELETE -> (folder ? deleteFolders : deleteFiles).add(record);
            }
        }

        createFolders.sort(SHALLOW_FIRST);
        createFiles.sort(LEXICAL);
        renames.sort(DEEP_FIRST);
        deleteFiles.sort(LEXICAL);
        deleteFolders.sort(DEEP_FIRST);

        List<OperationRecord> ordered = new ArrayList<>(records.size());
        ordered.addAll(createFolders);
        ordered.addAll(createFiles);
        ordered.addAll(renames);
        for (OperationRecord record : deleteFiles) {
            ordered.add(rebaseThroughRenames(record, renames));
        }
        for (OperationRecord record : deleteFolders) {
            ordered.add(rebaseThroughRenames(record, renames));
        }
        return ordered;
    }

    private static void requireSafe(OperationRecord record, Path root) {
        if (record.path() == null || record.path().isRoot()) {
            throw new PathSafetyException("不能调度针对声明根目录本身的操作：" + record.operation(), "");
        }
        PathSafety.requireSafe(record.path(), root);
        if (record.operation() == Operation.RENAME) {
            if (record.newPath() == null || record.newPath().isRoot()) {
                throw new PathSafetyException("重命名缺少目标路径：" + record.path(), record.path().toString());
            }
            PathSafety.requireSafe(record.newPath(), root);
        }
    }

    /**
     * 按重命名的执行顺序（深的在前）依次应用祖先目录的改名，得到删除执行时节点的实际位置。
     */
    private static OperationRecord rebaseThroughRenames(OperationRecord record, List<OperationRecord> orderedRenames) {
        TreePath current = record.path();
        for (OperationRecord rename : orderedRenames) {
            if (rename.nodeKind() == NodeKind.FOLDER && current.isDescendantOf(rename.path())) {
                current = current.rebase(rename.path(), rename.newPath());
            }
        }
        return current.equals(record.path()) ? record : record.withPath(current);
    }
}
