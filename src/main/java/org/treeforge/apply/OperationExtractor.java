package org.treeforge.apply;

import org.treeforge.exception.TreeValidationException;
import org.treeforge.tree.Operation;
import org.treeforge.tree.Tree;
import org.treeforge.tree.TreeNode;
import org.treeforge.tree.TreePath;

import java.util.ArrayList;
import java.util.List;

/**
 * 从带标记的树中提取操作记录。
 * <p>
 * 先序遍历，遇到带标记的节点就生成一条记录；新建目录下未标记的后代按隐式新建处理。
 * 重命名的新路径 = 同一父目录 + 重命名目标。
 */
public final class OperationExtractor {

    private OperationExtractor() {
    }

    public static List<OperationRecord> extract(Tree tree) {
        List<OperationRecord> records = new ArrayList<>();
        TreeNode root = tree.root();
        if (root.hasOperation()) {
            // 交给 validateOperations 拒绝，保证根节点永远不会进入调度
            records.add(toRecord(root, TreePath.root()));
        }
        extractChildren(tree, root, TreePath.root(), false, records);
        return records;
    }

    /**
     * 执行前的本地校验：不能操作根节点；重命名必须有新路径。任何违反都整体拒绝（一条也不调度）。
     */
    public static void validateOperations(List<OperationRecord> records) {
        List<String> violations = new ArrayList<>();
        for (OperationRecord record : records) {
            if (record.path() == null || record.path().isRoot()) {
                violations.add("根节点不可变，不能执行 " + record.operation());
                continue;
            }
            if (record.operation() == Operation.RENAME && (record.newPath() == null || record.newPath().isRoot())) {
                violations.add("重命名缺少目标路径：" + record.path());
            }
        }
        if (!violations.isEmpty()) {
            throw new TreeValidationException("操作校验失败：" + String.join("；", violations), violations);
        }
    }

    public static List<OperationRecord> extractAndValidate(Tree tree) {
        List<OperationRecord> records = extract(tree);
        validateOperations(records);
        return records;
    }

    private static void extractChildren(
            Tree tree,
            TreeNode parent,
            TreePath parentPath,
            boolean insideCreate,
            List<OperationRecord> records
    ) {
        for (TreeNode child : tree.children(parent)) {
            TreePath path = parentPath.child(child.name());
            if (child.hasOperation()) {
                records.add(toRecord(child, path));
            } else if (insideCreate) {
                records.add(OperationRecord.create(path, child.kind()));
            }
            boolean childInsideCreate = insideCreate || child.operation() == Operation.CREATE;
            extractChildren(tree, child, path, childInsideCreate, records);
        }
    }

    private static OperationRecord toRecord(TreeNode node, TreePath path) {
        return switch (node.operation()) {
            case CREATE -> OperationRecord.create(path, node.kind());
            case DELETE -> OperationRecord.delete(path, node.kind());
            case RENAME -> OperationRecord.rename(
                    path,
                    (node.renameTarget() == null || node.renameTarget().isBlank() || path.isRoot())
                            ? null
                            : path.withLastSegment(node.renameTarget()),
                    node.kind()
            );
        };
    }
}
