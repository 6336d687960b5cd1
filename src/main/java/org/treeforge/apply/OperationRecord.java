package org.treeforge.apply;

import org.treeforge.tree.NodeKind;
import org.treeforge.tree.Operation;
import org.treeforge.tree.TreePath;

/**
 * 从树中提取出的一条待执行变更（每次预览/应用都重新生成，不持久化）。
 *
 * @param path      节点路径（相对声明根目录）
 * @param operation 操作
 * @param newPath   重命名后的路径（仅 {@link Operation#RENAME}）
 * @param nodeKind  文件或目录
 */
public record OperationRecord(
        TreePath path,
        Operation operation,
        TreePath newPath,
        NodeKind nodeKind
) {

    public static OperationRecord create(TreePath path, NodeKind kind) {
        return new OperationRecord(path, Operation.CREATE, null, kind);
    }

    public static OperationRecord delete(TreePath path, NodeKind kind) {
        return new OperationRecord(path, Operation.DELETE, null, kind);
    }

    public static OperationRecord rename(TreePath path, TreePath newPath, NodeKind kind) {
        return new OperationRecord(path, Operation.RENAME, newPath, kind);
    }

    public OperationRecord withPath(TreePath path) {
        return new OperationRecord(path, operation, newPath, nodeKind);
    }

    public String describe() {
        String kind = nodeKind == NodeKind.FOLDER ? "目录" : "文件";
        return switch (operation) {
            case CREATE -> "新建" + kind + " " + path;
            case DELETE -> "删除" + kind + " " + path;
            case RENAME -> "重命名" + kind + " " + path + " -> " + newPath;
        };
    }
}
