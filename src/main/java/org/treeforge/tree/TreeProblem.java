package org.treeforge.tree;

/**
 * 树结构规则的违反项。
 *
 * @param line    节点来源行号（扫描得到的节点为 0）
 * @param path    节点路径
 * @param kind    违反的规则
 * @param message 说明
 */
public record TreeProblem(
        int line,
        TreePath path,
        Kind kind,
        String message
) {

    public enum Kind {
        INVALID_NAME,
        DUPLICATE_NAME,
        RENAME_TARGET_MISSING,
        INVALID_RENAME_TARGET,
        RENAME_TARGET_UNCHANGED,
        RENAME_COLLISION,
        MARKER_INSIDE_DELETED_FOLDER,
        MARKER_INSIDE_CREATED_FOLDER,
        ROOT_OPERATION
    }
}
