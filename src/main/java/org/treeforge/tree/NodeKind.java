package org.treeforge.tree;

/**
 * 节点类型：文件或目录（封闭集合）。
 */
public enum NodeKind {
    FILE,
    FOLDER;

    public boolean isFolder() {
        return this == FOLDER;
    }
}
