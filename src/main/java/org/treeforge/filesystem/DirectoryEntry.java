package org.treeforge.filesystem;

import org.treeforge.tree.NodeKind;

/**
 * 目录列表中的一项。
 */
public record DirectoryEntry(String name, NodeKind kind) {
}
