package org.treeforge.apply;

import org.treeforge.tree.TreePath;

import java.util.List;

/**
 * 声明结构与磁盘现状的差异。
 *
 * @param expectedPaths 从树推导出的“应当已存在”的路径（不含新建标记的子树）
 * @param actualPaths   磁盘扫描得到的路径
 * @param added         磁盘上有、树里没有（在工具之外新出现）
 * @param removed       树里有、磁盘上没有（在工具之外消失）
 */
public record StructuralMismatch(
        List<TreePath> expectedPaths,
        List<TreePath> actualPaths,
        List<TreePath> added,
        List<TreePath> removed
) {

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
