package org.treeforge.apply;

import org.treeforge.exception.TreeValidationException;
import org.treeforge.tree.Operation;
import org.treeforge.tree.Tree;
import org.treeforge.tree.TreeNode;
import org.treeforge.tree.TreePath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 结构一致性闸门：在提取/执行任何操作之前，确认树所描述的“现状”与磁盘完全一致。
 * <p>
 * 期望路径 = 树中所有节点路径，但不含标记为新建的节点及其整棵子树（它们声明为尚不存在）。
 * 与磁盘路径做集合比较：{@code added = actual - expected}，{@code removed = expected - actual}，
 * 二者恰好划分对称差。任何差异都会阻止后续操作，直到用户重新生成基线或接受磁盘现状为新基线。
 */
public final class StructureValidator {

    private StructureValidator() {
    }

    public static StructureCheckResult validate(Tree tree, Collection<TreePath> actualPaths) {
        StructuralMismatch mismatch = compare(expectedPaths(tree), actualPaths);
        return mismatch.isEmpty() ? StructureCheckResult.ok() : StructureCheckResult.mismatched(mismatch);
    }

    /**
     * 校验并在不一致时抛出 {@link TreeValidationException}（携带差异报告）。
     */
    public static void requireMatch(Tree tree, Collection<TreePath> actualPaths) {
        StructureCheckResult result = validate(tree, actualPaths);
        if (!result.valid()) {
            StructuralMismatch mismatch = result.mismatch();
            throw new TreeValidationException(
                    "树结构与磁盘不一致（新增 " + mismatch.added().size() + "，缺失 " + mismatch.removed().size()
                            + "）；请重新生成树或接受磁盘现状为新基线",
                    mismatch
            );
        }
    }

    public static List<TreePath> expectedPaths(Tree tree) {
        List<TreePath> paths = new ArrayList<>();
        collectExpected(tree, tree.root(), TreePath.root(), paths);
        paths.sort(null);
        return paths;
    }

    /**
     * 基线漂移：上次扫描/应用后的基线与磁盘现状之间的差异（用于提示，不作为闸门）。
     */
    public static StructuralMismatch drift(Tree baseline, Collection<TreePath> actualPaths) {
        return compare(expectedPaths(baseline), actualPaths);
    }

    public static StructuralMismatch compare(Collection<TreePath> expected, Collection<TreePath> actual) {
        SortedSet<TreePath> expectedSet = new TreeSet<>(expected);
        SortedSet<TreePath> actualSet = new TreeSet<>(actual);

        List<TreePath> added = new ArrayList<>();
        for (TreePath path : actualSet) {
            if (!expectedSet.contains(path)) {
                added.add(path);
            }
        }
        List<TreePath> removed = new ArrayList<>();
        for (TreePath path : expectedSet) {
            if (!actualSet.contains(path)) {
                removed.add(path);
            }
        }
        return new StructuralMismatch(
                List.copyOf(expectedSet),
                List.copyOf(actualSet),
                List.copyOf(added),
                List.copyOf(removed)
        );
    }

    /**
     * 生成面向用户的差异报告；每一侧最多列出 limit 条。
     */
    public static String formatMismatch(StructuralMismatch mismatch, int limit) {
        StringBuilder msg = new StringBuilder();
        msg.append("树结构与磁盘不一致，请重新生成树（或接受磁盘现状为新基线）后再继续。\n\n");
        appendSection(msg, "磁盘上新增（树中没有）", "+", mismatch.added(), limit);
        appendSection(msg, "磁盘上缺失（树中存在）", "-", mismatch.removed(), limit);
        return msg.toString();
    }

    private static void appendSection(StringBuilder msg, String title, String sign, List<TreePath> paths, int limit) {
        if (paths.isEmpty()) {
            return;
        }
        msg.append(title).append("（").append(paths.size()).append("）：\n");
        int shown = Math.min(Math.max(1, limit), paths.size());
        for (int i = 0; i < shown; i++) {
            msg.append("  ").append(sign).append(' ').append(paths.get(i)).append('\n');
        }
        if (paths.size() > shown) {
            msg.append("  ... 以及另外 ").append(paths.size() - shown).append(" 项\n");
        }
        msg.append('\n');
    }

    private static void collectExpected(Tree tree, TreeNode parent, TreePath parentPath, List<TreePath> paths) {
        for (TreeNode child : tree.children(parent)) {
            if (child.operation() == Operation.CREATE) {
                continue;
            }
            TreePath path = parentPath.child(child.name());
            paths.add(path);
            collectExpected(tree, child, path, paths);
        }
    }
}
