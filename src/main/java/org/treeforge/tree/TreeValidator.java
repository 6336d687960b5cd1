package org.treeforge.tree;

import org.treeforge.exception.TreeValidationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 节点名称与树结构规则校验。
 * <p>
 * 规则：
 * <ul>
 *   <li>名称必须满足 {@link PathSafety#isValidName}；同一目录下名称唯一。</li>
 *   <li>重命名必须带合法目标，且目标不能等于原名，也不能与兄弟节点的名称/重命名目标冲突
 *       （执行时重命名不会覆盖已存在路径，而删除排在重命名之后）。</li>
 *   <li>待删除目录内部的节点不能再带标记；待新建目录内部只能出现新建标记（其余后代隐式新建）。</li>
 *   <li>根节点不能带操作。</li>
 * </ul>
 * 文件不能包含子节点由 {@link Tree} 在构建时直接拒绝。
 */
public final class TreeValidator {

    private TreeValidator() {
    }

    public static List<TreeProblem> validate(Tree tree) {
        List<TreeProblem> problems = new ArrayList<>();
        TreeNode root = tree.root();
        if (root.hasOperation()) {
            problems.add(new TreeProblem(root.sourceLine(), TreePath.root(), TreeProblem.Kind.ROOT_OPERATION,
                    "根节点不可变，不能标记操作（" + root.operation() + "）"));
        }
        validateChildren(tree, root, TreePath.root(), null, problems);
        return problems;
    }

    /**
     * 校验并在存在问题时抛出 {@link TreeValidationException}。
     */
    public static void requireValid(Tree tree) {
        List<TreeProblem> problems = validate(tree);
        if (!problems.isEmpty()) {
            List<String> messages = new ArrayList<>(problems.size());
            for (TreeProblem problem : problems) {
                messages.add(problem.path() + "：" + problem.message());
            }
            throw new TreeValidationException("树结构校验失败（" + problems.size() + " 处）", messages);
        }
    }

    private static void validateChildren(
            Tree tree,
            TreeNode parent,
            TreePath parentPath,
            Operation inherited,
            List<TreeProblem> problems
    ) {
        List<TreeNode> children = tree.children(parent);
        Set<String> seen = new HashSet<>();
        Map<String, TreeNode> renameTargets = new HashMap<>();

        for (TreeNode child : children) {
            TreePath path = parentPath.child(child.name());

            if (!PathSafety.isValidName(child.name())) {
                problems.add(problem(child, path, TreeProblem.Kind.INVALID_NAME, "非法的节点名称：\"" + child.name() + "\""));
            }
            if (!seen.add(child.name())) {
                problems.add(problem(child, path, TreeProblem.Kind.DUPLICATE_NAME,
                        "目录 \"" + displayFolder(parentPath) + "\" 下存在重名节点：\"" + child.name() + "\""));
            }

            if (inherited == Operation.DELETE && child.hasOperation()) {
                problems.add(problem(child, path, TreeProblem.Kind.MARKER_INSIDE_DELETED_FOLDER,
                        "所在目录已标记删除，内部节点不能再带标记"));
            } else if (inherited == Operation.CREATE && child.hasOperation() && child.operation() != Operation.CREATE) {
                problems.add(problem(child, path, TreeProblem.Kind.MARKER_INSIDE_CREATED_FOLDER,
                        "所在目录将被新建，内部节点只能新建，不能" + (child.operation() == Operation.DELETE ? "删除" : "重命名")));
            }

            if (child.operation() == Operation.RENAME) {
                validateRenameTarget(child, path, renameTargets, problems);
            }

            Operation nextInherited = inherited != null ? inherited : child.operation();
            if (nextInherited == Operation.RENAME) {
                nextInherited = null;
            }
            if (child.kind() == NodeKind.FOLDER) {
                validateChildren(tree, child, path, nextInherited, problems);
            }
        }

        // 重命名目标不能撞上任何其他兄弟节点的现有名称
        for (Map.Entry<String, TreeNode> entry : renameTargets.entrySet()) {
            TreeNode renamed = entry.getValue();
            for (TreeNode sibling : children) {
                if (sibling != renamed && sibling.name().equals(entry.getKey())) {
                    problems.add(problem(renamed, parentPath.child(renamed.name()), TreeProblem.Kind.RENAME_COLLISION,
                            "重命名目标 \"" + entry.getKey() + "\" 与同目录下已有节点重名"));
                    break;
                }
            }
        }
    }

    private static void validateRenameTarget(
            TreeNode node,
            TreePath path,
            Map<String, TreeNode> renameTargets,
            List<TreeProblem> problems
    ) {
        String target = node.renameTarget();
        if (target == null || target.isBlank()) {
            problems.add(problem(node, path, TreeProblem.Kind.RENAME_TARGET_MISSING, "重命名缺少目标名称"));
            return;
        }
        if (!PathSafety.isValidName(target)) {
            problems.add(problem(node, path, TreeProblem.Kind.INVALID_RENAME_TARGET, "非法的重命名目标：\"" + target + "\""));
            return;
        }
        if (target.equals(node.name())) {
            problems.add(problem(node, path, TreeProblem.Kind.RENAME_TARGET_UNCHANGED, "重命名目标与原名称相同：\"" + target + "\""));
            return;
        }
        TreeNode previous = renameTargets.putIfAbsent(target, node);
        if (previous != null) {
            problems.add(problem(node, path, TreeProblem.Kind.RENAME_COLLISION,
                    "重命名目标 \"" + target + "\" 与 \"" + previous.name() + "\" 的重命名目标相同"));
        }
    }

    private static TreeProblem problem(TreeNode node, TreePath path, TreeProblem.Kind kind, String message) {
        return new TreeProblem(node.sourceLine(), path, kind, message);
    }

    private static String displayFolder(TreePath path) {
        return path.isRoot() ? "." : path.toString();
    }
}
