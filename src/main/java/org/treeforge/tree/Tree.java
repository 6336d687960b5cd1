package org.treeforge.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * 声明式目录结构：以数组存放全部节点，下标 0 为根。
 * <p>
 * 根节点是不可变的声明根目录：它的名称不参与路径拼接，子节点路径都相对于它。
 * 一棵树由单个编辑会话独占，构建完成后只读使用。
 */
public final class Tree {

    public static final String DEFAULT_ROOT_NAME = "root";

    private final List<TreeNode> nodes = new ArrayList<>();

    public Tree() {
        this(DEFAULT_ROOT_NAME);
    }

    public Tree(String rootName) {
        nodes.add(new TreeNode(0, -1, rootName, NodeKind.FOLDER, 0));
    }

    public TreeNode root() {
        return nodes.get(0);
    }

    public TreeNode node(int id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    public List<TreeNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<TreeNode> children(TreeNode parent) {
        List<TreeNode> result = new ArrayList<>(parent.children().size());
        for (int childId : parent.children()) {
            result.add(nodes.get(childId));
        }
        return result;
    }

    public TreeNode addFile(TreeNode parent, String name) {
        return add(parent, name, NodeKind.FILE, 0);
    }

    public TreeNode addFolder(TreeNode parent, String name) {
        return add(parent, name, NodeKind.FOLDER, 0);
    }

    /**
     * 在 parent 下追加一个子节点。
     * <p>
     * 这里不校验名称与重名（由 {@link TreeValidator} 统一报告），只拒绝在文件下挂子节点。
     */
    public TreeNode add(TreeNode parent, String name, NodeKind kind, int sourceLine) {
        if (parent.kind() != NodeKind.FOLDER) {
            throw new IllegalArgumentException("文件节点不能包含子节点：" + pathOf(parent));
        }
        TreeNode node = new TreeNode(nodes.size(), parent.id(), name, kind, sourceLine);
        nodes.add(node);
        parent.addChild(node.id());
        return node;
    }

    /**
     * 设置节点操作标记（覆盖原有标记；一个节点只有一个操作）。
     *
     * @param renameTarget 仅在 {@link Operation#RENAME} 时有意义，其余操作应为 null
     */
    public void mark(TreeNode node, Operation operation, String renameTarget) {
        node.mark(operation, operation == Operation.RENAME ? renameTarget : null);
    }

    public TreePath pathOf(TreeNode node) {
        List<String> reversed = new ArrayList<>();
        TreeNode current = node;
        while (!current.isRoot()) {
            reversed.add(current.name());
            current = nodes.get(current.parentId());
        }
        Collections.reverse(reversed);
        return TreePath.of(reversed);
    }

    /**
     * 先序遍历除根以外的所有节点，同时给出解析后的路径。
     */
    public void walk(BiConsumer<TreeNode, TreePath> visitor) {
        walk(root(), TreePath.root(), visitor);
    }

    private void walk(TreeNode parent, TreePath parentPath, BiConsumer<TreeNode, TreePath> visitor) {
        for (int childId : parent.children()) {
            TreeNode child = nodes.get(childId);
            TreePath childPath = parentPath.child(child.name());
            visitor.accept(child, childPath);
            walk(child, childPath, visitor);
        }
    }

    /**
     * 是否存在任何操作标记（含根）。
     */
    public boolean hasOperations() {
        for (TreeNode node : nodes) {
            if (node.hasOperation()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 全部节点路径（不含根），按自然顺序排序。
     */
    public List<TreePath> allPaths() {
        List<TreePath> paths = new ArrayList<>(nodes.size());
        walk((node, path) -> paths.add(path));
        Collections.sort(paths);
        return paths;
    }
}
