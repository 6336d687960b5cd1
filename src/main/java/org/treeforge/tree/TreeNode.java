package org.treeforge.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 树中的一个节点。节点存放在 {@link Tree} 的数组中，子节点以下标引用。
 * <p>
 * 结构字段（父子关系、操作标记）只能通过 {@link Tree} 修改。
 */
public final class TreeNode {

    private final int id;
    private final int parentId;
    private final String name;
    private final NodeKind kind;
    private final int sourceLine;
    private final List<Integer> children = new ArrayList<>();
    private Operation operation;
    private String renameTarget;

    TreeNode(int id, int parentId, String name, NodeKind kind, int sourceLine) {
        this.id = id;
        this.parentId = parentId;
        this.name = name;
        this.kind = kind;
        this.sourceLine = sourceLine;
    }

    public int id() {
        return id;
    }

    /**
     * 父节点下标；根节点为 -1。
     */
    public int parentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId < 0;
    }

    public String name() {
        return name;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * 解析来源行号（1-based）；扫描得到的节点为 0。
     */
    public int sourceLine() {
        return sourceLine;
    }

    public List<Integer> children() {
        return Collections.unmodifiableList(children);
    }

    public Operation operation() {
        return operation;
    }

    public String renameTarget() {
        return renameTarget;
    }

    public boolean hasOperation() {
        return operation != null;
    }

    void addChild(int childId) {
        children.add(childId);
    }

    void mark(Operation operation, String renameTarget) {
        this.operation = operation;
        this.renameTarget = renameTarget;
    }
}
