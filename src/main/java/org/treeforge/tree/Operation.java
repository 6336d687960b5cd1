package org.treeforge.tree;

/**
 * 节点上声明的操作标记。
 * <p>
 * 文本中的写法（位于行尾，前面恰好一个空格）：
 * <ul>
 *   <li>{@code [+]} 新建</li>
 *   <li>{@code [-]} 删除</li>
 *   <li>{@code [~ newName]} 重命名</li>
 * </ul>
 * 未标记的节点表示“保持不变，必须与磁盘现状一致”。
 */
public enum Operation {
    CREATE,
    DELETE,
    RENAME;

    /**
     * 生成行尾标记文本（不含前导空格）。
     */
    public String marker(String renameTarget) {
        return switch (this) {
            case CREATE -> "[+]";
            case DELETE -> "[-]";
            case RENAME -> "[~ " + renameTarget + "]";
        };
    }
}
