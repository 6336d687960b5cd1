package org.treeforge.tree;

import java.util.List;

/**
 * {@link Tree} -> 树形文本（{@link TreeParser} 的逆过程）。
 * <p>
 * 输出示例：
 * <pre>
 * ├── src/
 * │   ├── a.txt
 * │   └── b.txt [+]
 * └── README.md
 * </pre>
 * 每一级都带连接符（包括第一级），保证没有扩展名的文件也能被解析器识别；
 * 未标记的树经过“序列化 -> 解析 -> 序列化”后逐字节不变。
 */
public final class TreeSerializer {

    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String PIPE = "│   ";
    private static final String BLANK = "    ";

    private TreeSerializer() {
    }

    public static String serialize(Tree tree) {
        StringBuilder out = new StringBuilder();
        appendChildren(tree, tree.root(), "", out);
        return out.toString();
    }

    /**
     * 生成给用户编辑的完整文档：标题 + 标记说明 + 树。标题与说明行都会被解析器跳过。
     */
    public static String render(Tree tree, String title) {
        StringBuilder out = new StringBuilder();
        out.append("# ").append(title).append("\n\n");
        out.append("<!-- 标记：[+] 新建  [-] 删除  [~ 新名称] 重命名；目录以 / 结尾；一行只能有一个标记 -->\n\n");
        out.append(serialize(tree));
        return out.toString();
    }

    /**
     * 名称能否在树形文本中原样表达：单节点树序列化后再解析，必须得到同名、同类型且不带标记的节点。
     * <p>
     * 合法但无法表达的名称（例如以 {@code " [+]"} 结尾、含标记记号、首尾空白、以连接符开头）由扫描器跳过。
     */
    public static boolean isExpressible(String name, NodeKind kind) {
        if (!PathSafety.isValidName(name)) {
            return false;
        }
        Tree single = new Tree();
        single.add(single.root(), name, kind, 0);
        ParseResult parsed = TreeParser.parse(serialize(single));
        if (!parsed.isSuccess()) {
            return false;
        }
        Tree tree = parsed.tree();
        List<TreeNode> children = tree.children(tree.root());
        if (children.size() != 1) {
            return false;
        }
        TreeNode node = children.get(0);
        return node.name().equals(name)
                && node.kind() == kind
                && !node.hasOperation()
                && tree.children(node).isEmpty();
    }

    private static void appendChildren(Tree tree, TreeNode parent, String indent, StringBuilder out) {
        List<TreeNode> children = tree.children(parent);
        for (int i = 0; i < children.size(); i++) {
            TreeNode child = children.get(i);
            boolean last = i == children.size() - 1;
            out.append(indent).append(last ? LAST_BRANCH : BRANCH).append(child.name());
            if (child.kind() == NodeKind.FOLDER) {
                out.append('/');
            }
            if (child.hasOperation()) {
                out.append(' ').append(child.operation().marker(child.renameTarget()));
            }
            out.append('\n');
            if (child.kind() == NodeKind.FOLDER) {
                appendChildren(tree, child, indent + (last ? BLANK : PIPE), out);
            }
        }
    }
}
