package org.treeforge.filesystem;

import org.treeforge.tree.PathSafety;
import org.treeforge.tree.Tree;
import org.treeforge.tree.TreeNode;
import org.treeforge.tree.TreePath;
import org.treeforge.tree.TreeSerializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 通过 {@link FilesystemProvider#listDirectory} 递归扫描声明根目录，得到未标记的 {@link Tree}。
 * <p>
 * 同一目录下目录在前、文件在后，各自按名称排序，保证生成的文本稳定。
 * 名称不满足 {@link PathSafety#isValidName}，或无法经 {@link TreeSerializer#isExpressible} 原样往返的条目，
 * 扫描时连同其子树一起跳过并给出告警。
 */
public class FilesystemScanner {

    private static final Comparator<DirectoryEntry> ENTRY_ORDER = Comparator
            .comparing((DirectoryEntry e) -> !e.kind().isFolder())
            .thenComparing(DirectoryEntry::name);

    private final IgnorePatterns ignorePatterns;
    private final int maxEntries;

    public FilesystemScanner(IgnorePatterns ignorePatterns, int maxEntries) {
        this.ignorePatterns = ignorePatterns;
        this.maxEntries = maxEntries;
    }

    public ScanResult scan(FilesystemProvider provider, String rootName) throws IOException {
        Tree tree = new Tree(rootName);
        List<String> warnings = new ArrayList<>();
        scanFolder(provider, tree, tree.root(), TreePath.root(), warnings);
        return new ScanResult(tree, warnings);
    }

    private void scanFolder(
            FilesystemProvider provider,
            Tree tree,
            TreeNode folder,
            TreePath folderPath,
            List<String> warnings
    ) throws IOException {
        List<DirectoryEntry> entries = new ArrayList<>(provider.listDirectory(folderPath));
        entries.sort(ENTRY_ORDER);
        for (DirectoryEntry entry : entries) {
            TreePath childPath = folderPath.child(entry.name());
            if (ignorePatterns.isIgnored(childPath)) {
                continue;
            }
            if (!PathSafety.isValidName(entry.name())) {
                warnings.add("名称包含不支持的字符，已跳过：" + childPath);
                continue;
            }
            if (!TreeSerializer.isExpressible(entry.name(), entry.kind())) {
                warnings.add("名称无法在树形文本中原样表示（含标记记号、首尾空白或连接符），已跳过：" + childPath);
                continue;
            }
            if (tree.size() - 1 >= maxEntries) {
                throw new IllegalStateException("扫描条目数超过上限 " + maxEntries + "（tree-forge.scan-max-entries）；请缩小根目录范围或增加忽略规则");
            }
            TreeNode child = tree.add(folder, entry.name(), entry.kind(), 0);
            if (entry.kind().isFolder()) {
                scanFolder(provider, tree, child, childPath, warnings);
            }
        }
    }

    /**
     * 扫描结果。
     *
     * @param tree     未标记的树（根名称为声明根目录名）
     * @param warnings 非致命告警（例如跳过了无法表达的名称）
     */
    public record ScanResult(Tree tree, List<String> warnings) {

        public List<TreePath> paths() {
            return tree.allPaths();
        }
    }
}
