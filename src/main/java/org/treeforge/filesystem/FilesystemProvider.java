package org.treeforge.filesystem;

import org.treeforge.tree.TreePath;

import java.io.IOException;
import java.util.List;

/**
 * 磁盘操作的外部协作者。路径都相对于该 provider 所绑定的声明根目录。
 * <p>
 * 核心只在执行阶段调用写操作；{@link #listDirectory} 只用于扫描。
 */
public interface FilesystemProvider {

    List<DirectoryEntry> listDirectory(TreePath path) throws IOException;

    /**
     * 新建空文件；已存在时报错。
     */
    void createFile(TreePath path) throws IOException;

    /**
     * 新建目录（父目录必须已存在）；已存在时报错。
     */
    void createFolder(TreePath path) throws IOException;

    /**
     * 重命名；目标已存在时报错，绝不覆盖。目标父目录缺失时按需创建。
     */
    void rename(TreePath oldPath, TreePath newPath) throws IOException;

    /**
     * 递归删除（符号链接只删除链接本身）。
     */
    void deleteRecursive(TreePath path) throws IOException;
}
