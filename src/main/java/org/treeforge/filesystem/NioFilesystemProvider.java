package org.treeforge.filesystem;

import org.treeforge.tree.NodeKind;
import org.treeforge.tree.TreePath;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 {@code java.nio.file} 的 {@link FilesystemProvider}，绑定在一个声明根目录上。
 * <p>
 * 每次操作前都经 {@link SecurePathResolver#resolveWithin} 解析路径（越界/链接逃逸校验）。
 * 符号链接不跟随：列目录时按文件处理，删除时只删除链接本身。
 */
public class NioFilesystemProvider implements FilesystemProvider {

    private final Path root;
    private final SecurePathResolver pathResolver;

    public NioFilesystemProvider(Path root, SecurePathResolver pathResolver) {
        this.root = root.toAbsolutePath().normalize();
        this.pathResolver = pathResolver;
    }

    public Path root() {
        return root;
    }

    @Override
    public List<DirectoryEntry> listDirectory(TreePath path) throws IOException {
        Path dir = pathResolver.resolveWithin(root, path);
        List<DirectoryEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                boolean directory = Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS);
                entries.add(new DirectoryEntry(child.getFileName().toString(), directory ? NodeKind.FOLDER : NodeKind.FILE));
            }
        }
        return entries;
    }

    @Override
    public void createFile(TreePath path) throws IOException {
        Files.createFile(pathResolver.resolveWithin(root, path));
    }

    @Override
    public void createFolder(TreePath path) throws IOException {
        Files.createDirectory(pathResolver.resolveWithin(root, path));
    }

    @Override
    public void rename(TreePath oldPath, TreePath newPath) throws IOException {
        Path source = pathResolver.resolveWithin(root, oldPath);
        Path target = pathResolver.resolveWithin(root, newPath);
        if (!Files.exists(source, LinkOption.NOFOLLOW_LINKS)) {
            throw new NoSuchFileException(source.toString(), null, "重命名源不存在");
        }
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new FileAlreadyExistsException(target.toString(), null, "重命名目标已存在，不会覆盖");
        }
        Path parent = target.getParent();
        if (parent != null && !Files.isDirectory(parent, LinkOption.NOFOLLOW_LINKS)) {
            Files.createDirectories(parent);
        }
        // 不带 REPLACE_EXISTING：并发出现的同名目标同样会让 move 失败
        Files.move(source, target);
    }

    @Override
    public void deleteRecursive(TreePath path) throws IOException {
        Path target = pathResolver.resolveWithin(root, path);
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new NoSuchFileException(target.toString(), null, "待删除路径不存在");
        }
        if (!Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
            Files.delete(target);
            return;
        }
        // walkFileTree 默认不跟随符号链接：链接作为普通条目在 visitFile 中删除
        Files.walkFileTree(target, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
