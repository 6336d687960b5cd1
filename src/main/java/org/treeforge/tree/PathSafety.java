package org.treeforge.tree;

import org.treeforge.exception.PathSafetyException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * 路径安全校验：用户声明的结构与磁盘变更之间唯一的闸门。
 * <p>
 * 规则：
 * <ul>
 *   <li>{@link #isSafe}：拒绝绝对路径；把相对路径解析到 root 下并 normalize，结果必须仍以 root 为前缀。
 *       以解析结果为准，而不是在字符串上查找 {@code ..}（名称中可以合法地包含 {@code ..}，例如 {@code a..b}）。</li>
 *   <li>{@link #isValidName}：拒绝空白、{@code .}、{@code ..}、路径分隔符、{@code < > : " | ? *} 与控制字符。</li>
 * </ul>
 * 这里的规则不受任何配置影响。
 */
public final class PathSafety {

    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[<>:\"|?*\\x00-\\x1F]");

    private PathSafety() {
    }

    public static boolean isValidName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        if (".".equals(name) || "..".equals(name)) {
            return false;
        }
        if (name.indexOf('/') >= 0 || name.indexOf('\\') >= 0) {
            return false;
        }
        return !INVALID_NAME_CHARS.matcher(name).find();
    }

    public static boolean isSafe(String relativePath, Path root) {
        if (relativePath == null || root == null) {
            return false;
        }
        Path rootNormalized = root.toAbsolutePath().normalize();
        Path relative;
        try {
            relative = Path.of(relativePath);
        } catch (InvalidPathException e) {
            return false;
        }
        if (relative.isAbsolute() || relativePath.startsWith("/") || relativePath.startsWith("\\")) {
            return false;
        }
        Path resolved = rootNormalized.resolve(relative).normalize();
        return resolved.startsWith(rootNormalized);
    }

    public static boolean isSafe(TreePath path, Path root) {
        for (String segment : path.segments()) {
            if (!isValidName(segment)) {
                return false;
            }
        }
        return isSafe(path.toString(), root);
    }

    /**
     * 失败即抛出的版本：名称不合法或越出 root 时抛出 {@link PathSafetyException}。
     */
    public static void requireSafe(TreePath path, Path root) {
        for (String segment : path.segments()) {
            requireValidName(segment);
        }
        if (!isSafe(path.toString(), root)) {
            throw new PathSafetyException("路径越出声明的根目录：" + path, path.toString());
        }
    }

    public static void requireValidName(String name) {
        if (!isValidName(name)) {
            throw new PathSafetyException("非法的节点名称：\"" + name + "\"", name);
        }
    }
}
