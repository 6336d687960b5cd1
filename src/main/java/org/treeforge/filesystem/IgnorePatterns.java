package org.treeforge.filesystem;

import org.treeforge.tree.TreePath;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * 扫描时使用的忽略规则（名称或简单通配符）。
 * <p>
 * 不含 {@code /} 的模式：路径中任意一段的名称相等或 glob 匹配即忽略（例如 {@code node_modules}、{@code *.log}）。
 * 含 {@code /} 的模式：对完整相对路径做 glob 匹配（例如 {@code build/**}）。
 */
public final class IgnorePatterns {

    private final List<String> segmentNames = new ArrayList<>();
    private final List<PathMatcher> segmentMatchers = new ArrayList<>();
    private final List<PathMatcher> pathMatchers = new ArrayList<>();

    public IgnorePatterns(List<String> patterns) {
        if (patterns == null) {
            return;
        }
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            String trimmed = pattern.strip();
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + trimmed);
            if (trimmed.contains("/")) {
                pathMatchers.add(matcher);
            } else {
                segmentNames.add(trimmed);
                segmentMatchers.add(matcher);
            }
        }
    }

    public static IgnorePatterns none() {
        return new IgnorePatterns(List.of());
    }

    public boolean isIgnored(TreePath path) {
        for (String segment : path.segments()) {
            if (segmentNames.contains(segment)) {
                return true;
            }
            Path name = toPath(segment);
            if (name == null) {
                continue;
            }
            for (PathMatcher matcher : segmentMatchers) {
                if (matcher.matches(name)) {
                    return true;
                }
            }
        }
        if (!pathMatchers.isEmpty()) {
            Path relative = toPath(path.toString());
            if (relative != null) {
                for (PathMatcher matcher : pathMatchers) {
                    if (matcher.matches(relative)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static Path toPath(String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
