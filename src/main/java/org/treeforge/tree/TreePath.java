package org.treeforge.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 相对声明根目录的路径：从根到节点的名称序列（根本身为空序列）。
 * <p>
 * 展示与比较时统一使用 {@code /} 分隔；自然顺序为逐段字典序，前缀更短者在前，
 * 用于在同深度的记录之间得到确定的排列。
 */
public final class TreePath implements Comparable<TreePath> {

    private static final TreePath ROOT = new TreePath(List.of());

    private final List<String> segments;

    private TreePath(List<String> segments) {
        this.segments = segments;
    }

    public static TreePath root() {
        return ROOT;
    }

    public static TreePath of(String... segments) {
        return of(List.of(segments));
    }

    public static TreePath of(List<String> segments) {
        if (segments.isEmpty()) {
            return ROOT;
        }
        for (String segment : segments) {
            Objects.requireNonNull(segment, "路径段不能为 null");
        }
        return new TreePath(List.copyOf(segments));
    }

    /**
     * 解析以 {@code /}（或 {@code \}）分隔的相对路径；空串或 {@code .} 表示根。
     */
    public static TreePath parse(String path) {
        if (path == null || path.isBlank() || ".".equals(path)) {
            return ROOT;
        }
        List<String> result = new ArrayList<>();
        for (String part : path.replace('\\', '/').split("/")) {
            if (!part.isEmpty()) {
                result.add(part);
            }
        }
        return of(result);
    }

    public List<String> segments() {
        return segments;
    }

    public int depth() {
        return segments.size();
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public String name() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    public TreePath parent() {
        if (segments.size() <= 1) {
            return ROOT;
        }
        return new TreePath(segments.subList(0, segments.size() - 1));
    }

    public TreePath child(String name) {
        List<String> result = new ArrayList<>(segments.size() + 1);
        result.addAll(segments);
        result.add(name);
        return of(result);
    }

    /**
     * 同一父目录下替换最后一段（重命名目标路径）。
     */
    public TreePath withLastSegment(String name) {
        if (segments.isEmpty()) {
            throw new IllegalStateException("根路径没有可替换的最后一段");
        }
        return parent().child(name);
    }

    /**
     * 是否为 {@code ancestor} 的严格后代。
     */
    public boolean isDescendantOf(TreePath ancestor) {
        if (ancestor.segments.size() >= segments.size()) {
            return false;
        }
        return segments.subList(0, ancestor.segments.size()).equals(ancestor.segments);
    }

    /**
     * 把前缀 {@code from} 替换为 {@code to}（要求本路径等于 from 或是其后代）。
     */
    public TreePath rebase(TreePath from, TreePath to) {
        if (!equals(from) && !isDescendantOf(from)) {
            throw new IllegalArgumentException("路径 " + this + " 不在 " + from + " 之下");
        }
        List<String> result = new ArrayList<>(to.segments);
        result.addAll(segments.subList(from.segments.size(), segments.size()));
        return of(result);
    }

    @Override
    public int compareTo(TreePath other) {
        int common = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < common; i++) {
            int cmp = segments.get(i).compareTo(other.segments.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TreePath other)) {
            return false;
        }
        return segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return String.join("/", segments);
    }
}
