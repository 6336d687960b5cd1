package org.treeforge.filesystem;

import org.treeforge.exception.PathSafetyException;
import org.treeforge.filesystem.dto.AllowedRoot;
import org.treeforge.tree.PathSafety;
import org.treeforge.tree.TreePath;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 安全路径解析器：
 * <ul>
 *   <li>{@link #resolve}：把工具调用传入的 rootId + 路径解析为白名单（{@code tree-forge.roots}）内的“声明根目录”。</li>
 *   <li>{@link #resolveWithin}：把树中的相对路径解析为声明根目录下的绝对路径，供执行阶段使用。</li>
 * </ul>
 * <p>
 * 两者都会阻止路径穿越，并对已存在的各级路径做 realPath 校验，
 * 防止中间某一级是 symlink/junction 导致逃逸（默认不允许符号链接，见 {@code tree-forge.allow-symlink}）。
 * 目标路径可能尚不存在（新建、重命名目标），因此只校验已存在的前缀。
 */
public class SecurePathResolver {

    private final TreeForgeProperties properties;
    private final List<Root> roots;

    public SecurePathResolver(TreeForgeProperties properties) {
        this.properties = properties;
        this.roots = normalizeRoots(properties);
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.rootPath().toString()));
        }
        return result;
    }

    /**
     * 解析声明根目录：必须存在、是目录，且位于白名单内。
     */
    public ResolvedPath resolve(String rootId, String inputPath) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（tree-forge.roots）");
        }

        Path rawPath = (inputPath == null || inputPath.isBlank()) ? null : Path.of(inputPath);
        Root selectedRoot;
        Path absolute;

        // 绝对路径：找“最匹配”的 root（路径层级最长）；相对路径：从 rootId 指定的 root 解析，缺省为 root0
        if (rawPath != null && rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = (rawPath == null) ? selectedRoot.rootPath() : selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new PathSafetyException("路径不在允许访问的根目录范围内：" + inputPath, inputPath);
        }
        if (!Files.isDirectory(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不是目录：" + absolute);
        }
        validateWithinRoot(selectedRoot.rootPath(), absolute);

        return new ResolvedPath(selectedRoot.id(), selectedRoot.rootPath(), absolute, displayPath(selectedRoot.rootPath(), absolute));
    }

    /**
     * 把树中的相对路径解析到声明根目录之下（名称与越界规则由 {@link PathSafety} 负责，链接逃逸在这里校验）。
     */
    public Path resolveWithin(Path declaredRoot, TreePath path) {
        PathSafety.requireSafe(path, declaredRoot);
        Path root = declaredRoot.toAbsolutePath().normalize();
        Path absolute = path.isRoot() ? root : root.resolve(path.toString()).normalize();
        validateWithinRoot(root, absolute);
        return absolute;
    }

    private void validateWithinRoot(Path root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root, e);
        }

        // 对 root -> 目标路径 的逐级路径做 realPath 校验，防止中间某一级是 junction/symlink
        Path current = root;
        for (Path segment : root.relativize(absolute)) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (Files.isSymbolicLink(current)) {
                if (!properties.isAllowSymlink()) {
                    throw new PathSafetyException("不允许访问符号链接路径：" + current, current.toString());
                }
                if (current.equals(absolute)) {
                    // 目标本身是链接：只操作链接本身，不跟随
                    break;
                }
            }
            try {
                Path realCurrent = current.toRealPath();
                if (!realCurrent.startsWith(rootReal)) {
                    throw new PathSafetyException("路径通过链接/junction 逃逸出根目录：" + current, current.toString());
                }
            } catch (IOException e) {
                throw new PathSafetyException("路径无法解析：" + current + "（" + e.getMessage() + "）", current.toString());
            }
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new PathSafetyException("路径不在允许访问的根目录范围内：" + absolute, absolute.toString()));
    }

    private static List<Root> normalizeRoots(TreeForgeProperties properties) {
        List<String> configured = properties.getRoots();
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 tree-forge.roots[" + i + "] 不能为空");
            Path path = Path.of(value).toAbsolutePath().normalize();
            result.add(new Root("root" + i, path));
        }
        return result;
    }

    private static String displayPath(Path root, Path absolute) {
        String relative = root.relativize(absolute).toString().replace('\\', '/');
        return relative.isEmpty() ? "." : relative;
    }

    private record Root(String id, Path rootPath) {
    }

    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
