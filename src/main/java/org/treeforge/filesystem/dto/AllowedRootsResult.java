package org.treeforge.filesystem.dto;

import java.util.List;

/**
 * {@code tree_list_roots} 的返回结果。
 *
 * @param roots 根目录白名单
 */
public record AllowedRootsResult(List<AllowedRoot> roots) {
}
