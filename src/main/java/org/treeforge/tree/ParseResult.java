package org.treeforge.tree;

import org.treeforge.exception.TreeParseException;

import java.util.List;

/**
 * 解析结果：要么得到一棵树且没有任何错误，要么没有树且带全部错误。
 *
 * @param tree     解析得到的树（存在错误时为 null）
 * @param problems 全部解析错误（成功时为空列表）
 */
public record ParseResult(
        Tree tree,
        List<ParseProblem> problems
) {

    public static ParseResult success(Tree tree) {
        return new ParseResult(tree, List.of());
    }

    public static ParseResult failure(List<ParseProblem> problems) {
        return new ParseResult(null, List.copyOf(problems));
    }

    public boolean isSuccess() {
        return tree != null && problems.isEmpty();
    }

    public Tree treeOrThrow() {
        if (!isSuccess()) {
            throw new TreeParseException(problems);
        }
        return tree;
    }
}
