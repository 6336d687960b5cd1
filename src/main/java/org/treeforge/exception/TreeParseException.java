package org.treeforge.exception;

import org.treeforge.tree.ParseProblem;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 文本解析失败：携带全部（而不只是第一个）带行号的问题。
 */
public class TreeParseException extends TreeForgeException {

    private final List<ParseProblem> problems;

    public TreeParseException(List<ParseProblem> problems) {
        super(describe(problems));
        this.problems = List.copyOf(problems);
    }

    public List<ParseProblem> getProblems() {
        return problems;
    }

    private static String describe(List<ParseProblem> problems) {
        return "解析失败（" + problems.size() + " 处错误）：\n" + problems.stream()
                .map(ParseProblem::describe)
                .collect(Collectors.joining("\n"));
    }
}
