package org.treeforge.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 带操作标记的缩进文本 -> {@link Tree}。
 * <p>
 * 文本格式：
 * <ul>
 *   <li>每行一个节点；缩进以 4 列为一级，{@code "│   "}、4 个空格、{@code "├── "}、{@code "└── "} 各算一级，Tab 也算一级。</li>
 *   <li>名称以 {@code /} 结尾表示目录。</li>
 *   <li>行尾标记（前面恰好一个空格）：{@code [+]} 新建、{@code [-]} 删除、{@code [~ newName]} 重命名；一行最多一个标记。</li>
 * </ul>
 * <p>
 * 只解析“看起来像树条目”的行（白名单）：
 * <ul>
 *   <li>带有树形连接符（{@code ├ └ │}）的行；</li>
 *   <li>或者去掉标记后是单个不含空白的记号，且以 {@code /} 结尾或带扩展名。</li>
 * </ul>
 * 空行、{@code #} 开头的标题/注释、{@code <!--} 注释、代码围栏以及其它说明文字一律跳过，不会被误当成节点。
 * <p>
 * 全部错误都会被收集并带行号返回；只有零错误时才返回树。
 */
public final class TreeParser {

    public static final int INDENT_WIDTH = 4;

    private static final Pattern MARKER = Pattern.compile("\\[\\+]|\\[-]|\\[~[^\\]]*]");
    private static final Pattern HAS_EXTENSION = Pattern.compile(".*\\.\\w+");

    private TreeParser() {
    }

    public static ParseResult parse(String content) {
        List<ParseProblem> problems = new ArrayList<>();
        List<EntryLine> entries = new ArrayList<>();

        String[] lines = (content == null) ? new String[0] : content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String raw = stripCarriageReturn(lines[i]);
            EntryLine entry = readLine(raw, i + 1, problems);
            if (entry != null) {
                entries.add(entry);
            }
        }

        if (!problems.isEmpty()) {
            return ParseResult.failure(problems);
        }
        if (entries.isEmpty()) {
            return ParseResult.failure(List.of(new ParseProblem(0, "", ParseProblem.Kind.EMPTY_DOCUMENT, "没有找到任何树条目")));
        }

        Tree tree = buildTree(entries, problems);
        if (!problems.isEmpty()) {
            return ParseResult.failure(problems);
        }

        for (TreeProblem problem : TreeValidator.validate(tree)) {
            String text = problem.line() > 0 ? stripCarriageReturn(lines[problem.line() - 1]) : "";
            problems.add(new ParseProblem(problem.line(), text, toParseKind(problem.kind()), problem.message()));
        }
        if (!problems.isEmpty()) {
            return ParseResult.failure(problems);
        }
        return ParseResult.success(tree);
    }

    /**
     * 解析；失败时抛出带全部错误的 {@link org.treeforge.exception.TreeParseException}。
     */
    public static Tree parseOrThrow(String content) {
        return parse(content).treeOrThrow();
    }

    private static EntryLine readLine(String raw, int lineNumber, List<ParseProblem> problems) {
        String trimmed = raw.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("<!--") || trimmed.startsWith("```")) {
            return null;
        }

        int prefixEnd = 0;
        int width = 0;
        boolean connector = false;
        while (prefixEnd < raw.length()) {
            char c = raw.charAt(prefixEnd);
            if (c == '\t') {
                width += INDENT_WIDTH;
            } else if (c == ' ' || c == '\u00A0' || c == '─') {
                width += 1;
            } else if (c == '│' || c == '├' || c == '└') {
                width += 1;
                connector = true;
            } else {
                break;
            }
            prefixEnd++;
        }

        String entry = raw.substring(prefixEnd).stripTrailing();
        if (entry.isEmpty()) {
            // 只有竖线的分隔行
            return null;
        }

        if (!connector && !looksLikeEntry(entry)) {
            return null;
        }

        Matcher matcher = MARKER.matcher(entry);
        int markerCount = 0;
        int markerStart = -1;
        int markerEnd = -1;
        while (matcher.find()) {
            markerCount++;
            markerStart = matcher.start();
            markerEnd = matcher.end();
        }
        if (markerCount > 1) {
            problems.add(new ParseProblem(lineNumber, raw, ParseProblem.Kind.MULTIPLE_MARKERS, "一行只能有一个操作标记"));
            return null;
        }

        String name = entry;
        Operation operation = null;
        String renameTarget = null;
        if (markerCount == 1) {
            if (markerEnd != entry.length()) {
                problems.add(new ParseProblem(lineNumber, raw, ParseProblem.Kind.MALFORMED_MARKER, "操作标记必须位于行尾"));
                return null;
            }
            if (markerStart < 2 || entry.charAt(markerStart - 1) != ' ' || Character.isWhitespace(entry.charAt(markerStart - 2))) {
                problems.add(new ParseProblem(lineNumber, raw, ParseProblem.Kind.MALFORMED_MARKER, "操作标记前必须恰好有一个空格"));
                return null;
            }
            String token = entry.substring(markerStart, markerEnd);
            name = entry.substring(0, markerStart - 1);
            if ("[+]".equals(token)) {
                operation = Operation.CREATE;
            } else if ("[-]".equals(token)) {
                operation = Operation.DELETE;
            } else {
                String inner = token.substring(2, token.length() - 1);
                if (inner.isBlank()) {
                    problems.add(new ParseProblem(lineNumber, raw, ParseProblem.Kind.RENAME_TARGET_MISSING, "重命名标记缺少目标名称"));
                    return null;
                }
                if (inner.charAt(0) != ' ') {
                    problems.add(new ParseProblem(lineNumber, raw, ParseProblem.Kind.MALFORMED_MARKER, "重命名标记格式应为 [~ 新名称]"));
                    return null;
                }
                operation = Operation.RENAME;
                renameTarget = inner.strip();
            }
        }

        boolean folder = name.endsWith("/");
        String cleanName = folder ? name.substring(0, name.length() - 1) : name;
        if (cleanName.isEmpty()) {
            problems.add(new ParseProblem(lineNumber, raw, ParseProblem.Kind.INVALID_NAME, "节点名称为空"));
            return null;
        }
        if (!PathSafety.isValidName(cleanName)) {
            problems.add(new ParseProblem(lineNumber, raw, ParseProblem.Kind.INVALID_NAME, "非法的节点名称：\"" + cleanName + "\""));
            return null;
        }
        if (renameTarget != null) {
            if (folder && renameTarget.endsWith("/")) {
                renameTarget = renameTarget.substring(0, renameTarget.length() - 1);
            }
            if (!PathSafety.isValidName(renameTarget)) {
                problems.add(new ParseProblem(lineNumber, raw, ParseProblem.Kind.INVALID_RENAME_TARGET, "非法的重命名目标：\"" + renameTarget + "\""));
                return null;
            }
        }

        if (width % INDENT_WIDTH != 0) {
            problems.add(new ParseProblem(lineNumber, raw, ParseProblem.Kind.INDENTATION,
                    "缩进宽度 " + width + " 不是 " + INDENT_WIDTH + " 的整数倍"));
            return null;
        }

        return new EntryLine(lineNumber, raw, width / INDENT_WIDTH, cleanName,
                folder ? NodeKind.FOLDER : NodeKind.FILE, operation, renameTarget);
    }

    /**
     * 没有树形连接符的行：去掉所有标记后必须是单个记号，且以 / 结尾或带扩展名。
     */
    private static boolean looksLikeEntry(String entry) {
        String bare = MARKER.matcher(entry).replaceAll("").strip();
        if (bare.isEmpty()) {
            return false;
        }
        for (int i = 0; i < bare.length(); i++) {
            if (Character.isWhitespace(bare.charAt(i))) {
                return false;
            }
        }
        return bare.endsWith("/") || HAS_EXTENSION.matcher(bare).matches();
    }

    private static Tree buildTree(List<EntryLine> entries, List<ParseProblem> problems) {
        Tree tree = new Tree();
        int base = entries.get(0).depth();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(tree.root(), base - 1));

        for (EntryLine entry : entries) {
            if (entry.depth() < base) {
                problems.add(new ParseProblem(entry.lineNumber(), entry.raw(), ParseProblem.Kind.INDENTATION,
                        "缩进比第一个条目更浅，无法确定父节点"));
                continue;
            }
            while (stack.peek().depth() >= entry.depth()) {
                stack.pop();
            }
            Frame parent = stack.peek();
            if (entry.depth() > parent.depth() + 1) {
                problems.add(new ParseProblem(entry.lineNumber(), entry.raw(), ParseProblem.Kind.INDENTATION,
                        "缩进跳级（比父节点深 " + (entry.depth() - parent.depth()) + " 级），无法确定父节点"));
                continue;
            }
            if (parent.node().kind() != NodeKind.FOLDER) {
                problems.add(new ParseProblem(entry.lineNumber(), entry.raw(), ParseProblem.Kind.NESTED_UNDER_FILE,
                        "不能在文件 \"" + parent.node().name() + "\" 下添加子节点"));
                continue;
            }

            TreeNode node = tree.add(parent.node(), entry.name(), entry.kind(), entry.lineNumber());
            if (entry.operation() != null) {
                tree.mark(node, entry.operation(), entry.renameTarget());
            }
            stack.push(new Frame(node, entry.depth()));
        }
        return tree;
    }

    private static ParseProblem.Kind toParseKind(TreeProblem.Kind kind) {
        return switch (kind) {
            case INVALID_NAME -> ParseProblem.Kind.INVALID_NAME;
            case DUPLICATE_NAME -> ParseProblem.Kind.DUPLICATE_NAME;
            case RENAME_TARGET_MISSING -> ParseProblem.Kind.RENAME_TARGET_MISSING;
            case INVALID_RENAME_TARGET, RENAME_TARGET_UNCHANGED, RENAME_COLLISION -> ParseProblem.Kind.INVALID_RENAME_TARGET;
            case MARKER_INSIDE_DELETED_FOLDER, MARKER_INSIDE_CREATED_FOLDER, ROOT_OPERATION -> ParseProblem.Kind.CONFLICTING_OPERATIONS;
        };
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private record EntryLine(
            int lineNumber,
            String raw,
            int depth,
            String name,
            NodeKind kind,
            Operation operation,
            String renameTarget
    ) {
    }

    private record Frame(TreeNode node, int depth) {
    }
}
