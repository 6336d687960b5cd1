package org.treeforge.tree;

/**
 * 一条带行号的解析错误。
 *
 * @param line    行号（1-based；与具体行无关的错误为 0）
 * @param text    出错的原始行文本（与具体行无关时为空串）
 * @param kind    错误类别
 * @param message 面向用户的说明
 */
public record ParseProblem(
        int line,
        String text,
        Kind kind,
        String message
) {

    public enum Kind {
        INDENTATION,
        MULTIPLE_MARKERS,
        RENAME_TARGET_MISSING,
        MALFORMED_MARKER,
        INVALID_NAME,
        INVALID_RENAME_TARGET,
        NESTED_UNDER_FILE,
        DUPLICATE_NAME,
        CONFLICTING_OPERATIONS,
        EMPTY_DOCUMENT
    }

    public String describe() {
        if (line <= 0) {
            return message;
        }
        return "第 " + line + " 行：" + message + "（" + text.strip() + "）";
    }
}
