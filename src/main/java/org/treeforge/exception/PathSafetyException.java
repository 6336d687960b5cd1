package org.treeforge.exception;

/**
 * 路径越出声明根目录，或节点名称非法。
 */
public class PathSafetyException extends TreeForgeException {

    private final String offendingPath;

    public PathSafetyException(String message, String offendingPath) {
        super(message);
        this.offendingPath = offendingPath;
    }

    public String getOffendingPath() {
        return offendingPath;
    }
}
