package org.treeforge.filesystem.dto;

import org.treeforge.apply.OperationRecord;

/**
 * 一条变更的对外表示（路径统一使用 / 分隔）。
 *
 * @param operation CREATE / DELETE / RENAME
 * @param kind      FILE / FOLDER
 * @param path      相对声明根目录的路径
 * @param newPath   重命名后的路径（仅 RENAME）
 */
public record OperationView(String operation, String kind, String path, String newPath) {

    public static OperationView of(OperationRecord record) {
        return new OperationView(
                record.operation().name(),
                record.nodeKind().name(),
                record.path().toString(),
                record.newPath() == null ? null : record.newPath().toString()
        );
    }
}
