package org.treeforge.apply;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.treeforge.exception.PathSafetyException;
import org.treeforge.tree.NodeKind;
import org.treeforge.tree.Operation;
import org.treeforge.tree.TreePath;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplySchedulerTest {

    @TempDir
    Path root;

    @Test
    void schedule_ordersBucketsAndDepths() {
        List<OperationRecord> ordered = ApplyScheduler.schedule(mixedRecords(), root);

        assertThat(ordered).extracting(OperationRecord::describe).containsExactly(
                "新建目录 a",
                "新建目录 z",
                "新建目录 a/b",
                "新建文件 a/b/f.txt",
                "新建文件 a/x.txt",
                "重命名文件 old/sub/f.txt -> old/sub/g.txt",
                "重命名目录 old -> new",
                "删除文件 c.txt",
                "删除文件 new/sub/h.txt",
                "删除目录 new/sub/tmp",
                "删除目录 gone"
        );
    }

    @Test
    void schedule_isIndependentOfInputOrder() {
        List<OperationRecord> expected = ApplyScheduler.schedule(mixedRecords(), root);
        Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            List<OperationRecord> shuffled = new ArrayList<>(mixedRecords());
            Collections.shuffle(shuffled, random);

            assertThat(ApplyScheduler.schedule(shuffled, root)).isEqualTo(expected);
        }
    }

    @Test
    void schedule_parentFoldersAreCreatedBeforeChildrenAndDeletedAfter() {
        List<OperationRecord> ordered = ApplyScheduler.schedule(mixedRecords(), root);

        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                OperationRecord earlier = ordered.get(i);
                OperationRecord later = ordered.get(j);
                // 同为新建时，子节点不会排在父目录之前
                if (earlier.operation() == later.operation() && earlier.path().isDescendantOf(later.path())) {
                    assertThat(earlier.operation()).as(earlier + " / " + later).isNotEqualTo(Operation.CREATE);
                }
                // 同为删除时，父目录不会排在子节点之前
                if (earlier.operation() == later.operation() && later.path().isDescendantOf(earlier.path())) {
                    assertThat(earlier.operation()).as(earlier + " / " + later).isNotEqualTo(Operation.DELETE);
                }
            }
        }
    }

    @Test
    void schedule_rejectsUnsafePathsBeforeOrderingAnything() {
        List<OperationRecord> escaping = List.of(
                OperationRecord.create(TreePath.of("ok.txt"), NodeKind.FILE),
                OperationRecord.create(TreePath.of("..", "escape.txt"), NodeKind.FILE)
        );
        assertThatThrownBy(() -> ApplyScheduler.schedule(escaping, root)).isInstanceOf(PathSafetyException.class);

        List<OperationRecord> badTarget = List.of(
                OperationRecord.rename(TreePath.of("a.txt"), TreePath.of(".."), NodeKind.FILE)
        );
        assertThatThrownBy(() -> ApplyScheduler.schedule(badTarget, root)).isInstanceOf(PathSafetyException.class);

        List<OperationRecord> onRoot = List.of(OperationRecord.delete(TreePath.root(), NodeKind.FOLDER));
        assertThatThrownBy(() -> ApplyScheduler.schedule(onRoot, root)).isInstanceOf(PathSafetyException.class);
    }

    private static List<OperationRecord> mixedRecords() {
        return List.of(
                OperationRecord.create(TreePath.of("a", "b"), NodeKind.FOLDER),
                OperationRecord.delete(TreePath.of("gone"), NodeKind.FOLDER),
                OperationRecord.create(TreePath.of("a", "x.txt"), NodeKind.FILE),
                OperationRecord.rename(TreePath.of("old"), TreePath.of("new"), NodeKind.FOLDER),
                OperationRecord.delete(TreePath.of("old", "sub", "h.txt"), NodeKind.FILE),
                OperationRecord.create(TreePath.of("z"), NodeKind.FOLDER),
                OperationRecord.rename(TreePath.of("old", "sub", "f.txt"), TreePath.of("old", "sub", "g.txt"), NodeKind.FILE),
                OperationRecord.delete(TreePath.of("c.txt"), NodeKind.FILE),
                OperationRecord.create(TreePath.of("a"), NodeKind.FOLDER),
                OperationRecord.delete(TreePath.of("old", "sub", "tmp"), NodeKind.FOLDER),
                OperationRecord.create(TreePath.of("a", "b", "f.txt"), NodeKind.FILE)
        );
    }
}
