package org.treeforge.apply;

import org.junit.jupiter.api.Test;
import org.treeforge.exception.OperationExecutionException;
import org.treeforge.filesystem.DirectoryEntry;
import org.treeforge.filesystem.FilesystemProvider;
import org.treeforge.tree.NodeKind;
import org.treeforge.tree.TreePath;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplyExecutorTest {

    private final ApplyExecutor executor = new ApplyExecutor();

    @Test
    void execute_callsProviderInOrder() {
        RecordingProvider provider = new RecordingProvider(null);
        List<OperationRecord> ordered = List.of(
                OperationRecord.create(TreePath.of("a"), NodeKind.FOLDER),
                OperationRecord.create(TreePath.of("a", "b.txt"), NodeKind.FILE),
                OperationRecord.rename(TreePath.of("c.txt"), TreePath.of("d.txt"), NodeKind.FILE),
                OperationRecord.delete(TreePath.of("e"), NodeKind.FOLDER)
        );

        ApplyReport report = executor.execute(ordered, provider, false);

        assertThat(report.dryRun()).isFalse();
        assertThat(report.executed()).isEqualTo(ordered);
        assertThat(provider.calls).containsExactly(
                "createFolder a",
                "createFile a/b.txt",
                "rename c.txt d.txt",
                "deleteRecursive e"
        );
    }

    @Test
    void execute_dryRunReturnsSameListWithoutTouchingProvider() {
        RecordingProvider provider = new RecordingProvider(null);
        List<OperationRecord> ordered = List.of(
                OperationRecord.create(TreePath.of("a.txt"), NodeKind.FILE),
                OperationRecord.delete(TreePath.of("b.txt"), NodeKind.FILE)
        );

        ApplyReport report = executor.execute(ordered, provider, true);

        assertThat(report.dryRun()).isTrue();
        assertThat(report.executed()).isEqualTo(ordered);
        assertThat(provider.calls).isEmpty();
    }

    @Test
    void execute_stopsAtFirstFailureWithoutRollback() {
        OperationRecord first = OperationRecord.create(TreePath.of("a.txt"), NodeKind.FILE);
        OperationRecord failing = OperationRecord.rename(TreePath.of("b.txt"), TreePath.of("c.txt"), NodeKind.FILE);
        OperationRecord never = OperationRecord.delete(TreePath.of("d.txt"), NodeKind.FILE);
        RecordingProvider provider = new RecordingProvider("rename b.txt c.txt");

        assertThatThrownBy(() -> executor.execute(List.of(first, failing, never), provider, false))
                .isInstanceOf(OperationExecutionException.class)
                .hasMessageContaining("重命名文件 b.txt -> c.txt")
                .hasCauseInstanceOf(FileAlreadyExistsException.class)
                .satisfies(e -> {
                    OperationExecutionException ex = (OperationExecutionException) e;
                    assertThat(ex.getCompleted()).containsExactly(first);
                    assertThat(ex.getFailed()).isEqualTo(failing);
                    assertThat(ex.getRemaining()).containsExactly(never);
                });
        assertThat(provider.calls).containsExactly("createFile a.txt", "rename b.txt c.txt");
    }

    /**
     * 记录调用的 provider；调用描述等于 failOn 时抛出 {@link FileAlreadyExistsException}。
     */
    private static final class RecordingProvider implements FilesystemProvider {

        private final String failOn;
        private final List<String> calls = new ArrayList<>();

        private RecordingProvider(String failOn) {
            this.failOn = failOn;
        }

        @Override
        public List<DirectoryEntry> listDirectory(TreePath path) {
            return List.of();
        }

        @Override
        public void createFile(TreePath path) throws IOException {
            record("createFile " + path);
        }

        @Override
        public void createFolder(TreePath path) throws IOException {
            record("createFolder " + path);
        }

        @Override
        public void rename(TreePath oldPath, TreePath newPath) throws IOException {
            record("rename " + oldPath + " " + newPath);
        }

        @Override
        public void deleteRecursive(TreePath path) throws IOException {
            record("deleteRecursive " + path);
        }

        private void record(String call) throws IOException {
            calls.add(call);
            if (call.equals(failOn)) {
                throw new FileAlreadyExistsException(call);
            }
        }
    }
}
