package org.treeforge.apply;

import org.junit.jupiter.api.Test;
import org.treeforge.exception.TreeValidationException;
import org.treeforge.tree.NodeKind;
import org.treeforge.tree.Operation;
import org.treeforge.tree.Tree;
import org.treeforge.tree.TreeParser;
import org.treeforge.tree.TreePath;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationExtractorTest {

    @Test
    void extract_singleCreate() {
        Tree tree = TreeParser.parseOrThrow("""
                └── src/
                    ├── a.txt
                    └── b.txt [+]
                """);

        assertThat(OperationExtractor.extractAndValidate(tree))
                .containsExactly(OperationRecord.create(TreePath.of("src", "b.txt"), NodeKind.FILE));
    }

    @Test
    void extract_renameKeepsParent() {
        Tree tree = TreeParser.parseOrThrow("""
                └── src/
                    └── old.txt [~ new.txt]
                """);

        List<OperationRecord> records = OperationExtractor.extractAndValidate(tree);

        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.operation()).isEqualTo(Operation.RENAME);
            assertThat(record.path()).isEqualTo(TreePath.of("src", "old.txt"));
            assertThat(record.newPath()).isEqualTo(TreePath.of("src", "new.txt"));
            assertThat(record.nodeKind()).isEqualTo(NodeKind.FILE);
        });
    }

    @Test
    void extract_unmarkedDescendantsOfCreatedFolderAreCreated() {
        Tree tree = TreeParser.parseOrThrow("""
                └── app/ [+]
                    ├── src/
                    │   └── Main.java
                    └── README.md [+]
                """);

        assertThat(OperationExtractor.extract(tree)).containsExactly(
                OperationRecord.create(TreePath.of("app"), NodeKind.FOLDER),
                OperationRecord.create(TreePath.of("app", "src"), NodeKind.FOLDER),
                OperationRecord.create(TreePath.of("app", "src", "Main.java"), NodeKind.FILE),
                OperationRecord.create(TreePath.of("app", "README.md"), NodeKind.FILE)
        );
    }

    @Test
    void extract_deletedFolderYieldsOneRecord() {
        Tree tree = TreeParser.parseOrThrow("""
                └── build/ [-]
                    └── out.class
                """);

        assertThat(OperationExtractor.extract(tree))
                .containsExactly(OperationRecord.delete(TreePath.of("build"), NodeKind.FOLDER));
    }

    @Test
    void extract_rootIsImmutable() {
        Tree tree = new Tree();
        tree.addFile(tree.root(), "a.txt");
        tree.mark(tree.root(), Operation.DELETE, null);

        assertThatThrownBy(() -> OperationExtractor.extractAndValidate(tree))
                .isInstanceOf(TreeValidationException.class)
                .hasMessageContaining("根节点不可变");
    }

    @Test
    void validateOperations_rejectsWholeBatch() {
        List<OperationRecord> records = List.of(
                OperationRecord.create(TreePath.of("ok.txt"), NodeKind.FILE),
                OperationRecord.rename(TreePath.of("a.txt"), null, NodeKind.FILE),
                OperationRecord.delete(TreePath.root(), NodeKind.FOLDER)
        );

        assertThatThrownBy(() -> OperationExtractor.validateOperations(records))
                .isInstanceOf(TreeValidationException.class)
                .satisfies(e -> assertThat(((TreeValidationException) e).getViolations()).hasSize(2));
    }
}
