package org.treeforge.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TreeSerializerTest {

    @Test
    void serialize_usesConnectorsOnEveryLevel() {
        Tree tree = sampleTree();

        assertThat(TreeSerializer.serialize(tree)).isEqualTo("""
                ├── src/
                │   ├── a.txt
                │   └── lib/
                │       └── b.txt
                ├── empty/
                └── Makefile
                """);
    }

    @Test
    void serialize_parseSerializeIsByteIdentical() {
        String once = TreeSerializer.serialize(sampleTree());
        String twice = TreeSerializer.serialize(TreeParser.parseOrThrow(once));

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void serialize_writesMarkersBack() {
        Tree tree = new Tree();
        TreeNode src = tree.addFolder(tree.root(), "src");
        tree.mark(tree.addFile(src, "a.txt"), Operation.CREATE, null);
        tree.mark(tree.addFile(src, "old.txt"), Operation.RENAME, "new.txt");
        tree.mark(tree.addFolder(tree.root(), "tmp"), Operation.DELETE, null);

        String text = TreeSerializer.serialize(tree);

        assertThat(text).isEqualTo("""
                ├── src/
                │   ├── a.txt [+]
                │   └── old.txt [~ new.txt]
                └── tmp/ [-]
                """);
        assertThat(TreeSerializer.serialize(TreeParser.parseOrThrow(text))).isEqualTo(text);
    }

    @Test
    void render_headerAndLegendAreSkippedByParser() {
        Tree tree = sampleTree();

        String document = TreeSerializer.render(tree, "project");

        assertThat(document).startsWith("# project\n\n<!--");
        assertThat(TreeParser.parseOrThrow(document).allPaths()).isEqualTo(tree.allPaths());
    }

    @Test
    void isExpressible_rejectsNamesThatDoNotSurviveRoundTrip() {
        assertThat(TreeSerializer.isExpressible("a.txt", NodeKind.FILE)).isTrue();
        assertThat(TreeSerializer.isExpressible("my notes.md", NodeKind.FILE)).isTrue();
        assertThat(TreeSerializer.isExpressible("Makefile", NodeKind.FILE)).isTrue();
        assertThat(TreeSerializer.isExpressible("src", NodeKind.FOLDER)).isTrue();

        assertThat(TreeSerializer.isExpressible("a [+]", NodeKind.FILE)).isFalse();
        assertThat(TreeSerializer.isExpressible("a [-]", NodeKind.FOLDER)).isFalse();
        assertThat(TreeSerializer.isExpressible("a[~b].txt", NodeKind.FILE)).isFalse();
        assertThat(TreeSerializer.isExpressible("trail ", NodeKind.FILE)).isFalse();
        assertThat(TreeSerializer.isExpressible(" lead", NodeKind.FILE)).isFalse();
        assertThat(TreeSerializer.isExpressible("─dash", NodeKind.FILE)).isFalse();
        assertThat(TreeSerializer.isExpressible("│bar", NodeKind.FOLDER)).isFalse();
        assertThat(TreeSerializer.isExpressible("a:b", NodeKind.FILE)).isFalse();
    }

    private static Tree sampleTree() {
        Tree tree = new Tree("project");
        TreeNode src = tree.addFolder(tree.root(), "src");
        tree.addFile(src, "a.txt");
        TreeNode lib = tree.addFolder(src, "lib");
        tree.addFile(lib, "b.txt");
        tree.addFolder(tree.root(), "empty");
        tree.addFile(tree.root(), "Makefile");
        return tree;
    }
}
