package org.treeforge.filesystem;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.treeforge.apply.StructureValidator;
import org.treeforge.tree.Tree;
import org.treeforge.tree.TreeParser;
import org.treeforge.tree.TreePath;
import org.treeforge.tree.TreeSerializer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilesystemScannerTest {

    @TempDir
    Path root;

    private NioFilesystemProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        TreeForgeProperties properties = new TreeForgeProperties();
        properties.setRoots(List.of(root.toString()));
        provider = new NioFilesystemProvider(root, new SecurePathResolver(properties));

        Files.createDirectories(root.resolve("src/main"));
        Files.createDirectories(root.resolve(".git/objects"));
        Files.createDirectories(root.resolve("logs"));
        Files.writeString(root.resolve("src/main/App.java"), "", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("README.md"), "", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("Makefile"), "", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("logs/app.log"), "", StandardCharsets.UTF_8);
    }

    @Test
    void scan_foldersFirstThenNamesAndIgnores() throws IOException {
        FilesystemScanner scanner = new FilesystemScanner(new IgnorePatterns(List.of(".git", "*.log")), 1000);

        FilesystemScanner.ScanResult result = scanner.scan(provider, "project");

        assertThat(result.warnings()).isEmpty();
        assertThat(TreeSerializer.serialize(result.tree())).isEqualTo("""
                ├── logs/
                ├── src/
                │   └── main/
                │       └── App.java
                ├── Makefile
                └── README.md
                """);
        assertThat(result.paths()).doesNotContain(TreePath.of(".git"));
    }

    @Test
    void scan_skipsNamesTheTextCannotExpress() throws IOException {
        Path odd = root.resolve("odd");
        Files.createDirectories(odd);
        Files.writeString(odd.resolve("ok.txt"), "", StandardCharsets.UTF_8);
        Files.writeString(odd.resolve("a [+]"), "", StandardCharsets.UTF_8);
        Files.writeString(odd.resolve("a[~b].txt"), "", StandardCharsets.UTF_8);
        Files.writeString(odd.resolve("trail "), "", StandardCharsets.UTF_8);
        Files.writeString(odd.resolve(" lead"), "", StandardCharsets.UTF_8);
        Files.createDirectories(odd.resolve("─dir/inner"));
        FilesystemScanner scanner = new FilesystemScanner(new IgnorePatterns(List.of(".git", "*.log")), 1000);

        FilesystemScanner.ScanResult result = scanner.scan(provider, "project");

        assertThat(result.paths()).filteredOn(p -> p.isDescendantOf(TreePath.of("odd")))
                .containsExactly(TreePath.of("odd", "ok.txt"));
        assertThat(result.warnings()).hasSize(5).allSatisfy(w -> assertThat(w).contains("无法在树形文本中原样表示"));

        // 生成的文本原样解析后与扫描结果一致，结构闸门可以通过
        String text = TreeSerializer.serialize(result.tree());
        Tree reparsed = TreeParser.parseOrThrow(text);
        assertThat(TreeSerializer.serialize(reparsed)).isEqualTo(text);
        assertThat(StructureValidator.validate(reparsed, result.paths()).valid()).isTrue();
    }

    @Test
    void scan_failsInsteadOfTruncating() {
        FilesystemScanner scanner = new FilesystemScanner(IgnorePatterns.none(), 3);

        assertThatThrownBy(() -> scanner.scan(provider, "project"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("tree-forge.scan-max-entries");
    }
}
