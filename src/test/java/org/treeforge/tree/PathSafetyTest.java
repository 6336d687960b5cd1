package org.treeforge.tree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.treeforge.exception.PathSafetyException;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathSafetyTest {

    @TempDir
    Path root;

    @Test
    void isValidName_rejectsReservedNames() {
        assertThat(PathSafety.isValidName("a.txt")).isTrue();
        assertThat(PathSafety.isValidName("a..b")).isTrue();
        assertThat(PathSafety.isValidName("my file.md")).isTrue();

        assertThat(PathSafety.isValidName(null)).isFalse();
        assertThat(PathSafety.isValidName("")).isFalse();
        assertThat(PathSafety.isValidName("   ")).isFalse();
        assertThat(PathSafety.isValidName(".")).isFalse();
        assertThat(PathSafety.isValidName("..")).isFalse();
        assertThat(PathSafety.isValidName("a/b")).isFalse();
        assertThat(PathSafety.isValidName("a\\b")).isFalse();
        assertThat(PathSafety.isValidName("../escape")).isFalse();
        for (String c : new String[]{"<", ">", ":", "\"", "|", "?", "*", "\u0000", "\u001F"}) {
            assertThat(PathSafety.isValidName("a" + c + "b")).as(c).isFalse();
        }
    }

    @Test
    void isSafe_staysInsideRoot() {
        assertThat(PathSafety.isSafe("src/a.txt", root)).isTrue();
        assertThat(PathSafety.isSafe("src/../a.txt", root)).isTrue();
        assertThat(PathSafety.isSafe("a..b/c", root)).isTrue();

        assertThat(PathSafety.isSafe("../outside", root)).isFalse();
        assertThat(PathSafety.isSafe("src/../../outside", root)).isFalse();
        assertThat(PathSafety.isSafe("/etc/passwd", root)).isFalse();
        assertThat(PathSafety.isSafe(root.resolve("a.txt").toString(), root)).isFalse();
    }

    @Test
    void requireSafe_checksEverySegment() {
        PathSafety.requireSafe(TreePath.of("src", "a.txt"), root);

        assertThatThrownBy(() -> PathSafety.requireSafe(TreePath.of("src", ".."), root))
                .isInstanceOf(PathSafetyException.class);
        assertThatThrownBy(() -> PathSafety.requireSafe(TreePath.of("..", "escape"), root))
                .isInstanceOf(PathSafetyException.class)
                .satisfies(e -> assertThat(((PathSafetyException) e).getOffendingPath()).isEqualTo(".."));
        assertThat(PathSafety.isSafe(TreePath.of("a:b"), root)).isFalse();
    }
}
