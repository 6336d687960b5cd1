package org.treeforge.filesystem;

import org.junit.jupiter.api.Test;
import org.treeforge.tree.TreePath;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IgnorePatternsTest {

    @Test
    void isIgnored_segmentAndPathPatterns() {
        IgnorePatterns patterns = new IgnorePatterns(List.of("node_modules", "*.log", "build/**", " "));

        assertThat(patterns.isIgnored(TreePath.parse("node_modules"))).isTrue();
        assertThat(patterns.isIgnored(TreePath.parse("web/node_modules/react"))).isTrue();
        assertThat(patterns.isIgnored(TreePath.parse("logs/app.log"))).isTrue();
        assertThat(patterns.isIgnored(TreePath.parse("build/classes/A.class"))).isTrue();

        assertThat(patterns.isIgnored(TreePath.parse("build"))).isFalse();
        assertThat(patterns.isIgnored(TreePath.parse("sub/build/x"))).isFalse();
        assertThat(patterns.isIgnored(TreePath.parse("src/App.java"))).isFalse();
        assertThat(IgnorePatterns.none().isIgnored(TreePath.parse("node_modules"))).isFalse();
    }
}
