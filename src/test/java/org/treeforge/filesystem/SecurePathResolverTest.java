package org.treeforge.filesystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.treeforge.exception.PathSafetyException;
import org.treeforge.filesystem.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecurePathResolverTest {

    @TempDir
    Path first;

    @TempDir
    Path second;

    @Test
    void resolve_relativeToRootId() throws IOException {
        Files.createDirectories(second.resolve("project/src"));
        SecurePathResolver resolver = resolver();

        SecurePathResolver.ResolvedPath resolved = resolver.resolve("root1", "project/src");

        assertThat(resolved.rootId()).isEqualTo("root1");
        assertThat(resolved.absolutePath()).isEqualTo(second.toAbsolutePath().normalize().resolve("project/src"));
        assertThat(resolved.displayPath()).isEqualTo("project/src");
        assertThat(resolver.resolve(null, null).displayPath()).isEqualTo(".");
        assertThat(resolver.listRoots()).extracting(AllowedRoot::id).containsExactly("root0", "root1");
    }

    @Test
    void resolve_rejectsPathsOutsideRoots() throws IOException {
        Files.writeString(first.resolve("a.txt"), "");
        SecurePathResolver resolver = resolver();

        assertThatThrownBy(() -> resolver.resolve("root0", "../"))
                .isInstanceOf(PathSafetyException.class);
        assertThatThrownBy(() -> resolver.resolve("root9", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve("root0", "a.txt"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不是目录");
    }

    private SecurePathResolver resolver() {
        TreeForgeProperties properties = new TreeForgeProperties();
        properties.setRoots(List.of(first.toString(), second.toString()));
        return new SecurePathResolver(properties);
    }
}
