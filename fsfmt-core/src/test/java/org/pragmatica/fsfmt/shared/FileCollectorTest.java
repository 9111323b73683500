package org.pragmatica.fsfmt.shared;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class FileCollectorTest {

    @TempDir
    Path root;

    @Test
    void collectSourceFiles_walksDirectories_skippingBuildOutput() throws IOException {
        var program = write("src/Program.fs");
        var signature = write("src/Library.fsi");
        var script = write("build.fsx");
        write("src/notes.txt");
        write("bin/Debug/Generated.fs");
        write("obj/Temp.fs");
        write(".git/Hook.fs");

        var files = FileCollector.collectSourceFiles(List.of(root), message -> {});

        assertThat(files).containsExactly(script, signature, program);
    }

    @Test
    void collectSourceFiles_acceptsExplicitFiles() throws IOException {
        var file = write("Single.fs");

        assertThat(FileCollector.collectSourceFiles(List.of(file), message -> {})).containsExactly(file);
    }

    @Test
    void collectSourceFiles_reportsMissingPaths() {
        var errors = new ArrayList<String>();
        var missing = root.resolve("Missing.fs");

        var files = FileCollector.collectSourceFiles(List.of(missing), errors::add);

        assertThat(files).isEmpty();
        assertThat(errors).containsExactly("File not found: " + missing);
    }

    @Test
    void isSourceFile_matchesSourceExtensions() {
        assertThat(FileCollector.isSourceFile(Path.of("A.fs"))).isTrue();
        assertThat(FileCollector.isSourceFile(Path.of("A.fsi"))).isTrue();
        assertThat(FileCollector.isSourceFile(Path.of("A.fsx"))).isTrue();
        assertThat(FileCollector.isSourceFile(Path.of("A.fsproj"))).isFalse();
    }

    private Path write(String relative) throws IOException {
        var path = root.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, "let x = 1\n");
        return path;
    }
}
