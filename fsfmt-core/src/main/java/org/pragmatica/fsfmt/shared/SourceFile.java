package org.pragmatica.fsfmt.shared;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Source file content together with the path it was read from.
 */
public record SourceFile(Path fileName, String content) {
    public static SourceFile sourceFile(Path fileName, String content) {
        return new SourceFile(fileName, content);
    }

    public static SourceFile read(Path path) throws IOException {
        return new SourceFile(path, Files.readString(path, StandardCharsets.UTF_8));
    }

    public SourceFile withContent(String newContent) {
        return new SourceFile(fileName, newContent);
    }

    public void write() throws IOException {
        Files.writeString(fileName, content, StandardCharsets.UTF_8);
    }
}
