package org.pragmatica.fsfmt.format;

import org.pragmatica.fsfmt.shared.SourceFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * The files in format-examples/ are already formatted. Formatting them must leave them unchanged.
 */
class GoldenFormatterTest {

    private static final Path EXAMPLES_DIR = Path.of("src/test/resources/format-examples");

    private FsFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = FsFormatter.fsFormatter();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Bindings.fs",
            "Comments.fs",
            "Directives.fs",
            "Lists.fs",
            "Match.fs",
            "Types.fs"
    })
    void formatter_isIdempotent_onGoldenExamples(String fileName) throws IOException {
        var source = SourceFile.read(EXAMPLES_DIR.resolve(fileName));

        formatter.format(source)
                 .onFailure(cause -> fail("Format failed for " + fileName + ": " + cause.message()))
                 .onSuccess(formatted -> {
                     if (!formatted.content()
                                   .equals(source.content())) {
                         System.err.println("=== Expected (" + fileName + ") ===");
                         System.err.println(source.content());
                         System.err.println("=== Actual ===");
                         System.err.println(formatted.content());
                         fail("Formatter changed golden example: " + fileName);
                     }
                 });
    }

    @Test
    void formatter_parsesAllGoldenExamples() throws IOException {
        try (var files = Files.list(EXAMPLES_DIR)) {
            files.filter(path -> path.toString()
                                     .endsWith(".fs"))
                 .forEach(path -> {
                     try {
                         formatter.format(SourceFile.read(path))
                                  .onFailure(cause -> fail("Failed to parse " + path.getFileName() + ": "
                                                           + cause.message()));
                     } catch (IOException e) {
                         fail("Could not read " + path + ": " + e.getMessage());
                     }
                 });
        }
    }
}
