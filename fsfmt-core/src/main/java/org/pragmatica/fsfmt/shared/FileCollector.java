package org.pragmatica.fsfmt.shared;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Utility for collecting source files from paths.
 */
public final class FileCollector {
    private static final Set<String> EXTENSIONS = Set.of(".fs", ".fsi", ".fsx");

    private FileCollector() {}

    /**
     * Collect source files from a list of paths (files or directories).
     * Directories are scanned recursively; hidden directories and build output are skipped.
     *
     * @param paths        List of paths to collect from
     * @param errorHandler Handler for errors during collection
     * @return List of source file paths, sorted within each directory
     */
    public static List<Path> collectSourceFiles(List<Path> paths, Consumer<String> errorHandler) {
        var files = new ArrayList<Path>();

        for (var path : paths) {
            if (Files.isDirectory(path)) {
                files.addAll(scan(path, errorHandler));
            } else if (isSourceFile(path)) {
                files.add(path);
            } else if (!Files.exists(path)) {
                errorHandler.accept("File not found: " + path);
            }
        }

        return files;
    }

    public static boolean isSourceFile(Path path) {
        var name = path.getFileName()
                       .toString();
        return EXTENSIONS.stream()
                         .anyMatch(name::endsWith);
    }

    private static List<Path> scan(Path directory, Consumer<String> errorHandler) {
        try (Stream<Path> stream = Files.walk(directory)) {
            return stream.filter(Files::isRegularFile)
                         .filter(FileCollector::isSourceFile)
                         .filter(path -> !isExcluded(directory.relativize(path)))
                         .sorted()
                         .collect(Collectors.toList());
        } catch (IOException e) {
            errorHandler.accept("Error scanning " + directory + ": " + e.getMessage());
            return List.of();
        }
    }

    private static boolean isExcluded(Path relative) {
        for (var segment : relative) {
            var name = segment.toString();
            if (name.startsWith(".") || name.equals("bin") || name.equals("obj")) {
                return true;
            }
        }
        return false;
    }
}
