package org.pragmatica.fsfmt.cli;

import org.pragmatica.fsfmt.shared.FileCollector;
import org.pragmatica.fsfmt.shared.SourceFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

/**
 * Check command - reports files that are not formatted (for CI).
 */
@Command(name = "check",
         description = "Verify that source files are formatted, without changing them",
         mixinStandardHelpOptions = true)
public class CheckCommand implements Callable<Integer> {
    @ParentCommand
    FsFmtCli parent;

    @Spec
    CommandSpec spec;

    @Parameters(paramLabel = "<path>",
                description = "Files or directories to check",
                arity = "1..*")
    List<Path> paths;

    @Override
    public Integer call() {
        var formatter = parent.formatter();
        if (formatter == null) {
            return 2;
        }
        var out = spec.commandLine()
                      .getOut();
        var err = spec.commandLine()
                      .getErr();
        var files = FileCollector.collectSourceFiles(paths, err::println);
        var issues = 0;

        for (var path : files) {
            try {
                var formatted = formatter.isFormatted(SourceFile.read(path));
                if (formatted.isFailure()) {
                    formatted.onFailure(error -> err.println(path + ": " + error.message()));
                    issues++;
                } else if (!formatted.unwrap()) {
                    out.println("Not formatted: " + path);
                    issues++;
                }
            } catch (IOException e) {
                err.println(path + ": " + e.getMessage());
                issues++;
            }
        }
        out.printf("Checked %d files, %d with issues%n", files.size(), issues);
        out.flush();
        // 0 when every file is formatted, 1 otherwise
        return issues == 0
               ? 0
               : 1;
    }
}
