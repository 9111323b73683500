package org.pragmatica.fsfmt.cli;

import org.pragmatica.fsfmt.shared.FileCollector;
import org.pragmatica.fsfmt.shared.SourceFile;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

/**
 * Format command - rewrites source files in place.
 */
@Command(name = "format",
         description = "Format source files in place",
         mixinStandardHelpOptions = true)
public class FormatCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @ParentCommand
    FsFmtCli parent;

    @Spec
    CommandSpec spec;

    @Parameters(paramLabel = "<path>",
                description = "Files or directories to format",
                arity = "1..*")
    List<Path> paths;

    @Option(names = {"--stdout"},
            description = "Print formatted text instead of writing files")
    boolean stdout;

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
        var failed = 0;
        var changed = 0;

        for (var path : files) {
            try {
                var source = SourceFile.read(path);
                var result = formatter.format(source);
                if (result.isFailure()) {
                    result.onFailure(error -> err.println(path + ": " + error.message()));
                    failed++;
                    continue;
                }
                var formatted = result.unwrap();
                if (stdout) {
                    out.print(formatted.content());
                } else if (!formatted.content()
                                     .equals(source.content())) {
                    formatted.write();
                    changed++;
                    log.debug("Formatted {}", path);
                }
            } catch (IOException e) {
                err.println(path + ": " + e.getMessage());
                failed++;
            }
        }
        report(out, files.size(), changed, failed);
        return failed == 0
               ? 0
               : 1;
    }

    private void report(PrintWriter out, int total, int changed, int failed) {
        if (stdout) {
            out.flush();
            return;
        }
        out.printf("Formatted %d of %d files%s%n",
                   changed,
                   total,
                   failed == 0
                   ? ""
                   : ", " + failed + " failed");
        out.flush();
    }
}
