package org.pragmatica.fsfmt.cli;

import org.pragmatica.fsfmt.format.FormatterConfig;
import org.pragmatica.fsfmt.format.FsFormatter;

import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

/**
 * Command line entry point.
 * <p>
 * Usage examples:
 * <pre>
 * fsfmt format src/
 * fsfmt format --stdout Program.fs
 * fsfmt check --config fsfmt.properties src/ tests/
 * </pre>
 */
@Command(name = "fsfmt",
         mixinStandardHelpOptions = true,
         version = "fsfmt 0.1.0",
         description = "Trivia-preserving source formatter",
         subcommands = {FormatCommand.class, CheckCommand.class})
public class FsFmtCli implements Runnable {
    static final String DEFAULT_CONFIG_FILE = "fsfmt.properties";

    @Option(names = {"-c", "--config"},
            description = "Path to a properties file with formatter settings (default: ./" + DEFAULT_CONFIG_FILE + " when present)")
    Path configPath;

    @Option(names = {"-v", "--verbose"},
            description = "Log formatting details")
    boolean verbose;

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new FsFmtCli());
    }

    @Override
    public void run() {
        spec.commandLine()
            .usage(spec.commandLine()
                       .getOut());
    }

    /**
     * Formatter for the selected configuration, or null after reporting why the configuration
     * could not be loaded.
     */
    FsFormatter formatter() {
        if (verbose) {
            Configurator.setRootLevel(Level.DEBUG);
        }
        var path = configPath != null
                   ? configPath
                   : Path.of(DEFAULT_CONFIG_FILE);
        if (configPath == null && !Files.exists(path)) {
            return FsFormatter.fsFormatter();
        }
        return FormatterConfig.load(path)
                              .fold(error -> {
                                        spec.commandLine()
                                            .getErr()
                                            .println("Invalid configuration " + path + ": " + error.message());
                                        return null;
                                    },
                                    FsFormatter::fsFormatter);
    }
}
