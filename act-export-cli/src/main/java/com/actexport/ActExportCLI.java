package com.actexport;

import com.actexport.cli.ExportCommand;
import com.actexport.cli.ExtractCommand;
import com.actexport.cli.ListCommand;
import com.actexport.cli.OutlineCommand;
import com.actexport.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for act exports.
 *
 * <p>Reads a stored act snapshot (JSON) and exports it to plain text, Markdown or DOCX,
 * either whole or one numbered section at a time.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code export} - Export the whole act into files</li>
 *   <li>{@code extract} - Export one numbered section</li>
 *   <li>{@code outline} - Print the item structure</li>
 *   <li>{@code validate} - Check a snapshot for broken references and table geometry</li>
 *   <li>{@code list} - List available formats and output writers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Export to every configured format
 * actexport export act.json -o exports
 *
 * # Print section 5.1 as Markdown
 * actexport extract act.json 5.1 -f markdown
 *
 * # Check references from directives
 * actexport validate act.json --references 5.1,5.2 --prefix 5.
 * }</pre>
 */
@Command(
    name = "actexport",
    mixinStandardHelpOptions = true,
    version = "ActExport 1.0.0-SNAPSHOT",
    description = "Exports act documents to plain text, Markdown and DOCX",
    subcommands = {
        ExportCommand.class,
        ExtractCommand.class,
        OutlineCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class ActExportCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ActExportCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("ActExport - Act document exporter");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'actexport --help' to see available commands");
        System.out.println("Use 'actexport <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        ActExportCLI cli = new ActExportCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
