package com.actexport.cli;

import com.actexport.core.config.ConfigLoader;
import com.actexport.core.config.ExportConfig;
import com.actexport.core.io.ActJsonReader;
import com.actexport.core.model.ActData;
import com.actexport.core.output.ActExporter;
import com.actexport.core.output.ExportedFile;
import com.actexport.core.tree.SubtreeOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to export the section under one item number.
 *
 * <p>Text formats are printed to standard output unless {@code --output} names a file;
 * DOCX always needs an output file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Section 5.1 with everything below it
 * actexport extract act.json 5.1
 *
 * # Only the item itself
 * actexport extract act.json 5.1 --no-recursive
 *
 * # Two levels as DOCX
 * actexport extract act.json 5 --max-depth 2 -f docx -o section5.docx
 * }</pre>
 */
@Command(
    name = "extract",
    description = "Export the section under one item number",
    mixinStandardHelpOptions = true
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Parameters(index = "0", description = "Act snapshot (JSON)")
    private Path actFile;

    @Parameters(index = "1", description = "Item number, e.g. 5.1")
    private String number;

    @Option(names = {"--no-recursive"}, description = "Export the item without its children")
    private boolean noRecursive;

    @Option(names = {"--max-depth"}, description = "Deepest level below the item to include")
    private Integer maxDepth;

    @Option(
        names = {"-f", "--format"},
        description = "Format: text, markdown, docx (default: ${DEFAULT-VALUE})",
        defaultValue = "markdown"
    )
    private String format;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path outputFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: actexport.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            ExportConfig config = ConfigLoader.load(configPath);
            ActData data = new ActJsonReader().read(actFile);
            SubtreeOptions subtree = noRecursive ? SubtreeOptions.nodeOnly() : new SubtreeOptions(true, maxDepth);

            Optional<ExportedFile> exported = new ActExporter()
                .renderSubtree(format, data, number, subtree, config.toRenderOptions());
            if (exported.isEmpty()) {
                log.warn("Item {} not found in {}", number, actFile);
                System.err.println("✗ Item " + number + " not found");
                return 1;
            }

            ExportedFile file = exported.get();
            if (outputFile != null) {
                Path parent = outputFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.write(outputFile, file.content());
                System.out.println("✓ Wrote item " + number + " to: " + outputFile);
            } else if (file.isText()) {
                System.out.print(file.contentAsString());
            } else {
                System.err.println("✗ Format " + format + " is binary, use --output to write it to a file");
                return 1;
            }
            return 0;
        } catch (Exception e) {
            log.error("Extract failed", e);
            System.err.println("✗ Extract failed: " + e.getMessage());
            return 1;
        }
    }
}
