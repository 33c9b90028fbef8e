package com.actexport.cli;

import com.actexport.core.config.ConfigLoader;
import com.actexport.core.config.ExportConfig;
import com.actexport.core.io.ActJsonReader;
import com.actexport.core.model.ActData;
import com.actexport.core.output.ActExporter;
import com.actexport.core.output.ExportBundle;
import com.actexport.core.output.ExportFileNames;
import com.actexport.core.output.ExportedFile;
import com.actexport.core.output.OutputContext;
import com.actexport.core.output.OutputWriter;
import com.actexport.core.render.RenderOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to export a whole act into one file per format.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Read the act snapshot</li>
 *   <li>Render every requested format</li>
 *   <li>Hand the files to the configured output writers</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Export using actexport.yaml defaults
 * actexport export act.json
 *
 * # Export Markdown and DOCX into ./out
 * actexport export act.json -f markdown,docx -o out
 * }</pre>
 */
@Command(
    name = "export",
    description = "Export the whole act into files",
    mixinStandardHelpOptions = true
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Parameters(index = "0", description = "Act snapshot (JSON)")
    private Path actFile;

    @Option(
        names = {"-f", "--formats"},
        split = ",",
        description = "Formats to export: text, markdown, docx (default: from config)"
    )
    private List<String> formats;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"-w", "--writers"},
        split = ",",
        description = "Output writers: filesystem, console (default: from config)"
    )
    private List<String> writers;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: actexport.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            ExportConfig config = ConfigLoader.load(configPath);
            RenderOptions options = config.toRenderOptions();
            ExportConfig.OutputConfig outputConfig = config.output();

            log.info("Exporting act: {}", actFile.toAbsolutePath());
            ActData data = new ActJsonReader().read(actFile);

            ActExporter exporter = new ActExporter(
                new ExportFileNames(outputConfig.filePrefix(), Clock.systemDefaultZone()));
            List<String> selectedFormats = formats != null && !formats.isEmpty() ? formats : outputConfig.formats();

            List<ExportedFile> files = new ArrayList<>();
            for (String format : selectedFormats) {
                files.add(exporter.renderFull(format, data, options));
            }
            System.out.println("✓ Rendered " + files.size() + " file(s)");

            String directory = outputDir != null ? outputDir.toString() : outputConfig.directory();
            OutputContext context = new OutputContext(directory, outputConfig.settings());
            writeOutput(new ExportBundle(files), context, writers != null ? writers : outputConfig.writers());

            System.out.println("✓ Export complete");
            return 0;
        } catch (Exception e) {
            log.error("Export failed", e);
            System.err.println("✗ Export failed: " + e.getMessage());
            return 1;
        }
    }

    private void writeOutput(ExportBundle bundle, OutputContext context, List<String> writerIds) {
        Map<String, OutputWriter> available = new LinkedHashMap<>();
        for (OutputWriter writer : ServiceLoader.load(OutputWriter.class)) {
            available.putIfAbsent(writer.getId(), writer);
        }

        for (String id : writerIds) {
            OutputWriter writer = available.get(id.trim());
            if (writer == null) {
                throw new IllegalArgumentException("Unknown output writer: " + id);
            }
            log.debug("Writing output with: {}", writer.getId());
            writer.write(bundle, context);
            if ("filesystem".equals(writer.getId())) {
                System.out.println("✓ Wrote output to: " + context.outputDirectory());
            }
        }
    }
}
