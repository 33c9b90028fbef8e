package com.actexport.core.output.impl;

import com.actexport.core.output.ExportBundle;
import com.actexport.core.output.ExportedFile;
import com.actexport.core.output.OutputContext;
import com.actexport.core.output.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writer that stores exported acts on the filesystem.
 *
 * <p>Creates the directory structure automatically and overwrites existing files.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * OutputContext context = new OutputContext("./exports", Map.of());
 * ExportBundle bundle = new ExportBundle(List.of(
 *     exporter.renderFull("markdown", data, options)
 * ));
 *
 * new FileSystemOutputWriter().write(bundle, context);
 * // Creates: ./exports/act_20240101_120000.md
 * }</pre>
 */
public class FileSystemOutputWriter implements OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemOutputWriter.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void write(ExportBundle bundle, OutputContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        logger.info("Writing {} files to filesystem at: {}", bundle.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (ExportedFile file : bundle.files()) {
            writeFile(outputDir, file);
        }
        logger.info("Successfully wrote {} files to filesystem", bundle.files().size());
    }

    private void writeFile(Path outputDir, ExportedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath());
        logger.debug("Writing file: {}", targetPath);

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.write(targetPath, file.content());
            logger.info("Wrote file: {} ({} bytes)", file.relativePath(), file.size());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + targetPath, e);
        }
    }
}
