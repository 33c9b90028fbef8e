package com.actexport.core.output;

/**
 * Interface for writers that deliver exported acts to a destination.
 *
 * <p>Writers are discovered via Java Service Provider Interface (SPI), so the same export
 * can be written to the filesystem and echoed to the console in one run.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemOutputWriter implements OutputWriter {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public void write(ExportBundle bundle, OutputContext context) {
 *         Path outputDir = Paths.get(context.outputDirectory());
 *         for (ExportedFile file : bundle.files()) {
 *             Files.write(outputDir.resolve(file.relativePath()), file.content());
 *         }
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.actexport.core.output.OutputWriter}
 *
 * @see ExportBundle
 * @see OutputContext
 */
public interface OutputWriter {

    /**
     * Returns unique identifier for this writer.
     *
     * <p>Used for selecting the writer on the command line. Should be lowercase
     * (e.g., "filesystem", "console").
     *
     * @return unique writer identifier
     */
    String getId();

    /**
     * Writes the exported files to the target destination.
     *
     * <p>Implementations read their configuration from {@link OutputContext} and throw
     * {@link IllegalStateException} when the destination cannot be written.
     *
     * @param bundle the exported files
     * @param context output context with directory and settings
     * @throws IllegalStateException if writing fails
     */
    void write(ExportBundle bundle, OutputContext context);
}
