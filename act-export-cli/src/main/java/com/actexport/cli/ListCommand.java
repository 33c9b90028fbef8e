package com.actexport.cli;

import com.actexport.core.output.OutputWriter;
import com.actexport.core.render.ActRenderer;
import picocli.CommandLine.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available export formats and output writers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI).
 */
@Command(
    name = "list",
    description = "List available export formats and output writers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Override
    public Integer call() {
        System.out.println("Available Formats:");
        System.out.println();
        int formats = 0;
        for (ActRenderer<?> renderer : ServiceLoader.load(ActRenderer.class)) {
            formats++;
            System.out.printf("  • %s (ID: %s)%n", renderer.getDisplayName(), renderer.getId());
            System.out.printf("    File Extension: .%s%n", renderer.getFileExtension());
            System.out.printf("    Content Type: %s%n", renderer.getContentType());
            System.out.println();
        }
        if (formats == 0) {
            System.out.println("  No formats found.");
            System.out.println();
        }

        System.out.println("Available Output Writers:");
        System.out.println();
        int writers = 0;
        for (OutputWriter writer : ServiceLoader.load(OutputWriter.class)) {
            writers++;
            System.out.printf("  • %s%n", writer.getId());
        }
        if (writers == 0) {
            System.out.println("  No output writers found.");
        }

        log.debug("Listed {} formats and {} writers", formats, writers);
        return 0;
    }
}
