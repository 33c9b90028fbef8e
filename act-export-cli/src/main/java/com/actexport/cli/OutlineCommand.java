package com.actexport.cli;

import com.actexport.core.io.ActJsonReader;
import com.actexport.core.model.ActData;
import com.actexport.core.tree.TreeOutline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to print the item structure of an act.
 */
@Command(
    name = "outline",
    description = "Print the item structure of an act",
    mixinStandardHelpOptions = true
)
public class OutlineCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(OutlineCommand.class);

    @Parameters(index = "0", description = "Act snapshot (JSON)")
    private Path actFile;

    @Option(names = {"--elements"}, description = "Include tables, text blocks and violations with totals")
    private boolean withElements;

    @Override
    public Integer call() {
        try {
            ActData data = new ActJsonReader().read(actFile);
            System.out.println(TreeOutline.render(data.tree(), withElements));
            return 0;
        } catch (IOException e) {
            log.error("Failed to read act: {}", actFile, e);
            System.err.println("✗ Failed to read " + actFile + ": " + e.getMessage());
            return 1;
        }
    }
}
