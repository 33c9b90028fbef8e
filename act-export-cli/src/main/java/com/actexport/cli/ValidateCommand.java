package com.actexport.cli;

import com.actexport.core.io.ActJsonReader;
import com.actexport.core.model.ActData;
import com.actexport.core.tree.ActDataValidator;
import com.actexport.core.tree.DataProblem;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check an act snapshot for problems that would degrade its exports.
 *
 * <p>Exits with 1 when any problem is found.
 */
@Command(
    name = "validate",
    description = "Check table geometry, node references, duplicate numbers and item references",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Act snapshot (JSON)")
    private Path actFile;

    @Option(names = {"--references"}, split = ",", description = "Item numbers referenced from outside the act")
    private List<String> references;

    @Option(names = {"--prefix"}, description = "Section every reference must point into, e.g. 5.")
    private String prefix;

    @Override
    public Integer call() {
        ActData data;
        try {
            data = new ActJsonReader().read(actFile);
        } catch (IOException e) {
            log.error("Failed to read act: {}", actFile, e);
            System.err.println("✗ Failed to read " + actFile + ": " + e.getMessage());
            return 1;
        }

        log.info("Validating act: {}", actFile);
        List<DataProblem> problems = new ActDataValidator()
            .validate(data, references != null ? references : List.of(), prefix);
        if (problems.isEmpty()) {
            System.out.println("✓ No problems found");
            return 0;
        }

        System.out.println("✗ Found " + problems.size() + " problem(s):");
        for (DataProblem problem : problems) {
            System.out.println("  • " + problem);
        }
        return 1;
    }
}
