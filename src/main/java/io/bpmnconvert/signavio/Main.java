package io.bpmnconvert.signavio;

import ch.qos.logback.classic.Level;
import io.bpmnconvert.signavio.batch.BatchConverter;
import io.bpmnconvert.signavio.batch.BatchSummary;
import io.bpmnconvert.signavio.batch.ConversionResult;
import io.bpmnconvert.signavio.config.ConverterConfig;
import io.bpmnconvert.signavio.config.ConverterConfigHelper;
import io.bpmnconvert.signavio.diagnostics.Diagnostic;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line entry point.
 *
 * Usage:
 *   signavio2bpmn model.json                 -- writes model.bpmn next to the input
 *   signavio2bpmn exports/                   -- converts every *.json into a sibling bpmn_xml/ directory
 *   signavio2bpmn exports/ -o out/ -v        -- custom output directory, print diagnostics per file
 */
@Command(
        name = "signavio2bpmn",
        mixinStandardHelpOptions = true,
        version = "signavio2bpmn 1.0.0",
        description = "Convert Signavio BPMN JSON exports to BPMN 2.0 XML"
)
public class Main implements Callable<Integer> {
    private static final String APPLICATION_LOGGER = "io.bpmnconvert.signavio";

    @Parameters(paramLabel = "<input>", description = "A Signavio JSON file or a directory of *.json files")
    private Path input;

    @Option(names = {"--output", "-o"}, paramLabel = "<output>",
            description = "Output file for a single input, output directory for a directory input")
    private Path output;

    @Option(names = {"--verbose", "-v"}, description = "Log debug output and print diagnostics per file")
    private boolean verbose;

    @Option(names = {"--config", "-c"}, paramLabel = "<config.json>", description = "Converter configuration file")
    private Path configFile;

    @Option(names = {"--threads"}, paramLabel = "N", description = "Worker threads for directory input")
    private Integer threads;

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(APPLICATION_LOGGER)).setLevel(Level.DEBUG);
        }
        if (!Files.exists(input)) {
            System.err.println("[ERROR] Input not found: " + input);
            return 1;
        }

        ConverterConfig config;
        try {
            config = configFile == null
                    ? ConverterConfigHelper.loadDefault()
                    : ConverterConfigHelper.loadConfigFile(configFile.toString());
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("[ERROR] Invalid configuration " + configSource(configFile) + ": " + e.getMessage());
            return 1;
        }
        if (threads != null) {
            config.threads = threads;
        }

        SignavioConverter converter = new SignavioConverter(config);
        BatchConverter batchConverter = new BatchConverter(converter);

        BatchSummary summary;
        if (Files.isDirectory(input)) {
            Path outputDirectory = output != null ? output : defaultOutputDirectory(input);
            summary = batchConverter.convertDirectory(input, outputDirectory);
        } else {
            Path outputFile = singleOutputFile(batchConverter);
            summary = batchConverter.convertAll(List.of(input), ignored -> outputFile);
        }

        report(summary);
        return summary.allSucceeded() ? 0 : 1;
    }

    static String configSource(Path configFile) {
        return configFile == null ? "classpath:" + ConverterConfigHelper.DEFAULT_CONFIG_RESOURCE : configFile.toString();
    }

    static Path defaultOutputDirectory(Path inputDirectory) {
        Path parent = inputDirectory.toAbsolutePath().getParent();
        return parent == null
                ? inputDirectory.resolve(BatchConverter.DEFAULT_OUTPUT_DIRECTORY)
                : parent.resolve(BatchConverter.DEFAULT_OUTPUT_DIRECTORY);
    }

    private Path singleOutputFile(BatchConverter batchConverter) {
        if (output == null) {
            Path parent = input.toAbsolutePath().getParent();
            return batchConverter.outputFileFor(input, parent);
        }
        if (Files.isDirectory(output)) {
            return batchConverter.outputFileFor(input, output);
        }
        return output;
    }

    private void report(BatchSummary summary) {
        for (ConversionResult result : summary.results()) {
            if (result.success()) {
                System.out.printf("  [ok] %s -> %s%n", result.inputFile(), result.outputFile());
            } else {
                System.out.printf("  [x]  %s: %s%n", result.inputFile(), result.failureMessage());
            }
            if (verbose) {
                for (Diagnostic diagnostic : result.diagnostics()) {
                    System.out.println("         " + diagnostic);
                }
            }
        }
        System.out.println(summary);
    }
}
