package io.bpmnconvert.signavio.batch;

import io.bpmnconvert.signavio.ConvertedDocument;
import io.bpmnconvert.signavio.SignavioConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Converts many files in parallel. A failing file is recorded in its own result and never
 * stops the others.
 */
public class BatchConverter {
    private static final Logger log = LoggerFactory.getLogger(BatchConverter.class);

    public static final String DEFAULT_OUTPUT_DIRECTORY = "bpmn_xml";

    private final SignavioConverter converter;
    private final int threads;

    public BatchConverter(SignavioConverter converter, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive, got " + threads);
        }
        this.converter = converter;
        this.threads = threads;
    }

    public BatchConverter(SignavioConverter converter) {
        this(converter, converter.getConfig().effectiveThreads());
    }

    /**
     * Lists the {@code *.json} files directly inside a directory, sorted by name.
     */
    public static List<Path> findInputFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Given path is not a directory: " + directory);
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to list input directory: " + directory, e);
        }
    }

    /**
     * Output path for an input file: same base name, configured extension, inside {@code outputDirectory}.
     */
    public Path outputFileFor(Path inputFile, Path outputDirectory) {
        String fileName = inputFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        return outputDirectory.resolve(baseName + converter.getConfig().outputExtension);
    }

    public BatchSummary convertDirectory(Path inputDirectory, Path outputDirectory) {
        List<Path> inputs = findInputFiles(inputDirectory);
        log.info("Found {} JSON files in {}", inputs.size(), inputDirectory);
        return convertAll(inputs, input -> outputFileFor(input, outputDirectory));
    }

    /**
     * Converts every input on a fixed pool and waits for all of them.
     *
     * @param inputs    files to convert
     * @param outputFor maps an input file to the file its XML is written to
     * @return one result per input, in input order
     */
    public BatchSummary convertAll(List<Path> inputs, Function<Path, Path> outputFor) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(threads, inputs.size())));
        try {
            List<Future<ConversionResult>> futures = new ArrayList<>(inputs.size());
            for (Path input : inputs) {
                futures.add(executor.submit(() -> convertOne(input, outputFor.apply(input))));
            }

            List<ConversionResult> results = new ArrayList<>(inputs.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), inputs.get(i)));
            }
            BatchSummary summary = new BatchSummary(results);
            log.info("{}", summary);
            return summary;
        } finally {
            executor.shutdownNow();
        }
    }

    private ConversionResult await(Future<ConversionResult> future, Path input) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(input, "Interrupted while waiting for conversion");
        } catch (ExecutionException e) {
            return failure(input, String.valueOf(e.getCause()));
        }
    }

    ConversionResult convertOne(Path input, Path output) {
        try {
            ConvertedDocument document = converter.convertFile(input, output);
            return ConversionResult.builder()
                    .inputFile(input)
                    .outputFile(output)
                    .success(true)
                    .diagnostics(document.diagnostics().getRecords())
                    .diagnosticCounts(document.diagnostics().countsByKind())
                    .build();
        } catch (RuntimeException e) {
            log.error("Error converting file: {}: {}", input.getFileName(), e.getMessage());
            log.debug("Conversion failure of {}", input, e);
            return failure(input, e.getMessage());
        }
    }

    private static ConversionResult failure(Path input, String message) {
        return ConversionResult.builder()
                .inputFile(input)
                .success(false)
                .failureMessage(message)
                .build();
    }
}
