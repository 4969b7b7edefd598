package org.neuralchilli.cellflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.cellflow.domain.Artifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Concatenates per-file tabular results into the run-level summary.
 * <p>
 * Inputs are CSV files sharing one header; the summary holds that header once
 * followed by every input's rows, in input order. Inputs are only read, and
 * the same inputs in the same order always give the same bytes.
 */
@ApplicationScoped
public class ResultAggregator implements StageFunction {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    @Override
    public Artifact apply(StageInvocation invocation) throws IOException {
        Path summary = aggregate(invocation.inputs(), invocation.output());
        return Artifact.of(invocation.stage(), summary);
    }

    /**
     * Write the concatenation of {@code inputs} to {@code target}.
     *
     * @throws IllegalStateException if an input is not tabular or its header
     *                               differs from the first input's
     */
    public Path aggregate(List<Artifact> inputs, Path target) throws IOException {
        log.info("Merging {} per-file results into {}", inputs.size(), target);

        String header = null;
        int rows = 0;

        Files.createDirectories(target.toAbsolutePath().getParent());
        Path partial = target.resolveSibling(target.getFileName() + ".partial");

        try (BufferedWriter writer = Files.newBufferedWriter(partial, StandardCharsets.UTF_8)) {
            for (Artifact input : inputs) {
                if (!input.isTabular()) {
                    throw new IllegalStateException("Cannot merge non-tabular artifact: " + input);
                }

                List<String> lines = Files.readAllLines(input.path(), StandardCharsets.UTF_8);
                if (lines.isEmpty()) {
                    log.warn("Skipping empty result: {}", input.path());
                    continue;
                }

                String inputHeader = lines.get(0);
                if (header == null) {
                    header = inputHeader;
                    writer.write(header);
                    writer.write('\n');
                } else if (!header.equals(inputHeader)) {
                    throw new IllegalStateException(
                            "Header of " + input.path() + " does not match the first result: '"
                                    + inputHeader + "' vs '" + header + "'"
                    );
                }

                for (String row : lines.subList(1, lines.size())) {
                    if (row.isBlank()) {
                        continue;
                    }
                    writer.write(row);
                    writer.write('\n');
                    rows++;
                }
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(partial);
            throw e;
        }

        Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        log.info("Summary written: {} rows from {} results", rows, inputs.size());
        return target;
    }
}
