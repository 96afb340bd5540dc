package com.eainde.cds.output;

import com.eainde.cds.model.InstitutionReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes an {@link InstitutionReport} as indented JSON, creating parent directories.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportWriter {

    private final ObjectMapper objectMapper;

    /**
     * @return the path written
     * @throws ReportWriteException when serialization or the file write fails
     */
    public Path write(InstitutionReport report, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
            log.info("Output written to: {}", target);
            return target;
        } catch (IOException e) {
            throw new ReportWriteException("Cannot write report for " + report.slug() + " to " + target, e);
        }
    }

    /** {@code <outputDir>/<slug>.json} */
    public static Path defaultTarget(String outputDir, String slug) {
        return Path.of(outputDir, slug + ".json");
    }
}
