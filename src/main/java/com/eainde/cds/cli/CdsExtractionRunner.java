package com.eainde.cds.cli;

import com.eainde.cds.config.ExtractionProperties;
import com.eainde.cds.output.ReportWriteException;
import com.eainde.cds.output.ReportWriter;
import com.eainde.cds.service.BatchExtractionResult;
import com.eainde.cds.service.CdsExtractionService;
import com.eainde.cds.service.SchoolName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 * cds-extractor &lt;school&gt; [--pdf-dir=DIR] [--single-pdf=FILE] [--output=FILE] [--verbose]
 * </pre>
 *
 * <h3>Exit codes</h3>
 * <ul>
 *   <li>0: report written, even when single documents failed</li>
 *   <li>1: the report could not be written</li>
 *   <li>2: no school given</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CdsExtractionRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE =
            "Usage: cds-extractor <school> [--pdf-dir=DIR] [--single-pdf=FILE] [--output=FILE] [--verbose]";

    private static final String EXTRACTION_LOGGER = "com.eainde.cds";

    private final CdsExtractionService extractionService;
    private final ReportWriter reportWriter;
    private final ExtractionProperties properties;
    private final LoggingSystem loggingSystem;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            log.error("School name is required. {}", USAGE);
            exitCode = 2;
            return;
        }

        if (args.containsOption("verbose")) {
            loggingSystem.setLogLevel(EXTRACTION_LOGGER, LogLevel.DEBUG);
        }

        String school = positional.get(0);
        SchoolName name = SchoolName.configured(school, properties);

        BatchExtractionResult result;
        String singlePdf = option(args, "single-pdf");
        if (singlePdf != null) {
            result = extractionService.processFiles(school, List.of(Path.of(singlePdf)));
        } else {
            String pdfDir = option(args, "pdf-dir");
            Path directory = pdfDir != null
                    ? Path.of(pdfDir)
                    : Path.of(properties.getPdfRoot(), name.displayName());
            result = extractionService.processDirectory(school, directory);
        }

        String output = option(args, "output");
        Path target = output != null
                ? Path.of(output)
                : ReportWriter.defaultTarget(properties.getOutputDir(), name.slug());

        try {
            reportWriter.write(result.getReport(), target);
        } catch (ReportWriteException e) {
            log.error("Failed to write report", e);
            exitCode = 1;
            return;
        }

        log.info("School: {}, years extracted: {}", result.getReport().name(), result.getReport().years().size());
        exitCode = 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return null;
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value;
    }
}
