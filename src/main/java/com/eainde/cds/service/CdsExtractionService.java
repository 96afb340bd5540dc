package com.eainde.cds.service;

import com.eainde.cds.assemble.RecordAssembler;
import com.eainde.cds.config.ExtractionProperties;
import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.ingest.DocumentIngestor;
import com.eainde.cds.model.ExtractedRecord;
import com.eainde.cds.model.InstitutionReport;
import com.eainde.cds.period.ReportingPeriodResolver;
import com.eainde.cds.rules.TextRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Service that processes a school's documents into one {@link InstitutionReport}.
 *
 * For each document, in file-name order:
 *   1. Infer the reporting period from the file name
 *   2. Ingest text and tables
 *   3. Assemble the record with the school's extraction profile
 *
 * A document that fails is logged and excluded; the remaining documents are still processed.
 */
@Service
public class CdsExtractionService {

    private static final Logger log = LoggerFactory.getLogger(CdsExtractionService.class);

    private final DocumentIngestor documentIngestor;
    private final ExtractionProperties properties;
    private final TextRuleSet textRuleSet;

    public CdsExtractionService(DocumentIngestor documentIngestor,
                                ExtractionProperties properties,
                                TextRuleSet textRuleSet) {
        this.documentIngestor = documentIngestor;
        this.properties = properties;
        this.textRuleSet = textRuleSet;
    }

    /**
     * Processes every {@code *.pdf} in the directory.
     */
    public BatchExtractionResult processDirectory(String school, Path directory) {
        SchoolName name = SchoolName.configured(school, properties);
        if (!Files.isDirectory(directory)) {
            log.error("PDF directory not found: {}", directory);
            return BatchExtractionResult.empty(name);
        }

        List<Path> documents;
        try (Stream<Path> entries = Files.list(directory)) {
            documents = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Cannot list PDF directory: {}", directory, e);
            return BatchExtractionResult.empty(name);
        }

        if (documents.isEmpty()) {
            log.error("No PDF files found in: {}", directory);
            return BatchExtractionResult.empty(name);
        }
        return processFiles(school, documents);
    }

    /**
     * Main entry point: processes the given documents strictly one after another and
     * returns the aggregated report.
     */
    public BatchExtractionResult processFiles(String school, List<Path> documents) {
        SchoolName name = SchoolName.configured(school, properties);
        log.info("Starting extraction for school: {} ({} documents)", name.displayName(), documents.size());

        RecordAssembler assembler = RecordAssembler.forProfile(textRuleSet, properties.profile(name.slug()));

        List<Path> ordered = new ArrayList<>(documents);
        ordered.sort(Comparator.comparing(p -> p.getFileName().toString()));

        Map<String, ExtractedRecord> years = new LinkedHashMap<>();
        List<BatchExtractionResult.FileResult> fileResults = new ArrayList<>();

        for (Path document : ordered) {
            String fileName = document.getFileName().toString();
            String period = ReportingPeriodResolver.resolve(fileName);
            log.info("Processing {} (Year: {})", fileName, period);

            try {
                DocumentContent content = documentIngestor.ingest(document);
                ExtractedRecord record = assembler.assemble(content);

                if (years.containsKey(period)) {
                    log.warn("Reporting period {} already extracted; {} replaces the earlier document",
                            period, fileName);
                }
                years.put(period, record);
                fileResults.add(BatchExtractionResult.FileResult.success(fileName, period));
                logSummary(period, record);
            } catch (Exception e) {
                log.error("Error processing {}", fileName, e);
                fileResults.add(BatchExtractionResult.FileResult.failure(fileName, period, e.getMessage()));
            }
        }

        BatchExtractionResult result = BatchExtractionResult.aggregate(
                new InstitutionReport(name.displayName(), name.slug(), years), fileResults);

        log.info("Extraction completed for school: {}. Processed: {}, Succeeded: {}, Failed: {}",
                name.displayName(),
                result.getTotalCount(),
                result.getSuccessCount(),
                result.getFailureCount());

        return result;
    }

    private void logSummary(String period, ExtractedRecord record) {
        log.info("  {}: {} applied, {} admitted ({})",
                period,
                String.format("%,d", record.admissions().applied()),
                String.format("%,d", record.admissions().admitted()),
                String.format("%.1f%%", record.admissions().acceptanceRate() * 100));
        if (record.testScores().sat() != null) {
            log.info("  SAT: {}-{}",
                    record.testScores().sat().composite().p25(),
                    record.testScores().sat().composite().p75());
        }
        if (record.costs().totalCOA() > 0) {
            log.info("  Total COA: ${}", String.format("%,d", record.costs().totalCOA()));
        }
    }
}
