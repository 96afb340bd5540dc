package com.eainde.cds.ingest;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;
import technology.tabula.ObjectExtractor;
import technology.tabula.Page;
import technology.tabula.RectangularTextContainer;
import technology.tabula.Table;
import technology.tabula.extractors.SpreadsheetExtractionAlgorithm;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a PDF report: PDFBox for the text of each page, tabula's ruling-line
 * (spreadsheet) algorithm for tables.
 *
 * <p>Page texts are joined with a newline. A page whose tables cannot be extracted is
 * logged and skipped; its text is still part of the document.</p>
 */
@Slf4j
@Component
public class PdfDocumentIngestor implements DocumentIngestor {

    @Override
    public DocumentContent ingest(Path document) {
        try (PDDocument pdf = PDDocument.load(document.toFile())) {
            String text = extractText(pdf);
            List<RawTable> tables = extractTables(pdf, document);
            log.debug("Ingested {}: {} pages, {} chars, {} tables",
                    document.getFileName(), pdf.getNumberOfPages(), text.length(), tables.size());
            return DocumentContent.of(text, tables);
        } catch (IOException e) {
            throw new DocumentIngestionException("Cannot read document " + document.getFileName(), e);
        }
    }

    private String extractText(PDDocument pdf) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        List<String> pages = new ArrayList<>();
        for (int pageNumber = 1; pageNumber <= pdf.getNumberOfPages(); pageNumber++) {
            stripper.setStartPage(pageNumber);
            stripper.setEndPage(pageNumber);
            String pageText = stripper.getText(pdf);
            if (pageText != null && !pageText.isBlank()) {
                pages.add(pageText.strip());
            }
        }
        return String.join("\n", pages);
    }

    private List<RawTable> extractTables(PDDocument pdf, Path document) {
        List<RawTable> tables = new ArrayList<>();
        ObjectExtractor extractor = new ObjectExtractor(pdf);
        SpreadsheetExtractionAlgorithm algorithm = new SpreadsheetExtractionAlgorithm();

        for (int pageNumber = 1; pageNumber <= pdf.getNumberOfPages(); pageNumber++) {
            try {
                Page page = extractor.extract(pageNumber);
                for (Table table : algorithm.extract(page)) {
                    tables.add(toRawTable(table));
                }
            } catch (RuntimeException e) {
                log.warn("Table extraction failed on page {} of {}; using its text only",
                        pageNumber, document.getFileName(), e);
            }
        }
        return tables;
    }

    @SuppressWarnings("rawtypes")
    private RawTable toRawTable(Table table) {
        List<List<String>> rows = new ArrayList<>();
        for (List<RectangularTextContainer> row : table.getRows()) {
            List<String> cells = new ArrayList<>(row.size());
            for (RectangularTextContainer cell : row) {
                String text = cell.getText();
                cells.add(text == null || text.isBlank() ? null : text.strip());
            }
            rows.add(cells);
        }
        return RawTable.of(rows);
    }
}
