package com.eainde.cds.service;

import com.eainde.cds.model.InstitutionReport;

import java.util.List;

/**
 * Aggregated result of processing a batch of documents for one school.
 *
 * Contains the assembled report (one record per reporting period) and the per-file
 * outcomes with summary counts.
 */
public class BatchExtractionResult {

    private final InstitutionReport report;
    private final List<FileResult> fileResults;
    private final int successCount;
    private final int failureCount;

    private BatchExtractionResult(InstitutionReport report, List<FileResult> fileResults) {
        this.report = report;
        this.fileResults = List.copyOf(fileResults);
        this.successCount = (int) fileResults.stream().filter(FileResult::isSuccess).count();
        this.failureCount = fileResults.size() - this.successCount;
    }

    public static BatchExtractionResult aggregate(InstitutionReport report, List<FileResult> fileResults) {
        return new BatchExtractionResult(report, fileResults);
    }

    public static BatchExtractionResult empty(SchoolName school) {
        return new BatchExtractionResult(InstitutionReport.empty(school.displayName(), school.slug()), List.of());
    }

    public InstitutionReport getReport() {
        return report;
    }

    public List<FileResult> getFileResults() {
        return fileResults;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public int getTotalCount() {
        return fileResults.size();
    }

    /**
     * Per-file result: the reporting period it was filed under, or the error that excluded it.
     */
    public static class FileResult {

        private final String fileName;
        private final String period;
        private final boolean success;
        private final String errorMessage;

        private FileResult(String fileName, String period, boolean success, String errorMessage) {
            this.fileName = fileName;
            this.period = period;
            this.success = success;
            this.errorMessage = errorMessage;
        }

        public static FileResult success(String fileName, String period) {
            return new FileResult(fileName, period, true, null);
        }

        public static FileResult failure(String fileName, String period, String errorMessage) {
            return new FileResult(fileName, period, false, errorMessage);
        }

        public String getFileName() {
            return fileName;
        }

        public String getPeriod() {
            return period;
        }

        public boolean isSuccess() {
            return success;
        }

        public String getErrorMessage() {
            return errorMessage;
        }
    }
}
