package com.eainde.cds.cli;

import com.eainde.cds.config.ExtractionProperties;
import com.eainde.cds.config.SchoolProfile;
import com.eainde.cds.output.ReportWriteException;
import com.eainde.cds.output.ReportWriter;
import com.eainde.cds.service.BatchExtractionResult;
import com.eainde.cds.service.CdsExtractionService;
import com.eainde.cds.service.SchoolName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CdsExtractionRunnerTest {

    @Mock
    private CdsExtractionService extractionService;

    @Mock
    private ReportWriter reportWriter;

    @Mock
    private LoggingSystem loggingSystem;

    private CdsExtractionRunner runner;

    private final BatchExtractionResult emptyResult = BatchExtractionResult.empty(SchoolName.of("brown"));

    @BeforeEach
    void setUp() {
        runner = new CdsExtractionRunner(extractionService, reportWriter, new ExtractionProperties(), loggingSystem);
    }

    @Test
    @DisplayName("should exit with 2 when no school is given")
    void missingSchool() {
        runner.run(new DefaultApplicationArguments("--verbose"));

        assertThat(runner.getExitCode()).isEqualTo(2);
        verifyNoInteractions(extractionService, reportWriter);
    }

    @Test
    @DisplayName("should process the default directory and write the default output")
    void defaults() {
        when(extractionService.processDirectory(anyString(), any())).thenReturn(emptyResult);

        runner.run(new DefaultApplicationArguments("brown"));

        verify(extractionService).processDirectory("brown", Path.of("./College-Data", "Brown"));
        verify(reportWriter).write(emptyResult.getReport(), Path.of("src/data/schools", "brown.json"));
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("the default directory uses the profile's display name")
    void configuredDisplayName() {
        SchoolProfile ucla = new SchoolProfile();
        ucla.setDisplayName("UCLA");
        ExtractionProperties properties = new ExtractionProperties();
        properties.getSchools().put("ucla", ucla);
        CdsExtractionRunner configured =
                new CdsExtractionRunner(extractionService, reportWriter, properties, loggingSystem);
        when(extractionService.processDirectory(anyString(), any())).thenReturn(emptyResult);

        configured.run(new DefaultApplicationArguments("ucla"));

        verify(extractionService).processDirectory("ucla", Path.of("./College-Data", "UCLA"));
        verify(reportWriter).write(emptyResult.getReport(), Path.of("src/data/schools", "ucla.json"));
    }

    @Test
    @DisplayName("should honour --pdf-dir and --output")
    void explicitPaths() {
        when(extractionService.processDirectory(anyString(), any())).thenReturn(emptyResult);

        runner.run(new DefaultApplicationArguments("brown", "--pdf-dir=/data/brown", "--output=/tmp/out.json"));

        verify(extractionService).processDirectory("brown", Path.of("/data/brown"));
        verify(reportWriter).write(emptyResult.getReport(), Path.of("/tmp/out.json"));
    }

    @Test
    @DisplayName("should process a single document with --single-pdf")
    void singlePdf() {
        when(extractionService.processFiles(anyString(), any())).thenReturn(emptyResult);

        runner.run(new DefaultApplicationArguments("brown", "--single-pdf=CDS_2024-2025.pdf"));

        verify(extractionService).processFiles("brown", List.of(Path.of("CDS_2024-2025.pdf")));
    }

    @Test
    @DisplayName("should raise extraction logging to DEBUG with --verbose")
    void verbose() {
        when(extractionService.processDirectory(anyString(), any())).thenReturn(emptyResult);

        runner.run(new DefaultApplicationArguments("brown", "--verbose"));

        verify(loggingSystem).setLogLevel("com.eainde.cds", LogLevel.DEBUG);
    }

    @Test
    @DisplayName("should exit with 1 when the report cannot be written")
    void writeFailure() {
        when(extractionService.processDirectory(anyString(), any())).thenReturn(emptyResult);
        when(reportWriter.write(any(), any()))
                .thenThrow(new ReportWriteException("Cannot write report", new IOException("disk full")));

        runner.run(new DefaultApplicationArguments("brown"));

        assertThat(runner.getExitCode()).isEqualTo(1);
    }
}
