package com.eainde.cds.output;

import com.eainde.cds.assemble.RecordAssembler;
import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.ExtractedRecord;
import com.eainde.cds.model.InstitutionReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ReportWriter writer = new ReportWriter(objectMapper);

    private static InstitutionReport report() {
        ExtractedRecord record = RecordAssembler.standard().assemble(DocumentContent.textOnly(String.join("\n",
                "Total first-time, first-year applicants 12,345",
                "Total first-time, first-year admitted 2,000")));
        return new InstitutionReport("Brown", "brown", Map.of("2024-2025", record));
    }

    @Test
    @DisplayName("should write the canonical shape and create parent directories")
    void writes(@TempDir Path tempDir) throws IOException {
        Path target = tempDir.resolve("nested/schools/brown.json");

        writer.write(report(), target);

        JsonNode json = objectMapper.readTree(target.toFile());
        assertThat(json.get("name").asText()).isEqualTo("Brown");
        assertThat(json.get("slug").asText()).isEqualTo("brown");

        JsonNode year = json.get("years").get("2024-2025");
        assertThat(year.get("admissions").get("applied").asInt()).isEqualTo(12345);
        assertThat(year.get("admissions").get("acceptanceRate").asDouble()).isEqualTo(0.162);
        assertThat(year.get("admissions").has("earlyDecision")).isFalse();
        assertThat(year.get("testScores").has("sat")).isFalse();
        assertThat(year.get("demographics").get("byRace").fieldNames().next()).isEqualTo("international");
        assertThat(year.get("costs").get("totalCOA").asInt()).isZero();
    }

    @Test
    @DisplayName("percentile triples carry exactly p25, p50 and p75")
    void percentileShape(@TempDir Path tempDir) throws IOException {
        ExtractedRecord record = RecordAssembler.standard().assemble(DocumentContent.textOnly(String.join("\n",
                "SAT Evidence-Based Reading and Writing 600 - 720",
                "SAT Math 620 - 760")));
        Path target = tempDir.resolve("brown.json");

        writer.write(new InstitutionReport("Brown", "brown", Map.of("2024-2025", record)), target);

        JsonNode sat = objectMapper.readTree(target.toFile())
                .get("years").get("2024-2025").get("testScores").get("sat");
        for (String block : List.of("composite", "readingWriting", "math")) {
            assertThat(sat.get(block).fieldNames()).toIterable()
                    .as(block)
                    .containsExactly("p25", "p50", "p75");
        }
        assertThat(sat.get("composite").get("p25").asInt()).isEqualTo(1220);
        assertThat(sat.get("composite").get("p75").asInt()).isEqualTo(1480);
    }

    @Test
    @DisplayName("should indent the output")
    void indented(@TempDir Path tempDir) throws IOException {
        Path target = tempDir.resolve("brown.json");

        writer.write(InstitutionReport.empty("Brown", "brown"), target);

        assertThat(Files.readAllLines(target)).hasSizeGreaterThan(1);
    }

    @Test
    @DisplayName("should wrap write failures")
    void failure(@TempDir Path tempDir) {
        assertThatThrownBy(() -> writer.write(InstitutionReport.empty("Brown", "brown"), tempDir))
                .isInstanceOf(ReportWriteException.class)
                .hasMessageContaining("brown");
    }

    @Test
    @DisplayName("default target is <output-dir>/<slug>.json")
    void defaultTarget() {
        assertThat(ReportWriter.defaultTarget("src/data/schools", "brown"))
                .isEqualTo(Path.of("src/data/schools", "brown.json"));
    }
}
