package com.ocreval.report.service;

import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.exception.ReportException;
import com.ocreval.report.ReportFixtures;
import com.ocreval.report.codec.CsvRecordExporter;
import com.ocreval.report.codec.JsonReportCodec;
import com.ocreval.report.config.ReportFormat;
import com.ocreval.report.config.ReportProperties;
import com.ocreval.report.render.ComparisonReportRenderer;
import com.ocreval.report.render.MarkdownReportRenderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportWriterTest {

    @TempDir
    Path tempDir;

    private final ReportProperties properties = new ReportProperties();
    private final JsonReportCodec codec = new JsonReportCodec();
    private final ReportWriter writer = new ReportWriter(properties,
            new MarkdownReportRenderer(properties), new ComparisonReportRenderer(), codec, new CsvRecordExporter());

    @Test
    void writesTimestampedMarkdownAndJson() throws IOException {
        EvaluationReport report = ReportFixtures.report("qwen-vl");
        Path out = tempDir.resolve("reports/nested");
        String timestamp = ReportWriter.timestamp(report.getFinishedAt());

        List<Path> files = writer.writeEvaluation(report, out, ReportFormat.BOTH, null);

        assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly(
                "qwen-vl_accuracy_report_" + timestamp + ".md",
                "qwen-vl_results_" + timestamp + ".json");
        assertThat(Files.readString(files.get(0))).startsWith("# qwen-vl 图片识别准确率报告");
        assertThat(codec.readReport(Files.readString(files.get(1)))).isEqualTo(report);
    }

    @Test
    void customNameAndSingleFormat() {
        List<Path> files = writer.writeEvaluation(ReportFixtures.report("tesseract"), tempDir, ReportFormat.JSON, "run1");

        assertThat(files).containsExactly(tempDir.resolve("run1.json"));
        assertThat(tempDir.resolve("run1.md")).doesNotExist();
    }

    @Test
    void allFormatAddsCsv() {
        List<Path> files = writer.writeEvaluation(ReportFixtures.report("tesseract"), tempDir, ReportFormat.ALL, "run2");

        assertThat(files).containsExactly(tempDir.resolve("run2.md"), tempDir.resolve("run2.json"),
                tempDir.resolve("run2.csv"));
    }

    @Test
    void comparisonUsesConfiguredDefaultName() {
        EvaluationReport first = ReportFixtures.report("qwen-vl");
        EvaluationReport second = ReportFixtures.report("tesseract");

        List<Path> files = writer.writeComparison(ReportFixtures.comparison(first, second),
                List.of(first, second), tempDir, null);

        assertThat(files).containsExactly(tempDir.resolve("model_comparison.md"), tempDir.resolve("model_comparison.json"));
        assertThat(files).allMatch(Files::exists);
    }

    @Test
    void ioFailureIsAReportError() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");

        assertThatThrownBy(() -> writer.writeEvaluation(ReportFixtures.report("qwen-vl"),
                blocker.resolve("out"), ReportFormat.MARKDOWN, null))
                .isInstanceOf(ReportException.class)
                .hasMessageStartingWith("写入报告失败");
    }

    @Test
    void engineNamesAreMadeFileSafe() {
        assertThat(ReportWriter.safeFileName("qwen/vl 7b")).isEqualTo("qwen_vl_7b");
        assertThat(ReportWriter.safeFileName(" ")).isEqualTo("engine");
    }

    @Test
    void reportFormatParsing() {
        assertThat(ReportFormat.parse("Markdown")).isEqualTo(ReportFormat.MARKDOWN);
        assertThat(ReportFormat.parse(null)).isEqualTo(ReportFormat.BOTH);
        assertThatThrownBy(() -> ReportFormat.parse("pdf")).hasMessageContaining("pdf");
    }
}
