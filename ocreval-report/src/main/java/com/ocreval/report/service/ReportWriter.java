package com.ocreval.report.service;

import com.ocreval.common.dto.ComparisonResult;
import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.exception.ReportException;
import com.ocreval.report.codec.CsvRecordExporter;
import com.ocreval.report.codec.JsonReportCodec;
import com.ocreval.report.config.ReportFormat;
import com.ocreval.report.config.ReportProperties;
import com.ocreval.report.render.ComparisonReportRenderer;
import com.ocreval.report.render.MarkdownReportRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 报告落盘：渲染 Markdown / JSON 并写入输出目录。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportWriter {

    static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final ReportProperties properties;
    private final MarkdownReportRenderer markdownRenderer;
    private final ComparisonReportRenderer comparisonRenderer;
    private final JsonReportCodec jsonCodec;
    private final CsvRecordExporter csvExporter;

    /**
     * 写出单引擎评估报告。
     *
     * @param outputDir  输出目录，null 时使用配置值
     * @param format     报告格式，null 时使用配置值
     * @param reportName 自定义文件名（不含扩展名），为空时按引擎名和时间生成
     * @return 写出的文件，依次为 Markdown、JSON、CSV
     */
    public List<Path> writeEvaluation(EvaluationReport report, Path outputDir, ReportFormat format, String reportName) {
        Path dir = resolveDir(outputDir);
        ReportFormat effective = format != null ? format : properties.getFormat();
        boolean custom = reportName != null && !reportName.isBlank();
        String engine = safeFileName(report.getEngineName());
        String timestamp = timestamp(report.getFinishedAt());

        List<Path> written = new ArrayList<>();
        if (effective.includesMarkdown()) {
            String name = custom ? reportName + ".md" : engine + "_accuracy_report_" + timestamp + ".md";
            written.add(write(dir.resolve(name), markdownRenderer.render(report)));
            log.info("Markdown 报告已保存至: {}", written.get(written.size() - 1));
        }
        if (effective.includesJson()) {
            String name = custom ? reportName + ".json" : engine + "_results_" + timestamp + ".json";
            written.add(write(dir.resolve(name), jsonCodec.writeReport(report)));
            log.info("JSON 结果已保存至: {}", written.get(written.size() - 1));
        }
        if (effective.includesCsv()) {
            String name = custom ? reportName + ".csv" : engine + "_records_" + timestamp + ".csv";
            written.add(write(dir.resolve(name), csvExporter.write(report)));
            log.info("CSV 明细已保存至: {}", written.get(written.size() - 1));
        }
        return written;
    }

    /**
     * 写出对比报告，Markdown 与 JSON 各一份。
     *
     * @param reportName 文件名前缀，为空时使用配置的默认名
     */
    public List<Path> writeComparison(ComparisonResult comparison, List<EvaluationReport> reports,
                                      Path outputDir, String reportName) {
        Path dir = resolveDir(outputDir);
        String name = reportName != null && !reportName.isBlank()
                ? reportName : properties.getComparisonReportName();

        Path markdown = write(dir.resolve(name + ".md"), comparisonRenderer.render(comparison, reports));
        Path json = write(dir.resolve(name + ".json"), jsonCodec.writeComparison(comparison));
        log.info("对比报告已保存至: {}, {}", markdown, json);
        return List.of(markdown, json);
    }

    private Path resolveDir(Path outputDir) {
        return outputDir != null ? outputDir : Path.of(properties.getOutputDir());
    }

    private Path write(Path file, String content) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new ReportException("写入报告失败: " + file, e);
        }
    }

    static String timestamp(Instant instant) {
        LocalDateTime time = instant != null
                ? LocalDateTime.ofInstant(instant, ZoneId.systemDefault())
                : LocalDateTime.now();
        return FILE_TIMESTAMP.format(time);
    }

    /**
     * 引擎名中不适合做文件名的字符替换为下划线。
     */
    static String safeFileName(String name) {
        if (name == null || name.isBlank()) {
            return "engine";
        }
        return name.replaceAll("[^A-Za-z0-9._\\-]", "_");
    }
}
