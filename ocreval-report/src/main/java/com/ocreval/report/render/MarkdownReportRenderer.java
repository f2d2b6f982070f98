package com.ocreval.report.render;

import com.ocreval.common.dto.EvaluationRecord;
import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.dto.EvaluationSummary;
import com.ocreval.common.dto.FailureEntry;
import com.ocreval.common.dto.ManifestParseError;
import com.ocreval.common.dto.RecognitionOutcome;
import com.ocreval.report.config.ReportProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ocreval.report.render.MarkdownSupport.cell;
import static com.ocreval.report.render.MarkdownSupport.decimal;
import static com.ocreval.report.render.MarkdownSupport.directoryLabel;
import static com.ocreval.report.render.MarkdownSupport.percent;
import static com.ocreval.report.render.MarkdownSupport.ratio;

/**
 * 单引擎评估报告（Markdown）。
 * <p>
 * 章节顺序：基本信息、技术细节、分目录结果、统计信息、识别失败、数据质量、评估方法、结论。
 */
@Component
@RequiredArgsConstructor
public class MarkdownReportRenderer {

    private static final Set<String> HEADLINE_KEYS = Set.of("name", "type");

    private final ReportProperties properties;

    public String render(EvaluationReport report) {
        StringBuilder md = new StringBuilder();
        EvaluationSummary summary = report.getSummary();

        line(md, "# " + report.getEngineName() + " 图片识别准确率报告");
        line(md, "");
        line(md, "**运行 ID**: " + report.getRunId());
        line(md, "**测试时间**: " + MarkdownSupport.time(report.getStartedAt()));
        line(md, "**使用模型**: " + report.getEngineName());
        line(md, "**测试图片总数**: " + summary.getTotalImages());
        line(md, "**识别成功数**: " + summary.getSucceededImages());
        line(md, "**总体准确率**: " + ratio(summary.getOverallAccuracy()));
        line(md, "");

        appendTechnicalDetails(md, report);
        appendDirectoryResults(md, report);
        appendStatistics(md, summary);
        appendFailures(md, summary.getFailures());
        appendDataQuality(md, report);
        appendEvaluationMethod(md);
        appendConclusion(md, report.getEngineName(), summary);

        line(md, "---");
        line(md, "");
        line(md, "*报告生成时间: " + MarkdownSupport.now() + "*");
        return md.toString();
    }

    private void appendTechnicalDetails(StringBuilder md, EvaluationReport report) {
        Map<String, Object> details = report.getEngineDetails();
        line(md, "## 技术实现细节");
        line(md, "");
        line(md, "### 模型配置");
        line(md, "");
        line(md, "- **模型名称**: " + details.getOrDefault("name", report.getEngineName()));
        line(md, "- **模型类型**: " + details.getOrDefault("type", "未知"));
        details.forEach((key, value) -> {
            if (!HEADLINE_KEYS.contains(key)) {
                line(md, "- **" + key + "**: " + value);
            }
        });
        line(md, "");

        line(md, "### 运行耗时");
        line(md, "");
        line(md, "- **开始时间**: " + MarkdownSupport.time(report.getStartedAt()));
        line(md, "- **结束时间**: " + MarkdownSupport.time(report.getFinishedAt()));
        line(md, "- **总处理时间**: " + MarkdownSupport.seconds(report.getElapsed()));
        line(md, "- **平均识别耗时**: " + MarkdownSupport.millis(report.getAverageLatencyMillis()));
        line(md, "");
    }

    private void appendDirectoryResults(StringBuilder md, EvaluationReport report) {
        line(md, "## 分目录结果");
        line(md, "");
        if (report.getDirectorySummaries().isEmpty()) {
            line(md, "没有可评估的目录。");
            line(md, "");
            return;
        }

        int sampleRows = properties.getSampleRows();
        report.getDirectorySummaries().forEach((directory, summary) -> {
            line(md, "### " + directoryLabel(directory));
            line(md, "");
            line(md, "- **目录路径**: " + directory);
            line(md, "- **图片数量**: " + summary.getTotalImages());
            line(md, "- **平均准确率**: " + ratio(summary.getOverallAccuracy()));
            line(md, "- **完全匹配数量**: " + summary.getExactMatchCount());
            line(md, "- **完全匹配率**: " + ratio(summary.getExactMatchRate()));
            line(md, "");

            if (sampleRows <= 0) {
                return;
            }
            List<EvaluationRecord> records = report.getRecords().stream()
                    .filter(r -> summary.getImagePaths().contains(r.getImagePath()))
                    .toList();
            line(md, "#### 详细识别结果（前" + sampleRows + "个样本）");
            line(md, "");
            line(md, "| 图片名称 | 标准答案 | 识别结果 | 准确率 | 完全匹配 |");
            line(md, "|---------|---------|---------|--------|---------|");
            records.stream().limit(sampleRows).forEach(r -> line(md, "| "
                    + cell(fileName(r.getImagePath())) + " | "
                    + cell(r.getGroundTruth().getTranscription()) + " | "
                    + cell(predicted(r.getOutcome())) + " | "
                    + decimal(r.getAccuracy()) + " | "
                    + (r.isExactMatch() ? "✓" : "✗") + " |"));
            if (records.size() > sampleRows) {
                line(md, "| ... | ... | ... | ... | ... |");
                line(md, "| (共" + records.size() + "个样本) | | | | |");
            }
            line(md, "");
        });
    }

    private void appendStatistics(StringBuilder md, EvaluationSummary summary) {
        line(md, "## 统计信息");
        line(md, "");
        line(md, "- **完全匹配数量**: " + summary.getExactMatchCount());
        line(md, "- **完全匹配率**: " + ratio(summary.getExactMatchRate()));
        line(md, "- **识别失败数量**: " + summary.failedImages());
        line(md, "");
        line(md, "### 准确率分布");
        line(md, "");
        summary.getAccuracyDistribution().forEach((bucket, count) ->
                line(md, "- **" + bucket + "**: " + count + " 张图片 ("
                        + percent(count, summary.getTotalImages()) + ")"));
        line(md, "");
    }

    private void appendFailures(StringBuilder md, List<FailureEntry> failures) {
        if (failures.isEmpty()) {
            return;
        }
        line(md, "## 识别失败");
        line(md, "");
        line(md, "| 图片 | 失败原因 |");
        line(md, "|------|---------|");
        for (FailureEntry failure : failures) {
            line(md, "| " + cell(failure.getImagePath()) + " | " + cell(failure.getErrorDetail()) + " |");
        }
        line(md, "");
    }

    private void appendDataQuality(StringBuilder md, EvaluationReport report) {
        line(md, "## 数据质量");
        line(md, "");
        line(md, "- **跳过的标注行**: " + report.getSkippedLines());
        line(md, "- **排除的困难样本**: " + report.getExcludedDifficult());
        line(md, "");
        List<ManifestParseError> errors = report.getParseErrors();
        if (errors.isEmpty()) {
            return;
        }
        line(md, "| 标注文件 | 行号 | 原因 |");
        line(md, "|---------|------|------|");
        for (ManifestParseError error : errors) {
            line(md, "| " + cell(error.getSource()) + " | " + error.getLineNumber() + " | "
                    + cell(error.getReason()) + " |");
        }
        line(md, "");
    }

    private void appendEvaluationMethod(StringBuilder md) {
        line(md, "## 评估方法");
        line(md, "");
        line(md, "1. **完全匹配率**：识别结果与标准答案完全相同时计为 1，否则为 0");
        line(md, "   - 公式：`完全匹配率 = 完全匹配数量 / 总图片数`");
        line(md, "2. **编辑距离准确率**：基于 Levenshtein 编辑距离计算字符级相似度");
        line(md, "   - 公式：`准确率 = 1 - 编辑距离 / max(len(标准答案), len(识别结果))`");
        line(md, "3. **总体准确率**：所有图片编辑距离准确率的平均值，识别失败的图片计 0 分");
        line(md, "");
    }

    private void appendConclusion(StringBuilder md, String engineName, EvaluationSummary summary) {
        line(md, "## 结论与建议");
        line(md, "");
        Double accuracy = summary.getOverallAccuracy();
        if (accuracy == null) {
            line(md, "### " + engineName + " 无可用数据");
            line(md, "");
            line(md, "- 数据集中没有可评估的图片，请检查图片目录与标注文件");
        } else if (accuracy >= properties.getAccuracyThreshold()) {
            line(md, "### " + engineName + " 表现优异");
            line(md, "");
            line(md, "- 准确率达到 " + ratio(accuracy) + "，表现优异");
            line(md, "- 适用于对准确率要求较高的生产环境");
        } else if (accuracy >= properties.getGoodThreshold()) {
            line(md, "### " + engineName + " 表现良好");
            line(md, "");
            line(md, "- 准确率为 " + ratio(accuracy) + "，表现良好");
            line(md, "- 可考虑进一步优化以提高准确率");
        } else {
            line(md, "### " + engineName + " 需要优化");
            line(md, "");
            line(md, "- 准确率为 " + ratio(accuracy) + "，建议进行优化");
            line(md, "- 考虑调整配置参数或后处理规则");
        }
        line(md, "");
    }

    private static String predicted(RecognitionOutcome outcome) {
        if (outcome == null) {
            return "";
        }
        return outcome.isSucceeded() ? outcome.getRecognizedText() : "失败: " + outcome.getErrorDetail();
    }

    private static String fileName(String imagePath) {
        int slash = imagePath.lastIndexOf('/');
        return slash < 0 ? imagePath : imagePath.substring(slash + 1);
    }

    private static void line(StringBuilder md, String text) {
        md.append(text).append('\n');
    }
}
