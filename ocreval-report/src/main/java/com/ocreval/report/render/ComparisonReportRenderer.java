package com.ocreval.report.render;

import com.ocreval.common.dto.AccuracyBucket;
import com.ocreval.common.dto.ComparisonResult;
import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.dto.EvaluationSummary;
import com.ocreval.common.dto.RankedEngine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.ocreval.report.render.MarkdownSupport.cell;
import static com.ocreval.report.render.MarkdownSupport.delta;
import static com.ocreval.report.render.MarkdownSupport.directoryLabel;
import static com.ocreval.report.render.MarkdownSupport.ratio;

/**
 * 多引擎对比报告（Markdown），引擎按名次排列。
 */
@Component
public class ComparisonReportRenderer {

    /**
     * @param comparison 对比结果
     * @param reports    各引擎的评估报告，用于分目录对比与耗时，可为空
     */
    public String render(ComparisonResult comparison, List<EvaluationReport> reports) {
        Map<String, EvaluationReport> byEngine = reports.stream()
                .collect(Collectors.toMap(EvaluationReport::getEngineName, Function.identity(), (a, b) -> a));
        StringBuilder md = new StringBuilder();

        line(md, "# OCR模型对比评估报告");
        line(md, "");
        line(md, "**生成时间**: " + MarkdownSupport.now());
        line(md, "**对比模型**: " + String.join(", ", comparison.rankedEngineNames()));
        line(md, "");

        appendRanking(md, comparison, byEngine);
        appendDistribution(md, comparison);
        appendDirectoryComparison(md, comparison, byEngine);
        appendConclusion(md, comparison);
        return md.toString();
    }

    private void appendRanking(StringBuilder md, ComparisonResult comparison, Map<String, EvaluationReport> byEngine) {
        line(md, "## 总体排名");
        line(md, "");
        line(md, "| 排名 | 模型 | 总图片数 | 识别成功 | 总体准确率 | 完全匹配率 | 准确率差距 | 完全匹配率差距 | 平均耗时 |");
        line(md, "|------|------|----------|----------|------------|------------|------------|----------------|----------|");
        for (RankedEngine entry : comparison.getEntries()) {
            EvaluationSummary summary = entry.getSummary();
            EvaluationReport report = byEngine.get(entry.getEngineName());
            line(md, "| " + entry.getRank()
                    + " | " + cell(entry.getEngineName())
                    + " | " + summary.getTotalImages()
                    + " | " + summary.getSucceededImages()
                    + " | " + ratio(summary.getOverallAccuracy())
                    + " | " + ratio(summary.getExactMatchRate())
                    + " | " + delta(entry.getAccuracyDelta())
                    + " | " + delta(entry.getExactMatchRateDelta())
                    + " | " + (report == null ? "-" : MarkdownSupport.millis(report.getAverageLatencyMillis()))
                    + " |");
        }
        line(md, "");
    }

    private void appendDistribution(StringBuilder md, ComparisonResult comparison) {
        line(md, "## 准确率分布");
        line(md, "");
        StringBuilder header = new StringBuilder("| 区间 |");
        StringBuilder rule = new StringBuilder("|------|");
        for (RankedEngine entry : comparison.getEntries()) {
            header.append(' ').append(cell(entry.getEngineName())).append(" |");
            rule.append("------|");
        }
        line(md, header.toString());
        line(md, rule.toString());
        for (AccuracyBucket bucket : AccuracyBucket.values()) {
            StringBuilder row = new StringBuilder("| " + bucket.getLabel() + " |");
            for (RankedEngine entry : comparison.getEntries()) {
                Integer count = entry.getSummary().getAccuracyDistribution().get(bucket.getLabel());
                row.append(' ').append(count == null ? 0 : count).append(" |");
            }
            line(md, row.toString());
        }
        line(md, "");
    }

    private void appendDirectoryComparison(StringBuilder md, ComparisonResult comparison,
                                           Map<String, EvaluationReport> byEngine) {
        SortedSet<String> directories = new TreeSet<>();
        byEngine.values().forEach(r -> directories.addAll(r.getDirectorySummaries().keySet()));
        if (directories.isEmpty()) {
            return;
        }

        line(md, "## 分目录性能对比");
        line(md, "");
        for (String directory : directories) {
            line(md, "### " + directoryLabel(directory));
            line(md, "");
            line(md, "| 模型 | 图片数量 | 准确率 | 完全匹配率 |");
            line(md, "|------|----------|--------|------------|");
            for (RankedEngine entry : comparison.getEntries()) {
                EvaluationReport report = byEngine.get(entry.getEngineName());
                EvaluationSummary summary = report == null ? null : report.getDirectorySummaries().get(directory);
                if (summary == null) {
                    line(md, "| " + cell(entry.getEngineName()) + " | - | - | - |");
                } else {
                    line(md, "| " + cell(entry.getEngineName())
                            + " | " + summary.getTotalImages()
                            + " | " + ratio(summary.getOverallAccuracy())
                            + " | " + ratio(summary.getExactMatchRate()) + " |");
                }
            }
            line(md, "");
        }
    }

    private void appendConclusion(StringBuilder md, ComparisonResult comparison) {
        line(md, "## 结论");
        line(md, "");
        RankedEngine top = comparison.top();
        if (top == null || !top.getSummary().hasData()) {
            line(md, "所有引擎均无可用数据，无法给出最佳引擎。");
            line(md, "");
            return;
        }
        line(md, "### 最佳整体性能: " + top.getEngineName());
        line(md, "");
        line(md, "- 准确率: " + ratio(top.getSummary().getOverallAccuracy()));
        line(md, "- 完全匹配率: " + ratio(top.getSummary().getExactMatchRate()));
        line(md, "");
    }

    private static void line(StringBuilder md, String text) {
        md.append(text).append('\n');
    }
}
