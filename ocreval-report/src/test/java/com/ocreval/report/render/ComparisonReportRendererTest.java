package com.ocreval.report.render;

import com.ocreval.common.dto.ComparisonResult;
import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.dto.RankedEngine;
import com.ocreval.report.ReportFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ComparisonReportRendererTest {

    private final ComparisonReportRenderer renderer = new ComparisonReportRenderer();

    @Test
    void rendersRankingWithDeltasAndBestEngine() {
        EvaluationReport qwen = ReportFixtures.report("qwen-vl");
        EvaluationReport tesseract = EvaluationReport.builder()
                .runId("tesseract-run")
                .engineName("tesseract")
                .summary(ReportFixtures.summary("tesseract", 3, 3, 0, 0.5,
                        Map.of("[0,0.6)", 3), List.of("batch1/a.jpg", "batch1/b.jpg", "batch2/c.jpg")))
                .directorySummary("batch1", ReportFixtures.summary("tesseract", 2, 2, 0, 0.5,
                        Map.of("[0,0.6)", 2), List.of("batch1/a.jpg", "batch1/b.jpg")))
                .build();

        String md = renderer.render(ReportFixtures.comparison(qwen, tesseract), List.of(qwen, tesseract));

        assertThat(md).startsWith("# OCR模型对比评估报告\n");
        assertThat(md).contains("**对比模型**: qwen-vl, tesseract");
        assertThat(md).contains("| 1 | qwen-vl | 3 | 2 | 0.6296 (62.96%) | 0.3333 (33.33%) | +0.0000 | +0.0000 | 100.0 ms |");
        assertThat(md).contains("| 2 | tesseract | 3 | 3 | 0.5000 (50.00%) | 0.0000 (0.00%) | -0.1296 | -0.3333 | - |");
        assertThat(md).contains("| [0,0.6) | 1 | 3 |");
        assertThat(md).contains("### batch2");
        assertThat(md).contains("| tesseract | - | - | - |");
        assertThat(md).contains("### 最佳整体性能: qwen-vl");
    }

    @Test
    void noDataAnywhereHasNoBestEngine() {
        ComparisonResult comparison = ComparisonResult.builder()
                .entry(RankedEngine.builder()
                        .rank(1)
                        .engineName("alpha")
                        .summary(ReportFixtures.summary("alpha", 0, 0, 0, null, Map.of(), List.of()))
                        .build())
                .build();

        String md = renderer.render(comparison, List.of());

        assertThat(md).contains("| 1 | alpha | 0 | 0 | 无数据 | 无数据 | - | - | - |");
        assertThat(md).doesNotContain("## 分目录性能对比");
        assertThat(md).contains("所有引擎均无可用数据");
    }
}
