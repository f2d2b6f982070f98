package com.ocreval.cli;

import com.ocreval.common.dto.EvaluationReport;
import com.ocreval.common.dto.EvaluationSummary;

final class CliFixtures {

    private CliFixtures() {
    }

    static EvaluationReport report(String engineName, double accuracy) {
        return EvaluationReport.builder()
                .runId(engineName + "-run")
                .engineName(engineName)
                .summary(EvaluationSummary.builder()
                        .engineName(engineName)
                        .totalImages(2)
                        .succeededImages(2)
                        .exactMatchCount(accuracy == 1.0 ? 2 : 0)
                        .overallAccuracy(accuracy)
                        .exactMatchRate(accuracy == 1.0 ? 1.0 : 0.0)
                        .imagePath("batch1/a.jpg")
                        .imagePath("batch1/b.jpg")
                        .build())
                .build();
    }
}
