package com.ocreval.core.metric;

import com.ocreval.common.dto.EvaluationRecord;
import com.ocreval.common.dto.GroundTruthRecord;
import com.ocreval.common.dto.RecognitionOutcome;
import com.ocreval.core.config.EvaluationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 单条评估：比对标注与识别结果，计算完全匹配与编辑距离准确率。
 * <p>
 * 准确率 = (m - d) / m，其中 d 为编辑距离，m 为两串中较长者的码点数；两串都为空时为 1.0。
 * 识别失败的记录准确率为 0。
 */
@Component
@RequiredArgsConstructor
public class RecordEvaluator {

    private final EvaluationProperties properties;

    public EvaluationRecord evaluate(GroundTruthRecord groundTruth, RecognitionOutcome outcome, String imageKey) {
        EvaluationRecord.EvaluationRecordBuilder record = EvaluationRecord.builder()
                .imagePath(imageKey)
                .groundTruth(groundTruth)
                .outcome(outcome);

        if (!outcome.isSucceeded()) {
            return record.exactMatch(false).accuracy(0.0).build();
        }

        String expected = normalize(groundTruth.getTranscription());
        String actual = normalize(outcome.getRecognizedText());
        return record.exactMatch(expected.equals(actual))
                .accuracy(accuracy(expected, actual))
                .build();
    }

    /**
     * 编辑距离准确率，取值 [0, 1]。
     */
    public static double accuracy(String expected, String actual) {
        int m = Math.max(LevenshteinDistance.length(expected), LevenshteinDistance.length(actual));
        if (m == 0) {
            return 1.0;
        }
        int d = LevenshteinDistance.distance(expected, actual);
        double accuracy = (m - d) / (double) m;
        return Math.max(0.0, Math.min(1.0, accuracy));
    }

    private String normalize(String text) {
        String value = text == null ? "" : text;
        return properties.isCaseSensitive() ? value : value.toUpperCase(Locale.ROOT);
    }
}
