package com.ocreval.core.metric;

import com.ocreval.common.dto.EvaluationRecord;
import com.ocreval.common.dto.EvaluationSummary;
import com.ocreval.common.dto.FailureEntry;
import com.ocreval.common.dto.GroundTruthRecord;
import com.ocreval.common.dto.RecognitionOutcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

class SummaryAggregatorTest {

    private final SummaryAggregator aggregator = new SummaryAggregator();

    @Test
    void aggregatesCountsMeanAndDistribution() {
        List<EvaluationRecord> records = List.of(
                record("img1.jpg", 1.0, true, true),
                record("img2.jpg", 2.0 / 3.0, false, true),
                record("img3.jpg", 0.0, false, false));

        EvaluationSummary summary = aggregator.aggregate("stub", records);

        assertThat(summary.getEngineName()).isEqualTo("stub");
        assertThat(summary.getTotalImages()).isEqualTo(3);
        assertThat(summary.getSucceededImages()).isEqualTo(2);
        assertThat(summary.failedImages()).isEqualTo(1);
        assertThat(summary.getExactMatchCount()).isEqualTo(1);
        assertThat(summary.getOverallAccuracy()).isCloseTo((1.0 + 2.0 / 3.0) / 3.0, within(1e-12));
        assertThat(summary.getExactMatchRate()).isCloseTo(1.0 / 3.0, within(1e-12));
        assertThat(summary.getAccuracyDistribution()).containsExactly(
                entry("[0.9,1.0]", 1),
                entry("[0.8,0.9)", 0),
                entry("[0.7,0.8)", 0),
                entry("[0.6,0.7)", 1),
                entry("[0,0.6)", 1));
        assertThat(summary.getFailures()).extracting(FailureEntry::getImagePath).containsExactly("img3.jpg");
        assertThat(summary.getImagePaths()).containsExactly("img1.jpg", "img2.jpg", "img3.jpg");
    }

    @Test
    void emptyInputMeansNoData() {
        EvaluationSummary summary = aggregator.aggregate("stub", List.of());

        assertThat(summary.getTotalImages()).isZero();
        assertThat(summary.getOverallAccuracy()).isNull();
        assertThat(summary.getExactMatchRate()).isNull();
        assertThat(summary.hasData()).isFalse();
        assertThat(summary.getAccuracyDistribution().values()).containsOnly(0);
    }

    @Test
    void bucketBoundariesAreHalfOpen() {
        EvaluationSummary summary = aggregator.aggregate("stub", List.of(
                record("a", 0.9, false, true),
                record("b", 0.8, false, true),
                record("c", 0.7, false, true),
                record("d", 0.6, false, true),
                record("e", 0.5999, false, true)));

        assertThat(summary.getAccuracyDistribution().values()).containsExactly(1, 1, 1, 1, 1);
    }

    @Test
    void bucketCountsSumToTotal() {
        Random random = new Random(42);
        List<EvaluationRecord> records = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            records.add(record("img" + i, random.nextDouble(), false, random.nextBoolean()));
        }

        EvaluationSummary summary = aggregator.aggregate("stub", records);

        int sum = summary.getAccuracyDistribution().values().stream().mapToInt(Integer::intValue).sum();
        assertThat(sum).isEqualTo(summary.getTotalImages());
    }

    @Test
    void resultIsIndependentOfInputOrder() {
        Random random = new Random(7);
        List<EvaluationRecord> records = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            records.add(record("img" + i, random.nextDouble(), false, true));
        }
        EvaluationSummary original = aggregator.aggregate("stub", records);

        List<EvaluationRecord> shuffled = new ArrayList<>(records);
        Collections.shuffle(shuffled, new Random(99));
        EvaluationSummary permuted = aggregator.aggregate("stub", shuffled);

        assertThat(permuted.getOverallAccuracy()).isEqualTo(original.getOverallAccuracy());
        assertThat(permuted.getExactMatchRate()).isEqualTo(original.getExactMatchRate());
        assertThat(permuted.getAccuracyDistribution()).isEqualTo(original.getAccuracyDistribution());
        assertThat(permuted.getImagePaths()).isEqualTo(original.getImagePaths());
    }

    @Test
    void groupsByDirectoryInNameOrder() {
        List<EvaluationRecord> records = List.of(
                record("b/1.jpg", 1.0, true, true),
                record("a/1.jpg", 0.5, false, true),
                record("b/2.jpg", 0.0, false, false));

        Map<String, EvaluationSummary> byDirectory = aggregator.aggregateByDirectory("stub", records,
                r -> r.getImagePath().substring(0, 1));

        assertThat(byDirectory).containsOnlyKeys("a", "b");
        assertThat(byDirectory.keySet()).containsExactly("a", "b");
        assertThat(byDirectory.get("b").getTotalImages()).isEqualTo(2);
        assertThat(byDirectory.get("b").getOverallAccuracy()).isEqualTo(0.5);
    }

    private static EvaluationRecord record(String path, double accuracy, boolean exact, boolean succeeded) {
        RecognitionOutcome outcome = succeeded
                ? RecognitionOutcome.success(path, "TEXT", null)
                : RecognitionOutcome.failure(path, "engine error", null);
        return EvaluationRecord.builder()
                .imagePath(path)
                .groundTruth(GroundTruthRecord.builder().imagePath(path).transcription("TEXT").build())
                .outcome(outcome)
                .exactMatch(exact)
                .accuracy(accuracy)
                .build();
    }
}
