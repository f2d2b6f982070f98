package com.ocreval.core.compare;

import com.ocreval.common.dto.ComparisonResult;
import com.ocreval.common.dto.EvaluationSummary;
import com.ocreval.common.dto.RankedEngine;
import com.ocreval.common.exception.DatasetMismatchException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EngineComparatorTest {

    private static final Set<String> IMAGES = Set.of("a.jpg", "b.jpg");

    private final EngineComparator comparator = new EngineComparator();

    @Test
    void ranksByAccuracyThenExactMatchRateThenName() {
        ComparisonResult result = comparator.compare(List.of(
                summary("tesseract", 0.80, 0.50, IMAGES),
                summary("qwen-vl", 0.95, 0.50, IMAGES),
                summary("paddle", 0.80, 0.60, IMAGES),
                summary("easyocr", 0.80, 0.50, IMAGES)));

        assertThat(result.rankedEngineNames()).containsExactly("qwen-vl", "paddle", "easyocr", "tesseract");
        assertThat(result.getEntries()).extracting(RankedEngine::getRank).containsExactly(1, 2, 3, 4);
    }

    @Test
    void deltasAreRelativeToTopEngine() {
        ComparisonResult result = comparator.compare(List.of(
                summary("tesseract", 0.80, 0.50, IMAGES),
                summary("qwen-vl", 0.95, 0.90, IMAGES)));

        RankedEngine top = result.top();
        assertThat(top.getEngineName()).isEqualTo("qwen-vl");
        assertThat(top.getAccuracyDelta()).isEqualTo(0.0);
        assertThat(top.getExactMatchRateDelta()).isEqualTo(0.0);
        RankedEngine second = result.getEntries().get(1);
        assertThat(second.getAccuracyDelta()).isCloseTo(-0.15, within(1e-9));
        assertThat(second.getExactMatchRateDelta()).isCloseTo(-0.40, within(1e-9));
    }

    @Test
    void summariesWithoutDataRankLastWithoutDeltas() {
        ComparisonResult result = comparator.compare(List.of(
                summary("alpha", null, null, Set.of()),
                summary("beta", 0.0, 0.0, Set.of())));

        assertThat(result.rankedEngineNames()).containsExactly("beta", "alpha");
        assertThat(result.top().getAccuracyDelta()).isEqualTo(0.0);
        assertThat(result.getEntries().get(1).getAccuracyDelta()).isNull();
        assertThat(result.getEntries().get(1).getExactMatchRateDelta()).isNull();
    }

    @Test
    void onlyEmptySummariesAreRankedByName() {
        ComparisonResult result = comparator.compare(List.of(
                EvaluationSummary.builder().engineName("zzz").build(),
                EvaluationSummary.builder().engineName("aaa").build()));

        assertThat(result.rankedEngineNames()).containsExactly("aaa", "zzz");
        assertThat(result.getEntries()).allSatisfy(entry -> assertThat(entry.getAccuracyDelta()).isNull());
    }

    @Test
    void mismatchedImageSetsFail() {
        assertThatThrownBy(() -> comparator.compare(List.of(
                summary("tesseract", 0.8, 0.5, IMAGES),
                summary("qwen-vl", 0.9, 0.5, Set.of("a.jpg", "c.jpg")))))
                .isInstanceOf(DatasetMismatchException.class)
                .hasMessageContaining("tesseract")
                .hasMessageContaining("qwen-vl")
                .hasMessageContaining("b.jpg")
                .hasMessageContaining("c.jpg");
    }

    @Test
    void duplicateNamesAreRejected() {
        assertThatThrownBy(() -> comparator.compare(List.of(
                summary("tesseract", 0.8, 0.5, IMAGES),
                summary("tesseract", 0.9, 0.5, IMAGES))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyInputIsRejected() {
        assertThatThrownBy(() -> comparator.compare(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isIdempotentAndIndependentOfInputOrder() {
        List<EvaluationSummary> summaries = new ArrayList<>();
        Random random = new Random(3);
        for (int i = 0; i < 12; i++) {
            // 少量离散取值，制造大量并列
            double accuracy = random.nextInt(3) / 2.0;
            double rate = random.nextInt(2) / 2.0;
            summaries.add(summary("engine-" + i, accuracy, rate, IMAGES));
        }

        ComparisonResult first = comparator.compare(summaries);
        Collections.shuffle(summaries, new Random(11));
        ComparisonResult second = comparator.compare(summaries);

        assertThat(second).isEqualTo(first);
        assertThat(comparator.compare(summaries)).isEqualTo(second);
    }

    private static EvaluationSummary summary(String name, Double accuracy, Double rate, Set<String> images) {
        return EvaluationSummary.builder()
                .engineName(name)
                .totalImages(accuracy == null ? 0 : Math.max(1, images.size()))
                .succeededImages(images.size())
                .overallAccuracy(accuracy)
                .exactMatchRate(rate)
                .imagePaths(images)
                .build();
    }
}
