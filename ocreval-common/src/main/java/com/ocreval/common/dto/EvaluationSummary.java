package com.ocreval.common.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * 单个引擎在一个数据集上的汇总结果，构建后不可变。
 * <p>
 * 数据集为空时 {@code overallAccuracy} 与 {@code exactMatchRate} 为 null，表示"无数据"，
 * 不能当作 0 分参与比较。
 */
@Value
@Builder
@Jacksonized
public class EvaluationSummary {

    String engineName;

    int totalImages;

    int succeededImages;

    int exactMatchCount;

    /** 全部记录（含失败记 0 分）的平均准确率，无数据时为 null */
    Double overallAccuracy;

    /** 完全匹配率，无数据时为 null */
    Double exactMatchRate;

    /** 区间标签 -> 图片数，按区间从高到低，所有区间都存在 */
    @Singular("bucketCount")
    Map<String, Integer> accuracyDistribution;

    /** 识别失败的图片，保持遇到的先后顺序 */
    @Singular
    List<FailureEntry> failures;

    /** 参与汇总的图片键集合，对比时用于校验数据集一致 */
    @Singular
    SortedSet<String> imagePaths;

    public boolean hasData() {
        return totalImages > 0 && overallAccuracy != null;
    }

    public int failedImages() {
        return totalImages - succeededImages;
    }
}
