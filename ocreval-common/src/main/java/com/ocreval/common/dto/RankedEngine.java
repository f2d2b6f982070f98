package com.ocreval.common.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 对比结果中的一个名次。
 */
@Value
@Builder
@Jacksonized
public class RankedEngine {

    /** 名次，从 1 开始 */
    int rank;

    String engineName;

    EvaluationSummary summary;

    /** 与第一名总体准确率之差（非正数），无数据时为 null */
    Double accuracyDelta;

    /** 与第一名完全匹配率之差，无数据时为 null */
    Double exactMatchRateDelta;
}
