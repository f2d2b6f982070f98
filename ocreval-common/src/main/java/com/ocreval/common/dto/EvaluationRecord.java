package com.ocreval.common.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单条评估记录：一条标注与一次识别结果的比对。
 */
@Value
@Builder
@Jacksonized
public class EvaluationRecord {

    /** 数据集内的图片键（相对图片根目录的路径） */
    String imagePath;

    GroundTruthRecord groundTruth;

    RecognitionOutcome outcome;

    boolean exactMatch;

    /** 编辑距离准确率，取值 [0, 1] */
    double accuracy;
}
