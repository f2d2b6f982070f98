package com.ocreval.common.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 一条标注（Ground Truth），由标注文件的一行解析得到，加载后不可变。
 */
@Value
@Builder
@Jacksonized
public class GroundTruthRecord {

    /** 标注文件中写明的图片路径，在同一个标注文件内唯一 */
    String imagePath;

    /** 标准答案文本 */
    String transcription;

    /** 文本区域四边形顶点，未标注时为空列表 */
    @Singular
    List<TextPoint> points;

    /** 低置信度标注，可按配置从严格评分中排除 */
    boolean difficult;

    /** 该标注在所在行 JSON 数组中的下标 */
    int annotationIndex;

    /** 所在行号（从 1 开始） */
    int lineNumber;
}
