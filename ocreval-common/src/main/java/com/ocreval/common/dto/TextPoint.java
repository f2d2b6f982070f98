package com.ocreval.common.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 文本区域多边形的一个顶点（像素坐标）。
 */
@Value
@Builder
@Jacksonized
public class TextPoint {

    double x;

    double y;
}
