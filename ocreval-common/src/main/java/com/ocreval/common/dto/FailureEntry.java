package com.ocreval.common.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 识别失败的图片及失败原因。
 */
@Value
@Builder
@Jacksonized
public class FailureEntry {

    String imagePath;

    String errorDetail;
}
