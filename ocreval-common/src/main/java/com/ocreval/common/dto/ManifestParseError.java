package com.ocreval.common.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 标注文件中无法解析、被跳过的一行。
 */
@Value
@Builder
@Jacksonized
public class ManifestParseError {

    /** 标注文件名或路径 */
    String source;

    int lineNumber;

    String reason;

    /** 原始行内容（过长时截断） */
    String content;
}
