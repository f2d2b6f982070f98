package com.ocreval.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * 识别引擎对单张图片的一次识别结果。
 * <p>
 * 成功时 {@code recognizedText} 非 null（允许为空串）；失败时 {@code errorDetail} 描述原因。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RecognitionOutcome {

    /** 超时失败的固定错误描述 */
    public static final String TIMEOUT = "timeout";

    String imagePath;

    String recognizedText;

    boolean succeeded;

    String errorDetail;

    /** 调用耗时，可为 null */
    Duration latency;

    public static RecognitionOutcome success(String imagePath, String recognizedText, Duration latency) {
        return RecognitionOutcome.builder()
                .imagePath(imagePath)
                .recognizedText(recognizedText == null ? "" : recognizedText)
                .succeeded(true)
                .latency(latency)
                .build();
    }

    public static RecognitionOutcome failure(String imagePath, String errorDetail, Duration latency) {
        String detail = errorDetail == null || errorDetail.isBlank() ? "unknown error" : errorDetail;
        return RecognitionOutcome.builder()
                .imagePath(imagePath)
                .recognizedText("")
                .succeeded(false)
                .errorDetail(detail)
                .latency(latency)
                .build();
    }

    public static RecognitionOutcome timeout(String imagePath, Duration latency) {
        return failure(imagePath, TIMEOUT, latency);
    }

    @JsonIgnore
    public boolean isTimedOut() {
        return !succeeded && TIMEOUT.equals(errorDetail);
    }
}
