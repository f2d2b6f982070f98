package com.ocreval.common.exception;

/**
 * 识别引擎调用异常（模型服务返回错误、网络中断、本地模型崩溃等）。
 * <p>
 * 只在引擎内部流转，进入评估核心前会被转换为失败的识别结果。
 */
public class RecognitionException extends OcrEvalException {

    public RecognitionException(String message) {
        super(ErrorCode.EVALUATION_ERROR, message);
    }

    public RecognitionException(String message, Throwable cause) {
        super(ErrorCode.EVALUATION_ERROR, message, cause);
    }
}
