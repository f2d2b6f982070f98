package com.ocreval.common.exception;

/**
 * 图像处理异常（解码失败、编码失败等）。
 */
public class ImageProcessingException extends OcrEvalException {

    public ImageProcessingException(String message) {
        super(ErrorCode.EVALUATION_ERROR, message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(ErrorCode.EVALUATION_ERROR, message, cause);
    }
}
