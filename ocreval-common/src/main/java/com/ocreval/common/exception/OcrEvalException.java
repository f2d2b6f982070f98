package com.ocreval.common.exception;

/**
 * 系统基础异常，所有业务异常的父类。
 */
public class OcrEvalException extends RuntimeException {

    private final ErrorCode errorCode;

    public OcrEvalException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OcrEvalException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getExitCode() {
        return errorCode.getExitCode();
    }
}
