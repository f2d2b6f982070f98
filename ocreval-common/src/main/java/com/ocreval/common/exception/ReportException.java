package com.ocreval.common.exception;

/**
 * 报告生成或写入失败。
 */
public class ReportException extends OcrEvalException {

    public ReportException(String message, Throwable cause) {
        super(ErrorCode.REPORT_ERROR, message, cause);
    }
}
